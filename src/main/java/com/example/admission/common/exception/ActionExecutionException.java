package com.example.admission.common.exception;

import com.example.admission.domain.abuse.AbuseAction;

/**
 * 대응 조치(BLOCK, CHALLENGE, RATE_LIMIT) 실행 실패 예외
 *
 * 이미 반환된 허용/거부 결정에는 영향을 주지 않으며 로그로만 남는다.
 */
public class ActionExecutionException extends RuntimeException {

    private final AbuseAction action;

    public ActionExecutionException(AbuseAction action, String message, Throwable cause) {
        super(message, cause);
        this.action = action;
    }

    public AbuseAction getAction() {
        return action;
    }
}
