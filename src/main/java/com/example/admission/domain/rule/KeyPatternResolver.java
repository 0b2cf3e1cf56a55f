package com.example.admission.domain.rule;

import com.example.admission.domain.model.RateLimitRequest;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * keyPattern 플레이스홀더 치환
 *
 * 값이 없으면 userId는 "anonymous", 나머지는 "default"로 채운다. 실패하지 않는다.
 * {ip}는 원본 주소 대신 IpAddresses.fingerprint 값으로 치환한다.
 */
public final class KeyPatternResolver {

    public static final Set<String> PLACEHOLDERS = Set.of("userId", "ip", "endpoint", "method", "tier");
    public static final String DEFAULT_VALUE = "default";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");

    private KeyPatternResolver() {
    }

    public static String resolve(String keyPattern, RateLimitRequest request) {
        Matcher matcher = PLACEHOLDER.matcher(keyPattern);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(valueOf(matcher.group(1), request)));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    /**
     * 알 수 없는 플레이스홀더 이름 목록 (검증용)
     */
    public static Set<String> unknownPlaceholders(String keyPattern) {
        Matcher matcher = PLACEHOLDER.matcher(keyPattern);
        Set<String> unknown = new TreeSet<>();
        while (matcher.find()) {
            if (!PLACEHOLDERS.contains(matcher.group(1))) {
                unknown.add(matcher.group(1));
            }
        }
        return unknown;
    }

    private static String valueOf(String placeholder, RateLimitRequest request) {
        return switch (placeholder) {
            case "userId" -> request.isAuthenticated() ? request.getUserId() : RateLimitRequest.ANONYMOUS;
            case "ip" -> orDefault(IpAddresses.fingerprint(request.getIp()));
            case "endpoint" -> orDefault(RuleResolver.normalizePath(request.getEndpoint()));
            case "method" -> request.getMethod() == null ? DEFAULT_VALUE : request.getMethod().toUpperCase(Locale.ROOT);
            case "tier" -> orDefault(request.getTier());
            default -> DEFAULT_VALUE;
        };
    }

    private static String orDefault(String value) {
        return value == null || value.isBlank() ? DEFAULT_VALUE : value;
    }
}
