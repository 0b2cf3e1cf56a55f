package com.example.admission.domain.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed Window 상태
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixedWindowState {
    private long count;
    private long windowStartMillis;
}
