package com.ryuqq.prp.core.ratelimit;

import java.time.Duration;

/**
 * Rate Limiter 판단 결과 (영속화되지 않음).
 *
 * @param allowed 제출 허용 여부
 * @param reason 사람이 읽을 수 있는 사유 (허용 시 "OK")
 * @param waitEstimate 예상 대기 시간 (분 단위 절사, 허용 시 0)
 * @param submissionsInWindow 판단 시점의 윈도우 내 제출 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateDecision(
    boolean allowed,
    String reason,
    Duration waitEstimate,
    int submissionsInWindow
) {

    public RateDecision {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (waitEstimate == null || waitEstimate.isNegative()) {
            throw new IllegalArgumentException("waitEstimate must be non-negative (current: " + waitEstimate + ")");
        }
        if (submissionsInWindow < 0) {
            throw new IllegalArgumentException("submissionsInWindow must be non-negative (current: " + submissionsInWindow + ")");
        }
    }

    public static RateDecision allow(int submissionsInWindow) {
        return new RateDecision(true, "OK", Duration.ZERO, submissionsInWindow);
    }

    public static RateDecision deny(String reason, Duration waitEstimate, int submissionsInWindow) {
        return new RateDecision(false, reason, waitEstimate, submissionsInWindow);
    }

    /**
     * 예상 대기 시간 (분).
     *
     * @return 대기 분
     */
    public long waitMinutes() {
        return waitEstimate.toMinutes();
    }
}
