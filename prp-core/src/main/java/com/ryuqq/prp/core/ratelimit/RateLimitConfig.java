package com.ryuqq.prp.core.ratelimit;

import java.time.Duration;

/**
 * Rate Limiter 설정.
 *
 * <p>{@code maxPerHour = 0}은 모든 제출을 거부하는 설정 오류이므로
 * Limiter 내부가 아니라 생성 시점(시작 시)에 거부합니다.</p>
 *
 * @param maxPerHour rolling 1시간 동안 허용되는 최대 제출 수 (1 이상)
 * @param minInterval 연속 제출 간 최소 간격 (0 이상)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RateLimitConfig(int maxPerHour, Duration minInterval) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxPerHour=1, minInterval=60분</p>
     */
    public RateLimitConfig() {
        this(1, Duration.ofMinutes(60));
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxPerHour is not positive
     * @throws IllegalArgumentException if minInterval is null or negative
     */
    public RateLimitConfig {
        if (maxPerHour <= 0) {
            throw new IllegalArgumentException(
                "maxPerHour must be positive (current: " + maxPerHour + ")"
            );
        }
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException(
                "minInterval must be non-negative (current: " + minInterval + ")"
            );
        }
    }

    /**
     * minInterval만 변경한 새 인스턴스 생성.
     */
    public RateLimitConfig withMinInterval(Duration minInterval) {
        return new RateLimitConfig(maxPerHour, minInterval);
    }
}
