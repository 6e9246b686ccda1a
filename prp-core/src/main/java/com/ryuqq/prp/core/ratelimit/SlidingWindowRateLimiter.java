package com.ryuqq.prp.core.ratelimit;

import com.ryuqq.prp.core.state.OrchestratorState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rolling 1시간 윈도우 + 최소 간격 Rate Limiter.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * 1. recent = submissionTimes 중 (now - 1h) 이후 항목
 * 2. recent.size() >= maxPerHour
 *      → deny, wait = (recent[0] + 1h) - now
 * 3. lastSubmissionTime != null && now &lt; lastSubmissionTime + minInterval
 *      → deny, wait = (lastSubmissionTime + minInterval) - now
 * 4. allow
 * </pre>
 *
 * <p>경계값: {@code now == lastSubmissionTime + minInterval}은 허용됩니다.
 * 대기 시간은 분 단위로 절사하며 로깅용 참고값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private final RateLimitConfig config;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SlidingWindowRateLimiter(RateLimitConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public RateDecision canSubmit(OrchestratorState state, Instant now) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }

        // 1. 윈도우 정리 (상태는 변경하지 않음)
        List<Instant> recent = state.submissionsInWindow(now);

        // 2. 시간당 한도
        if (recent.size() >= config.maxPerHour()) {
            Instant waitUntil = recent.get(0).plus(OrchestratorState.SUBMISSION_WINDOW);
            Duration wait = wholeMinutes(Duration.between(now, waitUntil));
            return RateDecision.deny(
                "Rate limit: " + recent.size() + " batches in last hour. Wait " + wait.toMinutes() + " minutes.",
                wait,
                recent.size()
            );
        }

        // 3. 최소 간격
        Instant last = state.lastSubmissionTime();
        if (last != null) {
            Instant nextAllowed = last.plus(config.minInterval());
            if (now.isBefore(nextAllowed)) {
                Duration wait = wholeMinutes(Duration.between(now, nextAllowed));
                return RateDecision.deny(
                    "Minimum interval: Wait " + wait.toMinutes() + " minutes since last batch.",
                    wait,
                    recent.size()
                );
            }
        }

        return RateDecision.allow(recent.size());
    }

    @Override
    public RateLimitConfig getConfig() {
        return config;
    }

    private static Duration wholeMinutes(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : Duration.ofMinutes(duration.toMinutes());
    }
}
