package com.ryuqq.prp.core.ratelimit.noop;

import com.ryuqq.prp.core.ratelimit.RateDecision;
import com.ryuqq.prp.core.ratelimit.RateLimitConfig;
import com.ryuqq.prp.core.ratelimit.RateLimiter;
import com.ryuqq.prp.core.state.OrchestratorState;

import java.time.Duration;
import java.time.Instant;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 제출을 항상 허용합니다.
 * 테스트 환경이나 Rate Limiting 없이 파이프라인을 검증할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>canSubmit(): 항상 허용 (윈도우 내 제출 수는 그대로 보고)</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimitConfig UNLIMITED_CONFIG =
        new RateLimitConfig(Integer.MAX_VALUE, Duration.ZERO);

    @Override
    public RateDecision canSubmit(OrchestratorState state, Instant now) {
        return RateDecision.allow(state.submissionsInWindow(now).size());
    }

    @Override
    public RateLimitConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
