package com.ryuqq.prp.core.ratelimit;

import com.ryuqq.prp.core.state.OrchestratorState;

import java.time.Instant;

/**
 * Rate Limiter SPI.
 *
 * <p>비용이 큰 배치 제출 횟수를 rolling 1시간 윈도우와 최소 간격으로 제한합니다.</p>
 *
 * <p>구현체는 순수 함수여야 합니다. 상태를 읽기만 하고 변경하지 않으며,
 * 윈도우 정리의 영속화는 {@code StateStore.recordSubmission()}이 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateDecision decision = limiter.canSubmit(store.snapshot(), clock.instant());
 * if (!decision.allowed()) {
 *     log.warn("Rate limit check: {}", decision.reason());
 *     return deferred;
 * }
 * submitter.submit(request, outputDir, timeout);
 * store.recordSubmission(clock.instant());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 지금 제출해도 되는지 판단 (비블로킹).
     *
     * @param state 현재 오케스트레이터 상태
     * @param now 기준 시각
     * @return 허용 여부와 사유, 예상 대기 시간
     */
    RateDecision canSubmit(OrchestratorState state, Instant now);

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return 설정
     */
    RateLimitConfig getConfig();
}
