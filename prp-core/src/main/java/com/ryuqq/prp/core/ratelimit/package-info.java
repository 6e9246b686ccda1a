/**
 * Rate Limiter 패키지.
 *
 * <p>비용이 큰 배치 제출을 rolling 1시간 한도와 최소 간격으로 제한합니다.
 * Limiter는 {@link com.ryuqq.prp.core.state.OrchestratorState}를 읽기만 하는 순수 함수이며,
 * 제출 기록의 영속화는 {@code StateStore}가 담당합니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.prp.core.ratelimit.noop.NoOpRateLimiter}는
 * 모든 제출을 허용합니다. 테스트에서 Rate Limiting과 무관한 동작을 검증할 때 사용합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.prp.core.ratelimit;
