package com.ryuqq.prp.core.ratelimit;

import com.ryuqq.prp.core.state.OrchestratorState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SlidingWindowRateLimiter 유닛 테스트.
 *
 * <ul>
 *   <li>시간당 한도: 윈도우가 지나면 다시 허용</li>
 *   <li>최소 간격: 시간당 한도와 무관하게 거부</li>
 *   <li>경계값: next_allowed 시각은 허용</li>
 *   <li>순수성: 판단이 상태를 변경하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("SlidingWindowRateLimiter 테스트")
class SlidingWindowRateLimiterTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");

    @Test
    @DisplayName("제출 기록이 없으면 허용한다")
    void canSubmit_빈_상태면_허용() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig());

        // when
        RateDecision decision = limiter.canSubmit(OrchestratorState.initial(), T0);

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo("OK");
        assertThat(decision.waitEstimate()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("maxPerHour=1: 30분 뒤에는 약 30분 대기로 거부, 61분 뒤에는 허용")
    void canSubmit_시간당_한도_윈도우() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(1, Duration.ZERO));
        OrchestratorState state = OrchestratorState.initial().withSubmission(T0);

        // when
        RateDecision at30 = limiter.canSubmit(state, T0.plus(Duration.ofMinutes(30)));
        RateDecision at61 = limiter.canSubmit(state, T0.plus(Duration.ofMinutes(61)));

        // then
        assertThat(at30.allowed()).isFalse();
        assertThat(at30.waitMinutes()).isEqualTo(30);
        assertThat(at30.reason()).isEqualTo("Rate limit: 1 batches in last hour. Wait 30 minutes.");
        assertThat(at30.submissionsInWindow()).isEqualTo(1);

        assertThat(at61.allowed()).isTrue();
        assertThat(at61.submissionsInWindow()).isZero();
    }

    @Test
    @DisplayName("minInterval=60분, maxPerHour=10: 10분 간격 두 번째 제출은 거부")
    void canSubmit_최소_간격_위반시_거부() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(10, Duration.ofMinutes(60)));
        OrchestratorState state = OrchestratorState.initial().withSubmission(T0);

        // when
        RateDecision decision = limiter.canSubmit(state, T0.plus(Duration.ofMinutes(10)));

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.waitMinutes()).isEqualTo(50);
        assertThat(decision.reason()).isEqualTo("Minimum interval: Wait 50 minutes since last batch.");
    }

    @Test
    @DisplayName("now == last + minInterval 이면 허용한다 (경계 포함)")
    void canSubmit_경계값_허용() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(10, Duration.ofMinutes(15)));
        OrchestratorState state = OrchestratorState.initial().withSubmission(T0);

        // when
        RateDecision decision = limiter.canSubmit(state, T0.plus(Duration.ofMinutes(15)));

        // then
        assertThat(decision.allowed()).isTrue();
    }

    @Test
    @DisplayName("정확히 1시간 지난 제출은 윈도우에서 제외된다")
    void canSubmit_정확히_1시간_지난_기록은_제외() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(1, Duration.ZERO));
        OrchestratorState state = OrchestratorState.initial().withSubmission(T0);

        // when
        RateDecision decision = limiter.canSubmit(state, T0.plus(Duration.ofHours(1)));

        // then
        assertThat(decision.allowed()).isTrue();
    }

    @Test
    @DisplayName("시간당 한도 대기 시간은 가장 오래된 기록 기준으로 계산한다")
    void canSubmit_대기시간은_가장_오래된_기록_기준() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(2, Duration.ZERO));
        OrchestratorState state = OrchestratorState.initial()
            .withSubmission(T0)
            .withSubmission(T0.plus(Duration.ofMinutes(20)));

        // when
        RateDecision decision = limiter.canSubmit(state, T0.plus(Duration.ofMinutes(45)));

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.waitMinutes()).isEqualTo(15);
        assertThat(decision.submissionsInWindow()).isEqualTo(2);
    }

    @Test
    @DisplayName("판단은 상태를 변경하지 않는다")
    void canSubmit_상태_불변() {
        // given
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(5, Duration.ZERO));
        OrchestratorState state = OrchestratorState.initial().withSubmission(T0);

        // when
        limiter.canSubmit(state, T0.plus(Duration.ofHours(3)));

        // then
        assertThat(state.submissionTimes()).containsExactly(T0);
    }

    @Test
    @DisplayName("maxPerHour=0 설정은 생성 시점에 거부된다")
    void config_maxPerHour_0_거부() {
        assertThatThrownBy(() -> new RateLimitConfig(0, Duration.ofMinutes(60)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxPerHour");
    }

    @Test
    @DisplayName("음수 minInterval 설정은 거부된다")
    void config_음수_간격_거부() {
        assertThatThrownBy(() -> new RateLimitConfig().withMinInterval(Duration.ofMinutes(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("minInterval");
    }
}
