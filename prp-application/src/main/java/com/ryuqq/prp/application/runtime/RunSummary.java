package com.ryuqq.prp.application.runtime;

import com.ryuqq.prp.core.outcome.Outcome;

import java.util.List;

/**
 * 한 번의 큐 처리 결과 요약.
 *
 * @param outcomes 처리 순서대로의 아이템별 결과
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunSummary(List<Outcome> outcomes) {

    private static final RunSummary EMPTY = new RunSummary(List.of());

    public RunSummary {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        outcomes = List.copyOf(outcomes);
    }

    public static RunSummary empty() {
        return EMPTY;
    }

    public int processed() {
        return outcomes.size();
    }

    public long completed() {
        return outcomes.stream().filter(Outcome::isOk).count();
    }

    public long deferred() {
        return outcomes.stream().filter(Outcome::isDeferred).count();
    }

    public long failed() {
        return outcomes.stream().filter(Outcome::isFail).count();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
