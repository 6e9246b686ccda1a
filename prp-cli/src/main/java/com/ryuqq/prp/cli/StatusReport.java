package com.ryuqq.prp.cli;

import com.ryuqq.prp.core.model.QueueLayout;
import com.ryuqq.prp.core.ratelimit.RateDecision;
import com.ryuqq.prp.core.state.OrchestratorState;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;

/**
 * {@code --status} 출력.
 *
 * @param queueDir 큐 디렉토리
 * @param queued 대기 중인 아이템 수
 * @param processed 완료된 아이템 수
 * @param currentItem 처리 중인 아이템 (null 허용)
 * @param lastBatchTime 마지막 배치 제출 시각 (null 허용)
 * @param batchesInLastHour 최근 1시간 배치 수
 * @param decision 현재 시점 rate limit 판단
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatusReport(
    Path queueDir,
    int queued,
    int processed,
    String currentItem,
    Instant lastBatchTime,
    int batchesInLastHour,
    RateDecision decision
) {

    public static StatusReport of(QueueLayout layout, OrchestratorState state, int queued,
                                  RateDecision decision, Instant now) {
        return new StatusReport(
            layout.queueDir(),
            queued,
            state.completedItems().size(),
            state.currentItem(),
            state.lastSubmissionTime(),
            state.submissionsInWindow(now).size(),
            decision
        );
    }

    public void print(PrintWriter out) {
        out.println();
        out.println("=== PRP Orchestrator Status ===");
        out.println("Queue directory: " + queueDir);
        out.println("Queued: " + queued + " files");
        out.println("Processed: " + processed + " files");
        out.println("Current: " + (currentItem == null ? "None" : currentItem));
        out.println("Last batch: " + (lastBatchTime == null ? "Never" : lastBatchTime.toString()));
        out.println("Batches (1h): " + batchesInLastHour);
        out.println("Can submit: " + (decision.allowed() ? "Yes" : "No") + " (" + decision.reason() + ")");
        out.println();
        out.flush();
    }
}
