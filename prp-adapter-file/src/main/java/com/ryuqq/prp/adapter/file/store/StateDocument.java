package com.ryuqq.prp.adapter.file.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ryuqq.prp.core.state.OrchestratorState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 상태 파일의 JSON 스키마.
 *
 * <p>기존 상태 파일과 호환되는 snake_case 키를 사용합니다.
 * {@code batch_count_1h}는 참고용이며 읽을 때 무시됩니다.</p>
 *
 * @param lastBatchTime 마지막 제출 시각
 * @param processedFiles 완료된 아이템 이름
 * @param currentProcessing 처리 중인 아이템
 * @param batchCount1h 쓰기 시점의 1시간 윈도우 내 제출 수
 * @param batchTimes 1시간 윈도우 내 제출 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"last_batch_time", "processed_files", "current_processing", "batch_count_1h", "batch_times"})
record StateDocument(
    @JsonProperty("last_batch_time") Instant lastBatchTime,
    @JsonProperty("processed_files") List<String> processedFiles,
    @JsonProperty("current_processing") String currentProcessing,
    @JsonProperty("batch_count_1h") int batchCount1h,
    @JsonProperty("batch_times") List<Instant> batchTimes
) {

    static StateDocument from(OrchestratorState state, Instant now) {
        return new StateDocument(
            state.lastSubmissionTime(),
            new ArrayList<>(state.completedItems()),
            state.currentItem(),
            state.submissionsInWindow(now).size(),
            state.submissionTimes()
        );
    }

    OrchestratorState toState() {
        List<Instant> times = new ArrayList<>();
        if (batchTimes != null) {
            for (Instant t : batchTimes) {
                if (t != null) {
                    times.add(t);
                }
            }
        }
        return new OrchestratorState(
            lastBatchTime,
            times,
            processedFiles == null ? new LinkedHashSet<>() : new LinkedHashSet<>(processedFiles),
            currentProcessing
        );
    }
}
