package com.ryuqq.prp.adapter.runner;

import java.time.Duration;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollInterval: daemon 모드에서 사이클 사이 대기 시간 (기본 300초)</li>
 *   <li>maxBatchesPerHour: 시작 배너에 표시할 시간당 배치 한도 (기본 1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollInterval 큐 확인 간격 (양수여야 함)
 * @param maxBatchesPerHour 시간당 배치 한도 (1 이상이어야 함)
 */
public record QueueWorkerConfig(
    Duration pollInterval,
    int maxBatchesPerHour
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollInterval=300초, maxBatchesPerHour=1</p>
     */
    public QueueWorkerConfig() {
        this(Duration.ofSeconds(300), 1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueWorkerConfig {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException(
                "pollInterval must be positive (current: " + pollInterval + ")"
            );
        }
        if (maxBatchesPerHour <= 0) {
            throw new IllegalArgumentException(
                "maxBatchesPerHour must be positive (current: " + maxBatchesPerHour + ")"
            );
        }
    }

    /**
     * pollInterval만 변경한 새 인스턴스 생성.
     */
    public QueueWorkerConfig withPollInterval(Duration pollInterval) {
        return new QueueWorkerConfig(pollInterval, maxBatchesPerHour);
    }
}
