package com.ryuqq.prp.application.runtime;

import com.ryuqq.prp.core.exception.StateStoreException;

/**
 * 큐 처리 Runtime.
 *
 * <p>큐 디렉토리를 스캔하고 대기 중인 아이템을 한 번에 하나씩 파이프라인에 넣습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runOnce()
 *   ↓
 * listPending(queueDir, completed) → [item1, item2, ...] (오래된 순)
 *   ↓
 * For each item (stop() 확인):
 *   pipeline.process(item)
 *     - Ok       → 완료 집합에 기록됨
 *     - Deferred → 다음 사이클에 다시 제공
 *     - PipelineException → Fail로 기록, 다음 아이템 계속
 *   ↓
 * RunSummary 반환
 *
 * runDaemon()
 *   ↓
 * while (!stopped):
 *   runOnce() → 비어 있으면 "Queue empty, waiting..."
 *   poll interval 대기 (stop() 시 즉시 깨어남)
 * </pre>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>아이템 단위 실패: 로그 후 계속</li>
 *   <li>{@link StateStoreException}: 즉시 중단하고 전파 (치명적)</li>
 * </ul>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code QueueWorkerRunner}에서 제공됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface QueueRuntime {

    /**
     * 큐를 한 번 스캔하고 대기 중인 아이템을 모두 처리.
     *
     * @return 처리 결과 요약
     * @throws StateStoreException 상태 저장 실패 시
     */
    RunSummary runOnce();

    /**
     * {@link #stop()}이 호출될 때까지 주기적으로 {@link #runOnce()} 반복.
     *
     * @throws StateStoreException 상태 저장 실패 시
     */
    void runDaemon();

    /**
     * 협력적 중단 요청.
     *
     * <p>진행 중인 아이템은 끝까지 처리되며, 아이템 사이와 사이클 사이에서 중단됩니다.
     * 어느 스레드에서나 호출할 수 있습니다.</p>
     */
    void stop();
}
