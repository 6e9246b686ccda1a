package com.ryuqq.prp.adapter.runner;

import com.ryuqq.prp.application.pipeline.PhasePipeline;
import com.ryuqq.prp.application.pipeline.PipelineException;
import com.ryuqq.prp.application.runtime.QueueRuntime;
import com.ryuqq.prp.application.runtime.RunSummary;
import com.ryuqq.prp.application.scanner.QueueScanner;
import com.ryuqq.prp.core.exception.StateStoreException;
import com.ryuqq.prp.core.model.QueueLayout;
import com.ryuqq.prp.core.model.WorkItem;
import com.ryuqq.prp.core.outcome.Fail;
import com.ryuqq.prp.core.outcome.Outcome;
import com.ryuqq.prp.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queue Worker Runner 구현체.
 *
 * <p>큐 디렉토리의 정의 파일을 오래된 순서로 하나씩 {@link PhasePipeline}에 넣습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>큐 스캔 (완료된 아이템 제외)</li>
 *   <li>아이템 단위 실패 격리 (로그 후 다음 아이템 계속)</li>
 *   <li>daemon 모드 반복 및 협력적 중단</li>
 *   <li>이전 실행이 중단되며 남긴 current_item 정리</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>처리는 호출 스레드에서 순차적으로 수행</li>
 *   <li>{@link #stop()}은 다른 스레드(shutdown hook 등)에서 호출 가능</li>
 *   <li>daemon 대기는 latch로 수행되어 stop() 시 즉시 깨어남</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements QueueRuntime {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    private final QueueLayout layout;
    private final StateStore store;
    private final QueueScanner scanner;
    private final PhasePipeline pipeline;
    private final QueueWorkerConfig config;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    /**
     * 생성자.
     *
     * <p>상태에 current_item이 남아 있으면 이전 실행이 아이템 처리 중 중단된 것이므로
     * WARN 로그 후 정리합니다. 아이템 자체는 큐에 남아 있으므로 다음 스캔에서
     * 남은 산출물 기준으로 재개됩니다.</p>
     *
     * @param layout 디렉토리 구성
     * @param store 상태 저장소
     * @param scanner 큐 스캐너
     * @param pipeline 단계 파이프라인
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws StateStoreException current_item 정리 실패 시
     */
    public QueueWorkerRunner(
        QueueLayout layout,
        StateStore store,
        QueueScanner scanner,
        PhasePipeline pipeline,
        QueueWorkerConfig config
    ) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (scanner == null) {
            throw new IllegalArgumentException("scanner cannot be null");
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.layout = layout;
        this.store = store;
        this.scanner = scanner;
        this.pipeline = pipeline;
        this.config = config;

        clearInterruptedItem();
    }

    @Override
    public RunSummary runOnce() {
        log.info("=== Starting batch PRP processing (run once) ===");

        List<WorkItem> pending = pending();
        if (pending.isEmpty()) {
            log.info("No files in queue");
            return RunSummary.empty();
        }

        log.info("Found {} files in queue", pending.size());
        RunSummary summary = processAll(pending);

        log.info("=== Batch processing complete ===");
        return summary;
    }

    @Override
    public void runDaemon() {
        log.info("=== Starting PRP orchestrator in daemon mode ===");
        log.info("Queue directory: {}", layout.queueDir());
        log.info("Check interval: {}s", config.pollInterval().toSeconds());
        log.info("Rate limit: {} batches/hour", config.maxBatchesPerHour());

        while (!stopped.get()) {
            List<WorkItem> pending = scanForDaemon();
            if (pending == null) {
                log.warn("Skipping this cycle, retrying in {}s", config.pollInterval().toSeconds());
            } else if (pending.isEmpty()) {
                log.info("Queue empty, waiting...");
            } else {
                log.info("Found {} files in queue", pending.size());
                processAll(pending);
            }

            if (!awaitNextCycle()) {
                break;
            }
        }

        log.info("Shutting down gracefully...");
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            stopSignal.countDown();
        }
    }

    /**
     * 중단 요청 여부.
     *
     * @return stop()이 호출되었으면 true
     */
    public boolean isStopped() {
        return stopped.get();
    }

    private List<WorkItem> pending() {
        return scanner.listPending(layout.queueDir(), store.snapshot().completedItems());
    }

    /**
     * daemon용 큐 스캔. 스캔 실패는 다음 주기에 재시도합니다.
     *
     * @return 대기 아이템, 스캔에 실패하면 null
     */
    private List<WorkItem> scanForDaemon() {
        try {
            return pending();
        } catch (StateStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Could not scan queue {}: {}", layout.queueDir(), PipelineException.describe(e), e);
            return null;
        }
    }

    /**
     * 아이템 순차 처리.
     *
     * <p>{@link StateStoreException}은 잡지 않고 전파합니다.</p>
     */
    private RunSummary processAll(List<WorkItem> items) {
        List<Outcome> outcomes = new ArrayList<>();
        for (WorkItem item : items) {
            if (stopped.get()) {
                log.info("Stop requested, leaving {} for the next run", item.name());
                break;
            }
            outcomes.add(processItem(item));
        }
        return new RunSummary(outcomes);
    }

    private Outcome processItem(WorkItem item) {
        try {
            return pipeline.process(item);
        } catch (StateStoreException e) {
            throw e;
        } catch (PipelineException e) {
            log.warn("Continuing with next file after error");
            return e.toFail();
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing {}", item.name(), e);
            log.warn("Continuing with next file after error");
            return Fail.of(item.name(), null, PipelineException.INTERNAL, PipelineException.describe(e));
        }
    }

    /**
     * 다음 사이클까지 대기.
     *
     * @return 계속 진행하면 true, 중단 요청 또는 인터럽트 시 false
     */
    private boolean awaitNextCycle() {
        try {
            return !stopSignal.await(config.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            return false;
        }
    }

    private void clearInterruptedItem() {
        String current = store.snapshot().currentItem();
        if (current != null) {
            log.warn("Previous run was interrupted while processing {}; it will resume from its artifacts", current);
            store.markCurrent(null);
        }
    }
}
