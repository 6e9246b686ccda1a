package com.ryuqq.prp.application.pipeline;

import com.ryuqq.prp.core.exception.ArtifactNotFoundException;
import com.ryuqq.prp.core.exception.StateStoreException;
import com.ryuqq.prp.core.model.QueueLayout;
import com.ryuqq.prp.core.model.RequestPhase;
import com.ryuqq.prp.core.model.WorkItem;
import com.ryuqq.prp.core.outcome.Deferred;
import com.ryuqq.prp.core.outcome.Ok;
import com.ryuqq.prp.core.outcome.Outcome;
import com.ryuqq.prp.core.pipeline.PhaseResult;
import com.ryuqq.prp.core.pipeline.PhaseTransition;
import com.ryuqq.prp.core.pipeline.PipelinePhase;
import com.ryuqq.prp.core.ratelimit.RateDecision;
import com.ryuqq.prp.core.ratelimit.RateLimiter;
import com.ryuqq.prp.core.spi.BatchSubmitter;
import com.ryuqq.prp.core.spi.ContextCollector;
import com.ryuqq.prp.core.spi.RequestBuilder;
import com.ryuqq.prp.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 아이템 하나를 고정 순서의 단계로 처리하는 파이프라인.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * markCurrent(name)
 *   ↓
 * ShortCircuitResolver → 시작 단계 결정
 *   ↓
 * while (phase != DONE):
 *   - COLLECT / BUILD: Collaborator 호출
 *   - RATE_GATE: deny → markCurrent(null), Deferred 반환
 *   - SUBMIT: 제출 후 recordSubmission (예외가 나도 기록)
 *   - RELOCATE: 결과를 drafts/ 또는 active/로 이동
 *   ↓
 * markCompleted(name) → Ok
 * </pre>
 *
 * <p><strong>실패 처리:</strong> StateStoreException을 제외한 모든 예외는
 * 정의 파일을 failed/로 옮기고 오류 파일을 기록한 뒤 {@link PipelineException}으로 던집니다.
 * StateStoreException은 그대로 전파됩니다 (치명적).</p>
 *
 * <p>단일 워커 전제이며 thread-safe하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PhasePipeline {

    private static final Logger log = LoggerFactory.getLogger(PhasePipeline.class);

    private static final DateTimeFormatter ERROR_TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final QueueLayout layout;
    private final StateStore store;
    private final RateLimiter rateLimiter;
    private final ContextCollector collector;
    private final RequestBuilder requestBuilder;
    private final BatchSubmitter submitter;
    private final Duration submissionTimeout;
    private final Clock clock;
    private final ShortCircuitResolver resolver;
    private final ArtifactRelocator relocator;

    /**
     * 생성자.
     *
     * @param layout 디렉토리 구성
     * @param store 상태 저장소
     * @param rateLimiter Rate Limiter
     * @param collector 컨텍스트 수집기
     * @param requestBuilder 요청 생성기
     * @param submitter 배치 제출기
     * @param submissionTimeout 배치 제출 타임아웃
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null이거나 타임아웃이 양수가 아닌 경우
     */
    public PhasePipeline(
        QueueLayout layout,
        StateStore store,
        RateLimiter rateLimiter,
        ContextCollector collector,
        RequestBuilder requestBuilder,
        BatchSubmitter submitter,
        Duration submissionTimeout,
        Clock clock
    ) {
        if (layout == null) {
            throw new IllegalArgumentException("layout cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }
        if (requestBuilder == null) {
            throw new IllegalArgumentException("requestBuilder cannot be null");
        }
        if (submitter == null) {
            throw new IllegalArgumentException("submitter cannot be null");
        }
        if (submissionTimeout == null || submissionTimeout.isZero() || submissionTimeout.isNegative()) {
            throw new IllegalArgumentException("submissionTimeout must be positive (current: " + submissionTimeout + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.layout = layout;
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.collector = collector;
        this.requestBuilder = requestBuilder;
        this.submitter = submitter;
        this.submissionTimeout = submissionTimeout;
        this.clock = clock;
        this.resolver = new ShortCircuitResolver();
        this.relocator = new ArtifactRelocator();
    }

    /**
     * 아이템 처리.
     *
     * @param item 처리할 아이템
     * @return Ok (완료) 또는 Deferred (rate gate 거부)
     * @throws PipelineException 단계 실패 시 (아이템은 이미 failed/로 이동됨)
     * @throws StateStoreException 상태 저장 실패 시
     */
    public Outcome process(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }

        log.info("Processing: {}", item.name());
        store.markCurrent(item.name());

        ItemArtifacts artifacts = new ItemArtifacts(item, layout);
        List<PhaseResult> results = new ArrayList<>();
        PipelinePhase phase = PipelinePhase.initial();

        try {
            PipelinePhase start = resolver.resolve(artifacts);
            if (start != phase) {
                phase = PhaseTransition.transition(phase, start);
                log.info("Resuming {} at {} (earlier output found)", item.name(), phase);
            }
            boolean shortCircuited = phase != PipelinePhase.initial();

            if (phase == PipelinePhase.DONE) {
                List<Path> existing = artifacts.activeArtifacts();
                log.info("Found {} existing PRPs in {}", existing.size(), artifacts.activeDir());
                return complete(item, existing, results, true);
            }

            while (phase != PipelinePhase.DONE) {
                if (phase.isRateGate()) {
                    RateDecision decision = rateLimiter.canSubmit(store.snapshot(), clock.instant());
                    if (!decision.allowed()) {
                        return defer(item, phase, decision, results);
                    }
                    log.info("Rate limit check passed for {} ({} batches in last hour)",
                        item.name(), decision.submissionsInWindow());
                    results.add(PhaseResult.success(phase));
                } else {
                    results.add(execute(phase, artifacts));
                }
                phase = PhaseTransition.transition(phase, phase.next());
            }

            return complete(item, artifacts.activeArtifacts(), results, shortCircuited);
        } catch (StateStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw fail(item, artifacts, phase, e);
        }
    }

    private PhaseResult execute(PipelinePhase phase, ItemArtifacts artifacts) {
        WorkItem item = artifacts.item();
        switch (phase) {
            case COLLECT_CONTEXT:
                log.info("Phase 1: Collecting context for {}", item.name());
                return PhaseResult.success(phase, collector.collect(item.path(), artifacts.contextFile()));

            case BUILD_DRAFT_REQUEST:
                log.info("Phase 2: Creating draft batch request for {}", item.name());
                return PhaseResult.success(phase,
                    requestBuilder.build(artifacts.contextFile(), RequestPhase.DRAFT, artifacts.draftRequestFile()));

            case SUBMIT_DRAFT:
                log.info("Phase 3: Submitting draft batch for {}", item.name());
                return PhaseResult.success(phase, submit(artifacts.draftRequestFile(), artifacts.draftResultsDir()));

            case RELOCATE_DRAFT:
                return PhaseResult.success(phase, relocateDraft(artifacts));

            case COLLECT_DRAFT_CONTEXT:
                log.info("Phase 4: Collecting context from draft for {}", item.name());
                Path draft = firstRelocatedDraft(artifacts);
                return PhaseResult.success(phase, collector.collect(draft, artifacts.genContextFile()));

            case BUILD_FINAL_REQUEST:
                log.info("Phase 4: Creating generate batch request for {}", item.name());
                return PhaseResult.success(phase,
                    requestBuilder.build(artifacts.genContextFile(), RequestPhase.FINAL, artifacts.genRequestFile()));

            case SUBMIT_FINAL:
                log.info("Phase 5: Submitting generate batch for {}", item.name());
                return PhaseResult.success(phase, submit(artifacts.genRequestFile(), artifacts.genResultsDir()));

            case RELOCATE_FINAL:
                return PhaseResult.success(phase, relocateFinals(artifacts));

            default:
                throw new IllegalStateException("Phase is not executable: " + phase);
        }
    }

    /**
     * 배치 제출 후 제출 기록.
     *
     * <p>원격에 이미 배치가 생성되었을 수 있으므로 Submitter가 예외를 던져도 기록합니다.</p>
     */
    private List<Path> submit(Path requestFile, Path outputDirectory) {
        try {
            return submitter.submit(requestFile, outputDirectory, submissionTimeout);
        } finally {
            store.recordSubmission(clock.instant());
        }
    }

    private Path relocateDraft(ItemArtifacts artifacts) {
        List<Path> drafts = artifacts.stagedDrafts();
        if (drafts.isEmpty()) {
            throw new ArtifactNotFoundException("No draft PRP found in batch results", artifacts.draftResultsDir());
        }
        Path draft = drafts.get(0);
        Path relocated = relocator.relocate(draft, artifacts.draftsDir());
        log.info("Draft created: {}", relocated.getFileName());
        return relocated;
    }

    private Path firstRelocatedDraft(ItemArtifacts artifacts) {
        List<Path> drafts = artifacts.relocatedDrafts();
        if (drafts.isEmpty()) {
            throw new ArtifactNotFoundException("No relocated draft found", artifacts.draftsDir());
        }
        return drafts.get(0);
    }

    private List<Path> relocateFinals(ItemArtifacts artifacts) {
        List<Path> finals = artifacts.stagedFinals();
        if (finals.isEmpty()) {
            throw new ArtifactNotFoundException("No PRP files found in batch results", artifacts.genResultsDir());
        }
        List<Path> relocated = new ArrayList<>();
        for (Path prp : finals) {
            Path target = relocator.relocate(prp, artifacts.activeDir());
            log.info("PRP ready for implementation: {}", target.getFileName());
            relocated.add(target);
        }
        return relocated;
    }

    private Ok complete(WorkItem item, List<Path> artifacts, List<PhaseResult> results, boolean shortCircuited) {
        store.markCompleted(item.name());
        log.info("✓ PRPs generated from: {}", item.name());
        log.info("  Ready for execution: {} PRPs in {}", artifacts.size(), layout.activeDir().resolve(item.stem()));
        return new Ok(item.name(), artifacts, results, shortCircuited);
    }

    private Deferred defer(WorkItem item, PipelinePhase gate, RateDecision decision, List<PhaseResult> results) {
        log.warn("Rate limit check: {}", decision.reason());
        log.warn("Will retry {} later (waiting at {}, about {} minutes)", item.name(), gate, decision.waitMinutes());
        store.markCurrent(null);
        return new Deferred(item.name(), gate, decision.reason(), decision.waitEstimate(), results);
    }

    private PipelineException fail(WorkItem item, ItemArtifacts artifacts, PipelinePhase phase, RuntimeException cause) {
        PipelineException failure = new PipelineException(item.name(), phase, cause);
        log.error("Failed to process {} at {}: {}", item.name(), phase, PipelineException.describe(cause), cause);

        try {
            if (Files.exists(item.path())) {
                relocator.relocate(item.path(), layout.failedDir());
            }
        } catch (RuntimeException e) {
            log.error("Could not move {} to {}", item.name(), layout.failedDir(), e);
            failure.addSuppressed(e);
        }

        try {
            writeErrorReport(artifacts.errorFile(), phase, cause);
        } catch (IOException e) {
            log.error("Could not write error report {}", artifacts.errorFile(), e);
            failure.addSuppressed(e);
        }

        store.markCurrent(null);
        return failure;
    }

    private void writeErrorReport(Path errorFile, PipelinePhase phase, Throwable cause) throws IOException {
        Files.createDirectories(errorFile.getParent());
        String report = "Failed at: " + ZonedDateTime.now(clock).format(ERROR_TIMESTAMP) + "\n"
            + "Phase: " + phase + "\n"
            + "Error: " + PipelineException.describe(cause) + "\n";
        Files.writeString(errorFile, report, StandardCharsets.UTF_8);
    }
}
