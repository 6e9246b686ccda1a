package com.ryuqq.prp.application.pipeline;

import com.ryuqq.prp.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.prp.core.model.QueueLayout;
import com.ryuqq.prp.core.model.WorkItem;
import com.ryuqq.prp.core.outcome.Deferred;
import com.ryuqq.prp.core.outcome.Ok;
import com.ryuqq.prp.core.outcome.Outcome;
import com.ryuqq.prp.core.pipeline.PipelinePhase;
import com.ryuqq.prp.core.ratelimit.RateLimitConfig;
import com.ryuqq.prp.core.ratelimit.RateLimiter;
import com.ryuqq.prp.core.ratelimit.SlidingWindowRateLimiter;
import com.ryuqq.prp.core.ratelimit.noop.NoOpRateLimiter;
import com.ryuqq.prp.testkit.fake.FakeClock;
import com.ryuqq.prp.testkit.fake.FakeCollaborators;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PhasePipeline 통합 테스트.
 *
 * <p>실제 파일 시스템(@TempDir), InMemoryStateStore, FakeCollaborators로 검증합니다:</p>
 * <ul>
 *   <li>전체 단계 완료 및 산출물 재배치</li>
 *   <li>Rate gate 거부 시 연기 및 진행 상황 보존</li>
 *   <li>단계 실패 시 failed/ 이동과 오류 파일</li>
 *   <li>short-circuit</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("PhasePipeline 테스트")
class PhasePipelineTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofHours(3);

    @TempDir
    Path root;

    private QueueLayout layout;
    private InMemoryStateStore store;
    private FakeCollaborators fakes;
    private FakeClock clock;

    @BeforeEach
    void setUp() {
        layout = QueueLayout.under(root);
        layout.ensureDirectories();
        store = new InMemoryStateStore();
        store.load();
        fakes = new FakeCollaborators();
        clock = new FakeClock(T0);
    }

    // ============================================================
    // 1. 정상 처리
    // ============================================================

    @Test
    @DisplayName("모든 단계를 거쳐 최종 PRP를 active/로 옮기고 완료 처리한다")
    void process_전체_단계_완료() throws IOException {
        // given
        WorkItem item = definition("feature-a.md");

        // when
        Outcome outcome = pipeline(new NoOpRateLimiter()).process(item);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        Ok ok = (Ok) outcome;
        assertThat(ok.shortCircuited()).isFalse();
        assertThat(ok.artifacts()).containsExactly(
            layout.activeDir().resolve("feature-a").resolve("prp-feature-a-gen-request.md"));
        assertThat(ok.phases()).hasSize(10);
        assertThat(layout.draftsDir().resolve("feature-a").resolve("prp-feature-a-draft-request.md")).exists();

        assertThat(fakes.calls()).containsExactly(
            "collect:feature-a.md",
            "build:draft:feature-a-context.json",
            "submit:feature-a-draft-request.jsonl",
            "collect:prp-feature-a-draft-request.md",
            "build:generate:feature-a-gen-context.json",
            "submit:feature-a-gen-request.jsonl");

        assertThat(store.snapshot().completedItems()).containsExactly("feature-a.md");
        assertThat(store.snapshot().currentItem()).isNull();
        assertThat(store.snapshot().submissionTimes()).hasSize(2);
        // 정의 파일은 큐에 남는다
        assertThat(item.path()).exists();
    }

    // ============================================================
    // 2. Rate gate
    // ============================================================

    @Test
    @DisplayName("RATE_GATE_1 거부 시 Deferred를 반환하고 산출물을 보존한다")
    void process_rate_gate_거부시_연기() throws IOException {
        // given
        WorkItem item = definition("feature-a.md");
        store.recordSubmission(T0.minus(Duration.ofMinutes(10)));
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(1, Duration.ofMinutes(60)));

        // when
        Outcome outcome = pipeline(limiter).process(item);

        // then
        assertThat(outcome).isInstanceOf(Deferred.class);
        Deferred deferred = (Deferred) outcome;
        assertThat(deferred.phase()).isEqualTo(PipelinePhase.RATE_GATE_1);
        assertThat(deferred.reason()).startsWith("Rate limit: 1 batches in last hour");
        assertThat(deferred.waitEstimate()).isEqualTo(Duration.ofMinutes(50));

        assertThat(root.resolve("batch/feature-a-context.json")).exists();
        assertThat(root.resolve("batch/feature-a-draft-request.jsonl")).exists();
        assertThat(store.snapshot().isCompleted("feature-a.md")).isFalse();
        assertThat(store.snapshot().currentItem()).isNull();
        assertThat(fakes.count("submit")).isZero();
    }

    @Test
    @DisplayName("연기된 아이템은 윈도우가 지나면 수집/요청 생성 없이 SUBMIT_DRAFT부터 재개한다")
    void process_연기_후_재개시_진행상황_재사용() throws IOException {
        // given
        WorkItem item = definition("feature-a.md");
        store.recordSubmission(T0.minus(Duration.ofMinutes(10)));
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(1, Duration.ofMinutes(60)));
        PhasePipeline pipeline = pipeline(limiter);
        pipeline.process(item);
        fakes.reset();

        // when
        clock.advance(Duration.ofMinutes(61));
        Outcome outcome = pipeline.process(item);

        // then: 초안 제출 후 두 번째 gate에서 다시 연기된다 (maxPerHour=1)
        assertThat(fakes.calls()).first().isEqualTo("submit:feature-a-draft-request.jsonl");
        assertThat(fakes.count("build")).isEqualTo(1);
        assertThat(outcome).isInstanceOf(Deferred.class);
        assertThat(((Deferred) outcome).phase()).isEqualTo(PipelinePhase.RATE_GATE_2);
        assertThat(layout.draftsDir().resolve("feature-a").resolve("prp-feature-a-draft-request.md")).exists();
    }

    @Test
    @DisplayName("두 rate gate는 같은 윈도우를 공유한다")
    void process_두_gate가_같은_윈도우_공유() throws IOException {
        // given
        WorkItem item = definition("feature-a.md");
        RateLimiter limiter = new SlidingWindowRateLimiter(new RateLimitConfig(10, Duration.ofMinutes(60)));

        // when
        Outcome outcome = pipeline(limiter).process(item);

        // then
        assertThat(outcome).isInstanceOf(Deferred.class);
        Deferred deferred = (Deferred) outcome;
        assertThat(deferred.phase()).isEqualTo(PipelinePhase.RATE_GATE_2);
        assertThat(deferred.reason()).isEqualTo("Minimum interval: Wait 60 minutes since last batch.");
        assertThat(store.snapshot().submissionTimes()).containsExactly(T0);
    }

    // ============================================================
    // 3. 실패 처리
    // ============================================================

    @Test
    @DisplayName("컨텍스트 수집 실패 시 정의를 failed/로 옮기고 오류 파일을 기록한다")
    void process_수집_실패시_failed_이동() throws IOException {
        // given
        WorkItem item = definition("feature-b.md");
        fakes.failCollecting("feature-b.md");
        PhasePipeline pipeline = pipeline(new NoOpRateLimiter());

        // when & then
        assertThatThrownBy(() -> pipeline.process(item))
            .isInstanceOf(PipelineException.class)
            .satisfies(e -> {
                PipelineException failure = (PipelineException) e;
                assertThat(failure.getItemName()).isEqualTo("feature-b.md");
                assertThat(failure.getPhase()).isEqualTo(PipelinePhase.COLLECT_CONTEXT);
                assertThat(failure.getErrorCode()).isEqualTo("COLLABORATOR");
                assertThat(failure.toFail().message()).isEqualTo("Context collection failed for feature-b.md");
            });

        assertThat(item.path()).doesNotExist();
        assertThat(layout.failedDir().resolve("feature-b.md")).exists();
        String report = Files.readString(layout.failedDir().resolve("feature-b-error.txt"));
        assertThat(report)
            .startsWith("Failed at: 2025-06-01T10:00:00Z")
            .contains("Phase: COLLECT_CONTEXT")
            .contains("Error: Context collection failed for feature-b.md");
        assertThat(store.snapshot().isCompleted("feature-b.md")).isFalse();
        assertThat(store.snapshot().currentItem()).isNull();
    }

    @Test
    @DisplayName("제출이 실패해도 제출 기록은 남는다")
    void process_제출_실패시에도_기록() throws IOException {
        // given
        WorkItem item = definition("feature-c.md");
        fakes.failSubmitting("feature-c");
        PhasePipeline pipeline = pipeline(new NoOpRateLimiter());

        // when & then
        assertThatThrownBy(() -> pipeline.process(item))
            .isInstanceOf(PipelineException.class)
            .extracting(e -> ((PipelineException) e).getErrorCode())
            .isEqualTo("SUBMISSION");
        assertThat(store.snapshot().submissionTimes()).containsExactly(T0);
        assertThat(store.snapshot().lastSubmissionTime()).isEqualTo(T0);
    }

    @Test
    @DisplayName("배치 결과에 초안이 없으면 RELOCATE_DRAFT에서 실패한다")
    void process_초안_없음() throws IOException {
        // given
        WorkItem item = definition("feature-d.md");
        fakes.produceNothingFor("feature-d");
        PhasePipeline pipeline = pipeline(new NoOpRateLimiter());

        // when & then
        assertThatThrownBy(() -> pipeline.process(item))
            .isInstanceOf(PipelineException.class)
            .satisfies(e -> {
                PipelineException failure = (PipelineException) e;
                assertThat(failure.getPhase()).isEqualTo(PipelinePhase.RELOCATE_DRAFT);
                assertThat(failure.getErrorCode()).isEqualTo("ARTIFACT_MISSING");
            });
        assertThat(layout.failedDir().resolve("feature-d-error.txt")).exists();
    }

    // ============================================================
    // 4. Short-circuit
    // ============================================================

    @Test
    @DisplayName("active/에 이미 PRP가 있으면 Collaborator 호출 없이 완료 처리한다")
    void process_active_산출물_존재시_short_circuit() throws IOException {
        // given
        WorkItem item = definition("feature-e.md");
        Path done = Files.createDirectories(layout.activeDir().resolve("feature-e")).resolve("prp-001.md");
        Files.writeString(done, "# done");

        // when
        Outcome outcome = pipeline(new NoOpRateLimiter()).process(item);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(((Ok) outcome).shortCircuited()).isTrue();
        assertThat(((Ok) outcome).artifacts()).hasSize(1);
        assertThat(fakes.calls()).isEmpty();
        assertThat(store.snapshot().completedItems()).containsExactly("feature-e.md");
    }

    @Test
    @DisplayName("재배치된 초안이 있으면 초안 컨텍스트 수집부터 재개한다")
    void process_재배치된_초안에서_재개() throws IOException {
        // given
        WorkItem item = definition("feature-f.md");
        Path draft = Files.createDirectories(layout.draftsDir().resolve("feature-f")).resolve("prp-draft.md");
        Files.writeString(draft, "# draft");

        // when
        Outcome outcome = pipeline(new NoOpRateLimiter()).process(item);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(((Ok) outcome).shortCircuited()).isTrue();
        assertThat(fakes.calls()).containsExactly(
            "collect:prp-draft.md",
            "build:generate:feature-f-gen-context.json",
            "submit:feature-f-gen-request.jsonl");
    }

    @Test
    @DisplayName("이름이 다른 아이템의 접두사인 아이템도 그 아이템의 산출물로 short-circuit되지 않는다")
    void process_접두사를_공유하는_아이템은_서로_독립적이다() throws IOException {
        // given
        PhasePipeline pipeline = pipeline(new NoOpRateLimiter());
        Outcome first = pipeline.process(definition("x--y.md"));
        assertThat(first.isOk()).isTrue();
        fakes.reset();

        // when
        Outcome outcome = pipeline.process(definition("x.md"));

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        Ok ok = (Ok) outcome;
        assertThat(ok.shortCircuited()).isFalse();
        assertThat(ok.phases()).isNotEmpty();
        assertThat(ok.artifacts()).containsExactly(
            layout.activeDir().resolve("x").resolve("prp-x-gen-request.md"));
        assertThat(fakes.calls()).startsWith("collect:x.md");
        assertThat(layout.activeDir().resolve("x--y").resolve("prp-x--y-gen-request.md")).exists();
        assertThat(store.snapshot().completedItems()).containsExactlyInAnyOrder("x--y.md", "x.md");
    }

    private PhasePipeline pipeline(RateLimiter limiter) {
        return new PhasePipeline(layout, store, limiter,
            fakes.collector(), fakes.builder(), fakes.submitter(), TIMEOUT, clock);
    }

    private WorkItem definition(String name) throws IOException {
        Path file = Files.writeString(layout.queueDir().resolve(name), "# " + name);
        return new WorkItem(name, file, Files.getLastModifiedTime(file).toInstant());
    }
}
