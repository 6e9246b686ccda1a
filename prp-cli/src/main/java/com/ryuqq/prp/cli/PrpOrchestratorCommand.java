package com.ryuqq.prp.cli;

import com.ryuqq.prp.adapter.file.store.JsonFileStateStore;
import com.ryuqq.prp.adapter.runner.QueueWorkerRunner;
import com.ryuqq.prp.application.pipeline.PhasePipeline;
import com.ryuqq.prp.application.runtime.QueueRuntime;
import com.ryuqq.prp.application.runtime.RunSummary;
import com.ryuqq.prp.application.scanner.QueueScanner;
import com.ryuqq.prp.core.exception.StateStoreException;
import com.ryuqq.prp.core.model.QueueLayout;
import com.ryuqq.prp.core.outcome.Deferred;
import com.ryuqq.prp.core.outcome.Fail;
import com.ryuqq.prp.core.outcome.Outcome;
import com.ryuqq.prp.core.ratelimit.RateLimiter;
import com.ryuqq.prp.core.ratelimit.SlidingWindowRateLimiter;
import com.ryuqq.prp.core.spi.StateStore;
import com.ryuqq.prp.core.state.OrchestratorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * PRP 배치 처리 CLI.
 *
 * <pre>
 * prp-orchestrator                  # 큐를 한 번 처리하고 종료
 * prp-orchestrator --daemon         # 계속 실행하며 큐 감시
 * prp-orchestrator --status         # 현재 상태 출력
 * </pre>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 정상 종료 (아이템 단위 실패 포함)</li>
 *   <li>1: 설정 오류</li>
 *   <li>2: 상태 파일 읽기/쓰기 실패</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "prp-orchestrator",
    mixinStandardHelpOptions = true,
    version = "prp-orchestrator 1.0.0",
    description = "Autonomous PRP batch processor: turns queued definitions into PRPs through rate-limited batches."
)
public class PrpOrchestratorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PrpOrchestratorCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION = 1;
    static final int EXIT_STATE_STORE = 2;

    /** shutdown hook이 진행 중인 아이템을 기다리는 시간에 더하는 여유. */
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(10);

    @Spec
    CommandSpec spec;

    @Option(names = "--daemon", description = "Run in daemon mode (continuous monitoring)")
    private boolean daemon;

    @Option(names = "--status", description = "Show current status and exit")
    private boolean status;

    @Option(names = "--project-root", paramLabel = "<dir>",
        description = "Project root containing prp/, batch/, logs/ and scripts/ (default: working directory)")
    private Path projectRoot = Path.of("");

    private final Map<String, String> environment;
    private final BiFunction<Path, OrchestratorSettings, Collaborators> collaboratorFactory;
    private final Clock clock;

    public PrpOrchestratorCommand() {
        this(System.getenv(), Collaborators::scripts, Clock.systemDefaultZone());
    }

    /**
     * 생성자 (환경 변수, 협력자, 시계 주입).
     *
     * @param environment 환경 변수
     * @param collaboratorFactory 프로젝트 루트와 설정으로 협력자를 만드는 함수
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    PrpOrchestratorCommand(
        Map<String, String> environment,
        BiFunction<Path, OrchestratorSettings, Collaborators> collaboratorFactory,
        Clock clock
    ) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (collaboratorFactory == null) {
            throw new IllegalArgumentException("collaboratorFactory cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.environment = environment;
        this.collaboratorFactory = collaboratorFactory;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new PrpOrchestratorCommand()).execute(args));
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Path root = projectRoot.toAbsolutePath().normalize();

        OrchestratorSettings settings;
        try {
            settings = OrchestratorSettings.load(root, environment);
        } catch (ConfigurationException e) {
            err.println("Configuration Error: " + e.getMessage());
            err.flush();
            return EXIT_CONFIGURATION;
        }
        log.debug("Loaded {}", settings);

        try {
            QueueLayout layout = QueueLayout.under(root);
            StateStore store = new JsonFileStateStore(layout.stateFile(), clock);
            store.load();
            RateLimiter rateLimiter = new SlidingWindowRateLimiter(settings.rateLimitConfig());
            QueueScanner scanner = new QueueScanner();

            if (status) {
                printStatus(out, layout, store.snapshot(), scanner, rateLimiter);
                return EXIT_OK;
            }

            layout.ensureDirectories();
            Collaborators collaborators = collaboratorFactory.apply(root, settings);
            PhasePipeline pipeline = new PhasePipeline(layout, store, rateLimiter,
                collaborators.collector(), collaborators.requestBuilder(), collaborators.submitter(),
                settings.batchTimeout(), clock);
            QueueRuntime runtime = new QueueWorkerRunner(layout, store, scanner, pipeline, settings.workerConfig());

            if (daemon) {
                runDaemon(runtime, settings.batchTimeout().plus(SHUTDOWN_GRACE));
            } else {
                printSummary(out, runtime.runOnce());
            }
            return EXIT_OK;
        } catch (StateStoreException e) {
            log.error("State store failure, stopping: {}", e.getMessage(), e);
            err.println("State Error: " + e.getMessage());
            err.flush();
            return EXIT_STATE_STORE;
        }
    }

    /**
     * daemon 실행.
     *
     * <p>SIGTERM/SIGINT 시 shutdown hook이 stop()을 요청하고 진행 중인 아이템이
     * 끝날 때까지 JVM 종료를 늦춥니다.</p>
     */
    private void runDaemon(QueueRuntime runtime, Duration shutdownWait) {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            runtime.stop();
            try {
                if (!finished.await(shutdownWait.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Current item did not finish within {}s, exiting anyway", shutdownWait.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "prp-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            runtime.runDaemon();
        } finally {
            finished.countDown();
            removeShutdownHook(hook);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down");
        }
    }

    private void printStatus(PrintWriter out, QueueLayout layout, OrchestratorState state,
                             QueueScanner scanner, RateLimiter rateLimiter) {
        Instant now = clock.instant();
        int queued = scanner.listPending(layout.queueDir(), state.completedItems()).size();
        StatusReport.of(layout, state, queued, rateLimiter.canSubmit(state, now), now).print(out);
    }

    private static void printSummary(PrintWriter out, RunSummary summary) {
        for (Outcome outcome : summary.outcomes()) {
            out.println("  " + describe(outcome));
        }
        out.println("Completed: " + summary.completed()
            + ", Deferred: " + summary.deferred()
            + ", Failed: " + summary.failed());
        out.flush();
    }

    private static String describe(Outcome outcome) {
        if (outcome instanceof Deferred) {
            Deferred deferred = (Deferred) outcome;
            return "DEFERRED " + deferred.itemName() + " (" + deferred.reason() + ")";
        }
        if (outcome instanceof Fail) {
            Fail fail = (Fail) outcome;
            return "FAILED   " + fail.itemName() + " [" + fail.errorCode() + "] " + fail.message();
        }
        return "DONE     " + outcome.itemName();
    }
}
