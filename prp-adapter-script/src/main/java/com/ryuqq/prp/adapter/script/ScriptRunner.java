package com.ryuqq.prp.adapter.script;

import com.ryuqq.prp.core.exception.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 프로젝트의 helper 스크립트를 자식 프로세스로 실행.
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>스크립트 위치: {@code <scriptsDir>/<name>}, 실행 권한 부여 후 실행</li>
 *   <li>작업 디렉토리: 프로젝트 루트</li>
 *   <li>stdout/stderr는 합쳐서 DEBUG로 기록하고 마지막 {@value #TAIL_LINES}줄을 보관</li>
 *   <li>명령줄과 출력의 secret 값은 {@value #MASK}로 치환</li>
 * </ul>
 *
 * <p><strong>실패:</strong> 스크립트 없음, 0이 아닌 종료 코드, 타임아웃, 인터럽트는 모두
 * {@link CollaboratorException}입니다. 타임아웃 시 프로세스를 강제 종료합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    static final int TAIL_LINES = 20;
    static final String MASK = "****";

    private static final long OUTPUT_DRAIN_MILLIS = 5_000;

    private final Path projectRoot;
    private final Path scriptsDir;
    private final Set<String> secrets;

    /**
     * 생성자.
     *
     * @param projectRoot 작업 디렉토리
     * @param scriptsDir 스크립트 디렉토리
     * @param secrets 로그에서 가릴 값 (API key 등)
     * @throws IllegalArgumentException 경로가 null인 경우
     */
    public ScriptRunner(Path projectRoot, Path scriptsDir, Set<String> secrets) {
        if (projectRoot == null) {
            throw new IllegalArgumentException("projectRoot cannot be null");
        }
        if (scriptsDir == null) {
            throw new IllegalArgumentException("scriptsDir cannot be null");
        }
        this.projectRoot = projectRoot;
        this.scriptsDir = scriptsDir;
        this.secrets = secrets == null ? Set.of() : Set.copyOf(secrets);
    }

    /**
     * 스크립트 실행 (종료 코드 0이 아니면 예외).
     *
     * @param scriptName 스크립트 파일 이름
     * @param args 인자
     * @param timeout 최대 실행 시간
     * @return 실행 결과
     * @throws CollaboratorException 스크립트 없음, 실패, 타임아웃
     */
    public ScriptResult run(String scriptName, List<String> args, Duration timeout) {
        if (scriptName == null || scriptName.isBlank()) {
            throw new IllegalArgumentException("scriptName cannot be null or blank");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }

        Path script = scriptsDir.resolve(scriptName);
        if (!Files.isRegularFile(script)) {
            throw new CollaboratorException("Script not found: " + script);
        }
        if (!Files.isExecutable(script) && !script.toFile().setExecutable(true)) {
            log.warn("Could not mark script executable: {}", script);
        }

        List<String> command = new ArrayList<>();
        command.add(script.toString());
        command.addAll(args);
        log.info("Running: {}", mask(String.join(" ", command)));

        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(projectRoot.toFile())
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            throw new CollaboratorException("Cannot start script: " + scriptName, e);
        }

        Deque<String> tail = new ArrayDeque<>();
        Thread pump = new Thread(() -> drain(process, scriptName, tail), "script-output-" + scriptName);
        pump.setDaemon(true);
        pump.start();

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                pump.join(OUTPUT_DRAIN_MILLIS);
                throw new CollaboratorException("Script timed out after " + timeout.toSeconds() + "s: " + scriptName);
            }
            pump.join(OUTPUT_DRAIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CollaboratorException("Interrupted while running script: " + scriptName, e);
        }

        ScriptResult result = new ScriptResult(process.exitValue(), snapshot(tail));
        if (!result.isSuccess()) {
            log.error("Script failed: {} (exit {})", scriptName, result.exitCode());
            throw new CollaboratorException("Script failed: " + scriptName + " (exit " + result.exitCode() + ")"
                + (result.outputTail().isEmpty() ? "" : "\n" + String.join("\n", result.outputTail())));
        }
        return result;
    }

    /**
     * secret 값을 마스킹.
     *
     * @param text 원문
     * @return 마스킹된 문자열
     */
    String mask(String text) {
        String masked = text;
        for (String secret : secrets) {
            if (secret != null && !secret.isBlank()) {
                masked = masked.replace(secret, MASK);
            }
        }
        return masked;
    }

    private void drain(Process process, String scriptName, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String masked = mask(line);
                log.debug("{}: {}", scriptName, masked);
                synchronized (tail) {
                    tail.addLast(masked);
                    if (tail.size() > TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Output stream of {} closed: {}", scriptName, e.getMessage());
        }
    }

    private static List<String> snapshot(Deque<String> tail) {
        synchronized (tail) {
            return new ArrayList<>(tail);
        }
    }
}
