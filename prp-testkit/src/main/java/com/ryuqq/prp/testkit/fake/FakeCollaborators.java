package com.ryuqq.prp.testkit.fake;

import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.exception.SubmissionException;
import com.ryuqq.prp.core.model.RequestPhase;
import com.ryuqq.prp.core.spi.BatchSubmitter;
import com.ryuqq.prp.core.spi.ContextCollector;
import com.ryuqq.prp.core.spi.RequestBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 파일을 실제로 쓰는 테스트용 Collaborator 묶음.
 *
 * <p>외부 스크립트 대신 사용하며, 호출 기록과 실패 주입을 지원합니다.</p>
 *
 * <p><strong>기본 동작:</strong></p>
 * <ul>
 *   <li>collect: contextFile에 원본 파일 이름을 기록</li>
 *   <li>build: requestFile에 phase와 context 이름을 기록</li>
 *   <li>submit: outputDirectory에 {@code prp-<request stem>.md} 하나와 results.jsonl 생성</li>
 * </ul>
 *
 * <p><strong>호출 기록 형식:</strong></p>
 * <pre>
 * collect:&lt;source file name&gt;
 * build:&lt;draft|generate&gt;:&lt;context file name&gt;
 * submit:&lt;request file name&gt;
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeCollaborators {

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failingSources = new HashSet<>();
    private final Set<String> failingSubmissions = new HashSet<>();
    private final Set<String> emptySubmissions = new HashSet<>();

    private final ContextCollector collector = this::collect;
    private final RequestBuilder builder = this::build;
    private final BatchSubmitter submitter = this::submit;

    public ContextCollector collector() {
        return collector;
    }

    public RequestBuilder builder() {
        return builder;
    }

    public BatchSubmitter submitter() {
        return submitter;
    }

    /**
     * 지정한 이름의 원본 파일에 대해 collect 호출이 실패하도록 설정.
     *
     * @param sourceFileName 원본 파일 이름 (예: b.md)
     * @return this
     */
    public FakeCollaborators failCollecting(String sourceFileName) {
        failingSources.add(sourceFileName);
        return this;
    }

    /**
     * 지정한 stem의 요청 제출이 SubmissionException으로 실패하도록 설정.
     *
     * @param stem 아이템 stem
     * @return this
     */
    public FakeCollaborators failSubmitting(String stem) {
        failingSubmissions.add(stem);
        return this;
    }

    /**
     * 지정한 stem의 제출이 .md 산출물 없이 끝나도록 설정.
     *
     * @param stem 아이템 stem
     * @return this
     */
    public FakeCollaborators produceNothingFor(String stem) {
        emptySubmissions.add(stem);
        return this;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long count(String kind) {
        return calls().stream().filter(call -> call.startsWith(kind + ":")).count();
    }

    public void reset() {
        calls.clear();
        failingSources.clear();
        failingSubmissions.clear();
        emptySubmissions.clear();
    }

    private Path collect(Path sourceFile, Path contextFile) {
        String name = sourceFile.getFileName().toString();
        calls.add("collect:" + name);
        if (failingSources.contains(name)) {
            throw new CollaboratorException("Context collection failed for " + name);
        }
        return write(contextFile, "{\"source\":\"" + name + "\"}\n");
    }

    private Path build(Path contextFile, RequestPhase phase, Path requestFile) {
        calls.add("build:" + phase.cliValue() + ":" + contextFile.getFileName());
        return write(requestFile, "{\"phase\":\"" + phase.cliValue() + "\"}\n");
    }

    private List<Path> submit(Path requestFile, Path outputDirectory, Duration timeout) {
        String requestName = requestFile.getFileName().toString();
        calls.add("submit:" + requestName);
        for (String stem : failingSubmissions) {
            if (requestName.startsWith(stem + "-")) {
                throw new SubmissionException("Batch failed for " + requestName);
            }
        }
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        write(outputDirectory.resolve("results.jsonl"), "{}\n");
        for (String stem : emptySubmissions) {
            if (requestName.startsWith(stem + "-")) {
                return List.of();
            }
        }
        String requestStem = requestName.substring(0, requestName.lastIndexOf('.'));
        return List.of(write(outputDirectory.resolve("prp-" + requestStem + ".md"), "# PRP " + requestStem + "\n"));
    }

    private static Path write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            return Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
