package com.ryuqq.prp.testkit.fake;

import com.ryuqq.prp.core.exception.CollaboratorException;
import com.ryuqq.prp.core.exception.SubmissionException;
import com.ryuqq.prp.core.model.RequestPhase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FakeCollaboratorsTest {

    @TempDir
    Path dir;

    @Test
    void collaborators_WriteFilesAndRecordCalls() {
        // Given
        FakeCollaborators fakes = new FakeCollaborators();
        Path source = dir.resolve("a.md");

        // When
        Path context = fakes.collector().collect(source, dir.resolve("a-context.json"));
        Path request = fakes.builder().build(context, RequestPhase.DRAFT, dir.resolve("a-draft-request.jsonl"));
        List<Path> results = fakes.submitter().submit(request, dir.resolve("a-draft-results"), Duration.ofMinutes(1));

        // Then
        assertThat(context).exists();
        assertThat(request).exists();
        assertThat(results).hasSize(1);
        assertThat(results.get(0).getFileName().toString()).isEqualTo("prp-a-draft-request.md");
        assertThat(Files.exists(dir.resolve("a-draft-results/results.jsonl"))).isTrue();
        assertThat(fakes.calls()).containsExactly(
            "collect:a.md", "build:draft:a-context.json", "submit:a-draft-request.jsonl");
        assertThat(fakes.count("submit")).isEqualTo(1);
    }

    @Test
    void failureInjection_ThrowsCollaboratorExceptions() {
        // Given
        FakeCollaborators fakes = new FakeCollaborators().failCollecting("b.md").failSubmitting("c");

        // When & Then
        assertThatThrownBy(() -> fakes.collector().collect(dir.resolve("b.md"), dir.resolve("b-context.json")))
            .isInstanceOf(CollaboratorException.class);
        assertThatThrownBy(() -> fakes.submitter().submit(dir.resolve("c-gen-request.jsonl"), dir.resolve("out"), Duration.ZERO))
            .isInstanceOf(SubmissionException.class);
        assertThat(fakes.calls()).hasSize(2);
    }
}
