package com.ryuqq.prp.adapter.script;

import com.ryuqq.prp.core.exception.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScriptRunner 테스트 (POSIX shell 필요).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("ScriptRunner 테스트")
@EnabledOnOs({OS.LINUX, OS.MAC})
class ScriptRunnerTest {

    @TempDir
    Path root;

    private Path scripts;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        scripts = Files.createDirectories(root.resolve("scripts"));
        runner = new ScriptRunner(root, scripts, Set.of("sk-secret-123"));
    }

    @Test
    @DisplayName("프로젝트 루트에서 실행하고 출력 tail을 반환한다")
    void run_성공() throws IOException {
        // given
        script("hello.sh", "echo \"cwd=$(pwd)\"\necho \"args=$*\"\n");

        // when
        ScriptResult result = runner.run("hello.sh", List.of("--name", "x"), Duration.ofSeconds(10));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.outputTail()).contains("args=--name x");
        assertThat(result.outputTail().get(0)).startsWith("cwd=").endsWith(root.getFileName().toString());
    }

    @Test
    @DisplayName("0이 아닌 종료 코드는 stderr tail을 포함한 CollaboratorException")
    void run_실패_종료코드() throws IOException {
        // given
        script("fail.sh", "echo 'something broke' >&2\nexit 3\n");

        // when & then
        assertThatThrownBy(() -> runner.run("fail.sh", List.of(), Duration.ofSeconds(10)))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("exit 3")
            .hasMessageContaining("something broke");
    }

    @Test
    @DisplayName("타임아웃 시 프로세스를 종료하고 CollaboratorException")
    void run_타임아웃() throws IOException {
        // given
        script("slow.sh", "sleep 30\n");

        // when & then
        long start = System.nanoTime();
        assertThatThrownBy(() -> runner.run("slow.sh", List.of(), Duration.ofMillis(300)))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("스크립트가 없으면 CollaboratorException")
    void run_스크립트_없음() {
        assertThatThrownBy(() -> runner.run("missing.sh", List.of(), Duration.ofSeconds(1)))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("Script not found");
    }

    @Test
    @DisplayName("secret 값은 출력과 명령줄에서 마스킹된다")
    void run_secret_마스킹() throws IOException {
        // given
        script("leak.sh", "echo \"key is $2\"\n");

        // when
        ScriptResult result = runner.run("leak.sh", List.of("--api-key", "sk-secret-123"), Duration.ofSeconds(10));

        // then
        assertThat(result.outputTail()).containsExactly("key is ****");
        assertThat(runner.mask("--api-key sk-secret-123")).isEqualTo("--api-key ****");
    }

    private void script(String name, String body) throws IOException {
        Files.writeString(scripts.resolve(name), "#!/bin/sh\n" + body);
    }
}
