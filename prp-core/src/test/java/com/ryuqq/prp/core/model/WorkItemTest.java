package com.ryuqq.prp.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkItemTest {

    @Test
    void stem_StripsLastExtension() {
        WorkItem item = new WorkItem("feature.v2.md", Path.of("q/feature.v2.md"), Instant.EPOCH);

        assertThat(item.stem()).isEqualTo("feature.v2");
    }

    @Test
    void stem_WithoutExtension_ReturnsName() {
        WorkItem item = new WorkItem("README", Path.of("q/README"), Instant.EPOCH);

        assertThat(item.stem()).isEqualTo("README");
    }

    @Test
    void constructor_BlankName_ThrowsException() {
        assertThatThrownBy(() -> new WorkItem("", Path.of("q"), Instant.EPOCH))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
    }

    @Test
    void layout_Under_UsesDefaultDirectories() {
        QueueLayout layout = QueueLayout.under(Path.of("/work"));

        assertThat(layout.queueDir()).isEqualTo(Path.of("/work/prp/queue"));
        assertThat(layout.failedDir()).isEqualTo(Path.of("/work/prp/queue/failed"));
        assertThat(layout.stateFile()).isEqualTo(Path.of("/work/logs/prp-orchestrator-state.json"));
        assertThat(layout.directories()).hasSize(8);
    }
}
