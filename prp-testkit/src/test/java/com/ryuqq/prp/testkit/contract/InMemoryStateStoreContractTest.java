package com.ryuqq.prp.testkit.contract;

import com.ryuqq.prp.adapter.inmemory.store.InMemoryStateStore;
import com.ryuqq.prp.core.spi.StateStore;
import com.ryuqq.prp.core.state.OrchestratorState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Tests for InMemoryStateStore implementation.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryStateStoreContractTest extends AbstractStateStoreContractTest {

    @Override
    protected StateStore createStore() {
        return new InMemoryStateStore();
    }

    @Override
    protected StateStore reopen(StateStore previous) {
        OrchestratorState persisted = ((InMemoryStateStore) previous).persisted();
        return persisted == null ? new InMemoryStateStore() : new InMemoryStateStore(persisted);
    }

    @Test
    void everyMutator_WritesThrough() {
        // Given
        InMemoryStateStore inMemory = (InMemoryStateStore) store;
        inMemory.load();

        // When
        inMemory.recordSubmission(T0);
        inMemory.markCurrent("a.md");
        inMemory.markCompleted("a.md");

        // Then
        assertThat(inMemory.saveCount()).isEqualTo(3);
    }

    @Test
    void load_WhenCorrupted_ReturnsInitialState() {
        // Given
        InMemoryStateStore inMemory = (InMemoryStateStore) store;
        inMemory.load();
        inMemory.markCompleted("a.md");
        inMemory.corrupt();

        // When
        OrchestratorState state = inMemory.load();

        // Then
        assertThat(state).isEqualTo(OrchestratorState.initial());
    }
}
