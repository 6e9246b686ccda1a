package com.ryuqq.prp.adapter.file.store;

import com.ryuqq.prp.core.spi.StateStore;
import com.ryuqq.prp.testkit.contract.AbstractStateStoreContractTest;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Contract Tests for JsonFileStateStore implementation.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonFileStateStoreContractTest extends AbstractStateStoreContractTest {

    @TempDir
    Path dir;

    @Override
    protected StateStore createStore() {
        return new JsonFileStateStore(dir.resolve("logs").resolve("prp-orchestrator-state.json"));
    }

    @Override
    protected StateStore reopen(StateStore previous) {
        return new JsonFileStateStore(((JsonFileStateStore) previous).getStateFile());
    }
}
