package com.ryuqq.prp.core.spi;

import com.ryuqq.prp.core.exception.StateStoreException;
import com.ryuqq.prp.core.state.OrchestratorState;

import java.time.Instant;

/**
 * Persistent Storage SPI for the orchestrator state.
 *
 * <p>The store is the single source of truth for rate-limit decisions and
 * for the set of completed items. No in-memory-only counter is authoritative.</p>
 *
 * <p><strong>Durability Contract:</strong></p>
 * <ul>
 *   <li>Every mutator performs the in-memory change and an immediate {@link #save}
 *       before returning</li>
 *   <li>A crash right after a mutator returns leaves persisted state consistent with
 *       "the mutation happened"</li>
 *   <li>{@link #save} never leaves a half-written record readable by the next {@link #load}</li>
 * </ul>
 *
 * <p><strong>Failure Semantics:</strong></p>
 * <ul>
 *   <li>Ordinary operation never throws</li>
 *   <li>I/O failures (disk full, permissions) raise {@link StateStoreException}, which is fatal</li>
 * </ul>
 *
 * <p><strong>Ownership:</strong> a single orchestrator process owns the store exclusively.
 * Implementations are not required to coordinate across processes.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Loads the last persisted state and makes it the current snapshot.
     *
     * <p>Returns {@link OrchestratorState#initial()} if nothing was persisted yet or the
     * persisted copy cannot be parsed. A corrupt record degrades to "start fresh".</p>
     *
     * @return the loaded state
     * @throws StateStoreException if the record exists but cannot be read
     */
    OrchestratorState load();

    /**
     * Persists the full record and makes it the current snapshot.
     *
     * @param state the state to persist
     * @throws IllegalArgumentException if state is null
     * @throws StateStoreException if the record cannot be written
     */
    void save(OrchestratorState state);

    /**
     * Returns the current in-memory snapshot without touching storage.
     *
     * @return the current state
     */
    OrchestratorState snapshot();

    /**
     * Records a rate-limited submission and prunes entries that left the one hour window.
     *
     * @param at the submission time
     * @throws IllegalArgumentException if at is null
     * @throws StateStoreException if the record cannot be written
     */
    void recordSubmission(Instant at);

    /**
     * Sets or clears the item currently in the pipeline.
     *
     * @param itemName the item name, or null to clear
     * @throws StateStoreException if the record cannot be written
     */
    void markCurrent(String itemName);

    /**
     * Adds the item to the completed set and clears the current item.
     *
     * <p>Idempotent for a name already present.</p>
     *
     * @param itemName the item name
     * @throws IllegalArgumentException if itemName is null or blank
     * @throws StateStoreException if the record cannot be written
     */
    void markCompleted(String itemName);
}
