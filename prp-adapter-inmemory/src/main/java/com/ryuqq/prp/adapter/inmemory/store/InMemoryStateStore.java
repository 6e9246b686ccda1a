package com.ryuqq.prp.adapter.inmemory.store;

import com.ryuqq.prp.core.spi.StateStore;
import com.ryuqq.prp.core.state.OrchestratorState;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link StateStore} SPI for testing and reference purposes.
 *
 * <p>The store keeps two copies of the state: the {@code snapshot} the process works on and
 * the {@code persisted} copy that stands in for durable storage. Every mutator updates the
 * snapshot and immediately "persists" it, so {@link #load()} after a mutator observes the
 * mutation exactly as a file-backed store would after a restart.</p>
 *
 * <p><strong>Test Hooks:</strong></p>
 * <ul>
 *   <li>{@link #saveCount()}: number of persisted writes, used to verify write-through</li>
 *   <li>{@link #corrupt()}: makes the next {@link #load()} behave like an unreadable record</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private final Object lock = new Object();
    private final AtomicInteger saveCount = new AtomicInteger();

    private OrchestratorState snapshot;
    private OrchestratorState persisted;
    private boolean corrupted;

    /**
     * Creates a new InMemoryStateStore with nothing persisted.
     */
    public InMemoryStateStore() {
        this.snapshot = OrchestratorState.initial();
        this.persisted = null;
    }

    /**
     * Creates a store whose persisted copy is already the given state.
     *
     * @param persisted the state a subsequent {@link #load()} returns
     * @throws IllegalArgumentException if persisted is null
     */
    public InMemoryStateStore(OrchestratorState persisted) {
        if (persisted == null) {
            throw new IllegalArgumentException("persisted cannot be null");
        }
        this.snapshot = OrchestratorState.initial();
        this.persisted = persisted;
    }

    /**
     * {@inheritDoc}
     *
     * <p>A corrupted or missing record degrades to {@link OrchestratorState#initial()}.</p>
     */
    @Override
    public OrchestratorState load() {
        synchronized (lock) {
            if (persisted == null || corrupted) {
                corrupted = false;
                snapshot = OrchestratorState.initial();
            } else {
                snapshot = persisted;
            }
            return snapshot;
        }
    }

    @Override
    public void save(OrchestratorState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        synchronized (lock) {
            snapshot = state;
            persisted = state;
            saveCount.incrementAndGet();
        }
    }

    @Override
    public OrchestratorState snapshot() {
        synchronized (lock) {
            return snapshot;
        }
    }

    @Override
    public void recordSubmission(Instant at) {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        synchronized (lock) {
            save(snapshot.withSubmission(at));
        }
    }

    @Override
    public void markCurrent(String itemName) {
        synchronized (lock) {
            save(snapshot.withCurrentItem(itemName));
        }
    }

    @Override
    public void markCompleted(String itemName) {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        synchronized (lock) {
            save(snapshot.withCompleted(itemName));
        }
    }

    /**
     * Returns the persisted copy, or null if nothing was saved yet.
     *
     * @return the persisted state
     */
    public OrchestratorState persisted() {
        synchronized (lock) {
            return persisted;
        }
    }

    /**
     * Number of writes to the persisted copy.
     *
     * @return save count
     */
    public int saveCount() {
        return saveCount.get();
    }

    /**
     * Makes the next {@link #load()} treat the persisted copy as unreadable.
     */
    public void corrupt() {
        synchronized (lock) {
            corrupted = true;
        }
    }
}
