/**
 * In-memory StateStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the StateStore SPI
 * for tests and for wiring the pipeline without a file system.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.prp.adapter.inmemory.store.InMemoryStateStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.prp.core.spi.StateStore}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StateStore store = new InMemoryStateStore();
 * store.load();
 * store.recordSubmission(Instant.now());
 *
 * // Use in Contract Tests
 * class MyStateStoreContractTest extends AbstractStateStoreContractTest {
 *     {@literal @}Override
 *     protected StateStore createStore() {
 *         return new InMemoryStateStore();
 *     }
 * }
 * </pre>
 *
 * @see com.ryuqq.prp.core.spi.StateStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.prp.adapter.inmemory.store;
