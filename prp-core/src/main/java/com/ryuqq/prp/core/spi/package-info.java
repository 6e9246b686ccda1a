/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that adapters implement to give the pipeline
 * durable state and access to the external collaborators.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.prp.core.spi.StateStore} - Durable orchestrator state</li>
 *   <li>{@link com.ryuqq.prp.core.spi.ContextCollector} - Definition/draft → context artifact</li>
 *   <li>{@link com.ryuqq.prp.core.spi.RequestBuilder} - Context artifact → request payload</li>
 *   <li>{@link com.ryuqq.prp.core.spi.BatchSubmitter} - Request payload → produced artifacts</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (prp-adapter-file, prp-adapter-inmemory, prp-adapter-script)
 * provide the concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.prp.core.spi;
