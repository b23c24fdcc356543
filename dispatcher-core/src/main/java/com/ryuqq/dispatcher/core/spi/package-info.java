/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the broker boundary that infrastructure adapters implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.MessageBroker} - Command submission and transport lifecycle</li>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.RemoteTaskHandle} - Bounded-wait state lookup for one dispatched unit of work</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., dispatcher-adapter-inmemory) provide concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.dispatcher.core.spi;
