/**
 * In-memory Message Broker adapter for testing and reference.
 *
 * <p>Provides {@link com.ryuqq.dispatcher.adapter.inmemory.broker.InMemoryBroker}, an implementation of the
 * {@link com.ryuqq.dispatcher.core.spi.MessageBroker} SPI that records submissions and lets callers drive
 * remote state transitions explicitly.</p>
 *
 * <h2>Testing Support</h2>
 * <ul>
 *   <li>{@code transition(token, state)}: move a submission to a new remote state</li>
 *   <li>{@code failNextSubmissions(n)}: inject transport failures</li>
 *   <li>{@code submissions()}, {@code stateOf(token)}, {@code fetchCount(token)}: inspection methods</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li><strong>No Execution:</strong> commands are never run; see the process package for that</li>
 *   <li><strong>Single JVM:</strong> no distributed transport</li>
 * </ul>
 *
 * @see com.ryuqq.dispatcher.core.spi.MessageBroker
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.inmemory.broker;
