/**
 * Core domain model package containing identity value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.model.TaskInstanceKey} - One attempt of one task instance</li>
 *   <li>{@link com.ryuqq.dispatcher.core.model.QueueName} - Broker queue / resource pool name</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.dispatcher.core.model;
