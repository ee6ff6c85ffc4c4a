/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement to give the
 * core a transport between the App and the execution contexts of its Works.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.spi.QueueFabric} - Channel factory keyed by (queue id, role, work name)</li>
 *   <li>{@link com.ryuqq.workmesh.core.spi.QueueHandle} - One FIFO channel: push / pop(timeout)</li>
 *   <li>{@link com.ryuqq.workmesh.core.spi.QueueRole} - Channel roles and their accepted message types</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., workmesh-adapter-inmemory) provide concrete implementations.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.core.spi;
