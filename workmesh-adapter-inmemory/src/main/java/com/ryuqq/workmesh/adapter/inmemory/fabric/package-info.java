/**
 * In-memory Queue Fabric adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.workmesh.core.spi.QueueFabric} backed by
 * {@link java.util.concurrent.LinkedBlockingQueue} channels. Suitable for a single JVM where
 * execution contexts run on their own threads, and for tests.</p>
 *
 * <h2>Key Features</h2>
 * <ul>
 *   <li><strong>Shared channels:</strong> both endpoints obtain the same handle for the same identity</li>
 *   <li><strong>FIFO:</strong> per-channel ordering is preserved</li>
 *   <li><strong>Role check:</strong> a channel rejects message types of other roles</li>
 *   <li><strong>Teardown:</strong> deleting a channel discards its messages and unblocks readers on their next pop</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.adapter.inmemory.fabric;
