package com.ryuqq.workmesh.adapter.inmemory.fabric;

import com.ryuqq.workmesh.core.model.QueueId;
import com.ryuqq.workmesh.core.spi.QueueFabric;
import com.ryuqq.workmesh.core.spi.QueueHandle;
import com.ryuqq.workmesh.core.spi.QueueRole;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link QueueFabric} SPI for local execution and tests.
 *
 * <p>Channels live in a {@link ConcurrentHashMap} keyed by channel name and are created on
 * first access with {@code computeIfAbsent}, so the App side and the execution side of a
 * Work receive the very same {@link InMemoryQueueHandle}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * QueueFabric fabric = new InMemoryQueueFabric();
 * QueueId queueId = QueueId.generate();
 *
 * QueueHandle caller = fabric.getCallerQueue(queueId, "root.trainer");
 * caller.push(request);
 *
 * // same channel, seen from the execution side
 * fabric.getCallerQueue(queueId, "root.trainer").pop(100);
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class InMemoryQueueFabric implements QueueFabric {

    private final ConcurrentHashMap<String, InMemoryQueueHandle> channels;

    public InMemoryQueueFabric() {
        this.channels = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>A deleted channel is replaced by a fresh one on the next access</li>
     *   <li>Performance: O(1) lookup</li>
     * </ul>
     */
    @Override
    public QueueHandle getQueue(QueueRole role, QueueId queueId, String workName) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (queueId == null) {
            throw new IllegalArgumentException("queueId cannot be null");
        }
        if (!role.isPerWork() && workName != null) {
            throw new IllegalArgumentException("queue role " + role + " is app-wide and takes no workName");
        }
        String name = role.queueName(queueId.getValue(), workName);
        return channels.compute(name, (key, existing) ->
            existing == null || existing.isDeleted() ? new InMemoryQueueHandle(key, role) : existing);
    }

    @Override
    public boolean delete(String queueName) {
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        InMemoryQueueHandle removed = channels.remove(queueName);
        if (removed == null) {
            return false;
        }
        removed.delete();
        return true;
    }

    @Override
    public void close() {
        for (String name : Set.copyOf(channels.keySet())) {
            delete(name);
        }
    }

    /**
     * @return names of live channels, sorted
     */
    public Set<String> queueNames() {
        return new TreeSet<>(channels.keySet());
    }

    /**
     * @return number of live channels
     */
    public int queueCount() {
        return channels.size();
    }
}
