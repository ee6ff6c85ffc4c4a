package com.ryuqq.workmesh.core.spi;

import com.ryuqq.workmesh.core.contract.QueueMessage;

import java.util.Optional;

/**
 * A single point-to-point FIFO channel of the Queue Fabric.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: push and pop may be called concurrently from both endpoints</li>
 *   <li>FIFO: messages are popped in the order they were pushed</li>
 *   <li>At-least-once Delivery: a pushed message is delivered unless the channel is cleared or deleted</li>
 *   <li>Role check: messages whose type does not match the channel's role are rejected</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * QueueHandle caller = fabric.getCallerQueue(queueId, "root.trainer");
 * caller.push(request);
 *
 * Optional&lt;QueueMessage&gt; message = response.pop(100); // wait up to 100ms
 * Optional&lt;QueueMessage&gt; now = response.pop(0);       // non-blocking
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface QueueHandle {

    /**
     * @return the channel name, e.g. {@code 1a2b3c4d_caller_root.trainer}
     */
    String name();

    /**
     * @return the role this channel plays
     */
    QueueRole role();

    /**
     * Appends a message to the tail of the channel. Never blocks.
     *
     * @param message the message to push
     * @throws IllegalArgumentException if message is null or not accepted by the role
     * @throws IllegalStateException if the channel has been deleted
     */
    void push(QueueMessage message);

    /**
     * Removes the head of the channel.
     *
     * @param timeoutMs maximum time to wait; {@code <= 0} returns immediately
     * @return the head message, or empty if none arrived in time or the channel was deleted
     */
    Optional<QueueMessage> pop(long timeoutMs);

    /**
     * Typed variant of {@link #pop(long)}.
     *
     * @param timeoutMs maximum time to wait
     * @param type expected message type
     * @return the head message cast to {@code type}
     * @throws IllegalStateException if the head message is of another type
     */
    default <T extends QueueMessage> Optional<T> pop(long timeoutMs, Class<T> type) {
        return pop(timeoutMs).map(message -> {
            if (!type.isInstance(message)) {
                throw new IllegalStateException(
                    "Unexpected message on " + name() + ": " + message.getClass().getSimpleName());
            }
            return type.cast(message);
        });
    }

    /**
     * @return number of messages currently waiting
     */
    int size();

    /**
     * Drains and discards all waiting messages.
     *
     * @return number of discarded messages
     */
    int clear();
}
