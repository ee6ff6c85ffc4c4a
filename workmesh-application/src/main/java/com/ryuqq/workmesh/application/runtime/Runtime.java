package com.ryuqq.workmesh.application.runtime;

/**
 * Work Orchestration Runtime.
 *
 * <p>This interface defines the coordinator side of the work mesh: one pump cycle
 * drains every app-wide queue without blocking and folds the results into
 * work status and the canonical state tree.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Consume readiness and error signals (STARTING → RUNNING, → FAILED)</li>
 *   <li>Apply ordered deltas to the state tree and publish snapshots</li>
 *   <li>Dispatch call responses for calls made in future mode</li>
 *   <li>Periodically poll backend health in one batched pass</li>
 * </ul>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Drain readiness queue, then error queue
 * 2. Drain delta and api-delta queues → sequence per work → merge into state tree
 * 3. Drain orchestrator-response queues of proxied works
 * 4. If the status poll interval elapsed → Backend.updateWorkStatuses(works)
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is typically invoked on a fixed delay (CoordinatorLoop or a scheduler)</li>
 *   <li>Blocking callers also drain signals while they wait, so pump() is not required
 *       for a blocking call to complete</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(runtime::pump, 0, 10, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single non-blocking pump cycle.
     *
     * <p><strong>Exception Handling:</strong></p>
     * <ul>
     *   <li>Stale or duplicate deltas are logged and dropped, never thrown</li>
     *   <li>Backend polling failures are logged; the next cycle retries</li>
     * </ul>
     *
     * @throws IllegalStateException if the runtime has been shut down
     */
    void pump();

    /**
     * Stops every execution context and releases all queues.
     */
    void shutdown();
}
