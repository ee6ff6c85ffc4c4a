package com.ryuqq.workmesh.testkit.contract;

import com.ryuqq.workmesh.application.lifecycle.WorkManager;
import com.ryuqq.workmesh.application.proxy.CallHandle;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.error.CallCancelledException;
import com.ryuqq.workmesh.core.error.RemoteExecutionException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the Work lifecycle.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>kill() twice: STOPPED, no error</li>
 *   <li>kill() while a call is awaited: CallCancelledException</li>
 *   <li>restart(): back to RUNNING with a new generation</li>
 *   <li>A fatal error in one work leaves its siblings running</li>
 *   <li>Calls on a FAILED work are refused and nothing is enqueued</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class LifecycleContractTest extends AbstractContractTest {

    @Test
    void testStart_ReachesRunningBeforeFirstCall() {
        Work work = attach("trainer", arguments -> "ok");
        WorkManager manager = app.manager(work);

        manager.start();

        assertTrue(manager.isAlive());
        assertWorkStatus(work, WorkStatus.RUNNING);
        assertEquals(1, work.generation());
        assertTrue(work.backendHandle().isPresent());
    }

    @Test
    void testKill_Twice_IsNoOp() {
        // Given
        Work work = attach("trainer", arguments -> "ok");
        work.run();
        WorkManager manager = app.manager(work);

        // When
        manager.kill();
        assertDoesNotThrow(manager::kill);

        // Then
        assertWorkStatus(work, WorkStatus.STOPPED);
        assertFalse(manager.isAlive());
        assertTrue(work.backendHandle().isEmpty());
        assertFalse(app.queues().isRegistered(WorkName.of("root.trainer")));
    }

    @Test
    void testKill_NeverStarted_EndsStopped() {
        Work work = attach("idle", arguments -> "ok");

        app.manager(work).kill();

        assertWorkStatus(work, WorkStatus.STOPPED);
    }

    @Test
    void testKill_DuringAwait_CancelsCall() throws InterruptedException {
        // Given: a call that is being executed
        CountDownLatch entered = new CountDownLatch(1);
        Work work = attach("sleeper", arguments -> {
            entered.countDown();
            Thread.sleep(10_000);
            return "never";
        });
        CallHandle handle = work.submit(CallArguments.none());
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // When
        app.manager(work).kill();

        // Then
        CallCancelledException exception = assertThrows(CallCancelledException.class, () -> handle.await(5000));
        assertTrue(exception.getMessage().contains("killed"), exception.getMessage());
        assertWorkStatus(work, WorkStatus.STOPPED);
    }

    @Test
    void testRun_AfterKill_Refused() {
        Work work = attach("trainer", arguments -> "ok");
        work.run();
        app.manager(work).kill();

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> work.run());
        assertTrue(exception.getMessage().contains("STOPPED"), exception.getMessage());
    }

    @Test
    void testRestart_AfterKill_RunsAgain() {
        // Given
        Work work = attach("trainer", arguments -> "ok");
        work.run();
        WorkManager manager = app.manager(work);
        manager.kill();

        // When
        manager.restart();

        // Then
        assertWorkStatus(work, WorkStatus.RUNNING);
        assertEquals(2, work.generation());
        assertEquals("ok", work.run());
    }

    @Test
    void testRestart_RunningWork_NewGeneration() {
        Work work = attach("trainer", arguments -> "ok");
        work.run();

        app.manager(work).restart();

        assertWorkStatus(work, WorkStatus.RUNNING);
        assertEquals(2, work.generation());
        assertEquals("ok", work.run());
    }

    @Test
    void testFatalError_FailsOnlyThatWork() {
        // Given: two siblings, one of which raises an Error on its first call
        AtomicInteger calls = new AtomicInteger();
        Work fragile = attach("fragile", arguments -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("corrupted weights");
            }
            return "recovered";
        });
        Work sibling = attach("sibling", arguments -> "alive");
        assertEquals("alive", sibling.run());

        // When
        RemoteExecutionException exception = assertThrows(RemoteExecutionException.class, () -> fragile.run());
        pumpUntil(() -> fragile.status() == WorkStatus.FAILED, "fragile work to be marked FAILED");

        // Then
        assertEquals("java.lang.AssertionError", exception.getErrorType());
        assertTrue(fragile.lastError().orElse("").contains("corrupted weights"));
        assertWorkStatus(sibling, WorkStatus.RUNNING);
        assertEquals("alive", sibling.run());
    }

    @Test
    void testRun_OnFailedWork_RefusedWithoutEnqueue() {
        // Given
        Work fragile = attach("fragile", arguments -> {
            throw new StackOverflowError("deep recursion");
        });
        assertThrows(RemoteExecutionException.class, () -> fragile.run());
        pumpUntil(() -> fragile.status() == WorkStatus.FAILED, "fragile work to be marked FAILED");

        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> fragile.run());

        // Then
        assertTrue(exception.getMessage().contains("restart"), exception.getMessage());
        assertEquals(0, app.queues().require(WorkName.of("root.fragile")).caller().size());
    }

    @Test
    void testRestart_FailedWork_Recovers() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        Work fragile = attach("fragile", arguments -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("transient corruption");
            }
            return "recovered";
        });
        assertThrows(RemoteExecutionException.class, () -> fragile.run());
        pumpUntil(() -> fragile.status() == WorkStatus.FAILED, "fragile work to be marked FAILED");

        // When
        app.manager(fragile).restart();

        // Then
        assertWorkStatus(fragile, WorkStatus.RUNNING);
        assertTrue(fragile.lastError().isEmpty());
        assertEquals("recovered", fragile.run());
    }

    @Test
    void testStopAllWorks_StopsEveryWork() {
        Work first = attach("first", arguments -> 1);
        Work second = attach("second", arguments -> 2);
        first.run();
        second.run();

        app.stopAllWorks();

        assertWorkStatus(first, WorkStatus.STOPPED);
        assertWorkStatus(second, WorkStatus.STOPPED);
    }

    @Test
    void testRemove_KillsAndUntracksWork() {
        Work work = attach("trainer", arguments -> "ok");
        work.run();

        app.remove(work);

        assertWorkStatus(work, WorkStatus.STOPPED);
        assertTrue(app.work("root.trainer").isEmpty());
        assertFalse(app.stateSynchronizer().isTracked(WorkName.of("root.trainer")));
    }
}
