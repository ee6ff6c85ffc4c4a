package com.ryuqq.workmesh.testkit.contract;

import com.ryuqq.workmesh.application.proxy.CallHandle;
import com.ryuqq.workmesh.application.proxy.RunProxyInstaller;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkRun;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.error.CallTimeoutException;
import com.ryuqq.workmesh.core.error.ConfigurationException;
import com.ryuqq.workmesh.core.error.RemoteExecutionException;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the Run Proxy.
 *
 * <p>Calling a registered work's entry point must behave like a local call while
 * actually travelling through the caller and orchestrator-response queues to an
 * execution context.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>run(batch=5) answered with {"loss": 0.42} returns {"loss": 0.42}</li>
 *   <li>Unnamed work: ConfigurationException naming the missing name</li>
 *   <li>Wrapping twice: single effective wrap</li>
 *   <li>Remote exception: RemoteExecutionException with type name and message</li>
 *   <li>Concurrent callers each receive the response for their own sequence number</li>
 *   <li>Call timeout: CallTimeoutException, distinct from remote errors</li>
 * </ul>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class RunProxyContractTest extends AbstractContractTest {

    static class Trainer extends Work {
        @Override
        protected Object execute(CallArguments arguments) {
            return Map.of("loss", 0.42);
        }
    }

    @Test
    void testRun_KeywordArguments_ReturnsDecodedValue() {
        // Given: a trainer that answers with {"loss": 0.42}
        AtomicReference<Object> seenBatch = new AtomicReference<>();
        Work trainer = attach("trainer", arguments -> {
            seenBatch.set(arguments.kwarg("batch"));
            return Map.of("loss", 0.42);
        });

        // When
        Object result = trainer.runWith(Map.of("batch", 5));

        // Then
        assertEquals(Map.of("loss", 0.42), result);
        assertEquals(5, seenBatch.get());
        assertWorkStatus(trainer, WorkStatus.RUNNING);
    }

    @Test
    void testRun_PositionalArguments_ForwardedInOrder() {
        Work adder = attach("adder", arguments ->
            ((Number) arguments.arg(0)).intValue() - ((Number) arguments.arg(1)).intValue());

        assertEquals(7, adder.run(10, 3));
    }

    @Test
    void testRun_NullReturn_ReturnsNull() {
        Work noop = attach("noop", arguments -> null);

        assertNull(noop.run());
    }

    @Test
    void testRun_UnnamedWork_ThrowsConfigurationException() {
        // Given: a trainer that was never attached to a WorkFlow
        Trainer trainer = new Trainer();
        app.register(trainer);

        // When/Then
        ConfigurationException exception = assertThrows(ConfigurationException.class, () -> trainer.run());
        assertTrue(exception.getMessage().contains("Trainer"), exception.getMessage());
        assertTrue(exception.getMessage().contains("no name"), exception.getMessage());
        assertWorkStatus(trainer, WorkStatus.CREATED);
    }

    @Test
    void testWrap_Twice_SingleEffectiveWrap() {
        // Given
        AtomicInteger invocations = new AtomicInteger();
        Work work = attach("counter", arguments -> invocations.incrementAndGet());
        WorkRun firstWrap = work.entryPoint();

        // When: wrap again, directly and through register
        boolean wrappedAgain = RunProxyInstaller.wrap(app, work);
        app.register(work);

        // Then
        assertFalse(wrappedAgain);
        assertSame(firstWrap, work.entryPoint());
        assertEquals(1, work.run());
        assertEquals(1, invocations.get());
    }

    @Test
    void testRun_RemoteException_RaisesRemoteExecutionException() {
        // Given
        Work validator = attach("validator", arguments -> {
            throw new IllegalArgumentException("batch must be positive");
        });

        // When
        RemoteExecutionException exception = assertThrows(RemoteExecutionException.class,
            () -> validator.runWith(Map.of("batch", -1)));

        // Then: type name and message are carried over, work keeps running
        assertEquals("java.lang.IllegalArgumentException", exception.getErrorType());
        assertEquals("batch must be positive", exception.getRemoteMessage());
        assertEquals("root.validator", exception.getWorkName());
        assertWorkStatus(validator, WorkStatus.RUNNING);
    }

    @Test
    void testRun_AfterRemoteException_NextCallSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        Work flaky = attach("flaky", arguments -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first call fails");
            }
            return "ok";
        });

        assertThrows(RemoteExecutionException.class, () -> flaky.run());
        assertEquals("ok", flaky.run());
    }

    @Test
    void testRun_SequentialCalls_EachReturnsOwnResult() {
        Work doubler = attach("doubler", arguments -> ((Number) arguments.arg(0)).intValue() * 2);

        for (int i = 0; i < 20; i++) {
            assertEquals(i * 2, doubler.run(i));
        }
    }

    @Test
    void testRun_ConcurrentCallers_ResponsesMatchedBySequence() throws Exception {
        // Given
        Work echo = attach("echo", arguments -> arguments.arg(0));
        echo.run("warm-up");

        // When: several threads share the same response queue
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 10; i++) {
                    String payload = "t" + thread + "-" + i;
                    if (!payload.equals(echo.run(payload))) {
                        return false;
                    }
                }
                return true;
            }));
        }

        // Then
        for (Future<Boolean> future : futures) {
            assertTrue(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();
    }

    @Test
    void testSubmit_ReturnsHandleResolvedLater() {
        Work echo = attach("echo", arguments -> arguments.kwarg("value"));

        CallHandle first = echo.submit(CallArguments.kwargs(Map.of("value", "a")));
        CallHandle second = echo.submit(CallArguments.kwargs(Map.of("value", "b")));

        assertEquals("b", second.await(5000));
        assertEquals("a", first.await(5000));
        assertEquals(first.getSequence() + 1, second.getSequence());
    }

    @Test
    void testAwait_Timeout_ThrowsCallTimeoutException() {
        // Given: a work that blocks until released when asked to
        CountDownLatch release = new CountDownLatch(1);
        Work slow = attach("slow", arguments -> {
            if (Boolean.TRUE.equals(arguments.kwarg("block"))) {
                release.await(10, TimeUnit.SECONDS);
            }
            return "done";
        });

        // When
        CallHandle handle = slow.submit(CallArguments.kwargs(Map.of("block", true)));
        CallTimeoutException exception = assertThrows(CallTimeoutException.class, () -> handle.await(100));

        // Then: distinct from a remote error; the late response is dropped and the work stays usable
        assertEquals(handle.getSequence(), exception.getSequence());
        release.countDown();
        assertWorkStatus(slow, WorkStatus.RUNNING);
        assertEquals("done", slow.run());
    }
}
