package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.application.runtime.Runtime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * CoordinatorLoop 유닛 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CoordinatorLoopTest {

    @Mock
    private Runtime runtime;

    private CoordinatorLoop loop;

    @BeforeEach
    void setUp() {
        loop = new CoordinatorLoop(runtime, new RunnerConfig().withCoordinatorIntervalMs(5));
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void start_주기적으로_pump를_호출함() {
        // when
        loop.start();

        // then
        verify(runtime, timeout(2000).atLeast(3)).pump();
        assertThat(loop.isRunning()).isTrue();
    }

    @Test
    void tick_pump_예외가_발생해도_루프는_계속됨() {
        // given
        AtomicInteger calls = new AtomicInteger();
        doAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("transient");
            }
            return null;
        }).when(runtime).pump();

        // when
        loop.start();

        // then
        verify(runtime, timeout(2000).atLeast(3)).pump();
        assertThat(loop.failedCycles()).isEqualTo(1);
        assertThat(loop.completedCycles()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void stop_이후에는_pump를_호출하지_않음() throws InterruptedException {
        // given
        loop.start();
        verify(runtime, timeout(2000).atLeast(1)).pump();

        // when
        loop.stop();
        clearInvocations(runtime);
        Thread.sleep(30);

        // then
        verify(runtime, never()).pump();
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void start_두_번_호출해도_스케줄러는_하나() {
        // when
        loop.start();
        loop.start();

        // then
        verify(runtime, timeout(2000).atLeast(1)).pump();
        assertThat(loop.isRunning()).isTrue();
    }
}
