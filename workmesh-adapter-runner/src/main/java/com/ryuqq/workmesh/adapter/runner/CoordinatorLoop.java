package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.application.runtime.Runtime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Runtime#pump()}를 고정 지연으로 호출하는 코디네이터 루프.
 *
 * <p>pump 한 번이 실패해도 다음 주기는 계속 실행됩니다 (오류는 로그로 남김).</p>
 *
 * <pre>
 * CoordinatorLoop loop = new CoordinatorLoop(app, new RunnerConfig());
 * loop.start();
 * // ...
 * loop.stop();
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class CoordinatorLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorLoop.class);

    private final Runtime runtime;
    private final RunnerConfig config;
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private ScheduledExecutorService scheduler;

    /**
     * @param runtime pump 대상
     * @param config 설정 (coordinatorIntervalMs 사용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CoordinatorLoop(Runtime runtime, RunnerConfig config) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.runtime = runtime;
        this.config = config;
    }

    /**
     * 루프 시작. 이미 실행 중이면 아무것도 하지 않습니다.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, config.threadNamePrefix() + "coordinator");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, config.coordinatorIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Coordinator loop started (interval {}ms)", config.coordinatorIntervalMs());
    }

    private void tick() {
        try {
            runtime.pump();
            cycles.incrementAndGet();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.error("Coordinator pump cycle failed", e);
        }
    }

    /**
     * 루프 종료 (진행 중인 pump가 끝날 때까지 대기).
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Coordinator loop stopped after {} cycle(s), {} failure(s)", cycles.get(), failures.get());
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public long completedCycles() {
        return cycles.get();
    }

    public long failedCycles() {
        return failures.get();
    }
}
