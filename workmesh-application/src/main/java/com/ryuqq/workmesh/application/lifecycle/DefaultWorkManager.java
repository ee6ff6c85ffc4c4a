package com.ryuqq.workmesh.application.lifecycle;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.backend.Backend;
import com.ryuqq.workmesh.application.proxy.ProxyWorkRun;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.core.error.ConfigurationException;
import com.ryuqq.workmesh.core.error.ProvisioningException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * 기본 WorkManager 구현.
 *
 * <p>Work 하나, 소유 App, Backend에 묶입니다. start/kill/restart는 한 잠금으로 직렬화되고,
 * isAlive는 잠금 없이 volatile status를 읽습니다.</p>
 *
 * <p><strong>start 흐름:</strong></p>
 * <ol>
 *   <li>STARTING 전이, 세대 번호 발급</li>
 *   <li>큐 등록, Backend createWork</li>
 *   <li>readiness 신호를 startupTimeoutMs 동안 대기 (신호 큐를 직접 비움)</li>
 * </ol>
 *
 * <p><strong>kill 흐름:</strong> Backend stopWork → 대기 중인 호출 취소 → backend 핸들 해제
 * → 큐 폐기 → STOPPED</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class DefaultWorkManager implements WorkManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkManager.class);

    private final WorkApp app;
    private final Work work;
    private final Backend backend;
    private final Object lock = new Object();

    /**
     * @param app 소유 App
     * @param work 관리 대상 Work
     * @param backend 실행 환경
     */
    public DefaultWorkManager(WorkApp app, Work work, Backend backend) {
        if (app == null || work == null || backend == null) {
            throw new IllegalArgumentException("app, work and backend cannot be null");
        }
        this.app = app;
        this.work = work;
        this.backend = backend;
    }

    @Override
    public void start() {
        synchronized (lock) {
            startLocked();
        }
    }

    @Override
    public void kill() {
        synchronized (lock) {
            killLocked(true);
        }
    }

    @Override
    public void restart() {
        synchronized (lock) {
            WorkStatus status = work.status();
            if (status == WorkStatus.RUNNING || status == WorkStatus.FAILED) {
                work.transitionTo(WorkStatus.RESTARTING);
                killLocked(false);
            }
            log.info("Restarting work '{}' (was {})", work.displayName(), status);
            startLocked();
        }
    }

    @Override
    public boolean isAlive() {
        return work.status().isAlive();
    }

    public Work getWork() {
        return work;
    }

    private void startLocked() {
        if (work.status() == WorkStatus.RUNNING) {
            return;
        }
        WorkName name = work.name().orElseThrow(() -> new ConfigurationException(
            "Cannot start " + work.getClass().getSimpleName() + ": the work has no name"));

        work.transitionTo(WorkStatus.STARTING);
        long generation = work.nextGeneration();
        app.queues().register(name);
        log.info("Starting work '{}' (generation {})", name, generation);

        try {
            backend.createWork(app, work);
        } catch (ProvisioningException e) {
            work.markFailed(describe(e));
            log.error("Provisioning failed for work '{}': {}", name, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ProvisioningException wrapped = new ProvisioningException(name.getValue(), e.getMessage(), e);
            work.markFailed(describe(wrapped));
            log.error("Provisioning failed for work '{}'", name, e);
            throw wrapped;
        }

        awaitReadiness(name);
    }

    private void awaitReadiness(WorkName name) {
        long timeoutMs = app.config().startupTimeoutMs();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        while (true) {
            app.pumpSignals();
            WorkStatus status = work.status();
            if (status == WorkStatus.RUNNING) {
                log.info("Work '{}' is running", name);
                return;
            }
            if (status == WorkStatus.FAILED) {
                stopContextQuietly();
                throw new ProvisioningException(name.getValue(),
                    "execution context failed during startup (" + work.lastError().orElse("unknown error") + ")");
            }
            if (System.nanoTime() - deadline >= 0) {
                stopContextQuietly();
                ProvisioningException timeout = new ProvisioningException(name.getValue(),
                    "no readiness signal within " + timeoutMs + "ms");
                work.markFailed(describe(timeout));
                log.error("Work '{}' did not become ready within {}ms", name, timeoutMs);
                throw timeout;
            }
            try {
                Thread.sleep(app.config().pollingIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopContextQuietly();
                ProvisioningException interrupted = new ProvisioningException(name.getValue(),
                    "interrupted while waiting for readiness", e);
                work.markFailed(describe(interrupted));
                throw interrupted;
            }
        }
    }

    /**
     * @param terminal true면 STOPPED까지 전이 (restart 중에는 false)
     */
    private void killLocked(boolean terminal) {
        WorkStatus status = work.status();
        if (terminal && status == WorkStatus.STOPPED && work.backendHandle().isEmpty()) {
            log.debug("Work '{}' is already stopped", work.displayName());
            return;
        }
        if (terminal && status == WorkStatus.RUNNING) {
            work.transitionTo(WorkStatus.STOPPING);
        }

        stopContextQuietly();

        if (work.entryPoint() instanceof ProxyWorkRun proxy) {
            proxy.cancelPending("work '" + work.displayName() + "' was killed");
        }
        work.releaseBackend();
        work.name().ifPresent(name -> app.queues().release(name));

        if (terminal) {
            work.forceStop();
            log.info("Work '{}' killed (was {})", work.displayName(), status);
        }
    }

    private void stopContextQuietly() {
        try {
            backend.stopWork(app, work);
        } catch (RuntimeException e) {
            log.warn("Backend failed to stop work '{}', treating it as gone", work.displayName(), e);
        }
    }

    private static String describe(RuntimeException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
