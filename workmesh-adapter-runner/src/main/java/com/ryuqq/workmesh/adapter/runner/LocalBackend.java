package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.backend.Backend;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.core.error.ProvisioningException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * 로컬 실행 Backend.
 *
 * <p>Work마다 전용 데몬 스레드를 하나 만들어 {@link WorkRunner}를 실행합니다.
 * 별도 프로세스를 띄우는 대신 스레드로 실행 컨텍스트를 격리합니다.</p>
 *
 * <p><strong>상태 조회:</strong> 스레드가 끝났는데 Work가 아직 RUNNING이면 STOPPED로 반영합니다.
 * 루프가 오류로 끝난 경우는 ERROR 신호가 FAILED를 처리합니다.</p>
 *
 * <p><strong>URL:</strong> 포트를 노출한 Work는 {@code http://localhost:{port}}.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class LocalBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(LocalBackend.class);

    private final RunnerConfig config;

    public LocalBackend() {
        this(new RunnerConfig());
    }

    /**
     * @param config 실행 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public LocalBackend(RunnerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public void createWork(WorkApp app, Work work) {
        WorkName name = work.name()
            .orElseThrow(() -> new ProvisioningException(work.displayName(), "work has no name"));
        if (work.backendHandle(LocalHandle.class).filter(LocalHandle::isAlive).isPresent()) {
            throw new ProvisioningException(name.getValue(), "an execution context is already running");
        }

        WorkRunner runner;
        try {
            runner = WorkRunner.attach(app, work, config);
        } catch (IllegalStateException e) {
            throw new ProvisioningException(name.getValue(), e.getMessage(), e);
        }

        Thread thread = new Thread(runner, config.threadNamePrefix() + name.getValue());
        thread.setDaemon(true);
        work.bindBackend(new LocalHandle(runner, thread));
        thread.start();
        log.debug("Started local execution context for work '{}' on thread {}", name, thread.getName());
    }

    @Override
    public void updateWorkStatuses(List<Work> works) {
        for (Work work : works) {
            Optional<LocalHandle> handle = work.backendHandle(LocalHandle.class);
            if (handle.isEmpty() || handle.get().isAlive()) {
                continue;
            }
            if (work.status() == WorkStatus.RUNNING && work.markStopped()) {
                log.warn("Execution context of work '{}' is gone, marking it STOPPED", work.displayName());
            }
        }
    }

    @Override
    public void stopWork(WorkApp app, Work work) {
        stop(work);
    }

    @Override
    public void stopAllWorks(List<Work> works) {
        for (Work work : works) {
            stop(work);
        }
    }

    private void stop(Work work) {
        Optional<LocalHandle> found = work.backendHandle(LocalHandle.class);
        if (found.isEmpty()) {
            return;
        }
        LocalHandle handle = found.get();
        handle.runner().stop();
        Thread thread = handle.thread();
        if (thread == Thread.currentThread()) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(config.stopJoinTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Execution thread of work '{}' did not exit within {}ms",
                work.displayName(), config.stopJoinTimeoutMs());
        }
    }

    @Override
    public Optional<URI> resolveUrl(Work work) {
        if (!work.hasNetworkSurface()) {
            return Optional.empty();
        }
        return Optional.of(URI.create("http://localhost:" + work.exposedPort()));
    }

    public RunnerConfig getConfig() {
        return config;
    }
}
