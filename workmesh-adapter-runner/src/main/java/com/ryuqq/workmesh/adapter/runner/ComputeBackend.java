package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.backend.Backend;
import com.ryuqq.workmesh.application.proxy.ProxyWorkRun;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.core.error.ProvisioningException;
import com.ryuqq.workmesh.core.model.WorkName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 컴퓨트 인스턴스 Backend.
 *
 * <p>Work마다 {@link ComputeProvisioner}로 인스턴스(컨테이너, 클라우드 VM 등)를 만들고
 * 그 안에서 {@link WorkRunner}를 실행합니다.</p>
 *
 * <p><strong>상태 조회:</strong> 모든 인스턴스를 {@link ComputeProvisioner#describe} 한 번으로 조회합니다.</p>
 * <ul>
 *   <li>TERMINATED / NOT_FOUND: RUNNING이던 Work를 STOPPED로, 핸들 해제</li>
 *   <li>FAILED: Work를 FAILED로, 대기 중인 호출 취소</li>
 *   <li>PENDING / RUNNING: 변경 없음 (readiness는 신호로 처리)</li>
 * </ul>
 *
 * <p><strong>URL:</strong> 포트를 노출한 Work는 {@code http://{instance host}:{port}}.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class ComputeBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(ComputeBackend.class);

    private final ComputeProvisioner provisioner;
    private final RunnerConfig config;

    public ComputeBackend(ComputeProvisioner provisioner) {
        this(provisioner, new RunnerConfig());
    }

    /**
     * @param provisioner 인스턴스 프로비저너
     * @param config 실행 설정
     */
    public ComputeBackend(ComputeProvisioner provisioner, RunnerConfig config) {
        if (provisioner == null) {
            throw new IllegalArgumentException("provisioner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.provisioner = provisioner;
        this.config = config;
    }

    @Override
    public void createWork(WorkApp app, Work work) {
        WorkName name = work.name()
            .orElseThrow(() -> new ProvisioningException(work.displayName(), "work has no name"));

        WorkRunner runner;
        try {
            runner = WorkRunner.attach(app, work, config);
        } catch (IllegalStateException e) {
            throw new ProvisioningException(name.getValue(), e.getMessage(), e);
        }

        ComputeRequest request = new ComputeRequest(
            name.getValue(), app.queueId().getValue(), work.exposedPort(), runner);
        ComputeInstance instance;
        try {
            instance = provisioner.provision(request);
        } catch (ProvisioningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProvisioningException(name.getValue(), "provisioner error: " + e.getMessage(), e);
        }
        if (instance == null) {
            throw new ProvisioningException(name.getValue(), "provisioner returned no instance");
        }

        work.bindBackend(new ComputeHandle(instance, runner));
        log.info("Provisioned instance {} ({}) for work '{}'", instance.instanceId(), instance.host(), name);
    }

    @Override
    public void updateWorkStatuses(List<Work> works) {
        List<Work> tracked = new ArrayList<>();
        List<String> instanceIds = new ArrayList<>();
        for (Work work : works) {
            work.backendHandle(ComputeHandle.class).ifPresent(handle -> {
                tracked.add(work);
                instanceIds.add(handle.instance().instanceId());
            });
        }
        if (instanceIds.isEmpty()) {
            return;
        }

        Map<String, InstanceState> states = provisioner.describe(instanceIds);
        for (Work work : tracked) {
            Optional<ComputeHandle> handle = work.backendHandle(ComputeHandle.class);
            if (handle.isEmpty()) {
                continue;
            }
            String instanceId = handle.get().instance().instanceId();
            InstanceState state = states.getOrDefault(instanceId, InstanceState.NOT_FOUND);
            apply(work, instanceId, state);
        }
    }

    private void apply(Work work, String instanceId, InstanceState state) {
        switch (state) {
            case TERMINATED, NOT_FOUND -> {
                if (work.markStopped()) {
                    handleGone(work);
                    log.warn("Instance {} of work '{}' is {}, marking it STOPPED",
                        instanceId, work.displayName(), state);
                }
            }
            case FAILED -> {
                if (work.markFailed("InstanceFailure: instance " + instanceId + " failed")) {
                    handleGone(work);
                    if (work.entryPoint() instanceof ProxyWorkRun proxy) {
                        proxy.cancelPending("instance " + instanceId + " failed");
                    }
                    log.error("Instance {} of work '{}' failed", instanceId, work.displayName());
                }
            }
            default -> {
                // PENDING, RUNNING
            }
        }
    }

    private void handleGone(Work work) {
        work.backendHandle(ComputeHandle.class).ifPresent(handle -> handle.runner().stop());
        work.releaseBackend();
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
        Optional<ComputeHandle> handle = work.backendHandle(ComputeHandle.class);
        if (handle.isEmpty()) {
            return;
        }
        handle.get().runner().stop();
        String instanceId = handle.get().instance().instanceId();
        try {
            provisioner.terminate(instanceId);
            log.info("Terminated instance {} of work '{}'", instanceId, work.displayName());
        } catch (RuntimeException e) {
            log.warn("Failed to terminate instance {} of work '{}'", instanceId, work.displayName(), e);
        }
    }

    @Override
    public Optional<URI> resolveUrl(Work work) {
        if (!work.hasNetworkSurface()) {
            return Optional.empty();
        }
        return work.backendHandle(ComputeHandle.class)
            .map(handle -> URI.create("http://" + handle.instance().host() + ":" + work.exposedPort()));
    }
}
