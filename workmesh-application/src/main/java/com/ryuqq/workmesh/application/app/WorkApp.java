package com.ryuqq.workmesh.application.app;

import com.ryuqq.workmesh.application.backend.Backend;
import com.ryuqq.workmesh.application.lifecycle.DefaultWorkManager;
import com.ryuqq.workmesh.application.lifecycle.SignalMonitor;
import com.ryuqq.workmesh.application.lifecycle.WorkManager;
import com.ryuqq.workmesh.application.proxy.ProxyWorkRun;
import com.ryuqq.workmesh.application.proxy.RunProxyInstaller;
import com.ryuqq.workmesh.application.runtime.Runtime;
import com.ryuqq.workmesh.application.sync.StateSynchronizer;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkFlow;
import com.ryuqq.workmesh.core.codec.PayloadCodec;
import com.ryuqq.workmesh.core.contract.CopyRequest;
import com.ryuqq.workmesh.core.contract.CopyResponse;
import com.ryuqq.workmesh.core.contract.QueueMessage;
import com.ryuqq.workmesh.core.error.CallTimeoutException;
import com.ryuqq.workmesh.core.error.ConfigurationException;
import com.ryuqq.workmesh.core.model.QueueId;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.spi.QueueFabric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 작업 오케스트레이션 코디네이터.
 *
 * <p>Queue Fabric 하나와 Backend 하나를 소유하고, 등록된 Work마다 WorkManager를 둡니다.
 * 생성 시 {@link QueueId}를 만들고 App 전역 큐를 한 번 준비합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkApp app = new WorkApp(new InMemoryQueueFabric(), new LocalBackend());
 * WorkFlow root = new WorkFlow("root");
 * Work trainer = root.attach("trainer", new Work(arguments -&gt; Map.of("loss", 0.42)));
 * app.registerAll(root);
 *
 * Object result = trainer.runWith(Map.of("batch", 5));   // {loss=0.42}
 * app.pump();                                              // 상태 동기화
 * app.shutdown();
 * </pre>
 *
 * <p><strong>Thread-Safety:</strong> 등록/조회는 동시 호출 가능. pump()는 여러 스레드에서 호출해도 되지만
 * 보통 CoordinatorLoop 하나가 호출합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class WorkApp implements Runtime, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkApp.class);

    private final QueueId queueId;
    private final QueueFabric fabric;
    private final Backend backend;
    private final AppConfig config;
    private final PayloadCodec codec;
    private final QueueRegistry queues;
    private final StateSynchronizer stateSynchronizer;
    private final SignalMonitor signalMonitor;
    private final Map<Work, WorkManager> managers = new ConcurrentHashMap<>();
    private final Map<WorkName, Work> works = new ConcurrentHashMap<>();
    private final AtomicLong copyRequestIds = new AtomicLong();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile long lastStatusPollNanos = System.nanoTime();

    public WorkApp(QueueFabric fabric, Backend backend) {
        this(fabric, backend, new AppConfig());
    }

    public WorkApp(QueueFabric fabric, Backend backend, AppConfig config) {
        this(fabric, backend, config, QueueId.generate(), new PayloadCodec());
    }

    /**
     * App 생성.
     *
     * @param fabric Queue Fabric (App이 소유하며 shutdown 시 닫힘)
     * @param backend 실행 환경
     * @param config 설정
     * @param queueId 큐 ID
     * @param codec 호출 인자/반환값 코덱
     */
    public WorkApp(QueueFabric fabric, Backend backend, AppConfig config, QueueId queueId, PayloadCodec codec) {
        if (fabric == null || backend == null || config == null || queueId == null || codec == null) {
            throw new IllegalArgumentException("fabric, backend, config, queueId and codec cannot be null");
        }
        this.fabric = fabric;
        this.backend = backend;
        this.config = config;
        this.queueId = queueId;
        this.codec = codec;
        this.queues = new QueueRegistry(fabric, queueId);
        this.stateSynchronizer = new StateSynchronizer(
            queues.deltaQueue(), queues.apiDeltaQueue(), queues.apiStatePublishQueue());
        this.signalMonitor = new SignalMonitor(queues.readinessQueue(), queues.errorQueue(), this::work);
        log.info("WorkApp created (queueId={}, backend={})", queueId.getValue(), backend.getClass().getSimpleName());
    }

    // ========================================
    // 등록
    // ========================================

    /**
     * Work 등록: WorkManager를 만들고 진입 메서드를 Run Proxy로 감쌉니다.
     *
     * <p>이름이 있으면 바로 바인딩합니다. 실행 컨텍스트는 첫 호출(또는 {@link WorkManager#start()}) 때 만들어집니다.</p>
     *
     * @param work 대상 Work
     * @return 해당 Work의 WorkManager
     */
    public WorkManager register(Work work) {
        ensureOpen();
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (work.name().isPresent()) {
            bind(work);
        }
        WorkManager manager = managers.computeIfAbsent(work, w -> new DefaultWorkManager(this, w, backend));
        RunProxyInstaller.wrap(this, work);
        return manager;
    }

    /**
     * WorkFlow의 모든 Work 등록.
     */
    public void registerAll(WorkFlow flow) {
        for (Work work : flow.works()) {
            register(work);
        }
    }

    /**
     * Work를 이름으로 바인딩하고 상태 트리에서 추적 시작.
     *
     * @param work 이름 있는 Work
     * @throws ConfigurationException 이름이 없거나 같은 이름의 다른 Work가 있는 경우
     */
    public void bind(Work work) {
        WorkName name = work.name().orElseThrow(() -> new ConfigurationException(
            "Cannot bind " + work.getClass().getSimpleName() + ": the work has no name"));
        Work existing = works.putIfAbsent(name, work);
        if (existing != null && existing != work) {
            throw new ConfigurationException("Another work is already registered as '" + name + "'");
        }
        if (existing == null) {
            stateSynchronizer.track(name, work.state().lastDeltaId());
        }
    }

    /**
     * @throws IllegalStateException 등록되지 않은 Work인 경우
     */
    public WorkManager manager(Work work) {
        WorkManager manager = managers.get(work);
        if (manager == null) {
            throw new IllegalStateException("Work '" + work.displayName() + "' is not registered with this App");
        }
        return manager;
    }

    public Optional<Work> work(WorkName name) {
        return Optional.ofNullable(works.get(name));
    }

    public Optional<Work> work(String name) {
        return work(WorkName.of(name));
    }

    /**
     * @return 이름으로 바인딩된 Work 목록
     */
    public List<Work> works() {
        return Collections.unmodifiableList(new ArrayList<>(works.values()));
    }

    /**
     * Work 제거: kill 후 추적 해제.
     *
     * @param work 대상 Work
     */
    public void remove(Work work) {
        WorkManager manager = managers.remove(work);
        if (manager != null) {
            manager.kill();
        }
        work.name().ifPresent(name -> {
            works.remove(name, work);
            stateSynchronizer.untrack(name);
        });
        log.info("Work '{}' removed", work.displayName());
    }

    // ========================================
    // Runtime
    // ========================================

    @Override
    public void pump() {
        ensureOpen();
        pumpSignals();
        stateSynchronizer.pump();
        for (Work work : works.values()) {
            if (work.entryPoint() instanceof ProxyWorkRun proxy) {
                proxy.dispatchResponses();
            }
        }
        long intervalNanos = TimeUnit.MILLISECONDS.toNanos(config.statusPollIntervalMs());
        long now = System.nanoTime();
        if (now - lastStatusPollNanos >= intervalNanos) {
            lastStatusPollNanos = now;
            updateWorkStatuses();
        }
    }

    /**
     * readiness/error 신호만 처리 (블로킹 대기 중인 호출자와 WorkManager가 사용).
     *
     * @return 처리한 신호 수
     */
    public int pumpSignals() {
        return signalMonitor.drain();
    }

    /**
     * Backend에 모든 Work의 상태를 한 번에 조회시킴.
     */
    public void updateWorkStatuses() {
        try {
            backend.updateWorkStatuses(works());
        } catch (RuntimeException e) {
            log.warn("Backend status poll failed, will retry on next cycle", e);
        }
    }

    /**
     * 네트워크 포트를 노출한 Work의 URL을 조회해 각 Work에 저장.
     */
    public void resolveUrls() {
        for (Work work : works.values()) {
            Optional<URI> url = backend.resolveUrl(work);
            url.ifPresent(work::assignUrl);
            url.ifPresent(u -> log.info("Work '{}' is reachable at {}", work.displayName(), u));
        }
    }

    /**
     * 실행 컨텍스트의 로컬 상태 사본 요청 (copy-request / copy-response 왕복).
     *
     * @param work 대상 Work (RUNNING)
     * @param timeoutMs 최대 대기 시간
     * @return 상태 사본
     * @throws CallTimeoutException 시간 내 응답이 없는 경우
     */
    public Map<String, Object> requestStateCopy(Work work, long timeoutMs) {
        WorkName name = work.name().orElseThrow(() -> new ConfigurationException(
            "Cannot copy state of " + work.getClass().getSimpleName() + ": the work has no name"));
        if (!work.status().isAlive()) {
            throw new IllegalStateException("Work '" + name + "' is not running (status: " + work.status() + ")");
        }
        WorkQueues workQueues = queues.require(name);
        long requestId = copyRequestIds.incrementAndGet();
        workQueues.copyRequest().push(new CopyRequest(name, requestId));

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (true) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                throw new CallTimeoutException(name.getValue(), requestId, timeoutMs);
            }
            Optional<QueueMessage> message = workQueues.copyResponse().pop(remainingMs);
            if (message.isPresent() && message.get() instanceof CopyResponse response) {
                if (response.requestId() == requestId) {
                    return response.state();
                }
                log.debug("Dropping stale copy response #{} for work '{}'", response.requestId(), name);
            }
        }
    }

    /**
     * 모든 Work kill.
     */
    public void stopAllWorks() {
        for (WorkManager manager : new ArrayList<>(managers.values())) {
            manager.kill();
        }
    }

    /**
     * 모든 실행 컨텍스트 종료, 큐 해제, Fabric 닫기. 두 번째 호출은 아무것도 하지 않습니다.
     */
    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down WorkApp (queueId={}, works={})", queueId.getValue(), works.size());
        try {
            backend.stopAllWorks(works());
        } catch (RuntimeException e) {
            log.warn("Backend failed to stop all works", e);
        }
        stopAllWorks();
        queues.releaseAll();
        try {
            fabric.close();
        } catch (Exception e) {
            log.warn("Failed to close queue fabric", e);
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new IllegalStateException("WorkApp has been shut down");
        }
    }

    // ========================================
    // Accessors
    // ========================================

    public QueueId queueId() {
        return queueId;
    }

    public QueueRegistry queues() {
        return queues;
    }

    public StateSynchronizer stateSynchronizer() {
        return stateSynchronizer;
    }

    public Backend backend() {
        return backend;
    }

    public AppConfig config() {
        return config;
    }

    public PayloadCodec codec() {
        return codec;
    }
}
