package com.ryuqq.workmesh.application.work;

import com.ryuqq.workmesh.application.proxy.CallHandle;
import com.ryuqq.workmesh.application.proxy.WrappedRun;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.error.WorkMeshException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.statemachine.StatusTransition;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * 이름 있는 호출 가능한 작업 단위.
 *
 * <p>Work는 진입 메서드({@link WorkRun}), 상태({@link WorkStatus}), 로컬 관찰 상태({@link WorkState})를 가집니다.
 * App에 등록되면 진입 메서드가 Run Proxy로 교체되어, {@link #run(Object...)} 호출이
 * 원격 실행 컨텍스트로 전달됩니다. 호출하는 쪽의 코드는 달라지지 않습니다.</p>
 *
 * <p><strong>두 가지 정의 방식:</strong></p>
 * <pre>
 * // 1. 람다
 * Work trainer = new Work(arguments -&gt; Map.of("loss", 0.42));
 *
 * // 2. 상속
 * class Trainer extends Work {
 *     &#64;Override
 *     protected Object execute(CallArguments arguments) {
 *         state().set("epoch", arguments.kwarg("epoch"));
 *         return Map.of("loss", 0.42);
 *     }
 * }
 * </pre>
 *
 * <p><strong>상태 전이:</strong> status는 {@link StatusTransition} 규칙을 따르며 Work 인스턴스 모니터로 보호됩니다.
 * 읽기는 volatile이라 잠금 없이 가능합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class Work {

    private final WorkState state;
    private final int exposedPort;

    private volatile WorkName name;
    private volatile WorkRun entryPoint;
    private volatile WorkStatus status = WorkStatus.CREATED;
    private volatile String lastError;
    private volatile Object backendHandle;
    private volatile URI url;
    private volatile long generation;

    /**
     * 상속용 생성자. 진입 메서드는 {@link #execute(CallArguments)}입니다.
     */
    protected Work() {
        this(0);
    }

    /**
     * 상속용 생성자 (네트워크 포트 노출).
     *
     * @param exposedPort 노출 포트 (0이면 없음)
     */
    protected Work(int exposedPort) {
        validatePort(exposedPort);
        this.exposedPort = exposedPort;
        this.state = new WorkState(this::nameOrNull);
        this.entryPoint = this::execute;
    }

    /**
     * 람다 진입 메서드로 Work 생성.
     *
     * @param run 진입 메서드
     * @throws IllegalArgumentException run이 null인 경우
     */
    public Work(WorkRun run) {
        this(run, 0);
    }

    /**
     * 람다 진입 메서드와 노출 포트로 Work 생성.
     *
     * @param run 진입 메서드
     * @param exposedPort 노출 포트 (0이면 없음)
     * @throws IllegalArgumentException run이 null이거나 포트가 범위를 벗어난 경우
     */
    public Work(WorkRun run, int exposedPort) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        validatePort(exposedPort);
        this.exposedPort = exposedPort;
        this.state = new WorkState(this::nameOrNull);
        this.entryPoint = run;
    }

    /**
     * 상속 방식의 진입 메서드. 람다로 생성한 Work에서는 호출되지 않습니다.
     *
     * @param arguments 호출 인자
     * @return 반환값
     * @throws Exception Work가 던진 예외
     */
    protected Object execute(CallArguments arguments) throws Exception {
        throw new UnsupportedOperationException(
            getClass().getSimpleName() + " must override execute() or be created with a WorkRun");
    }

    // ========================================
    // 호출
    // ========================================

    /**
     * 위치 인자로 호출.
     */
    public Object run(Object... args) {
        return run(CallArguments.positional(args));
    }

    /**
     * 이름 인자로 호출 ({@code run(batch=5)} 형태).
     */
    public Object runWith(Map<String, Object> kwargs) {
        return run(CallArguments.kwargs(kwargs));
    }

    /**
     * 진입 메서드 호출.
     *
     * <p>등록된 Work라면 Run Proxy를 거쳐 원격으로 실행됩니다.
     * 검사 예외는 {@link WorkMeshException}으로 감싸서 던집니다.</p>
     *
     * @param arguments 호출 인자
     * @return 반환값 (FUTURE 모드에서는 {@link CallHandle})
     */
    public Object run(CallArguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        try {
            return entryPoint.run(arguments);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new WorkMeshException("Work '" + displayName() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * 비동기 호출. 호출 모드와 관계없이 {@link CallHandle}을 반환합니다.
     *
     * @param arguments 호출 인자
     * @return 호출 핸들
     * @throws IllegalStateException App에 등록되지 않은 Work인 경우
     */
    public CallHandle submit(CallArguments arguments) {
        WorkRun current = entryPoint;
        if (!(current instanceof WrappedRun)) {
            throw new IllegalStateException("Work '" + displayName() + "' is not registered with an App");
        }
        return ((WrappedRun) current).submit(arguments);
    }

    // ========================================
    // 이름
    // ========================================

    /**
     * 이름 부여 (한 번만 가능).
     *
     * @param workName 이름
     * @throws IllegalStateException 이미 다른 이름이 있는 경우
     */
    public synchronized void assignName(WorkName workName) {
        if (workName == null) {
            throw new IllegalArgumentException("workName cannot be null");
        }
        if (name != null && !name.equals(workName)) {
            throw new IllegalStateException("Work is already named '" + name + "'");
        }
        this.name = workName;
    }

    public Optional<WorkName> name() {
        return Optional.ofNullable(name);
    }

    private WorkName nameOrNull() {
        return name;
    }

    /**
     * 로그/메시지용 이름. 이름이 없으면 클래스 이름을 사용합니다.
     */
    public String displayName() {
        WorkName current = name;
        return current != null ? current.getValue() : getClass().getSimpleName();
    }

    // ========================================
    // 진입 메서드 교체 (Run Proxy)
    // ========================================

    public WorkRun entryPoint() {
        return entryPoint;
    }

    /**
     * 진입 메서드 교체.
     *
     * @param replacement 새 진입 메서드
     */
    public void replaceEntryPoint(WorkRun replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("replacement cannot be null");
        }
        this.entryPoint = replacement;
    }

    /**
     * 교체 전의 원래 진입 메서드 (실행 컨텍스트가 호출하는 대상).
     */
    public WorkRun originalEntryPoint() {
        WorkRun current = entryPoint;
        while (current instanceof WrappedRun) {
            current = ((WrappedRun) current).unwrap();
        }
        return current;
    }

    // ========================================
    // 상태
    // ========================================

    public WorkStatus status() {
        return status;
    }

    /**
     * 검증된 상태 전이.
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public synchronized void transitionTo(WorkStatus next) {
        status = StatusTransition.transition(status, next);
    }

    /**
     * STARTING → RUNNING (readiness 수신).
     *
     * @return 전이했으면 true, 현재 STARTING이 아니면 false
     */
    public synchronized boolean markReady() {
        if (status != WorkStatus.STARTING) {
            return false;
        }
        status = WorkStatus.RUNNING;
        lastError = null;
        return true;
    }

    /**
     * FAILED로 전이하고 마지막 오류를 기록.
     *
     * <p>이미 STOPPED(kill됨)이거나 FAILED인 경우 전이하지 않습니다.</p>
     *
     * @param error 오류 설명 ({@code "type: message"})
     * @return 전이했으면 true
     */
    public synchronized boolean markFailed(String error) {
        if (!StatusTransition.isAllowed(status, WorkStatus.FAILED)) {
            return false;
        }
        status = WorkStatus.FAILED;
        lastError = error;
        return true;
    }

    /**
     * 실행 컨텍스트가 사라진 것을 관찰했을 때 (RUNNING → STOPPING → STOPPED).
     *
     * @return 전이했으면 true
     */
    public synchronized boolean markStopped() {
        if (status != WorkStatus.RUNNING) {
            return false;
        }
        WorkStatus stopping = StatusTransition.transition(status, WorkStatus.STOPPING);
        status = StatusTransition.transition(stopping, WorkStatus.STOPPED);
        return true;
    }

    /**
     * 어떤 상태에서든 STOPPED (kill 전용).
     */
    public synchronized void forceStop() {
        status = StatusTransition.forceStop(status);
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * 새 실행 컨텍스트의 세대 번호 발급. 이전 세대의 신호는 무시됩니다.
     */
    public synchronized long nextGeneration() {
        return ++generation;
    }

    public long generation() {
        return generation;
    }

    // ========================================
    // Backend
    // ========================================

    /**
     * Backend 핸들 연결. 핸들의 타입은 Backend 구현이 정합니다.
     */
    public void bindBackend(Object handle) {
        this.backendHandle = handle;
    }

    public Optional<Object> backendHandle() {
        return Optional.ofNullable(backendHandle);
    }

    /**
     * 특정 타입의 Backend 핸들 조회.
     */
    public <T> Optional<T> backendHandle(Class<T> type) {
        Object current = backendHandle;
        return type.isInstance(current) ? Optional.of(type.cast(current)) : Optional.empty();
    }

    /**
     * Backend 핸들 해제.
     *
     * @return 해제된 핸들 (없었으면 empty)
     */
    public synchronized Optional<Object> releaseBackend() {
        Object previous = backendHandle;
        backendHandle = null;
        return Optional.ofNullable(previous);
    }

    // ========================================
    // 네트워크
    // ========================================

    public boolean hasNetworkSurface() {
        return exposedPort > 0;
    }

    public int exposedPort() {
        return exposedPort;
    }

    public Optional<URI> url() {
        return Optional.ofNullable(url);
    }

    public void assignUrl(URI resolved) {
        this.url = resolved;
    }

    public WorkState state() {
        return state;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", status=" + status + "}";
    }

    private static void validatePort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("exposedPort must be between 0 and 65535 (current: " + port + ")");
        }
    }
}
