package com.ryuqq.workmesh.application.work;

import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.model.WorkName;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Work의 로컬 관찰 가능 상태.
 *
 * <p>실행 컨텍스트 안에서 Work가 값을 기록하면, 값이 로컬에 반영되는 동시에
 * Work별 단조 증가 deltaId를 가진 {@link Delta}가 만들어져 {@link DeltaSink}로 전달됩니다.
 * 경로는 점(.)으로 구분합니다 ({@code "metrics.loss"}).</p>
 *
 * <p>sink가 연결되지 않은 상태(로컬 실행)에서는 값만 바뀌고 Delta는 만들어지지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * work.state().set("metrics.loss", 0.42);
 * work.state().set("logs.last", "epoch 3 done");
 * work.state().remove("logs.last");
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class WorkState {

    private final Supplier<WorkName> nameSupplier;
    private final Map<String, Object> values;
    private long deltaCounter;
    private DeltaSink sink;

    WorkState(Supplier<WorkName> nameSupplier) {
        this.nameSupplier = nameSupplier;
        this.values = new LinkedHashMap<>();
    }

    /**
     * 경로에 값 설정.
     *
     * @param path 점으로 구분된 경로
     * @param value 값 (null 가능)
     * @throws IllegalArgumentException path가 유효하지 않은 경우
     */
    public synchronized void set(String path, Object value) {
        List<String> segments = split(path);
        Map<String, Object> parent = values;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            parent = childMap(parent, segment);
        }
        parent.put(segments.get(segments.size() - 1), value);
        emit(segments, Delta.Operation.SET, value);
    }

    /**
     * 경로의 값 제거. 경로가 없으면 로컬 변경은 없지만 Delta는 기록됩니다.
     *
     * @param path 점으로 구분된 경로
     */
    public synchronized void remove(String path) {
        List<String> segments = split(path);
        Map<String, Object> parent = values;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            if (!(parent.get(segment) instanceof Map)) {
                parent = null;
                break;
            }
            parent = childMap(parent, segment);
        }
        if (parent != null) {
            parent.remove(segments.get(segments.size() - 1));
        }
        emit(segments, Delta.Operation.REMOVE, null);
    }

    /**
     * 경로의 값 조회.
     *
     * @param path 점으로 구분된 경로
     * @return 값 (없으면 null)
     */
    public synchronized Object get(String path) {
        Object current = values;
        for (String segment : split(path)) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    /**
     * @return 현재 상태의 깊은 사본 (읽기 전용)
     */
    public synchronized Map<String, Object> snapshot() {
        return deepCopy(values);
    }

    /**
     * @return 지금까지 발생한 마지막 deltaId (없으면 0)
     */
    public synchronized long lastDeltaId() {
        return deltaCounter;
    }

    /**
     * Delta 수신자 연결 (실행 컨텍스트 시작 시).
     *
     * @param sink 수신자
     */
    public synchronized void attach(DeltaSink sink) {
        this.sink = sink;
    }

    /**
     * 연결 해제. 현재 연결된 sink가 주어진 sink일 때만 해제합니다.
     *
     * @param expected 해제할 sink
     * @return 해제했으면 true
     */
    public synchronized boolean detach(DeltaSink expected) {
        if (sink != expected) {
            return false;
        }
        this.sink = null;
        return true;
    }

    private void emit(List<String> path, Delta.Operation operation, Object value) {
        WorkName name = nameSupplier.get();
        if (sink == null || name == null) {
            return;
        }
        deltaCounter++;
        sink.accept(new Delta(name, deltaCounter, path, operation, value));
    }

    private static List<String> split(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        List<String> segments = Arrays.asList(path.split("\\."));
        for (String segment : segments) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("path contains an empty segment: '" + path + "'");
            }
        }
        return segments;
    }

    private static Map<String, Object> childMap(Map<String, Object> parent, String segment) {
        Map<String, Object> child = new LinkedHashMap<>();
        if (parent.get(segment) instanceof Map<?, ?> existing) {
            existing.forEach((key, value) -> child.put(String.valueOf(key), value));
        }
        parent.put(segment, child);
        return child;
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            Object value = entry.getValue();
            copy.put(String.valueOf(entry.getKey()), value instanceof Map<?, ?> map ? deepCopy(map) : value);
        }
        return Collections.unmodifiableMap(copy);
    }
}
