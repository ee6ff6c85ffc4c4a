package com.ryuqq.workmesh.application.sync;

import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.error.StaleDeltaException;
import com.ryuqq.workmesh.core.model.WorkName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 정본 상태 트리.
 *
 * <p>최상위 키는 Work 이름이고, 그 아래는 Delta 경로로 만들어지는 중첩 Map입니다.
 * Delta 적용은 구조적 병합이라, 서로 다른 경로를 건드리는 Delta는 서로를 덮어쓰지 않습니다.</p>
 *
 * <p><strong>Thread-Safety:</strong> 스레드 안전하지 않습니다. {@link StateSynchronizer}만 변경합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
final class StateTree {

    private final Map<WorkName, Map<String, Object>> works = new LinkedHashMap<>();
    private long version;

    boolean contains(WorkName workName) {
        return works.containsKey(workName);
    }

    void addWork(WorkName workName) {
        works.putIfAbsent(workName, new LinkedHashMap<>());
    }

    boolean removeWork(WorkName workName) {
        if (works.remove(workName) == null) {
            return false;
        }
        version++;
        return true;
    }

    /**
     * Delta 적용.
     *
     * @param delta 적용할 Delta
     * @throws StaleDeltaException Work 노드가 없는 경우
     */
    void apply(Delta delta) {
        Map<String, Object> node = works.get(delta.workName());
        if (node == null) {
            throw new StaleDeltaException(
                "Delta #" + delta.deltaId() + " targets work '" + delta.workName() + "' which is no longer tracked");
        }
        List<String> path = delta.path();
        String leaf = path.get(path.size() - 1);

        if (delta.operation() == Delta.Operation.SET) {
            Map<String, Object> parent = node;
            for (String segment : path.subList(0, path.size() - 1)) {
                parent = childMap(parent, segment);
            }
            parent.put(leaf, delta.value());
        } else {
            Map<String, Object> parent = node;
            for (String segment : path.subList(0, path.size() - 1)) {
                if (!(parent.get(segment) instanceof Map)) {
                    version++;
                    return;
                }
                parent = childMap(parent, segment);
            }
            parent.remove(leaf);
        }
        version++;
    }

    Object valueAt(WorkName workName, List<String> path) {
        Object current = works.get(workName);
        for (String segment : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current instanceof Map<?, ?> map ? deepCopy(map) : current;
    }

    Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<WorkName, Map<String, Object>> entry : works.entrySet()) {
            copy.put(entry.getKey().getValue(), deepCopy(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    long version() {
        return version;
    }

    /**
     * 경로 중간 노드를 이 트리 소유의 가변 맵으로 교체하며 내려감 (Delta 값으로 들어온 맵은 복사).
     */
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
