package com.ryuqq.workmesh.application.work;

import com.ryuqq.workmesh.core.error.ConfigurationException;
import com.ryuqq.workmesh.core.model.WorkName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work들을 담는 합성 컨테이너.
 *
 * <p>자식 Work에 부모 이름을 접두사로 한 점(.) 구분 이름을 부여합니다.
 * Work는 WorkFlow에 붙는 순간 이름을 얻고, 이름이 없는 Work는 App에서 실행할 수 없습니다.</p>
 *
 * <pre>
 * WorkFlow root = new WorkFlow("root");
 * Work trainer = root.attach("trainer", new Work(arguments -&gt; train()));
 * trainer.name();   // root.trainer
 *
 * WorkFlow eval = root.attachFlow("eval");
 * eval.attach("scorer", scorer);   // root.eval.scorer
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class WorkFlow {

    private final WorkName name;
    private final Map<String, Object> children = new LinkedHashMap<>();

    /**
     * 최상위 WorkFlow 생성.
     *
     * @param name 루트 이름
     * @throws IllegalArgumentException 이름이 유효하지 않은 경우
     */
    public WorkFlow(String name) {
        this(WorkName.of(name));
    }

    private WorkFlow(WorkName name) {
        this.name = name;
    }

    public WorkName getName() {
        return name;
    }

    /**
     * 자식 Work 부착.
     *
     * @param childName 자식 이름 (점 포함 불가)
     * @param work Work
     * @return 같은 Work (이름 부여됨)
     * @throws ConfigurationException 같은 이름의 자식이 이미 있거나, Work가 다른 이름으로 부착되어 있는 경우
     */
    public synchronized <W extends Work> W attach(String childName, W work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        WorkName childWorkName = reserve(childName);
        Optional<WorkName> existing = work.name();
        if (existing.isPresent() && !existing.get().equals(childWorkName)) {
            throw new ConfigurationException(
                "Work '" + existing.get() + "' is already attached and cannot be renamed to '" + childWorkName + "'");
        }
        work.assignName(childWorkName);
        children.put(childName, work);
        return work;
    }

    /**
     * 하위 WorkFlow 부착.
     *
     * @param childName 자식 이름
     * @return 새 하위 WorkFlow
     */
    public synchronized WorkFlow attachFlow(String childName) {
        WorkFlow flow = new WorkFlow(reserve(childName));
        children.put(childName, flow);
        return flow;
    }

    private WorkName reserve(String childName) {
        WorkName childWorkName = name.child(childName);
        if (children.containsKey(childName)) {
            throw new ConfigurationException(
                "WorkFlow '" + name + "' already has a child named '" + childName + "'");
        }
        return childWorkName;
    }

    /**
     * 직접 자식 Work 조회.
     */
    public synchronized Optional<Work> work(String childName) {
        Object child = children.get(childName);
        return child instanceof Work ? Optional.of((Work) child) : Optional.empty();
    }

    /**
     * 하위 WorkFlow까지 포함한 모든 Work (부착 순서).
     */
    public synchronized List<Work> works() {
        List<Work> result = new ArrayList<>();
        for (Object child : children.values()) {
            if (child instanceof Work) {
                result.add((Work) child);
            } else {
                result.addAll(((WorkFlow) child).works());
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "WorkFlow{name=" + name + ", children=" + children.keySet() + "}";
    }
}
