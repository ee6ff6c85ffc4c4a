package com.ryuqq.workmesh.application.sync;

import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.model.WorkName;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Work별 Delta 순서 보장.
 *
 * <p>deltaId는 Work마다 1부터 증가합니다. 마지막 적용 id 이하는 중복으로 버리고,
 * 중간이 비면 앞선 Delta가 도착할 때까지 버퍼에 둡니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
final class DeltaSequencer {

    /**
     * offer 결과.
     */
    enum Disposition {
        /** 이번에 적용 가능한 Delta가 있음 (버퍼에서 풀려난 것 포함). */
        READY,
        /** 앞선 Delta를 기다리며 버퍼에 보관. */
        BUFFERED,
        /** 이미 적용했거나 버퍼에 있는 id. */
        DUPLICATE
    }

    record Offer(Disposition disposition, List<Delta> ready) {
    }

    private final Map<WorkName, Long> lastApplied = new HashMap<>();
    private final Map<WorkName, TreeMap<Long, Delta>> buffered = new HashMap<>();

    Offer offer(Delta delta) {
        WorkName workName = delta.workName();
        long last = lastApplied.getOrDefault(workName, 0L);
        TreeMap<Long, Delta> buffer = buffered.computeIfAbsent(workName, k -> new TreeMap<>());

        if (delta.deltaId() <= last || buffer.containsKey(delta.deltaId())) {
            return new Offer(Disposition.DUPLICATE, List.of());
        }
        if (delta.deltaId() > last + 1) {
            buffer.put(delta.deltaId(), delta);
            return new Offer(Disposition.BUFFERED, List.of());
        }

        List<Delta> ready = new ArrayList<>();
        ready.add(delta);
        long next = delta.deltaId() + 1;
        Delta following;
        while ((following = buffer.remove(next)) != null) {
            ready.add(following);
            next++;
        }
        lastApplied.put(workName, next - 1);
        return new Offer(Disposition.READY, ready);
    }

    long lastApplied(WorkName workName) {
        return lastApplied.getOrDefault(workName, 0L);
    }

    int bufferedCount(WorkName workName) {
        TreeMap<Long, Delta> buffer = buffered.get(workName);
        return buffer == null ? 0 : buffer.size();
    }

    /**
     * 다음에 기대하는 id를 {@code lastDeltaId + 1}로 맞춤. 버퍼는 비웁니다.
     */
    void seed(WorkName workName, long lastDeltaId) {
        buffered.remove(workName);
        if (lastDeltaId > 0) {
            lastApplied.put(workName, lastDeltaId);
        } else {
            lastApplied.remove(workName);
        }
    }

    void forget(WorkName workName) {
        lastApplied.remove(workName);
        buffered.remove(workName);
    }
}
