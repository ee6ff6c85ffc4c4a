package com.ryuqq.workmesh.testkit.contract;

import com.ryuqq.workmesh.adapter.runner.ComputeInstance;
import com.ryuqq.workmesh.adapter.runner.ComputeProvisioner;
import com.ryuqq.workmesh.adapter.runner.ComputeRequest;
import com.ryuqq.workmesh.adapter.runner.InstanceState;
import com.ryuqq.workmesh.core.error.ProvisioningException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link ComputeProvisioner} for testing.
 *
 * <p>Each "instance" is a daemon thread running the request's workload. Tests can
 * inject provisioning faults per work name and flip instance states to simulate
 * terminated or failed instances.</p>
 *
 * <p><strong>Thread-safety:</strong> All operations are thread-safe.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public class InMemoryComputeProvisioner implements ComputeProvisioner {

    private final Map<String, Instance> instances = new ConcurrentHashMap<>();
    private final Map<String, String> faults = new ConcurrentHashMap<>();
    private final List<String> terminated = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger describeCalls = new AtomicInteger();

    private static final class Instance {
        private final ComputeInstance instance;
        private final Thread thread;
        private volatile InstanceState state = InstanceState.RUNNING;

        private Instance(ComputeInstance instance, Thread thread) {
            this.instance = instance;
            this.thread = thread;
        }
    }

    /**
     * Makes every provisioning attempt for the given work fail.
     *
     * @param workName the work name
     * @param reason the failure reason (e.g. "quota exceeded")
     */
    public void failProvisioning(String workName, String reason) {
        faults.put(workName, reason);
    }

    public void clearFault(String workName) {
        faults.remove(workName);
    }

    @Override
    public ComputeInstance provision(ComputeRequest request) {
        String fault = faults.get(request.workName());
        if (fault != null) {
            throw new ProvisioningException(request.workName(), fault);
        }
        int number = sequence.incrementAndGet();
        ComputeInstance instance = new ComputeInstance("i-" + number, "10.0.0." + number);
        Thread thread = new Thread(request.workload(), "instance-" + instance.instanceId());
        thread.setDaemon(true);
        instances.put(instance.instanceId(), new Instance(instance, thread));
        thread.start();
        return instance;
    }

    @Override
    public void terminate(String instanceId) {
        Instance instance = instances.get(instanceId);
        if (instance == null) {
            return;
        }
        instance.state = InstanceState.TERMINATED;
        instance.thread.interrupt();
        terminated.add(instanceId);
    }

    @Override
    public Map<String, InstanceState> describe(Collection<String> instanceIds) {
        describeCalls.incrementAndGet();
        Map<String, InstanceState> states = new HashMap<>();
        for (String instanceId : instanceIds) {
            Instance instance = instances.get(instanceId);
            if (instance != null) {
                states.put(instanceId, instance.state);
            }
        }
        return states;
    }

    /**
     * Simulates an instance that died underneath the backend.
     *
     * @param instanceId the instance ID
     * @param state TERMINATED or FAILED
     */
    public void simulate(String instanceId, InstanceState state) {
        Instance instance = instances.get(instanceId);
        if (instance == null) {
            throw new IllegalArgumentException("Unknown instance: " + instanceId);
        }
        instance.state = state;
    }

    /**
     * Simulates an instance that vanished (describe no longer reports it).
     */
    public void forget(String instanceId) {
        instances.remove(instanceId);
    }

    public int instanceCount() {
        return instances.size();
    }

    public List<String> terminatedInstances() {
        synchronized (terminated) {
            return new ArrayList<>(terminated);
        }
    }

    public int describeCalls() {
        return describeCalls.get();
    }
}
