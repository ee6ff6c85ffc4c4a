package com.ryuqq.workmesh.application.app;

import com.ryuqq.workmesh.adapter.inmemory.fabric.InMemoryQueueFabric;
import com.ryuqq.workmesh.application.lifecycle.WorkManager;
import com.ryuqq.workmesh.application.support.ScriptedBackend;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkFlow;
import com.ryuqq.workmesh.core.contract.CopyRequest;
import com.ryuqq.workmesh.core.contract.CopyResponse;
import com.ryuqq.workmesh.core.error.CallTimeoutException;
import com.ryuqq.workmesh.core.error.ConfigurationException;
import com.ryuqq.workmesh.core.model.WorkName;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkApp 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class WorkAppTest {

    private ScriptedBackend backend;
    private InMemoryQueueFabric fabric;
    private WorkApp app;
    private WorkFlow root;

    @BeforeEach
    void setUp() {
        backend = new ScriptedBackend();
        fabric = new InMemoryQueueFabric();
        app = new WorkApp(fabric, backend, new AppConfig().withPollingIntervalMs(1).withStatusPollIntervalMs(1));
        root = new WorkFlow("root");
    }

    @AfterEach
    void tearDown() {
        app.shutdown();
    }

    @Test
    void register_NamedWork_BindsAndTracks() {
        // Given
        Work work = root.attach("trainer", new Work(arguments -> null));

        // When
        WorkManager manager = app.register(work);

        // Then
        assertThat(app.manager(work)).isSameAs(manager);
        assertThat(app.work("root.trainer")).containsSame(work);
        assertThat(app.stateSynchronizer().isTracked(WorkName.of("root.trainer"))).isTrue();
        assertThat(app.register(work)).isSameAs(manager);
    }

    @Test
    void bind_DuplicateName_ThrowsConfiguration() {
        // Given
        app.register(root.attach("trainer", new Work(arguments -> null)));
        Work impostor = new WorkFlow("root").attach("trainer", new Work(arguments -> null));

        // When & Then
        assertThatThrownBy(() -> app.register(impostor))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("already registered as 'root.trainer'");
    }

    @Test
    void manager_Unregistered_ThrowsException() {
        Work stranger = new Work(arguments -> null);
        assertThatThrownBy(() -> app.manager(stranger)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void registerAll_RegistersNestedWorks() {
        // Given
        root.attach("a", new Work(arguments -> null));
        root.attachFlow("group").attach("b", new Work(arguments -> null));

        // When
        app.registerAll(root);

        // Then
        assertThat(app.works()).hasSize(2);
        assertThat(app.work("root.group.b")).isPresent();
    }

    @Test
    void requestStateCopy_ReturnsMatchingResponse() throws Exception {
        // Given
        Work work = root.attach("trainer", new Work(arguments -> null));
        app.register(work).start();
        WorkQueues queues = app.queues().require(WorkName.of("root.trainer"));
        Thread responder = new Thread(() -> {
            CopyRequest request = queues.copyRequest().pop(2000, CopyRequest.class).orElseThrow();
            queues.copyResponse().push(new CopyResponse(request.workName(), request.requestId() + 100, Map.of("stale", true)));
            queues.copyResponse().push(new CopyResponse(request.workName(), request.requestId(), Map.of("epoch", 3)));
        });
        responder.start();

        // When
        Map<String, Object> state = app.requestStateCopy(work, 2000);
        responder.join(1000);

        // Then
        assertThat(state).isEqualTo(Map.of("epoch", 3));
    }

    @Test
    void requestStateCopy_NotRunning_ThrowsException() {
        // Given
        Work work = root.attach("trainer", new Work(arguments -> null));
        app.register(work);

        // When & Then
        assertThatThrownBy(() -> app.requestStateCopy(work, 100))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("is not running");
    }

    @Test
    void requestStateCopy_NoResponse_TimesOut() {
        // Given
        Work work = root.attach("trainer", new Work(arguments -> null));
        app.register(work).start();

        // When & Then
        assertThatThrownBy(() -> app.requestStateCopy(work, 30))
            .isInstanceOf(CallTimeoutException.class);
    }

    @Test
    void resolveUrls_AssignsUrlForNetworkWork() {
        // Given
        Work server = root.attach("server", new Work(arguments -> null, 8080));
        Work plain = root.attach("plain", new Work(arguments -> null));
        app.registerAll(root);

        // When
        app.resolveUrls();

        // Then
        assertThat(server.url()).contains(URI.create("http://scripted:8080"));
        assertThat(plain.url()).isEmpty();
    }

    @Test
    void pump_AfterInterval_PollsBackendStatus() throws Exception {
        // Given
        Thread.sleep(5);

        // When
        app.pump();

        // Then
        assertThat(backend.statusPolls()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void remove_KillsAndUntracks() {
        // Given
        Work work = root.attach("trainer", new Work(arguments -> null));
        app.register(work).start();

        // When
        app.remove(work);

        // Then
        assertThat(work.status()).isEqualTo(WorkStatus.STOPPED);
        assertThat(app.work("root.trainer")).isEmpty();
        assertThat(app.stateSynchronizer().isTracked(WorkName.of("root.trainer"))).isFalse();
    }

    @Test
    void register_AfterRemove_ContinuesDeltaSequence() {
        // Given
        WorkName name = WorkName.of("root.trainer");
        Work work = root.attach("trainer", new Work(arguments -> null));
        work.state().attach(app.queues().deltaQueue()::push);
        app.register(work);
        work.state().set("a", 1);
        work.state().set("b", 2);
        app.pump();
        app.remove(work);

        // When
        app.register(work);
        work.state().set("c", 3);
        app.pump();

        // Then
        assertThat(app.stateSynchronizer().valueAt(name, "c")).isEqualTo(3);
        assertThat(app.stateSynchronizer().bufferedDeltas(name)).isZero();
        assertThat(app.stateSynchronizer().lastAppliedDelta(name)).isEqualTo(3);
    }

    @Test
    void shutdown_StopsEverythingOnce() {
        // Given
        Work work = root.attach("trainer", new Work(arguments -> null));
        app.register(work).start();

        // When
        app.shutdown();
        app.shutdown();

        // Then
        assertThat(app.isShutdown()).isTrue();
        assertThat(backend.stopAllCalls()).isEqualTo(1);
        assertThat(work.status()).isEqualTo(WorkStatus.STOPPED);
        assertThat(fabric.queueCount()).isZero();
        assertThatThrownBy(() -> app.register(new Work(arguments -> null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }
}
