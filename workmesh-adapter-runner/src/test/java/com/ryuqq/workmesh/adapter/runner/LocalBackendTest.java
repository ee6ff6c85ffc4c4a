package com.ryuqq.workmesh.adapter.runner;

import com.ryuqq.workmesh.adapter.inmemory.fabric.InMemoryQueueFabric;
import com.ryuqq.workmesh.application.app.AppConfig;
import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkFlow;
import com.ryuqq.workmesh.core.error.ProvisioningException;
import com.ryuqq.workmesh.core.statemachine.WorkStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LocalBackend 유닛 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class LocalBackendTest {

    private LocalBackend backend;
    private WorkApp app;
    private Work work;

    @BeforeEach
    void setUp() {
        backend = new LocalBackend(new RunnerConfig().withPollIntervalMs(5).withThreadNamePrefix("test-"));
        app = new WorkApp(new InMemoryQueueFabric(), backend, new AppConfig().withPollingIntervalMs(5));
        work = new WorkFlow("root").attach("trainer", new Work(arguments -> "done", 9000));
    }

    @AfterEach
    void tearDown() {
        app.shutdown();
    }

    @Test
    void createWork_Work마다_이름_붙은_데몬_스레드를_시작함() {
        // when
        app.register(work).start();

        // then
        LocalHandle handle = work.backendHandle(LocalHandle.class).orElseThrow();
        assertThat(handle.thread().getName()).isEqualTo("test-root.trainer");
        assertThat(handle.thread().isDaemon()).isTrue();
        assertThat(handle.isAlive()).isTrue();
        assertThat(work.status()).isEqualTo(WorkStatus.RUNNING);
    }

    @Test
    void createWork_살아있는_컨텍스트가_있으면_거부함() {
        // given
        app.register(work).start();

        // when & then
        assertThatThrownBy(() -> backend.createWork(app, work))
            .isInstanceOf(ProvisioningException.class)
            .hasMessageContaining("already running");
    }

    @Test
    void createWork_큐가_없으면_ProvisioningException() {
        // when & then
        assertThatThrownBy(() -> backend.createWork(app, work))
            .isInstanceOf(ProvisioningException.class)
            .hasMessageContaining("root.trainer");
    }

    @Test
    void stopWork_스레드가_종료될_때까지_기다림() {
        // given
        app.register(work).start();
        LocalHandle handle = work.backendHandle(LocalHandle.class).orElseThrow();

        // when
        backend.stopWork(app, work);

        // then
        assertThat(handle.thread().isAlive()).isFalse();
        assertThat(handle.runner().isFinished()).isTrue();
    }

    @Test
    void updateWorkStatuses_스레드가_사라진_RUNNING_Work는_STOPPED로_전환됨() throws InterruptedException {
        // given
        app.register(work).start();
        LocalHandle handle = work.backendHandle(LocalHandle.class).orElseThrow();
        handle.runner().stop();
        handle.thread().join(2000);

        // when
        backend.updateWorkStatuses(List.of(work));

        // then
        assertThat(work.status()).isEqualTo(WorkStatus.STOPPED);
    }

    @Test
    void updateWorkStatuses_살아있는_Work는_변경하지_않음() {
        // given
        app.register(work).start();

        // when
        backend.updateWorkStatuses(List.of(work));

        // then
        assertThat(work.status()).isEqualTo(WorkStatus.RUNNING);
    }

    @Test
    void resolveUrl_노출_포트가_있으면_localhost_주소() {
        assertThat(backend.resolveUrl(work)).contains(URI.create("http://localhost:9000"));
        assertThat(backend.resolveUrl(new Work(arguments -> null))).isEmpty();
    }
}
