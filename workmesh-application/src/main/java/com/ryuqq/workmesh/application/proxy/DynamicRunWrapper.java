package com.ryuqq.workmesh.application.proxy;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkRun;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.error.ConfigurationException;
import com.ryuqq.workmesh.core.model.WorkName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 첫 호출을 가로채 원격 실행을 준비하는 진입 메서드.
 *
 * <p><strong>첫 호출 시 순서:</strong></p>
 * <ol>
 *   <li>이름 확인 (없으면 {@link ConfigurationException})</li>
 *   <li>App에 이름으로 바인딩하고 큐 등록</li>
 *   <li>WorkManager로 시작 (Backend createWork, readiness 대기)</li>
 *   <li>{@link ProxyWorkRun}을 진입 메서드로 설치</li>
 *   <li>호출 전달</li>
 * </ol>
 *
 * <p>시작에 실패하면 설치하지 않으므로, 재시작 후 다음 호출에서 다시 시도합니다.</p>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class DynamicRunWrapper implements WrappedRun {

    private static final Logger log = LoggerFactory.getLogger(DynamicRunWrapper.class);

    private final WorkApp app;
    private final Work work;
    private final WorkRun original;
    private ProxyWorkRun installed;

    DynamicRunWrapper(WorkApp app, Work work, WorkRun original) {
        this.app = app;
        this.work = work;
        this.original = original;
    }

    @Override
    public Object run(CallArguments arguments) {
        return install().run(arguments);
    }

    @Override
    public CallHandle submit(CallArguments arguments) {
        return install().submit(arguments);
    }

    @Override
    public WorkRun unwrap() {
        return original;
    }

    private synchronized ProxyWorkRun install() {
        if (installed != null) {
            return installed;
        }
        WorkName name = work.name().orElseThrow(() -> new ConfigurationException(
            "Failed to create execution context for " + work.getClass().getSimpleName()
                + ": the work has no name. It was never attached to a parent WorkFlow; "
                + "attach it before calling run()."));

        app.bind(work);
        app.queues().register(name);
        app.manager(work).start();

        ProxyWorkRun proxy = new ProxyWorkRun(app, work, original);
        work.replaceEntryPoint(proxy);
        installed = proxy;
        log.debug("Run proxy installed for work '{}'", name);
        return proxy;
    }
}
