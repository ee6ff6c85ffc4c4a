package com.ryuqq.workmesh.application.proxy;

import com.ryuqq.workmesh.application.app.WorkApp;
import com.ryuqq.workmesh.application.work.Work;
import com.ryuqq.workmesh.application.work.WorkRun;

/**
 * Work의 진입 메서드를 {@link DynamicRunWrapper}로 교체.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class RunProxyInstaller {

    private RunProxyInstaller() {
    }

    /**
     * 진입 메서드 교체. 이미 {@link WrappedRun}이면 아무것도 하지 않습니다.
     *
     * @param app 소유 App
     * @param work 대상 Work
     * @return 새로 감쌌으면 true
     */
    public static boolean wrap(WorkApp app, Work work) {
        if (app == null || work == null) {
            throw new IllegalArgumentException("app and work cannot be null");
        }
        synchronized (work) {
            WorkRun current = work.entryPoint();
            if (current instanceof WrappedRun) {
                return false;
            }
            work.replaceEntryPoint(new DynamicRunWrapper(app, work, current));
            return true;
        }
    }

    /**
     * @return 진입 메서드가 이미 교체되어 있으면 true
     */
    public static boolean isWrapped(Work work) {
        return work.entryPoint() instanceof WrappedRun;
    }
}
