package com.ryuqq.workmesh.core.spi;

import com.ryuqq.workmesh.core.contract.CallRequest;
import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.contract.WorkSignal;
import com.ryuqq.workmesh.core.model.Payload;
import com.ryuqq.workmesh.core.model.WorkName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueueRole 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class QueueRoleTest {

    private static final WorkName NAME = WorkName.of("root.trainer");

    @Test
    void queueName_PerWorkRole_AppendsWorkName() {
        assertEquals("q1_caller_root.trainer", QueueRole.CALLER.queueName("q1", "root.trainer"));
        assertEquals("q1_orchestrator_copy_response_root.trainer",
            QueueRole.ORCHESTRATOR_COPY_RESPONSE.queueName("q1", "root.trainer"));
    }

    @Test
    void queueName_AppWideRole_IgnoresWorkName() {
        assertEquals("q1_delta", QueueRole.DELTA.queueName("q1", null));
        assertEquals("q1_api_state_publish", QueueRole.API_STATE_PUBLISH.queueName("q1", "ignored"));
    }

    @Test
    void queueName_PerWorkRoleWithoutWorkName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> QueueRole.CALLER.queueName("q1", null));
    }

    @Test
    void queueName_BlankQueueId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> QueueRole.DELTA.queueName(" ", null));
    }

    @Test
    void accepts_MatchingMessageType_ReturnsTrue() {
        // Given
        CallRequest request = CallRequest.now(NAME, 1, Payload.empty());
        Delta delta = Delta.set(NAME, 1, List.of("a"), 1);

        // Then
        assertTrue(QueueRole.CALLER.accepts(request));
        assertFalse(QueueRole.CALLER.accepts(delta));
        assertTrue(QueueRole.API_DELTA.accepts(delta));
        assertTrue(QueueRole.ERROR.accepts(WorkSignal.ready(NAME, 1)));
    }

    @Test
    void isPerWork_OnlyWorkScopedRoles() {
        assertTrue(QueueRole.CALLER.isPerWork());
        assertTrue(QueueRole.ORCHESTRATOR_REQUEST.isPerWork());
        assertFalse(QueueRole.READINESS.isPerWork());
        assertFalse(QueueRole.API_DELTA.isPerWork());
    }
}
