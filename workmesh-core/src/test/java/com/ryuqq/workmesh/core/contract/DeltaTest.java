package com.ryuqq.workmesh.core.contract;

import com.ryuqq.workmesh.core.model.WorkName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Delta Record 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class DeltaTest {

    private static final WorkName NAME = WorkName.of("root.trainer");

    @Test
    void set_ValidValues_CreatesDelta() {
        // When
        Delta delta = Delta.set(NAME, 1, List.of("metrics", "loss"), 0.42);

        // Then
        assertEquals(Delta.Operation.SET, delta.operation());
        assertEquals(List.of("metrics", "loss"), delta.path());
        assertEquals(0.42, delta.value());
    }

    @Test
    void remove_HasNullValue() {
        Delta delta = Delta.remove(NAME, 2, List.of("metrics"));
        assertEquals(Delta.Operation.REMOVE, delta.operation());
        assertNull(delta.value());
    }

    @Test
    void constructor_NonPositiveDeltaId_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> Delta.set(NAME, 0, List.of("a"), 1));
        assertTrue(exception.getMessage().contains("deltaId must be positive"));
    }

    @Test
    void constructor_EmptyPath_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Delta.set(NAME, 1, List.of(), 1));
    }

    @Test
    void constructor_BlankSegment_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Delta.set(NAME, 1, List.of("a", " "), 1));
    }

    @Test
    void constructor_CopiesPath() {
        // Given
        List<String> path = new ArrayList<>(List.of("a"));
        Delta delta = Delta.set(NAME, 1, path, 1);

        // When
        path.add("b");

        // Then
        assertEquals(List.of("a"), delta.path());
    }
}
