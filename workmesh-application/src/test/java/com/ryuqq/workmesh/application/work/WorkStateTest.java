package com.ryuqq.workmesh.application.work;

import com.ryuqq.workmesh.core.contract.Delta;
import com.ryuqq.workmesh.core.model.WorkName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkState 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class WorkStateTest {

    private static final WorkName NAME = WorkName.of("root.trainer");

    private List<Delta> emitted;
    private WorkState state;

    @BeforeEach
    void setUp() {
        emitted = new ArrayList<>();
        state = new WorkState(() -> NAME);
    }

    @Test
    void set_WithoutSink_OnlyChangesLocalValue() {
        // When
        state.set("metrics.loss", 0.42);

        // Then
        assertThat(state.get("metrics.loss")).isEqualTo(0.42);
        assertThat(state.lastDeltaId()).isZero();
    }

    @Test
    void set_WithSink_EmitsMonotonicDeltas() {
        // Given
        state.attach(emitted::add);

        // When
        state.set("metrics.loss", 0.42);
        state.set("epoch", 3);
        state.remove("metrics.loss");

        // Then
        assertThat(emitted).extracting(Delta::deltaId).containsExactly(1L, 2L, 3L);
        assertThat(emitted.get(0).path()).containsExactly("metrics", "loss");
        assertThat(emitted.get(2).operation()).isEqualTo(Delta.Operation.REMOVE);
        assertThat(state.snapshot()).isEqualTo(Map.of("metrics", Map.of(), "epoch", 3));
    }

    @Test
    void set_WithoutName_EmitsNothing() {
        // Given
        WorkState unnamed = new WorkState(() -> null);
        unnamed.attach(emitted::add);

        // When
        unnamed.set("a", 1);

        // Then
        assertThat(emitted).isEmpty();
    }

    @Test
    void set_OverScalar_ReplacesWithMap() {
        // Given
        state.set("metrics", 1);

        // When
        state.set("metrics.loss", 0.1);

        // Then
        assertThat(state.get("metrics")).isEqualTo(Map.of("loss", 0.1));
    }

    @Test
    void remove_UnderImmutableMapValue_RemovesLocallyOnly() {
        // Given
        Map<String, Object> config = Map.of("lr", 0.1, "epochs", 3);
        state.set("config", config);

        // When
        state.remove("config.epochs");

        // Then
        assertThat(state.get("config")).isEqualTo(Map.of("lr", 0.1));
        assertThat(config).containsOnlyKeys("lr", "epochs");
    }

    @Test
    void remove_MissingPath_StillEmitsDelta() {
        // Given
        state.attach(emitted::add);

        // When
        state.remove("missing.leaf");

        // Then
        assertThat(emitted).hasSize(1);
        assertThat(state.get("missing.leaf")).isNull();
    }

    @Test
    void snapshot_IsDeepAndReadOnly() {
        // Given
        state.set("a.b", 1);
        Map<String, Object> snapshot = state.snapshot();

        // When
        state.set("a.b", 2);

        // Then
        assertThat(snapshot).isEqualTo(Map.of("a", Map.of("b", 1)));
        assertThatThrownBy(() -> snapshot.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void detach_OtherSink_KeepsCurrent() {
        // Given
        DeltaSink current = emitted::add;
        state.attach(current);

        // When
        boolean detached = state.detach(delta -> { });

        // Then
        assertThat(detached).isFalse();
        state.set("a", 1);
        assertThat(emitted).hasSize(1);
        assertThat(state.detach(current)).isTrue();
    }

    @Test
    void set_EmptySegment_ThrowsException() {
        assertThatThrownBy(() -> state.set("a..b", 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> state.set(" ", 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
