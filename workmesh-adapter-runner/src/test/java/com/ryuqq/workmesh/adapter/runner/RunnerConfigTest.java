package com.ryuqq.workmesh.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunnerConfig 유닛 테스트.
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
class RunnerConfigTest {

    @Test
    void 기본_생성자는_기본값을_사용함() {
        // when
        RunnerConfig config = new RunnerConfig();

        // then
        assertThat(config.pollIntervalMs()).isEqualTo(10);
        assertThat(config.threadNamePrefix()).isEqualTo("workmesh-");
        assertThat(config.stopJoinTimeoutMs()).isEqualTo(2000);
        assertThat(config.coordinatorIntervalMs()).isEqualTo(10);
    }

    @Test
    void with메서드는_한_필드만_바꾼_사본을_만듦() {
        // given
        RunnerConfig config = new RunnerConfig();

        // when
        RunnerConfig changed = config.withStopJoinTimeoutMs(0).withThreadNamePrefix("ctx-");

        // then
        assertThat(changed.stopJoinTimeoutMs()).isZero();
        assertThat(changed.threadNamePrefix()).isEqualTo("ctx-");
        assertThat(changed.pollIntervalMs()).isEqualTo(config.pollIntervalMs());
    }

    @Test
    void 잘못된_값은_거부함() {
        RunnerConfig config = new RunnerConfig();

        assertThatThrownBy(() -> config.withPollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollIntervalMs must be positive");
        assertThatThrownBy(() -> config.withThreadNamePrefix(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withStopJoinTimeoutMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withCoordinatorIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
