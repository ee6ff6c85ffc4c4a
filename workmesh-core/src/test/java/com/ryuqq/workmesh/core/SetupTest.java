package com.ryuqq.workmesh.core;

import com.ryuqq.workmesh.core.codec.PayloadCodec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 프로젝트 세팅 검증 테스트
 */
class SetupTest {

    @Test
    void jsonCodecShouldBeOnClasspath() {
        // Given
        PayloadCodec codec = new PayloadCodec();

        // When
        Object decoded = codec.decodeValue(codec.encodeValue(Map.of("loss", 0.42)));

        // Then
        assertThat(decoded).isEqualTo(Map.of("loss", 0.42));
    }

    @Test
    void javaVersionShouldBeAtLeast17() {
        // Given
        int feature = Runtime.version().feature();

        // Then
        assertThat(feature).isGreaterThanOrEqualTo(17);
    }
}
