package com.libragraph.evidence.core.config;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EvidenceConfigTest {

    @Test
    void shouldLoadBundledDefaults() {
        EvidenceConfig config = EvidenceConfig.load();

        assertThat(config.custodian()).isEqualTo("Unknown");
        assertThat(config.encoding()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(config.hashBufferSize()).isEqualTo(65536);
        assertThat(config.defaultRowNameField()).isEqualTo("Name");
        assertThat(config.itemDateFormat()).isEqualTo("yyyy-MM-dd HH:mm:ss.SSSSSS");
        assertThat(config.image().caseNumber()).isEqualTo("01");
        assertThat(config.image().examinerName()).isEqualTo("Unknown");
    }

    @Test
    void shouldApplyOverrides() {
        EvidenceConfig config = EvidenceConfig.load(Map.of(
                "evidence.custodian", "J. Smith",
                "evidence.hash-buffer-size", "1024",
                "evidence.image.case-number", "2024-117"));

        assertThat(config.custodian()).isEqualTo("J. Smith");
        assertThat(config.hashBufferSize()).isEqualTo(1024);
        assertThat(config.image().caseNumber()).isEqualTo("2024-117");
        assertThat(config.image().evidenceNumber()).isEqualTo("01");
    }

    @Test
    void shouldRejectNonPositiveBufferSize() {
        assertThatThrownBy(() -> EvidenceConfig.load(Map.of("evidence.hash-buffer-size", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hashBufferSize");
    }
}
