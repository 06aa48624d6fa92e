package com.libragraph.evidence.core.field;

import com.libragraph.evidence.types.FieldType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class FieldFactoryTest {

    @Test
    void shouldInferTypeFromValue() {
        assertThat(FieldFactory.infer("a", true).type()).isEqualTo(FieldType.BOOLEAN);
        assertThat(FieldFactory.infer("a", 12).type()).isEqualTo(FieldType.LONG_INTEGER);
        assertThat(FieldFactory.infer("a", 12L).type()).isEqualTo(FieldType.LONG_INTEGER);
        assertThat(FieldFactory.infer("a", 1.5d).type()).isEqualTo(FieldType.DECIMAL);
        assertThat(FieldFactory.infer("a", new BigDecimal("1.5")).type()).isEqualTo(FieldType.DECIMAL);
        assertThat(FieldFactory.infer("a", Instant.EPOCH).type()).isEqualTo(FieldType.DATE_TIME);
        assertThat(FieldFactory.infer("a", "text").type()).isEqualTo(FieldType.TEXT);
        assertThat(FieldFactory.infer("a", null).type()).isEqualTo(FieldType.TEXT);
    }

    @Test
    void shouldStoreInferredIntegersAsLong() {
        assertThat(FieldFactory.infer("count", 3).value()).isEqualTo(3L);
    }
}
