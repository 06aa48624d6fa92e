package com.libragraph.evidence.formats.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.evidence.formats.api.MalformedSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class JacksonDocumentReaderTest {

    private final JacksonDocumentReader reader = new JacksonDocumentReader();

    @TempDir
    Path tempDir;

    @Test
    void shouldParseObjectsPreservingOrder() throws Exception {
        Path json = tempDir.resolve("object.json");
        Files.writeString(json, "{\"z\": 1, \"a\": [true, null], \"m\": {\"k\": \"v\"}}");

        JsonNode root = reader.read(json);

        assertThat(root.isObject()).isTrue();
        assertThat(root.fieldNames()).toIterable().containsExactly("z", "a", "m");
        assertThat(root.get("a").isArray()).isTrue();
    }

    @Test
    void shouldParseScalarDocuments() throws Exception {
        Path json = tempDir.resolve("value.json");
        Files.writeString(json, "3.25");

        JsonNode root = reader.read(json);

        assertThat(root.isValueNode()).isTrue();
        assertThat(root.decimalValue()).isEqualByComparingTo(new BigDecimal("3.25"));
    }

    @Test
    void shouldRejectBrokenDocuments() throws Exception {
        Path json = tempDir.resolve("broken.json");
        Files.writeString(json, "{\"a\": ");

        assertThatThrownBy(() -> reader.read(json))
                .isInstanceOf(MalformedSourceException.class)
                .satisfies(e -> assertThat(((MalformedSourceException) e).source()).isEqualTo(json));

        Path trailing = tempDir.resolve("trailing.json");
        Files.writeString(trailing, "{\"a\": 1} this is not json");

        assertThatThrownBy(() -> reader.read(trailing))
                .isInstanceOf(MalformedSourceException.class);
    }

    @Test
    void shouldRejectEmptyDocuments() throws Exception {
        Path json = tempDir.resolve("empty.json");
        Files.writeString(json, "   ");

        assertThatThrownBy(() -> reader.read(json))
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("empty");
    }
}
