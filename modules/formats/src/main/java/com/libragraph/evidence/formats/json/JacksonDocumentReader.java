package com.libragraph.evidence.formats.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.evidence.formats.api.JsonDocumentReader;
import com.libragraph.evidence.formats.api.MalformedSourceException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link JsonDocumentReader} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Floating point numbers are kept as {@code BigDecimal} so no precision is lost on
 * their way into decimal fields. Content after the first value is rejected.
 */
public class JacksonDocumentReader implements JsonDocumentReader {

    private final ObjectMapper objectMapper;
    private final Charset charset;

    public JacksonDocumentReader() {
        this(new ObjectMapper()
                        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS),
                StandardCharsets.UTF_8);
    }

    public JacksonDocumentReader(ObjectMapper objectMapper, Charset charset) {
        this.objectMapper = objectMapper;
        this.charset = charset;
    }

    @Override
    public JsonNode read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
            reader.mark(1);
            if (reader.read() != 0xFEFF) {
                reader.reset();
            }
            JsonNode root = objectMapper.readTree(reader);
            if (root == null || root.isMissingNode()) {
                throw new MalformedSourceException(file, "document is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedSourceException(file, e.getOriginalMessage(), e);
        }
    }
}
