package com.libragraph.evidence.core.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for building load files and containers.
 *
 * <p>Read from MicroProfile Config under the {@code evidence.} prefix: system properties,
 * environment variables and {@code META-INF/microprofile-config.properties}.
 *
 * @param custodian           custodian every entry's location is assigned to
 * @param encoding            encoding of the manifest and of generated text natives
 * @param hashBufferSize      chunk size used when digesting native files
 * @param defaultRowNameField field whose value names a mapping or CSV row, when present
 * @param itemDateFormat      default pattern for parsing a mapping's item date field
 * @param maxNameLength       maximum length of an effective (sanitized) name
 * @param csvEncoding         encoding of CSV sources
 * @param image               properties written to the container's image metadata file
 */
public record EvidenceConfig(
        String custodian,
        Charset encoding,
        int hashBufferSize,
        String defaultRowNameField,
        String itemDateFormat,
        int maxNameLength,
        Charset csvEncoding,
        ImageMetadata image
) {
    public static final String PREFIX = "evidence.";

    private static final EvidenceConfig DEFAULTS = new EvidenceConfig(
            "Unknown",
            StandardCharsets.UTF_8,
            65536,
            "Name",
            "yyyy-MM-dd HH:mm:ss.SSSSSS",
            255,
            StandardCharsets.UTF_8,
            new ImageMetadata("01", "01", "Unknown", "Evidence Pack", "0.1.0")
    );

    public EvidenceConfig {
        Objects.requireNonNull(custodian, "custodian cannot be null");
        Objects.requireNonNull(encoding, "encoding cannot be null");
        Objects.requireNonNull(itemDateFormat, "itemDateFormat cannot be null");
        Objects.requireNonNull(csvEncoding, "csvEncoding cannot be null");
        Objects.requireNonNull(image, "image cannot be null");
        if (hashBufferSize <= 0) {
            throw new IllegalArgumentException("hashBufferSize must be > 0, got: " + hashBufferSize);
        }
        if (maxNameLength <= 0) {
            throw new IllegalArgumentException("maxNameLength must be > 0, got: " + maxNameLength);
        }
    }

    /**
     * Properties of the {@code image_metadata.xml} file inside a container.
     */
    public record ImageMetadata(
            String caseNumber,
            String evidenceNumber,
            String examinerName,
            String softwareName,
            String softwareVersion
    ) {
    }

    /**
     * Built-in defaults, without consulting any config source.
     */
    public static EvidenceConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads from the default MicroProfile Config sources.
     */
    public static EvidenceConfig load() {
        return load(Map.of());
    }

    /**
     * Loads from the default sources, with {@code overrides} taking precedence.
     * Keys are full property names, e.g. {@code evidence.custodian}.
     */
    public static EvidenceConfig load(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "evidence-overrides", 500))
                .build();
        return from(config);
    }

    public static EvidenceConfig from(Config config) {
        return new EvidenceConfig(
                string(config, "custodian", DEFAULTS.custodian()),
                Charset.forName(string(config, "encoding", DEFAULTS.encoding().name())),
                integer(config, "hash-buffer-size", DEFAULTS.hashBufferSize()),
                string(config, "default-rowname-field", DEFAULTS.defaultRowNameField()),
                string(config, "item-date-format", DEFAULTS.itemDateFormat()),
                integer(config, "max-name-length", DEFAULTS.maxNameLength()),
                Charset.forName(string(config, "csv.encoding", DEFAULTS.csvEncoding().name())),
                new ImageMetadata(
                        string(config, "image.case-number", DEFAULTS.image().caseNumber()),
                        string(config, "image.evidence-number", DEFAULTS.image().evidenceNumber()),
                        string(config, "image.examiner-name", DEFAULTS.image().examinerName()),
                        string(config, "image.software-name", DEFAULTS.image().softwareName()),
                        string(config, "image.software-version", DEFAULTS.image().softwareVersion())
                )
        );
    }

    private static String string(Config config, String key, String defaultValue) {
        return config.getOptionalValue(PREFIX + key, String.class).orElse(defaultValue);
    }

    private static int integer(Config config, String key, int defaultValue) {
        return config.getOptionalValue(PREFIX + key, Integer.class).orElse(defaultValue);
    }
}
