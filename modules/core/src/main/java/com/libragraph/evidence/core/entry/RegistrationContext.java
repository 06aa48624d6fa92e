package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.config.EvidenceConfig;

import java.util.Objects;

/**
 * Handed to an entry when a builder registers it.
 *
 * @param id       identifier assigned to the entry
 * @param sequence registration sequence number within the builder
 * @param config   settings of the registering builder
 */
public record RegistrationContext(String id, long sequence, EvidenceConfig config) {

    public RegistrationContext {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
    }
}
