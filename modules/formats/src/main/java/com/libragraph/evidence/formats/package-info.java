/**
 * Readers and writers for the formats the evidence builder consumes and produces.
 *
 * <p>The {@code api} package declares the collaborator contracts (CSV table reader,
 * JSON document reader, file stat). Each has one default implementation here:
 * Super CSV, Jackson, Apache Tika for MIME detection, and Commons Compress for the ZIP
 * container.
 */
package com.libragraph.evidence.formats;
