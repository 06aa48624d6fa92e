/**
 * Builds evidence containers: entries are registered with an
 * {@link com.libragraph.evidence.core.build.EvidenceBuilder}, arranged into a tree, described
 * in an EDRM XML manifest and packed with their natives into a single ZIP file.
 */
package com.libragraph.evidence.core;
