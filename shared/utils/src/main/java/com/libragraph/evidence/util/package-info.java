/**
 * Shared utilities for all Evidence Pack modules.
 *
 * <p>Contains {@link com.libragraph.evidence.util.ContentHash} (SHA-1) with the chunked
 * {@link com.libragraph.evidence.util.FileDigests file digests}, name sanitation, and the
 * EDRM date and XML text helpers. No framework dependencies, only Commons Codec.
 */
package com.libragraph.evidence.util;
