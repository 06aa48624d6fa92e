/**
 * Pure Java value types shared across all Evidence Pack modules.
 *
 * <p>Holds the entry variant tag and the EDRM field data types.
 * This module has no dependencies.
 */
package com.libragraph.evidence.types;
