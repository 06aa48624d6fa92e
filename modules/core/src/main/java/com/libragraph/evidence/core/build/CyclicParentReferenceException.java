package com.libragraph.evidence.core.build;

import java.util.List;

/**
 * Following parent references from an entry leads back to that entry.
 */
public class CyclicParentReferenceException extends RuntimeException {

    private final List<String> cycle;

    public CyclicParentReferenceException(List<String> cycle) {
        super("Parent references form a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Ids on the cycle, starting and ending with the same id.
     */
    public List<String> cycle() {
        return cycle;
    }
}
