package com.libragraph.evidence.core.pack;

/**
 * Wraps I/O failures while writing a container.
 */
public class PackagingException extends RuntimeException {

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }

    public PackagingException(String message) {
        super(message);
    }
}
