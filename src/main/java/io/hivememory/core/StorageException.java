package io.hivememory.core;

/**
 * Underlying database I/O failure. Surfaced as-is, never retried by the engine.
 */
public class StorageException extends MemoryException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
