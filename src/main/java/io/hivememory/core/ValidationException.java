package io.hivememory.core;

/**
 * Malformed caller input: bad TTL, unknown access level, missing scope field.
 */
public class ValidationException extends MemoryException {

    public ValidationException(String message) {
        super(message);
    }
}
