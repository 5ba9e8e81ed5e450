package io.hivememory.core;

/**
 * Raised by lookups that require a value when it is absent or expired.
 */
public class NotFoundException extends MemoryException {

    public NotFoundException(String message) {
        super(message);
    }
}
