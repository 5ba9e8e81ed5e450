package io.hivememory.acl;

import io.hivememory.core.ValidationException;

public enum Permission {
    READ,
    WRITE,
    DELETE,
    SHARE;

    public static Permission fromTag(String tag) {
        try {
            return Permission.valueOf(tag.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("Unknown permission: " + tag);
        }
    }
}
