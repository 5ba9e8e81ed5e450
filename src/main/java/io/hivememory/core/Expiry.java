package io.hivememory.core;

/**
 * TTL arithmetic. An {@code expiresAt} of 0 means "never expires"; rows written
 * by older schema versions may carry NULL for the same meaning.
 */
public final class Expiry {

    public static final long NEVER = 0L;

    /** SQL predicate for rows that are still live; binds one parameter (now). */
    public static final String LIVE = "(COALESCE(expires_at, 0) = 0 OR expires_at > ?)";

    /** SQL predicate for rows due for removal; binds one parameter (now). */
    public static final String DUE = "(COALESCE(expires_at, 0) != 0 AND expires_at <= ?)";

    private Expiry() {
    }

    public static long expiresAt(long nowMillis, long ttlSeconds) {
        if (ttlSeconds < 0) {
            throw new ValidationException("ttlSeconds must be >= 0, got " + ttlSeconds);
        }
        return ttlSeconds == 0 ? NEVER : nowMillis + ttlSeconds * 1000L;
    }

    public static boolean isExpired(long expiresAt, long nowMillis) {
        return expiresAt != NEVER && expiresAt <= nowMillis;
    }
}
