package com.cred.freestyle.warranty.infrastructure.ratelimit;

/**
 * Result of rate limit check.
 *
 * @author Warranty Platform Team
 */
public class RateLimitResult {

    private final boolean allowed;
    private final int limit;
    private final int remaining;
    private final long retryAfterSeconds;
    private final String reason;

    private RateLimitResult(boolean allowed, int limit, int remaining, long retryAfterSeconds, String reason) {
        this.allowed = allowed;
        this.limit = limit;
        this.remaining = remaining;
        this.retryAfterSeconds = retryAfterSeconds;
        this.reason = reason;
    }

    public static RateLimitResult allowed(int limit, int remaining) {
        return new RateLimitResult(true, limit, remaining, 0, null);
    }

    public static RateLimitResult rejected(int limit, long retryAfterSeconds, String reason) {
        return new RateLimitResult(false, limit, 0, retryAfterSeconds, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getLimit() {
        return limit;
    }

    public int getRemaining() {
        return remaining;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String getReason() {
        return reason;
    }
}
