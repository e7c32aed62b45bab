package com.cred.freestyle.warranty.infrastructure.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window attempt limiter for serial registration, keyed by caller.
 *
 * Windows are held per instance in a Caffeine cache bounded to
 * {@code max-tracked-keys} entries. Entries expire one window after their
 * last attempt; the cache ticker reads the injected {@link Clock}.
 *
 * @author Warranty Platform Team
 */
@Service
public class RegistrationRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationRateLimiter.class);

    private final Clock clock;
    private final int maxAttempts;
    private final Duration window;
    private final Cache<String, AttemptWindow> windows;

    public RegistrationRateLimiter(
            Clock clock,
            @Value("${warranty.rate-limit.registration.max-attempts:10}") int maxAttempts,
            @Value("${warranty.rate-limit.registration.window:PT15M}") Duration window,
            @Value("${warranty.rate-limit.registration.max-tracked-keys:10000}") int maxTrackedKeys
    ) {
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.window = window;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .maximumSize(maxTrackedKeys)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Count one attempt for the key and decide whether it may proceed.
     *
     * @param key Caller identity (user ID or client IP)
     * @return Rate limit result
     */
    public RateLimitResult tryAcquire(String key) {
        Instant now = clock.instant();

        AttemptWindow current = windows.asMap().compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new AttemptWindow(now.plus(window), 1);
            }
            return existing.increment();
        });

        if (current.getCount() > maxAttempts) {
            long retryAfter = Math.max(1, Duration.between(now, current.getResetAt()).toSeconds());
            logger.warn("Registration attempts exceeded for {}: {} in current window", key, current.getCount());
            return RateLimitResult.rejected(maxAttempts, retryAfter,
                    "Too many registration attempts. Please try again later.");
        }
        return RateLimitResult.allowed(maxAttempts, maxAttempts - current.getCount());
    }

    /**
     * Run pending expiry and size eviction.
     */
    public void cleanUp() {
        windows.cleanUp();
    }

    /**
     * Clear the window for a key.
     *
     * @param key Caller identity
     */
    public void reset(String key) {
        windows.invalidate(key);
    }

    long trackedKeys() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private static final class AttemptWindow {

        private final Instant resetAt;
        private final int count;

        private AttemptWindow(Instant resetAt, int count) {
            this.resetAt = resetAt;
            this.count = count;
        }

        private AttemptWindow increment() {
            return new AttemptWindow(resetAt, count + 1);
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(resetAt);
        }

        private Instant getResetAt() {
            return resetAt;
        }

        private int getCount() {
            return count;
        }
    }
}
