package com.cred.freestyle.warranty.infrastructure.scheduler;

import com.cred.freestyle.warranty.infrastructure.ratelimit.RegistrationRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that evicts expired registration rate limit windows.
 *
 * @author Warranty Platform Team
 */
@Component
public class RateLimitPurgeScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitPurgeScheduler.class);

    private final RegistrationRateLimiter rateLimiter;

    @Value("${warranty.rate-limit.registration.enabled:true}")
    private boolean enabled;

    public RateLimitPurgeScheduler(RegistrationRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${warranty.rate-limit.registration.purge-interval-ms:300000}")
    public void purgeExpiredWindows() {
        if (!enabled) {
            return;
        }
        try {
            rateLimiter.cleanUp();
            logger.debug("Registration rate limit windows cleaned up");
        } catch (Exception e) {
            logger.error("Error cleaning up registration rate limit windows", e);
        }
    }
}
