package com.cred.freestyle.warranty.infrastructure.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the registration attempt limiter on the customer registration endpoint.
 *
 * @author Warranty Platform Team
 */
@Configuration
public class RateLimitConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;

    @Value("${warranty.rate-limit.registration.enabled:true}")
    private boolean rateLimitingEnabled;

    public RateLimitConfig(RateLimitInterceptor rateLimitInterceptor) {
        this.rateLimitInterceptor = rateLimitInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (rateLimitingEnabled) {
            registry.addInterceptor(rateLimitInterceptor)
                    .addPathPatterns("/api/v1/users/*/serials");
        }
    }
}
