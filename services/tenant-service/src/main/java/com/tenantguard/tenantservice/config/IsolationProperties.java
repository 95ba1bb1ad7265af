package com.tenantguard.tenantservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scheduled isolation check, bound from {@code tenantguard.isolation.*}.
 *
 * @param enabled whether the periodic check runs
 * @param interval delay between the end of one run and the start of the next
 */
@ConfigurationProperties(prefix = "tenantguard.isolation")
public record IsolationProperties(boolean enabled, Duration interval) {

    public IsolationProperties {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            interval = Duration.ofHours(1);
        }
    }
}
