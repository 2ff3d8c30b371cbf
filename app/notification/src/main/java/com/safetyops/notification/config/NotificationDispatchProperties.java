/*
 * Where: Notification application configuration binding
 * What: Holds template defaults, batch parallelism and dedup window for dispatch
 * Why: Operational knobs are externalized instead of hard-coded in the service
 */
package com.safetyops.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.dispatch")
public record NotificationDispatchProperties(
    String baseUrl,
    String fromAddress,
    int batchConcurrency,
    Duration dedupWindow,
    int errorMessageMaxLength,
    int educationDueDays) {}
