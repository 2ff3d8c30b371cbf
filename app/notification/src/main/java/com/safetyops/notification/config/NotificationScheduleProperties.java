/*
 * Where: Notification application configuration binding
 * What: Holds the cron scheduler settings
 * Why: Pool size and evaluation zone differ between environments
 */
package com.safetyops.notification.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.schedule")
public record NotificationScheduleProperties(boolean enabled, int poolSize, ZoneId zone) {}
