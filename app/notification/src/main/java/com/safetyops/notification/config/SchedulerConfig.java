/*
 * Where: Notification scheduler configuration
 * What: Provides the cron timer pool and the bounded batch dispatch executor
 * Why: Timer callbacks and per-recipient sends must not share one unbounded pool
 */
package com.safetyops.notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  public static final String SCHEDULE_POOL = "notificationSchedulePool";
  public static final String DISPATCH_EXECUTOR = "notificationDispatchExecutor";

  @Bean(name = SCHEDULE_POOL)
  public ThreadPoolTaskScheduler notificationSchedulePool(NotificationScheduleProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(Math.max(1, properties.poolSize()));
    scheduler.setThreadNamePrefix("notification-cron-");
    // in-flight handlers finish on shutdown; they are never interrupted
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    return scheduler;
  }

  @Bean(name = DISPATCH_EXECUTOR)
  public ThreadPoolTaskExecutor notificationDispatchExecutor(
      NotificationDispatchProperties properties) {
    final int concurrency = Math.max(1, properties.batchConcurrency());
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(concurrency);
    executor.setMaxPoolSize(concurrency);
    executor.setThreadNamePrefix("notification-dispatch-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
