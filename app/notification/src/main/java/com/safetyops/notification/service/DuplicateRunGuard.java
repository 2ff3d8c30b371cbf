/*
 * Where: Notification service layer
 * What: In-process mutual exclusion keyed by job name
 * Why: A slow tick must not overlap the next firing of the same schedule
 */
package com.safetyops.notification.service;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Admits at most one handler per job name at a time within this process. Different job names never
 * block each other, and there is no coordination across processes.
 */
@Component
@RequiredArgsConstructor
public class DuplicateRunGuard {

  private static final Logger logger = LoggerFactory.getLogger(DuplicateRunGuard.class);
  static final String MDC_JOB_NAME = "job_name";

  private final Set<String> running = ConcurrentHashMap.newKeySet();
  private final NotificationMetrics metrics;

  /**
   * Runs {@code handler} unless a handler for {@code jobName} is already running.
   *
   * <p>Exceptions thrown by the handler are logged and swallowed. The name is always released.
   *
   * @return {@code true} if the handler was invoked, {@code false} if the call was skipped
   */
  public boolean runExclusive(String jobName, Runnable handler) {
    if (!running.add(jobName)) {
      logger.info("job skipped; already running job={}", jobName);
      metrics.recordGuardSkipped(jobName);
      return false;
    }
    MDC.put(MDC_JOB_NAME, jobName);
    try {
      handler.run();
    } catch (RuntimeException ex) {
      logger.error("job failed job={}", jobName, ex);
    } finally {
      running.remove(jobName);
      MDC.remove(MDC_JOB_NAME);
    }
    return true;
  }

  public boolean isRunning(String jobName) {
    return running.contains(jobName);
  }

  public Set<String> runningJobs() {
    return new TreeSet<>(running);
  }
}
