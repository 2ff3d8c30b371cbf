/*
 * Where: Notification service layer
 * What: Owns the live cron jobs created from persisted schedule definitions
 * Why: Schedules are edited at runtime; each edit is followed by reload or stop on this registry
 */
package com.safetyops.notification.service;

import com.safetyops.notification.config.NotificationScheduleProperties;
import com.safetyops.notification.config.SchedulerConfig;
import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.ScheduleDefinition;
import com.safetyops.notification.repository.ScheduleDefinitionRepository;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

/**
 * Maps schedule ids to registered cron jobs.
 *
 * <p>Every firing is wrapped in {@link DuplicateRunGuard} under the job name {@code
 * schedule:<id>}, so a tick that outlives its interval makes the next firing skip rather than
 * overlap. A definition with an unknown kind or a malformed cron expression is logged and
 * skipped; it never prevents others from loading. Stopping a job only cancels future firings; an
 * in-flight tick runs to completion.
 */
@Service
public class ScheduleRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleRegistry.class);
  private static final String JOB_NAME_PREFIX = "schedule:";

  private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
  private final TaskScheduler taskScheduler;
  private final ScheduleDefinitionRepository scheduleRepository;
  private final ScheduledNotificationJob job;
  private final DuplicateRunGuard guard;
  private final NotificationScheduleProperties properties;
  private final NotificationMetrics metrics;

  public ScheduleRegistry(
      @Qualifier(SchedulerConfig.SCHEDULE_POOL) TaskScheduler taskScheduler,
      ScheduleDefinitionRepository scheduleRepository,
      ScheduledNotificationJob job,
      DuplicateRunGuard guard,
      NotificationScheduleProperties properties,
      NotificationMetrics metrics) {
    this.taskScheduler = taskScheduler;
    this.scheduleRepository = scheduleRepository;
    this.job = job;
    this.guard = guard;
    this.properties = properties;
    this.metrics = metrics;
  }

  /**
   * Registers a job for every enabled definition. Partial success is normal.
   *
   * @return number of jobs registered by this call
   */
  public synchronized int loadAll() {
    final List<ScheduleDefinition> definitions = scheduleRepository.findAllEnabled();
    int registered = 0;
    for (ScheduleDefinition definition : definitions) {
      if (register(definition)) {
        registered++;
      }
    }
    logger.info(
        "schedules loaded registered={} definitions={} active={}",
        registered,
        definitions.size(),
        jobs.size());
    return registered;
  }

  /**
   * Stops any job for {@code id}, re-reads the definition and registers a fresh job if it is
   * enabled.
   *
   * @return whether a job is registered for {@code id} afterwards
   */
  public synchronized boolean reload(String id) {
    stop(id);
    final Optional<ScheduleDefinition> definition = scheduleRepository.findById(id);
    if (definition.isEmpty()) {
      logger.info("schedule reload found no definition id={}", id);
      return false;
    }
    if (!definition.get().enabled()) {
      logger.info("schedule reload left job paused id={}", id);
      return false;
    }
    return register(definition.get());
  }

  /**
   * Cancels future firings for {@code id}. No-op when nothing is registered.
   *
   * @return whether a job was registered before the call
   */
  public synchronized boolean stop(String id) {
    final ScheduledFuture<?> future = jobs.remove(id);
    if (future == null) {
      return false;
    }
    future.cancel(false);
    metrics.updateActiveSchedules(jobs.size());
    logger.info("schedule stopped id={}", id);
    return true;
  }

  @PreDestroy
  public synchronized void stopAll() {
    for (String id : Set.copyOf(jobs.keySet())) {
      stop(id);
    }
  }

  public boolean isRegistered(String id) {
    return jobs.containsKey(id);
  }

  public Set<String> activeIds() {
    return new TreeSet<>(jobs.keySet());
  }

  static String jobName(String scheduleId) {
    return JOB_NAME_PREFIX + scheduleId;
  }

  private boolean register(ScheduleDefinition definition) {
    final NotificationKind kind;
    final CronExpression cron;
    final CronTrigger trigger;
    try {
      kind = definition.kind();
      final String expression = CronSchedules.toSpringExpression(definition.cronExpression());
      cron = CronExpression.parse(expression);
      trigger = new CronTrigger(expression, properties.zone());
    } catch (IllegalArgumentException ex) {
      logger.warn(
          "schedule skipped; invalid definition id={} kind={} cron={} reason={}",
          definition.id(),
          definition.notificationKind(),
          definition.cronExpression(),
          ex.getMessage());
      return false;
    }

    // a repeated loadAll must not leave two timers for one id
    stop(definition.id());
    final String jobName = jobName(definition.id());
    final ScheduledFuture<?> future =
        taskScheduler.schedule(
            () -> guard.runExclusive(jobName, () -> job.execute(definition, cron)), trigger);
    if (future == null) {
      logger.warn(
          "schedule skipped; cron never fires id={} cron={}",
          definition.id(),
          definition.cronExpression());
      return false;
    }
    jobs.put(definition.id(), future);
    metrics.updateActiveSchedules(jobs.size());
    logger.info(
        "schedule registered id={} kind={} cron={} zone={}",
        definition.id(),
        kind,
        definition.cronExpression(),
        properties.zone());
    return true;
  }
}
