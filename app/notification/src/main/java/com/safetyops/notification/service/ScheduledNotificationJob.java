/*
 * Where: Notification service layer
 * What: Body of one cron tick: write back run times, resolve recipients, dispatch the batch
 * Why: Kept apart from the registry so a tick can be exercised without timers
 */
package com.safetyops.notification.service;

import com.safetyops.notification.config.NotificationScheduleProperties;
import com.safetyops.notification.model.BatchResult;
import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.Recipient;
import com.safetyops.notification.model.ScheduleDefinition;
import com.safetyops.notification.repository.ScheduleDefinitionRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledNotificationJob {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledNotificationJob.class);

  private final ScheduleDefinitionRepository scheduleRepository;
  private final RecipientResolvers recipientResolvers;
  private final NotificationDispatchService dispatchService;
  private final NotificationScheduleProperties properties;
  private final Clock clock;

  public BatchResult execute(ScheduleDefinition definition, CronExpression cron) {
    final ZoneId zone = properties.zone();
    final ZonedDateTime now = Instant.now(clock).atZone(zone);
    writeBackRunTimes(definition, now, cron);

    final NotificationKind kind = definition.kind();
    if (!kind.schedulable()) {
      logger.info(
          "schedule tick ignored; kind is event-driven id={} kind={}", definition.id(), kind);
      return BatchResult.EMPTY;
    }
    final Optional<RecipientResolver> resolver = recipientResolvers.find(kind);
    if (resolver.isEmpty()) {
      logger.warn(
          "schedule tick ignored; no recipient resolver id={} kind={}", definition.id(), kind);
      return BatchResult.EMPTY;
    }

    final List<Recipient> recipients = resolver.get().resolve(now);
    final BatchResult result = dispatchService.sendBatch(kind, recipients);
    logger.info(
        "schedule tick finished id={} kind={} recipients={} sent={} failed={} skipped={}",
        definition.id(),
        kind,
        recipients.size(),
        result.sent(),
        result.failed(),
        result.skipped());
    return result;
  }

  private void writeBackRunTimes(
      ScheduleDefinition definition, ZonedDateTime now, CronExpression cron) {
    final ZonedDateTime next = cron.next(now);
    try {
      scheduleRepository.updateRunTimes(
          definition.id(), now.toInstant(), next == null ? null : next.toInstant());
    } catch (DataAccessException ex) {
      // bookkeeping only; the tick still dispatches
      logger.warn("schedule run time write-back failed id={}", definition.id(), ex);
    }
  }
}
