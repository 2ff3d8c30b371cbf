/*
 * Where: Notification service layer
 * What: Records dispatch outcomes, guard skips, ledger write failures and active schedules
 * Why: Failures in this subsystem surface only through logs, the ledger and these meters
 */
package com.safetyops.notification.service;

import com.safetyops.notification.model.NotificationKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "notification.dispatch.total";
  private static final String METRIC_GUARD_SKIPPED_TOTAL = "notification.guard.skipped.total";
  private static final String METRIC_LEDGER_WRITE_FAILURES = "notification.ledger.write.failures.total";
  private static final String METRIC_SCHEDULE_ACTIVE = "notification.schedule.active";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeSchedules = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> guardSkipCounters = new ConcurrentHashMap<>();
  private final Counter ledgerWriteFailures;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SCHEDULE_ACTIVE, activeSchedules, AtomicInteger::get)
        .description("Number of cron schedules currently registered")
        .register(meterRegistry);
    this.ledgerWriteFailures =
        Counter.builder(METRIC_LEDGER_WRITE_FAILURES)
            .description("Send ledger rows that could not be persisted")
            .register(meterRegistry);
  }

  /** {@code result} is one of sent, failed, skipped. */
  public void recordDispatch(NotificationKind kind, String result) {
    dispatchCounters
        .computeIfAbsent(
            kind.name() + ':' + result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_TOTAL)
                    .description("Notification dispatch outcomes")
                    .tags(Tags.of("kind", kind.name(), "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordGuardSkipped(String jobName) {
    guardSkipCounters
        .computeIfAbsent(
            jobName,
            ignored ->
                Counter.builder(METRIC_GUARD_SKIPPED_TOTAL)
                    .description("Job firings skipped because the previous run was still active")
                    .tags(Tags.of("job", jobName))
                    .register(meterRegistry))
        .increment();
  }

  public void recordLedgerWriteFailure() {
    ledgerWriteFailures.increment();
  }

  public void updateActiveSchedules(int count) {
    activeSchedules.set(Math.max(count, 0));
  }
}
