/*
 * Where: Notification metrics test
 * What: Verifies dispatch, guard, ledger and schedule meters are recorded
 * Why: These meters are the only signal for silent delivery failures
 */
package com.safetyops.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.safetyops.notification.model.NotificationKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  @Test
  void recordsDispatchGuardLedgerAndScheduleMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.recordDispatch(NotificationKind.TBM_REMINDER, "sent");
    metrics.recordDispatch(NotificationKind.TBM_REMINDER, "sent");
    metrics.recordDispatch(NotificationKind.TBM_REMINDER, "failed");
    metrics.recordGuardSkipped("schedule:tbm-reminder");
    metrics.recordLedgerWriteFailure();
    metrics.updateActiveSchedules(3);

    assertThat(
            registry
                .get("notification.dispatch.total")
                .tags("kind", "TBM_REMINDER", "result", "sent")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("notification.dispatch.total")
                .tags("kind", "TBM_REMINDER", "result", "failed")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("notification.guard.skipped.total")
                .tag("job", "schedule:tbm-reminder")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.ledger.write.failures.total").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.schedule.active").gauge().value()).isEqualTo(3.0d);
  }

  @Test
  void activeScheduleGaugeNeverGoesNegative() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.updateActiveSchedules(-1);

    assertThat(registry.get("notification.schedule.active").gauge().value()).isZero();
  }
}
