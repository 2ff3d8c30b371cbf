/*
 * Where: Notification startup test
 * What: Verifies the ready-event load and its failure handling
 * Why: A store outage at boot must not take the application down
 */
package com.safetyops.notification.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ScheduleBootstrapTest {

  @Mock private ScheduleRegistry registry;

  @Test
  void readyEventLoadsAllSchedules() {
    new ScheduleBootstrap(registry).onReady();

    verify(registry).loadAll();
  }

  @Test
  void loadFailureIsLoggedNotThrown() {
    when(registry.loadAll()).thenThrow(new DataAccessResourceFailureException("db down"));

    assertThatCode(() -> new ScheduleBootstrap(registry).onReady()).doesNotThrowAnyException();
  }
}
