/*
 * Where: Notification startup
 * What: Loads persisted schedules once the application is ready
 * Why: A store outage at startup is logged; an operator can call load-all later
 */
package com.safetyops.notification.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.schedule.enabled", havingValue = "true")
public class ScheduleBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleBootstrap.class);

  private final ScheduleRegistry registry;

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    try {
      registry.loadAll();
    } catch (RuntimeException ex) {
      logger.error("schedule load on startup failed", ex);
    }
  }
}
