/*
 * Where: Notification application entry point
 * What: Boots Spring and binds configuration records
 * Why: Schedules are registered programmatically by ScheduleRegistry, not via @Scheduled
 */
package com.safetyops.notification;

import com.safetyops.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotificationApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotificationApplication.class, args);
  }
}
