/*
 * Where: Notification scheduler configuration
 * What: Carries the submitting thread's MDC into dispatch executor tasks
 * Why: Per-recipient send logs run on pool threads and must keep job_name
 */
package com.safetyops.notification.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    final Map<String, String> submitted = MDC.getCopyOfContextMap();
    return () -> {
      final Map<String, String> previous = MDC.getCopyOfContextMap();
      if (submitted == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(submitted);
      }
      try {
        runnable.run();
      } finally {
        if (previous == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(previous);
        }
      }
    };
  }
}
