/*
 * Where: Notification admin API
 * What: Hooks the schedule editor calls after changing or deleting a schedule definition
 * Why: Edits to schedule_definitions only take effect after reload/stop on the registry
 */
package com.safetyops.notification.api;

import com.safetyops.notification.service.ScheduleRegistry;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/schedules")
@RequiredArgsConstructor
public class ScheduleAdminController {

  private final ScheduleRegistry registry;

  /** Call after every create/update of a schedule definition. */
  @PostMapping("/{id}:reload")
  public ScheduleReloadResponse reload(@PathVariable("id") String id) {
    return new ScheduleReloadResponse(id, registry.reload(id));
  }

  /** Call after deleting a schedule definition. */
  @PostMapping("/{id}:stop")
  public ResponseEntity<Void> stop(@PathVariable("id") String id) {
    registry.stop(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/load-all")
  public ScheduleLoadResponse loadAll() {
    final int registered = registry.loadAll();
    return new ScheduleLoadResponse(registered, registry.activeIds());
  }

  @GetMapping("/active")
  public Set<String> active() {
    return registry.activeIds();
  }
}
