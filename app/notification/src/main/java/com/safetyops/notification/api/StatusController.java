/*
 * Where: Notification API
 * What: Liveness text and transport reachability check
 * Why: Operators confirm the mail relay is reachable before blaming schedules
 */
package com.safetyops.notification.api;

import com.safetyops.notification.transport.MailTransport;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final MailTransport transport;

  @GetMapping("/")
  public String home() {
    return "notification: ok";
  }

  @GetMapping("/status/transport")
  public Map<String, Boolean> transport() {
    return Map.of("reachable", transport.verify());
  }
}
