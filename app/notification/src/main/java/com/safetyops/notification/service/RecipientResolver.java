/*
 * Where: Notification service layer
 * What: Strategy that lists who a scheduled tick of one kind should notify
 * Why: Each kind has its own recipient rule; the job looks it up by kind instead of branching
 */
package com.safetyops.notification.service;

import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.Recipient;
import java.time.ZonedDateTime;
import java.util.List;

public interface RecipientResolver {

  NotificationKind kind();

  /**
   * @param now tick time in the schedule zone; date-derived variables are computed from it
   */
  List<Recipient> resolve(ZonedDateTime now);
}
