/*
 * Where: Notification recipient resolution
 * What: Users who have not completed an active safety course
 * Why: Drives the daily education reminder
 */
package com.safetyops.notification.service;

import com.safetyops.notification.config.NotificationDispatchProperties;
import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.Recipient;
import com.safetyops.notification.repository.RecipientRepository;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EducationReminderRecipientResolver implements RecipientResolver {

  private final RecipientRepository recipientRepository;
  private final NotificationDispatchProperties properties;

  @Override
  public NotificationKind kind() {
    return NotificationKind.EDUCATION_REMINDER;
  }

  @Override
  public List<Recipient> resolve(ZonedDateTime now) {
    final String dueDate =
        now.toLocalDate()
            .plusDays(properties.educationDueDays())
            .format(DateTimeFormatter.ISO_LOCAL_DATE);
    return recipientRepository.findIncompleteCourseUsers().stream()
        .map(
            row ->
                new Recipient(
                    row.userId(),
                    row.email(),
                    Map.of(
                        "userName", Objects.toString(row.username(), ""),
                        "courseName", Objects.toString(row.courseTitle(), ""),
                        "dueDate", dueDate)))
        .toList();
  }
}
