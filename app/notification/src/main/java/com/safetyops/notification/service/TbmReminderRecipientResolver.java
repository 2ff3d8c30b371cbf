/*
 * Where: Notification recipient resolution
 * What: Team leaders whose team has not filed today's TBM report
 * Why: Drives the weekday TBM reminder; "today" starts at midnight in the schedule zone
 */
package com.safetyops.notification.service;

import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.Recipient;
import com.safetyops.notification.repository.RecipientRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TbmReminderRecipientResolver implements RecipientResolver {

  private final RecipientRepository recipientRepository;

  @Override
  public NotificationKind kind() {
    return NotificationKind.TBM_REMINDER;
  }

  @Override
  public List<Recipient> resolve(ZonedDateTime now) {
    final LocalDate today = now.toLocalDate();
    final Instant startOfDay = today.atStartOfDay(now.getZone()).toInstant();
    final String date = today.format(DateTimeFormatter.ISO_LOCAL_DATE);
    return recipientRepository.findLeadersOfTeamsWithoutReportSince(startOfDay).stream()
        .map(
            row ->
                new Recipient(
                    row.userId(),
                    row.email(),
                    Map.of(
                        "managerName", Objects.toString(row.username(), ""),
                        "teamName", Objects.toString(row.teamName(), ""),
                        "date", date)))
        .toList();
  }
}
