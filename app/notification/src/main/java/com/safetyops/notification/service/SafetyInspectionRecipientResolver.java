/*
 * Where: Notification recipient resolution
 * What: Team leaders and administrators with an email address
 * Why: Drives the monthly safety inspection reminder
 */
package com.safetyops.notification.service;

import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.Recipient;
import com.safetyops.notification.repository.RecipientRepository;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SafetyInspectionRecipientResolver implements RecipientResolver {

  private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

  private final RecipientRepository recipientRepository;

  @Override
  public NotificationKind kind() {
    return NotificationKind.SAFETY_INSPECTION_REMINDER;
  }

  @Override
  public List<Recipient> resolve(ZonedDateTime now) {
    final String month = YearMonth.from(now).format(MONTH_FORMAT);
    return recipientRepository.findManagersWithEmail().stream()
        .map(
            row ->
                new Recipient(
                    row.userId(),
                    row.email(),
                    Map.of(
                        "managerName", Objects.toString(row.username(), ""),
                        "month", month)))
        .toList();
  }
}
