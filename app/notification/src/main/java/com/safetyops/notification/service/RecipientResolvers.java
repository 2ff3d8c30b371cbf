/*
 * Where: Notification service layer
 * What: Kind-to-resolver table built from every RecipientResolver bean
 * Why: Adding a scheduled kind means adding a bean, not another switch branch
 */
package com.safetyops.notification.service;

import com.safetyops.notification.model.NotificationKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class RecipientResolvers {

  private final Map<NotificationKind, RecipientResolver> byKind;

  public RecipientResolvers(List<RecipientResolver> resolvers) {
    final Map<NotificationKind, RecipientResolver> table = new EnumMap<>(NotificationKind.class);
    for (RecipientResolver resolver : resolvers) {
      final RecipientResolver previous = table.put(resolver.kind(), resolver);
      if (previous != null) {
        throw new IllegalStateException(
            "duplicate recipient resolver kind="
                + resolver.kind()
                + " "
                + previous.getClass().getSimpleName()
                + "/"
                + resolver.getClass().getSimpleName());
      }
    }
    this.byKind = Collections.unmodifiableMap(table);
  }

  public Optional<RecipientResolver> find(NotificationKind kind) {
    return Optional.ofNullable(byKind.get(kind));
  }
}
