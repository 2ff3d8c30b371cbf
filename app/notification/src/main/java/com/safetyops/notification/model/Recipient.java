/*
 * Where: Notification domain model
 * What: A resolved recipient together with its template variables
 * Why: Recipient resolution and dispatch stay decoupled; resolvers only produce these
 */
package com.safetyops.notification.model;

import java.util.Map;

public record Recipient(String recipientId, String email, Map<String, String> variables) {

  public Recipient {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }
}
