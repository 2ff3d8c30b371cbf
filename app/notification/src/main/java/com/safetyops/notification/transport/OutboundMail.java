/*
 * Where: Notification transport boundary
 * What: Rendered message handed to a MailTransport
 * Why: Keeps the transport contract independent of templates and kinds
 */
package com.safetyops.notification.transport;

import java.util.Objects;

public record OutboundMail(String to, String subject, String html, String from) {

  public OutboundMail {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(html, "html");
  }
}
