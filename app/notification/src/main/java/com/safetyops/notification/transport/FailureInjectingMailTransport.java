/*
 * Where: Notification transport boundary
 * What: CI/test-only transport that fails for recipients matching a prefix
 * Why: Reproduces transport failures end-to-end without touching production code paths
 */
package com.safetyops.notification.transport;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.transport.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingMailTransport implements MailTransport {

  private final LocalMailTransport delegate;

  @Value("${notification.transport.failure-injection.email-prefix:}")
  private String emailPrefix;

  @Override
  public TransportReceipt send(OutboundMail mail) {
    if (shouldInjectFailure(mail.to())) {
      throw new MailTransportException("mail failure injection matched to=" + mail.to());
    }
    return delegate.send(mail);
  }

  @Override
  public boolean verify() {
    return delegate.verify();
  }

  private boolean shouldInjectFailure(String to) {
    if (emailPrefix == null || emailPrefix.isBlank()) {
      return false;
    }
    return to.startsWith(emailPrefix);
  }
}
