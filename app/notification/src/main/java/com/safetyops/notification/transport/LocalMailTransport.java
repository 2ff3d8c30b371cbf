/*
 * Where: Notification transport boundary
 * What: Transport that only logs the message it would send
 * Why: Local runs and tests exercise the full dispatch path without an SMTP server
 */
package com.safetyops.notification.transport;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.transport.mode",
    havingValue = "local",
    matchIfMissing = true)
public class LocalMailTransport implements MailTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalMailTransport.class);

  @Override
  public TransportReceipt send(OutboundMail mail) {
    final String messageId = "<" + UUID.randomUUID() + "@local>";
    logger.info(
        "mail simulated send to={} subject={} messageId={}", mail.to(), mail.subject(), messageId);
    return new TransportReceipt(messageId);
  }

  @Override
  public boolean verify() {
    return true;
  }
}
