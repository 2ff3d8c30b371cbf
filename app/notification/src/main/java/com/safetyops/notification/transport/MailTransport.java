/*
 * Where: Notification transport boundary
 * What: Abstraction over the outbound mail channel
 * Why: Dispatch treats delivery as opaque and tests swap the channel freely
 */
package com.safetyops.notification.transport;

public interface MailTransport {

  /**
   * Sends one message.
   *
   * @return receipt carrying the transport's message identifier
   * @throws MailTransportException when the transport rejects or cannot reach the server
   */
  TransportReceipt send(OutboundMail mail);

  /** Returns whether the transport can currently reach its server. Never throws. */
  boolean verify();
}
