/*
 * Where: Notification transport boundary
 * What: Unchecked failure raised by a MailTransport
 * Why: Dispatch records the message in the ledger and never inspects transport codes
 */
package com.safetyops.notification.transport;

public class MailTransportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MailTransportException(String message) {
    super(message);
  }

  public MailTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
