/*
 * Where: Notification transport boundary
 * What: Sends HTML mail through Spring's JavaMailSender
 * Why: Production delivery goes through the site SMTP relay configured under spring.mail
 */
package com.safetyops.notification.transport;

import com.safetyops.notification.config.NotificationDispatchProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "notification.transport.mode", havingValue = "smtp")
public class SmtpMailTransport implements MailTransport {

  private static final Logger logger = LoggerFactory.getLogger(SmtpMailTransport.class);

  private final JavaMailSender mailSender;
  private final String defaultFrom;

  public SmtpMailTransport(JavaMailSender mailSender, NotificationDispatchProperties properties) {
    this.mailSender = mailSender;
    this.defaultFrom = properties.fromAddress();
  }

  @Override
  public TransportReceipt send(OutboundMail mail) {
    try {
      final MimeMessage message = mailSender.createMimeMessage();
      final MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
      helper.setFrom(mail.from() != null ? mail.from() : defaultFrom);
      helper.setTo(mail.to());
      helper.setSubject(mail.subject());
      helper.setText(mail.html(), true);
      mailSender.send(message);
      final String messageId = message.getMessageID();
      logger.debug("smtp mail sent to={} messageId={}", mail.to(), messageId);
      return new TransportReceipt(messageId);
    } catch (MailException | MessagingException ex) {
      throw new MailTransportException("smtp send failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public boolean verify() {
    if (!(mailSender instanceof JavaMailSenderImpl impl)) {
      logger.warn("smtp verify skipped; unsupported sender type={}", mailSender.getClass().getName());
      return false;
    }
    try {
      impl.testConnection();
      return true;
    } catch (MessagingException ex) {
      logger.warn("smtp verify failed host={} port={}", impl.getHost(), impl.getPort(), ex);
      return false;
    }
  }
}
