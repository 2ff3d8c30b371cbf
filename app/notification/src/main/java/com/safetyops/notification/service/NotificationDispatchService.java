/*
 * Where: Notification service layer
 * What: Renders a kind's template, hands it to the transport and records the outcome
 * Why: One recipient's failure must never abort a batch or surface as an exception
 */
package com.safetyops.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.safetyops.notification.config.NotificationDispatchProperties;
import com.safetyops.notification.config.SchedulerConfig;
import com.safetyops.notification.model.BatchResult;
import com.safetyops.notification.model.DispatchResult;
import com.safetyops.notification.model.NotificationKind;
import com.safetyops.notification.model.Recipient;
import com.safetyops.notification.model.SendLedgerEntry;
import com.safetyops.notification.model.TemplateDefinition;
import com.safetyops.notification.repository.TemplateDefinitionRepository;
import com.safetyops.notification.transport.MailTransport;
import com.safetyops.notification.transport.OutboundMail;
import com.safetyops.notification.transport.TransportReceipt;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class NotificationDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatchService.class);

  static final String ERROR_TEMPLATE_NOT_FOUND = "template not found";
  static final String ERROR_TEMPLATE_DISABLED = "template disabled";
  static final String VARIABLE_BASE_URL = "baseUrl";

  private final TemplateDefinitionRepository templateRepository;
  private final MailTransport transport;
  private final SendLedgerService ledger;
  private final NotificationDispatchProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final Executor dispatchExecutor;

  public NotificationDispatchService(
      TemplateDefinitionRepository templateRepository,
      MailTransport transport,
      SendLedgerService ledger,
      NotificationDispatchProperties properties,
      NotificationMetrics metrics,
      Clock clock,
      @Qualifier(SchedulerConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor) {
    this.templateRepository = templateRepository;
    this.transport = transport;
    this.ledger = ledger;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.dispatchExecutor = dispatchExecutor;
  }

  /**
   * Sends one notification of {@code kind} and appends exactly one ledger row for the attempt.
   * Never throws; every failure is reported through the returned result.
   */
  public DispatchResult sendByType(
      NotificationKind kind,
      String recipientEmail,
      String recipientId,
      Map<String, String> variables) {
    final Optional<TemplateDefinition> template;
    try {
      template = templateRepository.findByKind(kind);
    } catch (RuntimeException ex) {
      logger.error("template lookup failed kind={} recipientId={}", kind, recipientId, ex);
      return recordFailure(kind, recipientId, recipientEmail, "", ex.getMessage());
    }
    if (template.isEmpty()) {
      logger.warn("template not found; send skipped kind={} recipientId={}", kind, recipientId);
      return recordFailure(kind, recipientId, recipientEmail, "", ERROR_TEMPLATE_NOT_FOUND);
    }
    if (!template.get().enabled()) {
      logger.info("template disabled; send skipped kind={} recipientId={}", kind, recipientId);
      return recordFailure(kind, recipientId, recipientEmail, "", ERROR_TEMPLATE_DISABLED);
    }

    final Map<String, String> merged = mergeVariables(variables);
    final String subject = TemplateRenderer.render(template.get().subject(), merged);
    final String html = TemplateRenderer.render(template.get().content(), merged);

    final TransportReceipt receipt;
    try {
      receipt = transport.send(new OutboundMail(recipientEmail, subject, html, null));
    } catch (RuntimeException ex) {
      logger.warn("notification send failed kind={} recipientId={}", kind, recipientId, ex);
      return recordFailure(kind, recipientId, recipientEmail, subject, ex.getMessage());
    }
    ledger.append(SendLedgerEntry.sent(kind, recipientId, recipientEmail, subject, now()));
    metrics.recordDispatch(kind, "sent");
    logger.info(
        "notification sent kind={} recipientId={} messageId={}",
        kind,
        recipientId,
        receipt.messageId());
    return DispatchResult.sent(receipt.messageId());
  }

  /**
   * Dispatches {@code kind} to every recipient on the bounded dispatch executor and waits for all
   * of them. For deduplicated kinds, recipients already notified inside the window, and repeats of a
   * recipient within this batch, are skipped without a ledger row.
   */
  public BatchResult sendBatch(NotificationKind kind, List<Recipient> recipients) {
    if (recipients == null || recipients.isEmpty()) {
      return BatchResult.EMPTY;
    }
    final List<Recipient> candidates = new ArrayList<>(recipients.size());
    int skipped = 0;
    if (kind.deduplicated()) {
      final Set<String> seen = new HashSet<>();
      for (Recipient recipient : recipients) {
        if (seen.add(recipient.recipientId())) {
          candidates.add(recipient);
        } else {
          skipped++;
        }
      }
    } else {
      candidates.addAll(recipients);
    }

    final List<CompletableFuture<Outcome>> tasks =
        candidates.stream()
            .map(
                recipient ->
                    CompletableFuture.supplyAsync(
                        () -> dispatchOne(kind, recipient), dispatchExecutor))
            .toList();
    CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

    int sent = 0;
    int failed = 0;
    for (CompletableFuture<Outcome> task : tasks) {
      switch (task.join()) {
        case SENT -> sent++;
        case FAILED -> failed++;
        case SKIPPED -> skipped++;
      }
    }
    return new BatchResult(sent, failed, skipped);
  }

  @VisibleForTesting
  Outcome dispatchOne(NotificationKind kind, Recipient recipient) {
    try {
      if (kind.deduplicated() && ledger.isDuplicate(kind, recipient.recipientId())) {
        logger.debug(
            "notification suppressed by dedup window kind={} recipientId={}",
            kind,
            recipient.recipientId());
        metrics.recordDispatch(kind, "skipped");
        return Outcome.SKIPPED;
      }
      final DispatchResult result =
          sendByType(kind, recipient.email(), recipient.recipientId(), recipient.variables());
      return result.succeeded() ? Outcome.SENT : Outcome.FAILED;
    } catch (RuntimeException ex) {
      logger.error(
          "batch dispatch failed kind={} recipientId={}", kind, recipient.recipientId(), ex);
      return Outcome.FAILED;
    }
  }

  private DispatchResult recordFailure(
      NotificationKind kind,
      String recipientId,
      String recipientEmail,
      String subject,
      String error) {
    final String message = truncateError(error);
    ledger.append(
        SendLedgerEntry.failed(kind, recipientId, recipientEmail, subject, message, now()));
    metrics.recordDispatch(kind, "failed");
    return DispatchResult.failed(message);
  }

  @VisibleForTesting
  Map<String, String> mergeVariables(Map<String, String> variables) {
    final Map<String, String> merged = new HashMap<>();
    if (properties.baseUrl() != null) {
      merged.put(VARIABLE_BASE_URL, properties.baseUrl());
    }
    if (variables != null) {
      // caller-supplied values win over defaults
      merged.putAll(variables);
    }
    return merged;
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (maxLength <= 0 || message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private Instant now() {
    return Instant.now(clock);
  }

  enum Outcome {
    SENT,
    FAILED,
    SKIPPED
  }
}
