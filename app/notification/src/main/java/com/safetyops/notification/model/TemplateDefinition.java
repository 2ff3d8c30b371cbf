/*
 * Where: Notification domain model
 * What: Subject/body pair for one notification kind
 * Why: Administrators author the HTML; dispatch only substitutes tokens into it
 */
package com.safetyops.notification.model;

public record TemplateDefinition(
    NotificationKind notificationKind, String subject, String content, boolean enabled) {}
