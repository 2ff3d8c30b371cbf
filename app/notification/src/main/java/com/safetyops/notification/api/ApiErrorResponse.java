/*
 * Where: Notification admin API
 * What: Common error body
 * Why: Callers branch on a stable code rather than on message text
 */
package com.safetyops.notification.api;

public record ApiErrorResponse(String code, String message) {}
