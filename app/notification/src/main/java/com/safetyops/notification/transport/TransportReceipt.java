package com.safetyops.notification.transport;

public record TransportReceipt(String messageId) {}
