package com.safetyops.notification.api;

public record ScheduleReloadResponse(String id, boolean registered) {}
