package com.safetyops.notification.api;

import java.util.Set;

public record ScheduleLoadResponse(int registered, Set<String> active) {}
