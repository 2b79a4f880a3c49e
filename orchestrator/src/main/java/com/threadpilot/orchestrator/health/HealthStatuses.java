package com.threadpilot.orchestrator.health;

import org.springframework.boot.actuate.health.Status;

final class HealthStatuses {

    // Still serving, but over a soft limit. Mapped to HTTP 200 in application.yml.
    static final Status DEGRADED = new Status("DEGRADED", "Over soft capacity limit");

    private HealthStatuses() {}
}
