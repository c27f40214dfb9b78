package com.onalog.discovery.lead.model;

import java.time.Instant;

public record QueueEntry(long searchJobId, String tenantId, int priority, Instant enqueuedAt) {
}
