package com.onalog.discovery.lead.model;

import java.util.List;
import java.util.Map;

public record QueueSnapshot(
    boolean processing,
    Long activeSearchJobId,
    int queuedJobs,
    Map<String, List<QueueEntry>> tenantQueues,
    List<Long> pausedBackgroundJobs
) {
}
