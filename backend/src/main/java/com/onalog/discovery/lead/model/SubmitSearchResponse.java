package com.onalog.discovery.lead.model;

public record SubmitSearchResponse(
    long searchJobId,
    SearchJobStatus status,
    int queuePosition,
    int userQueuePosition,
    int priority
) {
}
