package com.onalog.discovery.lead.collab;

public record RelevanceVerdict(boolean relevant, double confidence, String reason) {
    public static RelevanceVerdict assumeRelevant(String reason) {
        return new RelevanceVerdict(true, 0.0, reason);
    }
}
