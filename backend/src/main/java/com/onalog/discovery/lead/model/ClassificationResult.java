package com.onalog.discovery.lead.model;

import java.util.List;

public record ClassificationResult(int score, List<String> reasons) {
    public static ClassificationResult fallback() {
        return new ClassificationResult(0, List.of("fallback"));
    }

    public boolean isFirstParty() {
        return score > 0;
    }

    public boolean isRejected(int threshold) {
        return score <= threshold;
    }
}
