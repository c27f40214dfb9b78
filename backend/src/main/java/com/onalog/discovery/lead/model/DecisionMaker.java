package com.onalog.discovery.lead.model;

public record DecisionMaker(
    String name,
    String title,
    String email,
    String source,
    double confidence
) {
    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
