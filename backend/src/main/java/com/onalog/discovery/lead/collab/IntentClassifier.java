package com.onalog.discovery.lead.collab;

public interface IntentClassifier {
    /**
     * True when the query targets digital/software businesses rather than physical locations.
     */
    boolean classifyDigitalIntent(String query);
}
