package com.onalog.discovery.lead.model;

public record DuplicateCheckResult(boolean duplicate, Long duplicateOfLeadId, String matchType) {
    public static final String MATCH_WEBSITE = "website";
    public static final String MATCH_NAME = "name";

    public static DuplicateCheckResult unique() {
        return new DuplicateCheckResult(false, null, null);
    }

    public static DuplicateCheckResult byWebsite(long leadId) {
        return new DuplicateCheckResult(true, leadId, MATCH_WEBSITE);
    }

    public static DuplicateCheckResult byName(long leadId) {
        return new DuplicateCheckResult(true, leadId, MATCH_NAME);
    }
}
