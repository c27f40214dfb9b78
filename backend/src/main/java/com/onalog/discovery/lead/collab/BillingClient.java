package com.onalog.discovery.lead.collab;

/**
 * Credit ledger owned by the billing service. One credit is reserved per non-duplicate lead before enrichment.
 */
public interface BillingClient {
    CreditReservation reserveCredit(String tenantId, long searchJobId);

    void refundCredit(String tenantId, long searchJobId, String reason);

    long balance(String tenantId);

    boolean hasPurchasedCredits(String tenantId);
}
