package com.onalog.discovery.lead.collab;

public record CreditReservation(boolean ok, String reason) {
    public static CreditReservation granted() {
        return new CreditReservation(true, null);
    }

    public static CreditReservation denied(String reason) {
        return new CreditReservation(false, reason);
    }
}
