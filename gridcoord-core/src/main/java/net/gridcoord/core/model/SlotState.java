package net.gridcoord.core.model;

public enum SlotState {
    PENDING, LEASED, SUBMITTED_OK, FAULTED, ABORTED_STALE, CANCELLED, EXPIRED, UNKNOWN;

    public static SlotState from(String s) {
        if (s == null) return UNKNOWN;
        try { return SlotState.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name(); }

    public boolean terminal() {
        return this == SUBMITTED_OK || this == FAULTED || this == ABORTED_STALE
                || this == CANCELLED || this == EXPIRED;
    }
}
