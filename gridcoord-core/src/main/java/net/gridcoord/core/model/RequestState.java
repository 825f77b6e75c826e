package net.gridcoord.core.model;

public enum RequestState {
    ACTIVE, COMPLETE, PARTIAL, FAILED, CANCELLED, EXPIRED, UNKNOWN;

    public static RequestState from(String s) {
        if (s == null) return UNKNOWN;
        try { return RequestState.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name(); }

    public boolean finished() {
        return this != ACTIVE && this != UNKNOWN;
    }
}
