package net.gridcoord.core.model;

public enum WorkloadKind {
    IMAGE, TEXT, UNKNOWN;

    public static WorkloadKind from(String s) {
        if (s == null) return UNKNOWN;
        try { return WorkloadKind.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name(); }
}
