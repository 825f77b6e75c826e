package net.gridcoord.core.model;

/** 슬롯이 마지막으로 실패한 이유의 종류 (워커 보고 vs. TTL 만료 회수) */
public enum FaultKind {
    WORKER_FAULT, STALE_ABORT;

    public static FaultKind from(String s) {
        if (s == null) return null;
        try { return FaultKind.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return null; }
    }
    public String code() { return name(); }
}
