package net.gridcoord.core.model;

/** 요청이 정상 종료 전에 닫힌 이유. 닫힌 요청의 슬롯은 재큐잉되지 않는다. */
public enum CloseReason {
    CANCELLED, EXPIRED;

    public static CloseReason from(String s) {
        if (s == null) return null;
        try { return CloseReason.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return null; }
    }
    public String code() { return name(); }

    public SlotState slotState() {
        return this == CANCELLED ? SlotState.CANCELLED : SlotState.EXPIRED;
    }
}
