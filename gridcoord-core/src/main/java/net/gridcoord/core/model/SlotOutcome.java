package net.gridcoord.core.model;

/** 워커가 제출하는 결과. SUCCESS면 resultRef 필수, FAULT면 faultReason. */
public record SlotOutcome(
        Kind kind,
        String resultRef,
        Long seed,
        String metadata,
        String faultReason
) {
    public enum Kind { SUCCESS, FAULT }

    public static SlotOutcome success(String resultRef, Long seed, String metadata) {
        return new SlotOutcome(Kind.SUCCESS, resultRef, seed, metadata, null);
    }

    public static SlotOutcome fault(String reason) {
        return new SlotOutcome(Kind.FAULT, null, null, null, reason);
    }

    public boolean succeeded() {
        return kind == Kind.SUCCESS;
    }
}
