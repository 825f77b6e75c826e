package net.gridcoord.app.web.dto;

import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.SlotOutcome;

/** state: "ok" | "faulted". 생략하면 ok */
public record SubmitRequest(
        String workerId,
        String id,
        String state,
        String result,
        Long seed,
        String metadata,
        String reason
) {
    public SlotOutcome toOutcome() {
        if (state == null || "ok".equalsIgnoreCase(state)) {
            return SlotOutcome.success(result, seed, metadata);
        }
        if ("faulted".equalsIgnoreCase(state)) {
            return SlotOutcome.fault(reason);
        }
        // 오타를 실패로 세면 워커가 자동 정지될 수 있다
        throw new ValidationException("state must be ok or faulted: " + state);
    }
}
