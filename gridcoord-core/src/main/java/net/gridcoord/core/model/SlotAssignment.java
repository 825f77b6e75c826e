package net.gridcoord.core.model;

import java.time.Duration;
import java.time.Instant;

/** poll 결과로 워커에게 돌려주는 리스 정보 */
public record SlotAssignment(
        String slotId,
        String requestId,
        String model,
        GenerationParams params,
        int attempt,
        Duration leaseTtl,
        Instant leaseExpiresAt
) {
    public static SlotAssignment of(JobSlot slot) {
        return new SlotAssignment(slot.id(), slot.requestId(), slot.assignedModel(), slot.params(),
                slot.attempt(), slot.leaseTtl(), slot.leaseExpiresAt());
    }
}
