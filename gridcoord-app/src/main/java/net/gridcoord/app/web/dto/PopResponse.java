package net.gridcoord.app.web.dto;

import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.SlotAssignment;

import java.time.Instant;

/** 맡길 작업이 없으면 id가 null */
public record PopResponse(
        String id,
        String requestId,
        String model,
        GenerationParams params,
        Integer attempt,
        Long ttlSeconds,
        Instant leaseExpiresAt
) {
    public static PopResponse empty() {
        return new PopResponse(null, null, null, null, null, null, null);
    }

    public static PopResponse of(SlotAssignment a) {
        return new PopResponse(a.slotId(), a.requestId(), a.model(), a.params(), a.attempt(),
                a.leaseTtl().toSeconds(), a.leaseExpiresAt());
    }
}
