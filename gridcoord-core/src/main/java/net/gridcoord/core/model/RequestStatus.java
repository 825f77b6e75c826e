package net.gridcoord.core.model;

import java.time.Instant;
import java.util.List;

/** 클라이언트용 읽기 전용 상태 뷰 */
public record RequestStatus(
        String requestId,
        String requesterId,
        RequestState state,
        int total,
        int pending,
        int leased,
        int succeeded,
        int failed,
        int cancelled,
        boolean done,
        Instant createdAt,
        Instant expiresAt,
        Instant finishedAt,
        List<SlotView> slots
) {
    public record SlotView(
            String slotId,
            int slotIndex,
            SlotState state,
            String workerId,
            String model,
            int attempt,
            int progressPercent,
            String resultRef,
            Long seed,
            String faultReason
    ) {
        public static SlotView of(JobSlot s) {
            return new SlotView(s.id(), s.slotIndex(), s.state(), s.workerId(), s.assignedModel(), s.attempt(),
                    s.progressPercent(), s.resultRef(), s.seed(), s.faultReason());
        }
    }
}
