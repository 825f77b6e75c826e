package net.gridcoord.core.model;

import java.time.Instant;

/** 슬롯이 종료 상태에 도달했을 때 외부(웹훅/분석)로 흘려보내는 이벤트 */
public record SlotOutcomeEvent(
        String slotId,
        String requestId,
        String requesterId,
        String workerId,
        SlotState state,
        String model,
        int attempt,
        String resultRef,
        Long seed,
        String faultReason,
        double workloadUnits,
        String webhookUrl,
        Instant at
) {}
