package net.gridcoord.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 클라이언트 제출 1건 ("waiting prompt"). slotCount는 생성 시 고정되며 이후 늘어나지 않는다.
 */
public record JobRequest(
        String id,
        String requesterId,
        int trustTier,
        int slotCount,
        GenerationParams params,
        List<String> models,    // 선호 순서, 비어 있으면 "아무 모델"
        boolean nsfw,
        String webhookUrl,
        RequestState state,
        CloseReason closeReason, // null = 열린 요청
        Instant createdAt,
        Instant expiresAt,
        Instant finishedAt,
        long version
) {
    public JobRequest {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public boolean closed() {
        return closeReason != null;
    }

    public boolean expiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public JobRequest closedBy(CloseReason reason) {
        return new JobRequest(id, requesterId, trustTier, slotCount, params, models, nsfw, webhookUrl,
                state, reason, createdAt, expiresAt, finishedAt, version);
    }

    public JobRequest finishedAs(RequestState finalState, Instant at) {
        return new JobRequest(id, requesterId, trustTier, slotCount, params, models, nsfw, webhookUrl,
                finalState, closeReason, createdAt, expiresAt, at, version);
    }

    public JobRequest withVersion(long v) {
        return new JobRequest(id, requesterId, trustTier, slotCount, params, models, nsfw, webhookUrl,
                state, closeReason, createdAt, expiresAt, finishedAt, v);
    }
}
