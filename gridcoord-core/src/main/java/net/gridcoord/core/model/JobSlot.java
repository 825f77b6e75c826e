package net.gridcoord.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 요청 안의 생성 작업 한 단위 ("processing generation").
 * 리스는 별도 엔티티가 아니라 workerId/leaseGrantedAt/leaseTtl 필드로 표현된다.
 * 상태 전이는 LeaseManager만 수행한다.
 */
public record JobSlot(
        String id,
        String requestId,
        String requesterId,
        int trustTier,
        int slotIndex,
        SlotState state,
        GenerationParams params,
        List<String> models,
        boolean nsfw,
        String assignedModel,
        String workerId,
        Instant leaseGrantedAt,
        Duration leaseTtl,
        int attempt,
        String resultRef,
        Long seed,
        String resultMetadata,
        String faultReason,
        FaultKind lastFaultKind,
        String lastFaultWorkerId,
        Instant lastFaultAt,
        int progressPercent,
        Instant progressUpdatedAt,
        Instant createdAt,
        Instant finishedAt,
        long version
) {
    public JobSlot {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public static JobSlot pendingOf(JobRequest request, String slotId, int slotIndex) {
        return new JobSlot(slotId, request.id(), request.requesterId(), request.trustTier(), slotIndex,
                SlotState.PENDING, request.params(), request.models(), request.nsfw(),
                null, null, null, null, 0, null, null, null, null, null, null, null,
                0, null, request.createdAt(), null, 0L);
    }

    public Instant leaseExpiresAt() {
        if (leaseGrantedAt == null || leaseTtl == null) return null;
        return leaseGrantedAt.plus(leaseTtl);
    }

    public boolean leaseExpiredAt(Instant now) {
        Instant until = leaseExpiresAt();
        return state == SlotState.LEASED && until != null && until.isBefore(now);
    }

    public boolean heldBy(String candidateWorkerId) {
        return state == SlotState.LEASED && workerId != null && workerId.equals(candidateWorkerId);
    }

    /** 이 워커가 방금 이 슬롯에서 실패했고 아직 쿨다운 중인가 */
    public boolean coolingDownFor(String candidateWorkerId, Instant now, Duration cooldown) {
        if (lastFaultWorkerId == null || lastFaultAt == null) return false;
        return lastFaultWorkerId.equals(candidateWorkerId) && now.isBefore(lastFaultAt.plus(cooldown));
    }

    // --- transitions (LeaseManager 전용) ---

    public JobSlot leased(String toWorker, String model, Instant grantedAt, Duration ttl) {
        return new JobSlot(id, requestId, requesterId, trustTier, slotIndex, SlotState.LEASED, params, models, nsfw,
                model, toWorker, grantedAt, ttl, attempt + 1, null, null, null, faultReason,
                lastFaultKind, lastFaultWorkerId, lastFaultAt, 0, null, createdAt, null, version);
    }

    public JobSlot succeeded(String ref, Long resultSeed, String metadata, Instant at) {
        return new JobSlot(id, requestId, requesterId, trustTier, slotIndex, SlotState.SUBMITTED_OK, params, models,
                nsfw, assignedModel, workerId, leaseGrantedAt, leaseTtl, attempt, ref, resultSeed, metadata, null,
                lastFaultKind, lastFaultWorkerId, lastFaultAt, 100, at, createdAt, at, version);
    }

    /** 실패/만료 후 재노출: 리스 필드를 비우고 마지막 실패 워커를 기록 (쿨다운용) */
    public JobSlot requeued(FaultKind kind, String reason, Instant at) {
        return new JobSlot(id, requestId, requesterId, trustTier, slotIndex, SlotState.PENDING, params, models, nsfw,
                null, null, null, null, attempt, null, null, null, reason,
                kind, workerId, at, 0, null, createdAt, null, version);
    }

    /** 종료 상태로 전이. 리스 보유자 정보는 이력으로 남긴다. */
    public JobSlot terminated(SlotState terminal, FaultKind kind, String reason, Instant at) {
        String faultWorker = kind == null ? lastFaultWorkerId : workerId;
        Instant faultAt = kind == null ? lastFaultAt : at;
        return new JobSlot(id, requestId, requesterId, trustTier, slotIndex, terminal, params, models, nsfw,
                assignedModel, workerId, leaseGrantedAt, leaseTtl, attempt, null, null, null, reason,
                kind == null ? lastFaultKind : kind, faultWorker, faultAt, progressPercent, progressUpdatedAt,
                createdAt, at, version);
    }

    public JobSlot withProgress(int percent, Instant at) {
        return new JobSlot(id, requestId, requesterId, trustTier, slotIndex, state, params, models, nsfw,
                assignedModel, workerId, leaseGrantedAt, leaseTtl, attempt, resultRef, seed, resultMetadata,
                faultReason, lastFaultKind, lastFaultWorkerId, lastFaultAt, percent, at, createdAt, finishedAt, version);
    }

    public JobSlot withVersion(long v) {
        return new JobSlot(id, requestId, requesterId, trustTier, slotIndex, state, params, models, nsfw,
                assignedModel, workerId, leaseGrantedAt, leaseTtl, attempt, resultRef, seed, resultMetadata,
                faultReason, lastFaultKind, lastFaultWorkerId, lastFaultAt, progressPercent, progressUpdatedAt,
                createdAt, finishedAt, v);
    }
}
