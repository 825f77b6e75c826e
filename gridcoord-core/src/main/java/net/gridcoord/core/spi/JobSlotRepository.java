package net.gridcoord.core.spi;

import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.WorkerCapabilities;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobSlotRepository {
    void insertAll(List<JobSlot> slots) throws Exception;

    Optional<JobSlot> findById(String id) throws Exception;

    List<JobSlot> findByRequest(String requestId) throws Exception;

    /** PENDING 슬롯을 createdAt, slotIndex 순으로 최대 limit개 */
    List<JobSlot> findPending(int limit) throws Exception;

    /**
     * 워커 능력(모델, 크기, NSFW)으로 거른 PENDING 슬롯 최대 limit개.
     * 요청자별 앞쪽 슬롯이 먼저 오도록 (요청자 내 순번, createdAt, requestId, slotIndex) 순.
     * 한 요청자의 적체가 다른 요청자의 슬롯을 창 밖으로 밀어내지 않는다.
     */
    List<JobSlot> findPendingFor(WorkerCapabilities worker, int limit) throws Exception;

    /** LEASED 중 leaseGrantedAt + leaseTtl < now 인 슬롯 */
    List<JobSlot> findLeaseExpiredAt(Instant now, int limit) throws Exception;

    List<JobSlot> findLeased(int limit) throws Exception;

    int countLeasedByWorker(String workerId) throws Exception;

    /** 슬롯 단위 직렬화의 핵심: (id, expectedVersion) 일치 시에만 반영, version+1 */
    boolean update(JobSlot slot, long expectedVersion) throws Exception;
}
