package net.gridcoord.core.maintenance;

import net.gridcoord.core.error.NotFoundException;
import net.gridcoord.core.model.CloseReason;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.service.LeaseManager;
import net.gridcoord.core.spi.Clock;
import net.gridcoord.core.spi.JobRequestRepository;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 주기 회수 루프. 슬롯을 stale로 선언할 수 있는 유일한 주체다.
 * 전이는 모두 LeaseManager의 CAS를 거치므로 여러 인스턴스가 동시에 돌아도 중복 처리되지 않는다.
 */
public final class ReconciliationLoop {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationLoop.class);

    private final JobSlotRepository slots;
    private final JobRequestRepository requests;
    private final LeaseManager leases;
    private final TxRunner tx;
    private final Clock clock;

    private int batchSize = 200;

    public ReconciliationLoop(JobSlotRepository slots,
                              JobRequestRepository requests,
                              LeaseManager leases,
                              TxRunner tx,
                              Clock clock) {
        this.slots = slots;
        this.requests = requests;
        this.leases = leases;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 한 번의 점검.
     * - TTL 지난 LEASED → stale abort (재큐잉 또는 종료)
     * - soft expiry 지난 요청 → 닫고 PENDING 슬롯 EXPIRED
     * - 보존 기간 지난 종료 요청 삭제 (finishedRetention이 null/0이면 생략)
     */
    public ReconciliationReport runOnce(Duration finishedRetention) throws Exception {
        Instant now = clock.now();
        ReconciliationReport r = new ReconciliationReport();

        // 1) 만료 리스 회수
        List<JobSlot> expired = tx.required(() -> slots.findLeaseExpiredAt(now, batchSize));
        for (JobSlot s : expired) {
            Optional<JobSlot> aborted = leases.abortStale(s.id());
            if (aborted.isEmpty()) continue;
            r.staleAborted++;
            if (aborted.get().state().terminal()) r.terminated++;
            else r.requeued++;
        }

        // 2) 요청 soft expiry
        List<JobRequest> overdue = tx.required(() -> requests.findOpenExpiredAt(now, batchSize));
        for (JobRequest req : overdue) {
            try {
                RequestStatus st = leases.closeRequest(req.id(), CloseReason.EXPIRED);
                r.expiredRequests++;
                if (st.done()) r.finishedRequests++;
            } catch (NotFoundException e) {
                log.debug("Request {} disappeared before expiry: {}", req.id(), e.getMessage());
            }
        }

        // 3) 오래된 종료 요청 정리
        if (finishedRetention != null && !finishedRetention.isZero() && !finishedRetention.isNegative()) {
            Instant threshold = now.minus(finishedRetention);
            r.purgedRequests = tx.required(() -> requests.deleteFinishedBefore(threshold));
        }

        r.timestamp = now;
        if (r.staleAborted > 0 || r.expiredRequests > 0 || r.purgedRequests > 0) {
            log.info("Reconciliation: {}", r);
        }
        return r;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    /** 간단 리포트 DTO */
    public static final class ReconciliationReport {
        public Instant timestamp;
        public int staleAborted;
        public int requeued;
        public int terminated;
        public int expiredRequests;
        public int finishedRequests;
        public int purgedRequests;

        @Override public String toString() {
            return "ReconciliationReport{" +
                    "timestamp=" + timestamp +
                    ", staleAborted=" + staleAborted +
                    ", requeued=" + requeued +
                    ", terminated=" + terminated +
                    ", expiredRequests=" + expiredRequests +
                    ", finishedRequests=" + finishedRequests +
                    ", purgedRequests=" + purgedRequests +
                    '}';
        }
    }
}
