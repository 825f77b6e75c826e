package net.gridcoord.core.service;

import net.gridcoord.core.error.AlreadyLeasedException;
import net.gridcoord.core.error.LeaseMismatchException;
import net.gridcoord.core.error.NotFoundException;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.CloseReason;
import net.gridcoord.core.model.FaultKind;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.model.SlotOutcome;
import net.gridcoord.core.model.SlotOutcomeEvent;
import net.gridcoord.core.model.SlotState;
import net.gridcoord.core.registry.WorkerRegistry;
import net.gridcoord.core.spi.Clock;
import net.gridcoord.core.spi.JobRequestRepository;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.OutcomeListener;
import net.gridcoord.core.spi.TxRunner;
import net.gridcoord.core.spi.UsageLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JobSlot 상태 머신.
 * <pre>
 * PENDING → LEASED → SUBMITTED_OK
 *                  → FAULTED / ABORTED_STALE → (attempt &lt; maxAttempts) PENDING
 * PENDING → CANCELLED / EXPIRED
 * </pre>
 * 모든 전이는 (slotId, version) CAS로 반영되므로 같은 슬롯에 대한 동시 리스/제출 중 하나만 성공한다.
 * 종료 전이는 부모 요청 행을 먼저 잠가 형제 슬롯 간 최종 집계를 직렬화한다.
 */
public final class LeaseManager {
    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);

    private final JobSlotRepository slots;
    private final JobRequestRepository requests;
    private final WorkerRegistry workers;
    private final UsageLedger usage;
    private final OutcomeListener listener;
    private final LeaseTtlPolicy ttlPolicy;
    private final CoordinatorSettings settings;
    private final WorkSignal signal;
    private final TxRunner tx;
    private final Clock clock;

    public LeaseManager(JobSlotRepository slots,
                        JobRequestRepository requests,
                        WorkerRegistry workers,
                        UsageLedger usage,
                        OutcomeListener listener,
                        LeaseTtlPolicy ttlPolicy,
                        CoordinatorSettings settings,
                        WorkSignal signal,
                        TxRunner tx,
                        Clock clock) {
        this.slots = slots;
        this.requests = requests;
        this.workers = workers;
        this.usage = usage;
        this.listener = listener;
        this.ttlPolicy = ttlPolicy;
        this.settings = settings;
        this.signal = signal;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * PENDING → LEASED. 슬롯 경합에서 지면 AlreadyLeasedException.
     * 워커 행을 잠근 상태에서 용량을 다시 확인하고, 그 사이 가득 찼거나 배정 불가가 됐으면 empty.
     */
    public Optional<JobSlot> lease(String slotId, String workerId, String model) throws Exception {
        Optional<JobSlot> granted = tx.required(() -> {
            JobSlot s = slots.findById(slotId)
                    .orElseThrow(() -> new NotFoundException("slot not found: " + slotId));
            if (s.state() != SlotState.PENDING) {
                throw new AlreadyLeasedException("slot " + slotId + " is " + s.state());
            }
            if (!workers.lockForLease(workerId)) {
                return Optional.<JobSlot>empty();
            }
            JobSlot next = s.leased(workerId, model, clock.now(), ttlPolicy.ttlFor(s.params()));
            if (!slots.update(next, s.version())) {
                throw new AlreadyLeasedException("slot " + slotId + " was leased concurrently");
            }
            return Optional.of(next.withVersion(s.version() + 1));
        });
        if (granted.isEmpty()) {
            log.debug("Worker {} has no spare capacity for slot {}", workerId, slotId);
            return granted;
        }
        JobSlot leased = granted.get();
        log.info("Slot {} of request {} leased to worker {} (attempt {}, model {}, ttl {}s)",
                leased.id(), leased.requestId(), workerId, leased.attempt(), model, leased.leaseTtl().toSeconds());
        return granted;
    }

    /**
     * LEASED → SUBMITTED_OK / FAULTED(재큐잉 포함).
     * 보유자가 아니거나 이미 종료된 슬롯이면 LeaseMismatchException이고 상태는 그대로다.
     * TTL이 지났더라도 회수 루프가 아직 회수하지 않았다면 제출은 유효하다.
     */
    public JobSlot submitResult(String workerId, String slotId, SlotOutcome outcome) throws Exception {
        requireIds(workerId, slotId);
        if (outcome == null || outcome.kind() == null) throw new ValidationException("outcome is required");
        if (outcome.succeeded() && (outcome.resultRef() == null || outcome.resultRef().isBlank())) {
            throw new ValidationException("successful outcome requires a result reference");
        }

        Transition t = tx.required(() -> {
            JobSlot s = slots.findById(slotId)
                    .orElseThrow(() -> new NotFoundException("slot not found: " + slotId));
            JobRequest req = requests.lockById(s.requestId())
                    .orElseThrow(() -> new NotFoundException("request not found: " + s.requestId()));
            // 잠금 이후 최신 상태로 다시 판단
            JobSlot current = slots.findById(slotId).orElseThrow();
            if (current.state().terminal()) {
                throw new LeaseMismatchException("slot " + slotId + " already finished as " + current.state());
            }
            if (!current.heldBy(workerId)) {
                throw new LeaseMismatchException("worker " + workerId + " does not hold the lease on slot " + slotId);
            }

            Instant now = clock.now();
            JobSlot next;
            if (outcome.succeeded()) {
                next = req.closed()
                        ? current.terminated(req.closeReason().slotState(), null,
                                "result discarded, request " + req.closeReason().code().toLowerCase(), now)
                        : current.succeeded(outcome.resultRef(), outcome.seed(), outcome.metadata(), now);
            } else {
                String reason = outcome.faultReason() == null ? "worker reported failure" : outcome.faultReason();
                next = afterFault(current, req, FaultKind.WORKER_FAULT, reason, now);
            }
            if (!slots.update(next, current.version())) {
                throw new LeaseMismatchException("slot " + slotId + " changed concurrently");
            }
            next = next.withVersion(current.version() + 1);

            workers.markOutcome(workerId, outcome.succeeded());
            if (next.state() == SlotState.SUBMITTED_OK) {
                usage.recordUsage(req.requesterId(), ttlPolicy.workloadUnits(next.params()), now);
            }
            Optional<RequestStatus> finished = next.state().terminal() ? finalizeIfDone(req.id()) : Optional.empty();
            return new Transition(next, req, finished);
        });

        if (t.slot().state() == SlotState.SUBMITTED_OK) {
            log.info("Slot {} of request {} completed by worker {} (attempt {})",
                    slotId, t.slot().requestId(), workerId, t.slot().attempt());
        } else if (t.slot().state() == SlotState.PENDING) {
            log.info("Slot {} of request {} faulted on worker {}: {} (attempt {}/{}), re-queued",
                    slotId, t.slot().requestId(), workerId, t.slot().faultReason(),
                    t.slot().attempt(), settings.maxAttempts());
        } else {
            log.info("Slot {} of request {} finished as {} on worker {}: {}",
                    slotId, t.slot().requestId(), t.slot().state(), workerId, t.slot().faultReason());
        }
        publish(t);
        return t.slot();
    }

    /**
     * LEASED → ABORTED_STALE (→ PENDING 재큐잉 또는 종료). ReconciliationLoop 전용.
     * 이미 전이됐거나 아직 만료 전이면 아무것도 하지 않고 empty. 여러 인스턴스가 동시에 돌아도 안전하다.
     */
    public Optional<JobSlot> abortStale(String slotId) throws Exception {
        Transition t = tx.required(() -> {
            JobSlot s = slots.findById(slotId).orElse(null);
            if (s == null) return null;
            JobRequest req = requests.lockById(s.requestId()).orElse(null);
            if (req == null) return null;
            JobSlot current = slots.findById(slotId).orElse(null);
            Instant now = clock.now();
            if (current == null || !current.leaseExpiredAt(now)) return null;

            String reason = "lease expired after " + current.leaseTtl().toSeconds() + "s without submission";
            JobSlot next = afterFault(current, req, FaultKind.STALE_ABORT, reason, now);
            if (!slots.update(next, current.version())) return null;
            next = next.withVersion(current.version() + 1);

            workers.markOutcome(current.workerId(), false);
            Optional<RequestStatus> finished = next.state().terminal() ? finalizeIfDone(req.id()) : Optional.empty();
            return new Transition(next, req, finished);
        });
        if (t == null) return Optional.empty();

        log.info("Aborted stale generation {} of request {} from worker {} (attempt {}/{}) -> {}",
                slotId, t.slot().requestId(), t.slot().lastFaultWorkerId(), t.slot().attempt(),
                settings.maxAttempts(), t.slot().state());
        publish(t);
        return Optional.of(t.slot());
    }

    /** 리스 보유자의 진행률 보고 */
    public JobSlot reportProgress(String workerId, String slotId, int currentStep, int totalSteps) throws Exception {
        requireIds(workerId, slotId);
        if (currentStep < 0 || totalSteps < 0) throw new ValidationException("progress steps must not be negative");
        return tx.required(() -> {
            JobSlot s = slots.findById(slotId)
                    .orElseThrow(() -> new NotFoundException("slot not found: " + slotId));
            if (!s.heldBy(workerId)) {
                throw new LeaseMismatchException("worker " + workerId + " does not hold the lease on slot " + slotId);
            }
            int percent = (int) Math.min(100L, (long) currentStep * 100L / Math.max(totalSteps, 1));
            JobSlot next = s.withProgress(percent, clock.now());
            if (!slots.update(next, s.version())) {
                throw new LeaseMismatchException("slot " + slotId + " changed concurrently");
            }
            return next.withVersion(s.version() + 1);
        });
    }

    /**
     * 요청을 닫는다 (취소/만료). PENDING 슬롯은 슬롯 단위로 원자적으로 종료되고,
     * LEASED 슬롯은 그대로 둔다. 결과가 오면 버려지고 만료되면 재큐잉 없이 종료된다.
     */
    public RequestStatus closeRequest(String requestId, CloseReason reason) throws Exception {
        List<Transition> closedSlots = new ArrayList<>();
        Optional<RequestStatus> finished = tx.required(() -> {
            JobRequest req = requests.lockById(requestId)
                    .orElseThrow(() -> new NotFoundException("request not found: " + requestId));
            if (req.state().finished()) return Optional.<RequestStatus>empty();
            if (!req.closed()) {
                if (!requests.update(req.closedBy(reason), req.version())) {
                    throw new IllegalStateException("request " + requestId + " changed while closing");
                }
                req = req.closedBy(reason).withVersion(req.version() + 1);
            }
            Instant now = clock.now();
            for (JobSlot s : slots.findByRequest(requestId)) {
                if (s.state() != SlotState.PENDING) continue;
                JobSlot next = s.terminated(reason.slotState(), null,
                        "request " + reason.code().toLowerCase() + " before lease", now);
                // 지는 경우는 그 사이 리스된 것이므로 LEASED로 남겨 둔다
                if (slots.update(next, s.version())) {
                    closedSlots.add(new Transition(next.withVersion(s.version() + 1), req, Optional.empty()));
                }
            }
            return finalizeIfDone(requestId);
        });

        log.info("Request {} closed ({}), {} pending slot(s) terminated", requestId, reason, closedSlots.size());
        for (Transition t : closedSlots) publish(t);
        finished.ifPresent(this::publishFinished);
        return tx.required(() -> statusOf(requestId));
    }

    public RequestStatus statusOf(String requestId) throws Exception {
        return tx.required(() -> {
            JobRequest req = requests.findById(requestId)
                    .orElseThrow(() -> new NotFoundException("request not found: " + requestId));
            return RequestStatuses.of(req, slots.findByRequest(requestId));
        });
    }

    // --- internals ---

    private static void requireIds(String workerId, String slotId) {
        if (workerId == null || workerId.isBlank()) throw new ValidationException("worker id is required");
        if (slotId == null || slotId.isBlank()) throw new ValidationException("slot id is required");
    }

    /** 실패 공통 처리: 열린 요청이고 시도 횟수가 남았으면 재큐잉, 아니면 종료 */
    private JobSlot afterFault(JobSlot s, JobRequest req, FaultKind kind, String reason, Instant now) {
        if (!req.closed() && s.attempt() < settings.maxAttempts()) {
            return s.requeued(kind, reason, now);
        }
        SlotState terminal;
        if (req.closed()) terminal = req.closeReason().slotState();
        else terminal = kind == FaultKind.STALE_ABORT ? SlotState.ABORTED_STALE : SlotState.FAULTED;
        return s.terminated(terminal, kind, reason, now);
    }

    /** 모든 형제 슬롯이 종료됐으면 요청을 최종 상태로 (호출자 트랜잭션 안에서) */
    private Optional<RequestStatus> finalizeIfDone(String requestId) throws Exception {
        for (int i = 0; i < 4; i++) {
            JobRequest req = requests.findById(requestId).orElse(null);
            if (req == null || req.state().finished()) return Optional.empty();
            List<JobSlot> siblings = slots.findByRequest(requestId);
            if (!RequestStatuses.allTerminal(siblings)) return Optional.empty();

            JobRequest done = req.finishedAs(RequestStatuses.finalStateOf(req, siblings), clock.now());
            if (requests.update(done, req.version())) {
                log.info("Request {} finished as {}", requestId, done.state());
                return Optional.of(RequestStatuses.of(done.withVersion(req.version() + 1), siblings));
            }
        }
        return Optional.empty();
    }

    private void publish(Transition t) {
        JobSlot s = t.slot();
        if (s.state() == SlotState.PENDING) {
            signal.notifyWork();
        } else if (s.state().terminal()) {
            var event = new SlotOutcomeEvent(s.id(), s.requestId(), s.requesterId(), s.workerId(), s.state(),
                    s.assignedModel(), s.attempt(), s.resultRef(), s.seed(), s.faultReason(),
                    ttlPolicy.workloadUnits(s.params()), t.request().webhookUrl(), s.finishedAt());
            try {
                listener.onSlotTerminal(event);
            } catch (RuntimeException e) {
                log.warn("Outcome listener failed for slot {}: {}", s.id(), e.toString());
            }
        }
        t.finished().ifPresent(this::publishFinished);
    }

    private void publishFinished(RequestStatus status) {
        try {
            listener.onRequestFinished(status);
        } catch (RuntimeException e) {
            log.warn("Outcome listener failed for request {}: {}", status.requestId(), e.toString());
        }
    }

    private record Transition(JobSlot slot, JobRequest request, Optional<RequestStatus> finished) {}
}
