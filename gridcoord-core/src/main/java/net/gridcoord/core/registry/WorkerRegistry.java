package net.gridcoord.core.registry;

import net.gridcoord.core.error.NotFoundException;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.model.WorkerDescriptor;
import net.gridcoord.core.model.WorkerHealth;
import net.gridcoord.core.service.CoordinatorSettings;
import net.gridcoord.core.spi.Clock;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.TxRunner;
import net.gridcoord.core.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * 워커 등록/하트비트/성과 카운터/자격 판정.
 * 카운터는 워커 레코드 단위 CAS로만 바뀐다 (프로세스 전역 카운터 없음).
 */
public final class WorkerRegistry {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);
    private static final int MAX_CAS_RETRIES = 16;

    private final WorkerRepository workers;
    private final JobSlotRepository slots;
    private final TxRunner tx;
    private final Clock clock;
    private final CoordinatorSettings settings;

    public WorkerRegistry(WorkerRepository workers,
                          JobSlotRepository slots,
                          TxRunner tx,
                          Clock clock,
                          CoordinatorSettings settings) {
        this.workers = workers;
        this.slots = slots;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    public String register(WorkerDescriptor descriptor) throws Exception {
        if (descriptor == null) throw new ValidationException("worker descriptor is required");
        if (descriptor.name() == null || descriptor.name().isBlank()) {
            throw new ValidationException("worker name is required");
        }
        validateCapabilities(descriptor.capabilities());

        return tx.required(() -> {
            if (workers.findByName(descriptor.name()).isPresent()) {
                throw new ValidationException("worker name already registered: " + descriptor.name());
            }
            String id = UUID.randomUUID().toString();
            workers.insert(Worker.ofNew(id, descriptor.ownerId(), descriptor.name(),
                    descriptor.capabilities(), clock.now()));
            log.info("Registered worker {} ({}) models={}", descriptor.name(), id,
                    descriptor.capabilities().models());
            return id;
        });
    }

    /**
     * 체크인 갱신. 자동 정지 기간이 끝난 워커는 여기서 프로베이션(시험 슬롯 1개)으로 넘어간다.
     */
    public Worker updateHeartbeat(String workerId, WorkerCapabilities capabilities) throws Exception {
        validateCapabilities(capabilities);
        return mutate(workerId, w -> {
            var now = clock.now();
            Worker next = w.withCheckIn(capabilities, now);
            if (next.health() == WorkerHealth.AUTO_PAUSED
                    && next.autoPausedUntil() != null
                    && !now.isBefore(next.autoPausedUntil())) {
                log.warn("Worker {} ({}) entering probation after auto-pause", w.name(), w.id());
                next = next.withHealth(WorkerHealth.PROBATION, null);
            }
            return next;
        });
    }

    /**
     * 종료된 슬롯 결과 반영. 연속 실패가 임계치에 닿으면 auto-pause,
     * 프로베이션 중 실패는 정지 연장, 성공은 스트릭 초기화.
     */
    public Worker markOutcome(String workerId, boolean success) throws Exception {
        return mutate(workerId, w -> {
            var now = clock.now();
            if (success) {
                Worker next = w.withCounters(w.successes() + 1, w.faults(), 0);
                if (next.health() == WorkerHealth.PROBATION) {
                    log.info("Worker {} ({}) passed probation, fault streak cleared", w.name(), w.id());
                    next = next.withHealth(WorkerHealth.HEALTHY, null);
                }
                return next;
            }
            int streak = w.faultStreak() + 1;
            Worker next = w.withCounters(w.successes(), w.faults() + 1, streak);
            if (next.health() == WorkerHealth.PROBATION) {
                log.warn("Worker {} ({}) failed its probation slot, pause extended", w.name(), w.id());
                return next.withHealth(WorkerHealth.AUTO_PAUSED, now.plus(settings.probationDelay()));
            }
            if (next.health() == WorkerHealth.HEALTHY && streak >= settings.faultThreshold()) {
                log.warn("Worker {} ({}) auto-paused after {} consecutive faults", w.name(), w.id(), streak);
                return next.withHealth(WorkerHealth.AUTO_PAUSED, now.plus(settings.probationDelay()));
            }
            return next;
        });
    }

    /** 등록됨 + 정지/점검/자동정지 아님 + 모델 선언 + 워크로드 수용 + 여유 용량 */
    public boolean isEligible(String workerId, String model, GenerationParams params) throws Exception {
        return tx.required(() -> {
            var opt = workers.findById(workerId);
            if (opt.isEmpty()) return false;
            Worker w = opt.get();
            if (!w.dispatchable()) return false;
            if (model != null && !w.capabilities().serves(model)) return false;
            if (params != null && !w.capabilities().fits(params)) return false;
            return hasSpareCapacity(w);
        });
    }

    public boolean hasSpareCapacity(Worker w) throws Exception {
        return tx.required(() -> slots.countLeasedByWorker(w.id()) < w.effectiveCapacity());
    }

    /**
     * 리스 트랜잭션 안에서 호출한다. 워커 행을 잠근 뒤 배정 가능 여부와 여유 용량을 다시 본다.
     * 잠금은 호출자 트랜잭션이 끝날 때 풀리므로 같은 워커의 동시 poll은 여기서 한 줄로 선다.
     */
    public boolean lockForLease(String workerId) throws Exception {
        return tx.required(() -> {
            Worker w = workers.lockById(workerId).orElse(null);
            return w != null && w.dispatchable() && slots.countLeasedByWorker(w.id()) < w.effectiveCapacity();
        });
    }

    public Worker get(String workerId) throws Exception {
        return find(workerId).orElseThrow(() -> new NotFoundException("worker not found: " + workerId));
    }

    public Optional<Worker> find(String workerId) throws Exception {
        return tx.required(() -> workers.findById(workerId));
    }

    // --- 운영 조작 ---

    public Worker setPaused(String workerId, boolean paused) throws Exception {
        return mutate(workerId, w -> w.withFlags(paused, w.maintenance(), w.active()));
    }

    public Worker setMaintenance(String workerId, boolean maintenance) throws Exception {
        return mutate(workerId, w -> w.withFlags(w.paused(), maintenance, w.active()));
    }

    public Worker deactivate(String workerId) throws Exception {
        return mutate(workerId, w -> w.withFlags(w.paused(), w.maintenance(), false));
    }

    /** 수동 해제: 스트릭과 자동 정지를 모두 지운다 */
    public Worker resetFaults(String workerId) throws Exception {
        return mutate(workerId, w -> w.withCounters(w.successes(), w.faults(), 0)
                .withHealth(WorkerHealth.HEALTHY, null));
    }

    private Worker mutate(String workerId, UnaryOperator<Worker> change) throws Exception {
        for (int i = 0; i < MAX_CAS_RETRIES; i++) {
            Worker updated = tx.required(() -> {
                Worker current = workers.findById(workerId)
                        .orElseThrow(() -> new NotFoundException("worker not found: " + workerId));
                Worker next = change.apply(current);
                return workers.update(next, current.version()) ? next.withVersion(current.version() + 1) : null;
            });
            if (updated != null) return updated;
        }
        throw new IllegalStateException("worker " + workerId + " update kept losing CAS races");
    }

    private static void validateCapabilities(WorkerCapabilities caps) {
        if (caps == null) throw new ValidationException("worker capabilities are required");
        if (caps.models().isEmpty()) throw new ValidationException("worker must declare at least one model");
        if (caps.models().stream().anyMatch(m -> m == null || m.isBlank())) {
            throw new ValidationException("model names must not be blank");
        }
        if (caps.maxConcurrent() < 1) throw new ValidationException("maxConcurrent must be >= 1");
        if (caps.maxPixels() <= 0 && caps.maxTokens() <= 0) {
            throw new ValidationException("worker must accept image pixels or text tokens");
        }
        if (caps.maxPixels() < 0 || caps.maxTokens() < 0) {
            throw new ValidationException("capacity limits must not be negative");
        }
    }
}
