package net.gridcoord.adapter.memory;

import net.gridcoord.adapter.memory.repo.InMemoryJobRequestRepository;
import net.gridcoord.adapter.memory.repo.InMemoryJobSlotRepository;
import net.gridcoord.adapter.memory.repo.InMemoryWorkerRepository;
import net.gridcoord.core.maintenance.ReconciliationLoop;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.RequestDescriptor;
import net.gridcoord.core.model.SlotAssignment;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.model.WorkerDescriptor;
import net.gridcoord.core.registry.WorkerRegistry;
import net.gridcoord.core.service.CooldownPolicy;
import net.gridcoord.core.service.CoordinatorSettings;
import net.gridcoord.core.service.JobLifecycleCoordinator;
import net.gridcoord.core.service.LeaseManager;
import net.gridcoord.core.service.LeaseTtlPolicy;
import net.gridcoord.core.service.Matcher;
import net.gridcoord.core.service.PriorityScorer;
import net.gridcoord.core.service.WorkSignal;
import net.gridcoord.core.spi.OutcomeListener;
import net.gridcoord.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.List;

/**
 * 메모리 어댑터 위에 코어 서비스를 조립하는 공통 베이스.
 * 매 테스트마다 저장소와 시계를 새로 만들어 격리한다.
 */
public abstract class TestSupport {
    protected static final Instant T0 = Instant.parse("2025-06-01T09:00:00Z");
    protected static final String KEY_ALICE = "key-alice";
    protected static final String KEY_BOB = "key-bob";

    protected MutableClock clock;
    protected CoordinatorSettings settings;
    protected TxRunner tx;
    protected InMemoryJobSlotRepository slots;
    protected InMemoryJobRequestRepository requests;
    protected InMemoryWorkerRepository workerRepo;
    protected InMemoryUsageLedger usage;
    protected StaticAccountService accounts;
    protected RecordingListener events;
    protected WorkSignal signal;

    protected WorkerRegistry registry;
    protected LeaseManager leases;
    protected Matcher matcher;
    protected JobLifecycleCoordinator coordinator;
    protected ReconciliationLoop reconciliation;

    @BeforeEach
    void assemble() {
        rebuild(settings());
    }

    /** 하위 테스트가 튜닝값을 바꿀 때 재정의 */
    protected CoordinatorSettings settings() {
        return CoordinatorSettings.defaults();
    }

    protected void rebuild(CoordinatorSettings s) {
        rebuild(s, null);
    }

    protected void rebuild(CoordinatorSettings s, OutcomeListener listenerOverride) {
        settings = s;
        clock = new MutableClock(T0);
        tx = new InMemoryTxRunner();
        slots = new InMemoryJobSlotRepository();
        requests = new InMemoryJobRequestRepository(slots, new RowLocks());
        workerRepo = new InMemoryWorkerRepository(new RowLocks());
        usage = new InMemoryUsageLedger(s.usageHalfLife());
        accounts = new StaticAccountService()
                .put(KEY_ALICE, "alice", 0)
                .put(KEY_BOB, "bob", 0);
        events = new RecordingListener();
        signal = new WorkSignal();

        var ttl = new LeaseTtlPolicy(s);
        registry = new WorkerRegistry(workerRepo, slots, tx, clock, s);
        leases = new LeaseManager(slots, requests, registry, usage,
                listenerOverride == null ? events : listenerOverride, ttl, s, signal, tx, clock);
        matcher = new Matcher(slots, registry, usage, new PriorityScorer(s.usageHalfLife()),
                CooldownPolicy.fixed(s.faultCooldown()), s, tx, clock);
        coordinator = new JobLifecycleCoordinator(requests, slots, registry, matcher, leases, accounts,
                signal, s, tx, clock);
        reconciliation = new ReconciliationLoop(slots, requests, leases, tx, clock);
    }

    // ---------- helpers ----------

    protected static WorkerCapabilities caps(int maxConcurrent, String... models) {
        return new WorkerCapabilities(List.of(models), maxConcurrent, 1024L * 1024L, 4096, false);
    }

    protected String registerWorker(String name, WorkerCapabilities c) throws Exception {
        return registry.register(new WorkerDescriptor("owner-" + name, name, c));
    }

    protected String submit(String apiKey, int n, String... models) throws Exception {
        return coordinator.submitRequest(new RequestDescriptor(apiKey, n,
                GenerationParams.image(512, 512, 30, "k_euler"), List.of(models), false, null, null));
    }

    protected SlotAssignment pollOrFail(String workerId, WorkerCapabilities c) throws Exception {
        return coordinator.pollForWork(workerId, c)
                .orElseThrow(() -> new AssertionError("expected work for " + workerId));
    }

    protected JobSlot slot(String slotId) throws Exception {
        return tx.required(() -> slots.findById(slotId)).orElseThrow();
    }
}
