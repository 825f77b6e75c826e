package net.gridcoord.integration.spring.sched;

import net.gridcoord.adapter.memory.InMemoryTxRunner;
import net.gridcoord.adapter.memory.InMemoryUsageLedger;
import net.gridcoord.adapter.memory.RowLocks;
import net.gridcoord.adapter.memory.StaticAccountService;
import net.gridcoord.adapter.memory.repo.InMemoryJobRequestRepository;
import net.gridcoord.adapter.memory.repo.InMemoryJobSlotRepository;
import net.gridcoord.adapter.memory.repo.InMemoryWorkerRepository;
import net.gridcoord.core.maintenance.ReconciliationLoop;
import net.gridcoord.core.maintenance.ReconciliationLoop.ReconciliationReport;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.RequestDescriptor;
import net.gridcoord.core.model.RequestState;
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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationSchedulerTest {

    @Test
    void sweep_expiresOverdueRequests_andPurgesWithConfiguredRetention() throws Exception {
        var s = CoordinatorSettings.defaults();
        var now = new AtomicReference<>(Instant.parse("2025-06-01T09:00:00Z"));
        var tx = new InMemoryTxRunner();
        var slots = new InMemoryJobSlotRepository();
        var requests = new InMemoryJobRequestRepository(slots, new RowLocks());
        var usage = new InMemoryUsageLedger(s.usageHalfLife());
        var registry = new WorkerRegistry(new InMemoryWorkerRepository(new RowLocks()), slots, tx, now::get, s);
        var leases = new LeaseManager(slots, requests, registry, usage, OutcomeListener.NOOP,
                new LeaseTtlPolicy(s), s, new WorkSignal(), tx, now::get);
        var matcher = new Matcher(slots, registry, usage, new PriorityScorer(s.usageHalfLife()),
                CooldownPolicy.fixed(s.faultCooldown()), s, tx, now::get);
        var coordinator = new JobLifecycleCoordinator(requests, slots, registry, matcher, leases,
                new StaticAccountService().put("k", "alice", 0), new WorkSignal(), s, tx, now::get);
        var scheduler = new ReconciliationScheduler(new ReconciliationLoop(slots, requests, leases, tx, now::get));
        scheduler.setFinishedRetention(Duration.ofMinutes(30));

        String req = coordinator.submitRequest(new RequestDescriptor("k", 2,
                GenerationParams.image(512, 512, 20, null), List.of(), false, null, Duration.ofMinutes(5)));

        now.set(now.get().plus(Duration.ofMinutes(6)));
        ReconciliationReport first = scheduler.sweep();
        assertEquals(1, first.expiredRequests);
        assertEquals(1, first.finishedRequests);
        assertEquals(RequestState.EXPIRED, coordinator.getRequestStatus(req).state());

        now.set(now.get().plus(Duration.ofMinutes(31)));
        ReconciliationReport second = scheduler.sweep();
        assertEquals(1, second.purgedRequests);
    }
}
