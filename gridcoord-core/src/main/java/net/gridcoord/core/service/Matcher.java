package net.gridcoord.core.service;

import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.PriorityKey;
import net.gridcoord.core.model.RequesterStats;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.registry.WorkerRegistry;
import net.gridcoord.core.spi.Clock;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.TxRunner;
import net.gridcoord.core.spi.UsageLedger;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 워커 poll 한 번에 대해 가장 알맞은 PENDING 슬롯을 고른다. 상태는 바꾸지 않는다 (리스는 LeaseManager).
 * 정렬: 요청자 우선순위 키 오름차순 → 슬롯 생성 시각 → 슬롯 번호.
 */
public final class Matcher {
    private final JobSlotRepository slots;
    private final WorkerRegistry workers;
    private final UsageLedger usage;
    private final PriorityScorer scorer;
    private final CooldownPolicy cooldown;
    private final CoordinatorSettings settings;
    private final TxRunner tx;
    private final Clock clock;

    public Matcher(JobSlotRepository slots,
                   WorkerRegistry workers,
                   UsageLedger usage,
                   PriorityScorer scorer,
                   CooldownPolicy cooldown,
                   CoordinatorSettings settings,
                   TxRunner tx,
                   Clock clock) {
        this.slots = slots;
        this.workers = workers;
        this.usage = usage;
        this.scorer = scorer;
        this.cooldown = cooldown;
        this.settings = settings;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 자격 없는 워커, 맞는 슬롯 없음 → empty (예외 아님).
     * excluded는 같은 poll 안에서 이미 경합에 진 슬롯.
     */
    public Optional<JobSlot> findSlotFor(String workerId, WorkerCapabilities declared, Set<String> excluded) throws Exception {
        return tx.required(() -> {
            Worker worker = workers.find(workerId).orElse(null);
            if (worker == null || !worker.dispatchable() || !workers.hasSpareCapacity(worker)) {
                return Optional.<JobSlot>empty();
            }
            Instant now = clock.now();
            Map<String, PriorityKey> keys = new HashMap<>();

            JobSlot best = null;
            PriorityKey bestKey = null;
            for (JobSlot s : slots.findPendingFor(declared, settings.matcherScanLimit())) {
                if (excluded.contains(s.id())) continue;
                if (!matches(s, workerId, declared, now)) continue;

                PriorityKey key = keys.get(s.requesterId());
                if (key == null) {
                    key = priorityOf(s, now);
                    keys.put(s.requesterId(), key);
                }
                if (best == null || ORDER.compare(new Candidate(s, key), new Candidate(best, bestKey)) < 0) {
                    best = s;
                    bestKey = key;
                }
            }
            return Optional.ofNullable(best);
        });
    }

    boolean matches(JobSlot s, String workerId, WorkerCapabilities declared, Instant now) {
        if (declared.resolveModel(s.models()) == null) return false;
        if (!declared.fits(s.params())) return false;
        if (s.nsfw() && !declared.acceptsNsfw()) return false;
        return !s.coolingDownFor(workerId, now, cooldown.cooldownAfter(s.attempt()));
    }

    private PriorityKey priorityOf(JobSlot s, Instant now) throws Exception {
        RequesterStats stats = usage.statsFor(s.requesterId()).withTrustTier(s.trustTier());
        return scorer.score(stats, now);
    }

    private record Candidate(JobSlot slot, PriorityKey key) {}

    private static final Comparator<Candidate> ORDER = Comparator
            .comparing(Candidate::key)
            .thenComparing(c -> c.slot().createdAt())
            .thenComparing(c -> c.slot().requestId())
            .thenComparingInt(c -> c.slot().slotIndex());
}
