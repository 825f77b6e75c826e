package net.gridcoord.adapter.memory.repo;

import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.SlotState;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.spi.JobSlotRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryJobSlotRepository implements JobSlotRepository {
    private static final Comparator<JobSlot> QUEUE_ORDER = Comparator
            .comparing(JobSlot::createdAt)
            .thenComparing(JobSlot::requestId)
            .thenComparingInt(JobSlot::slotIndex);

    private final ConcurrentHashMap<String, JobSlot> slots = new ConcurrentHashMap<>();

    @Override
    public void insertAll(List<JobSlot> batch) {
        for (JobSlot s : batch) {
            if (slots.putIfAbsent(s.id(), s) != null) {
                throw new IllegalStateException("duplicate slot id " + s.id());
            }
        }
    }

    @Override
    public Optional<JobSlot> findById(String id) {
        return Optional.ofNullable(slots.get(id));
    }

    @Override
    public List<JobSlot> findByRequest(String requestId) {
        return slots.values().stream()
                .filter(s -> s.requestId().equals(requestId))
                .sorted(Comparator.comparingInt(JobSlot::slotIndex))
                .toList();
    }

    @Override
    public List<JobSlot> findPending(int limit) {
        return slots.values().stream()
                .filter(s -> s.state() == SlotState.PENDING)
                .sorted(QUEUE_ORDER)
                .limit(limit)
                .toList();
    }

    @Override
    public List<JobSlot> findPendingFor(WorkerCapabilities worker, int limit) {
        List<JobSlot> eligible = slots.values().stream()
                .filter(s -> s.state() == SlotState.PENDING)
                .filter(s -> worker.resolveModel(s.models()) != null)
                .filter(s -> worker.fits(s.params()))
                .filter(s -> !s.nsfw() || worker.acceptsNsfw())
                .sorted(QUEUE_ORDER)
                .toList();

        Map<String, Integer> seen = new HashMap<>();
        List<Ranked> ranked = new ArrayList<>(eligible.size());
        for (JobSlot s : eligible) {
            ranked.add(new Ranked(s, seen.merge(s.requesterId(), 1, Integer::sum)));
        }
        return ranked.stream()
                .sorted(Comparator.comparingInt(Ranked::rank).thenComparing(Ranked::slot, QUEUE_ORDER))
                .limit(limit)
                .map(Ranked::slot)
                .toList();
    }

    private record Ranked(JobSlot slot, int rank) {}

    @Override
    public List<JobSlot> findLeaseExpiredAt(Instant now, int limit) {
        return slots.values().stream()
                .filter(s -> s.leaseExpiredAt(now))
                .sorted(Comparator.comparing(JobSlot::leaseExpiresAt))
                .limit(limit)
                .toList();
    }

    @Override
    public List<JobSlot> findLeased(int limit) {
        return slots.values().stream()
                .filter(s -> s.state() == SlotState.LEASED)
                .sorted(Comparator.comparing(JobSlot::leaseGrantedAt))
                .limit(limit)
                .toList();
    }

    @Override
    public int countLeasedByWorker(String workerId) {
        return (int) slots.values().stream()
                .filter(s -> s.heldBy(workerId))
                .count();
    }

    @Override
    public boolean update(JobSlot slot, long expectedVersion) {
        boolean[] applied = {false};
        slots.computeIfPresent(slot.id(), (id, current) -> {
            if (current.version() != expectedVersion) return current;
            applied[0] = true;
            return slot.withVersion(expectedVersion + 1);
        });
        return applied[0];
    }

    /** 요청 삭제와 함께 호출된다 */
    public int deleteByRequest(String requestId) {
        int before = slots.size();
        slots.values().removeIf(s -> s.requestId().equals(requestId));
        return before - slots.size();
    }
}
