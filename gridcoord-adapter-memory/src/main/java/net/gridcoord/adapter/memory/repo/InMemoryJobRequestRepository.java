package net.gridcoord.adapter.memory.repo;

import net.gridcoord.adapter.memory.RowLocks;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.model.RequestState;
import net.gridcoord.core.spi.JobRequestRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryJobRequestRepository implements JobRequestRepository {
    private final ConcurrentHashMap<String, JobRequest> requests = new ConcurrentHashMap<>();
    private final InMemoryJobSlotRepository slots;
    private final RowLocks locks;

    public InMemoryJobRequestRepository(InMemoryJobSlotRepository slots, RowLocks locks) {
        this.slots = slots;
        this.locks = locks;
    }

    @Override
    public void insert(JobRequest request) {
        if (requests.putIfAbsent(request.id(), request) != null) {
            throw new IllegalStateException("duplicate request id " + request.id());
        }
    }

    @Override
    public Optional<JobRequest> findById(String id) {
        return Optional.ofNullable(requests.get(id));
    }

    @Override
    public Optional<JobRequest> lockById(String id) {
        if (!requests.containsKey(id)) return Optional.empty();
        locks.lock("request:" + id);
        return findById(id);
    }

    @Override
    public boolean update(JobRequest request, long expectedVersion) {
        boolean[] applied = {false};
        requests.computeIfPresent(request.id(), (id, current) -> {
            if (current.version() != expectedVersion) return current;
            applied[0] = true;
            return request.withVersion(expectedVersion + 1);
        });
        return applied[0];
    }

    @Override
    public List<JobRequest> findOpenExpiredAt(Instant now, int limit) {
        return requests.values().stream()
                .filter(r -> r.state() == RequestState.ACTIVE && !r.closed() && r.expiredAt(now))
                .sorted(Comparator.comparing(JobRequest::expiresAt))
                .limit(limit)
                .toList();
    }

    @Override
    public int deleteFinishedBefore(Instant threshold) {
        List<String> victims = new ArrayList<>();
        for (JobRequest r : requests.values()) {
            if (r.state().finished() && r.finishedAt() != null && r.finishedAt().isBefore(threshold)) {
                victims.add(r.id());
            }
        }
        for (String id : victims) {
            requests.remove(id);
            slots.deleteByRequest(id);
        }
        return victims.size();
    }
}
