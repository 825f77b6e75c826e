package net.gridcoord.adapter.memory.repo;

import net.gridcoord.adapter.memory.RowLocks;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.spi.WorkerRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryWorkerRepository implements WorkerRepository {
    private final ConcurrentHashMap<String, Worker> workers = new ConcurrentHashMap<>();
    private final RowLocks locks;

    public InMemoryWorkerRepository(RowLocks locks) {
        this.locks = locks;
    }

    @Override
    public synchronized void insert(Worker worker) {
        // 이름 유일성 (JDBC에서는 UNIQUE 제약)
        if (findByName(worker.name()).isPresent() || workers.containsKey(worker.id())) {
            throw new IllegalStateException("duplicate worker " + worker.name());
        }
        workers.put(worker.id(), worker);
    }

    @Override
    public Optional<Worker> findById(String id) {
        return Optional.ofNullable(workers.get(id));
    }

    @Override
    public Optional<Worker> findByName(String name) {
        return workers.values().stream().filter(w -> w.name().equals(name)).findFirst();
    }

    @Override
    public Optional<Worker> lockById(String id) {
        if (!workers.containsKey(id)) return Optional.empty();
        locks.lock("worker:" + id);
        return findById(id);
    }

    @Override
    public List<Worker> findAll() {
        return workers.values().stream().sorted(Comparator.comparing(Worker::createdAt)).toList();
    }

    @Override
    public boolean update(Worker worker, long expectedVersion) {
        boolean[] applied = {false};
        workers.computeIfPresent(worker.id(), (id, current) -> {
            if (current.version() != expectedVersion) return current;
            applied[0] = true;
            return worker.withVersion(expectedVersion + 1);
        });
        return applied[0];
    }
}
