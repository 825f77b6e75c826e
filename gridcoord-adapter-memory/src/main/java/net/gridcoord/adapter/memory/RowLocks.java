package net.gridcoord.adapter.memory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/** SELECT ... FOR UPDATE 대용. 잠금은 현재 MemoryTxContext가 끝날 때 풀린다. */
public final class RowLocks {
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public void lock(String key) {
        MemoryTxContext ctx = MemoryTxContext.get();
        if (ctx == null) throw new IllegalStateException("MemoryTxContext required");
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        ctx.hold(lock);
    }
}
