package net.gridcoord.adapter.memory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 스레드에 묶인 메모리 "트랜잭션" 범위. 범위 안에서 잡은 행 잠금을 범위가 끝날 때 한 번에 푼다.
 * 롤백은 없다. 쓰기는 레코드 단위 CAS로 즉시 반영된다.
 */
public final class MemoryTxContext {
    private static final ThreadLocal<MemoryTxContext> LOCAL = new ThreadLocal<>();

    private final Deque<ReentrantLock> held = new ArrayDeque<>();

    private MemoryTxContext() {}

    static MemoryTxContext open() {
        MemoryTxContext ctx = new MemoryTxContext();
        LOCAL.set(ctx);
        return ctx;
    }

    public static MemoryTxContext get() { return LOCAL.get(); }

    static void set(MemoryTxContext ctx) {
        if (ctx == null) LOCAL.remove();
        else LOCAL.set(ctx);
    }

    void hold(ReentrantLock lock) {
        held.push(lock);
    }

    void releaseAll() {
        while (!held.isEmpty()) held.pop().unlock();
    }
}
