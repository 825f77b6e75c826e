package net.gridcoord.core.service;

import java.time.Duration;

/**
 * 새 작업이 생겼음을 알리는 세대 카운터. 제출/재큐잉 시 증가한다.
 * 코어는 기다리지 않는다. awaitChange는 long-poll을 구현하는 전송 계층 전용이다.
 */
public final class WorkSignal {
    private final Object monitor = new Object();
    private long generation;

    public long generation() {
        synchronized (monitor) {
            return generation;
        }
    }

    public void notifyWork() {
        synchronized (monitor) {
            generation++;
            monitor.notifyAll();
        }
    }

    /** seen 이후 세대가 바뀌면 true, maxWait 안에 안 바뀌면 false */
    public boolean awaitChange(long seen, Duration maxWait) throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        synchronized (monitor) {
            while (generation == seen) {
                long left = deadline - System.nanoTime();
                if (left <= 0) return false;
                monitor.wait(Math.max(1L, left / 1_000_000L));
            }
            return true;
        }
    }
}
