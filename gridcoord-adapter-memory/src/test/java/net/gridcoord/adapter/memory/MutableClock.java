package net.gridcoord.adapter.memory;

import net.gridcoord.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** 테스트용 가변 시계: TTL/쿨다운 시나리오를 기다림 없이 재현 */
public final class MutableClock implements Clock {
    private final AtomicReference<Instant> now;

    public MutableClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public Instant advance(Duration d) {
        return now.updateAndGet(t -> t.plus(d));
    }
}
