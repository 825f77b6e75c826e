package net.gridcoord.core.spi;

import java.time.Instant;

/** 시간 공급원. 테스트에서는 가변 시계를 꽂아 TTL/쿨다운을 즉시 재현한다. */
@FunctionalInterface
public interface Clock {
    Instant now();
}
