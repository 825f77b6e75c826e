package net.gridcoord.core.spi;

import net.gridcoord.core.model.RequesterStats;

import java.time.Instant;

/** 외부 Accounting/Ledger 서비스. 최근 사용량은 반감기로 감쇠된 누적치다. */
public interface UsageLedger {
    /** 기록이 없으면 recentUsage=0 인 통계 (trustTier는 호출자가 채운다) */
    RequesterStats statsFor(String requesterId) throws Exception;

    void recordUsage(String requesterId, double workloadUnits, Instant at) throws Exception;
}
