package net.gridcoord.core.service;

import java.time.Duration;

/** 슬롯에서 방금 실패한 워커에게 같은 슬롯을 다시 주지 않는 기간 */
public interface CooldownPolicy {
    Duration cooldownAfter(int attempt);

    /** 고정 쿨다운 정책 */
    static CooldownPolicy fixed(Duration cooldown) {
        return attempt -> cooldown;
    }
}
