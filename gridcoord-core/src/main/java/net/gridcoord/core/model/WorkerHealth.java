package net.gridcoord.core.model;

/**
 * 연속 실패 서킷 브레이커 상태. 사용자가 건 paused 플래그와는 별개다.
 * AUTO_PAUSED → (대기 시간 경과 후 하트비트) → PROBATION → 성공 시 HEALTHY / 실패 시 AUTO_PAUSED
 * 알 수 없는 저장 값은 AUTO_PAUSED로 읽는다. 해제 시각이 없으므로 운영자가 고칠 때까지 배정되지 않는다.
 */
public enum WorkerHealth {
    HEALTHY, AUTO_PAUSED, PROBATION;

    public static WorkerHealth from(String s) {
        if (s == null) return AUTO_PAUSED;
        try { return WorkerHealth.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return AUTO_PAUSED; }
    }
    public String code() { return name(); }
}
