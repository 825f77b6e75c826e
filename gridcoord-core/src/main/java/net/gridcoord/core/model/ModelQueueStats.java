package net.gridcoord.core.model;

import java.time.Duration;

/** 모델별 대기/진행 현황. 요청이 모델을 지정하지 않았으면 model = "*" */
public record ModelQueueStats(
        String model,
        int pending,
        int leased,
        Duration oldestPendingAge
) {}
