package net.gridcoord.core.spi;

import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.model.SlotOutcomeEvent;

/**
 * 종료 이벤트 훅 (웹훅, 앵커링, 분석). 코어는 fire-and-forget으로 호출하며
 * 구현이 실패해도 상태 전이는 되돌리지 않는다.
 */
public interface OutcomeListener {
    OutcomeListener NOOP = e -> {};

    void onSlotTerminal(SlotOutcomeEvent event);

    default void onRequestFinished(RequestStatus status) {}
}
