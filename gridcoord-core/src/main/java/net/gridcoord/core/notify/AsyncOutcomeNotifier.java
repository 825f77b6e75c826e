package net.gridcoord.core.notify;

import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.model.SlotOutcomeEvent;
import net.gridcoord.core.spi.OutcomeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 종료 이벤트를 executor로 넘겨 코어 전이 경로를 막지 않게 한다.
 * 하위 리스너의 실패는 로그로만 남는다.
 */
public final class AsyncOutcomeNotifier implements OutcomeListener {
    private static final Logger log = LoggerFactory.getLogger(AsyncOutcomeNotifier.class);

    private final Executor executor;
    private final List<OutcomeListener> delegates;

    public AsyncOutcomeNotifier(Executor executor, List<OutcomeListener> delegates) {
        this.executor = executor;
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onSlotTerminal(SlotOutcomeEvent event) {
        for (OutcomeListener l : delegates) {
            dispatch("slot " + event.slotId(), () -> l.onSlotTerminal(event));
        }
    }

    @Override
    public void onRequestFinished(RequestStatus status) {
        for (OutcomeListener l : delegates) {
            dispatch("request " + status.requestId(), () -> l.onRequestFinished(status));
        }
    }

    private void dispatch(String subject, Runnable call) {
        try {
            executor.execute(() -> {
                try {
                    call.run();
                } catch (RuntimeException e) {
                    log.warn("Outcome notification for {} failed: {}", subject, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Outcome notification for {} dropped: executor rejected it", subject);
        }
    }
}
