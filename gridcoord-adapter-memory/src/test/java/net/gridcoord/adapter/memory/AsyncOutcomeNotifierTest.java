package net.gridcoord.adapter.memory;

import net.gridcoord.core.model.RequestState;
import net.gridcoord.core.model.SlotAssignment;
import net.gridcoord.core.model.SlotOutcome;
import net.gridcoord.core.model.SlotOutcomeEvent;
import net.gridcoord.core.model.SlotState;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.notify.AsyncOutcomeNotifier;
import net.gridcoord.core.spi.OutcomeListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/** 종료 이벤트 훅은 비동기로 흘러가며 느리거나 실패해도 전이를 막지 않는다 */
class AsyncOutcomeNotifierTest extends TestSupport {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void slowAndFailingListeners_doNotBlockTheTransition() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        OutcomeListener slow = e -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        };
        OutcomeListener failing = e -> { throw new IllegalStateException("anchoring service down"); };
        RecordingListener recorder = new RecordingListener();

        rebuild(settings(), new AsyncOutcomeNotifier(executor, List.of(slow, failing, recorder)));
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);
        String req = submit(KEY_ALICE, 1, "sdxl");
        SlotAssignment a = pollOrFail(w, c);

        assertEquals(SlotState.SUBMITTED_OK,
                coordinator.submitResult(w, a.slotId(), SlotOutcome.success("blob://x", 9L, null)).state());
        assertEquals(RequestState.COMPLETE, coordinator.getRequestStatus(req).state());

        await().atMost(Duration.ofSeconds(5)).until(() -> recorder.finished.size() == 1);
        SlotOutcomeEvent e = recorder.slots.get(0);
        assertEquals(a.slotId(), e.slotId());
        assertEquals(w, e.workerId());
        assertEquals(1.0, e.workloadUnits());

        release.countDown();
    }

    @Test
    void rejectedExecution_isDropped_notThrown() throws Exception {
        executor.shutdown();
        RecordingListener recorder = new RecordingListener();
        var notifier = new AsyncOutcomeNotifier(executor, List.of(recorder));

        rebuild(settings().toBuilder().maxAttempts(1).build(), notifier);
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);
        submit(KEY_ALICE, 1, "sdxl");
        SlotAssignment a = pollOrFail(w, c);

        assertEquals(SlotState.FAULTED, coordinator.submitResult(w, a.slotId(), SlotOutcome.fault("x")).state());
        assertTrue(recorder.slots.isEmpty());
    }
}
