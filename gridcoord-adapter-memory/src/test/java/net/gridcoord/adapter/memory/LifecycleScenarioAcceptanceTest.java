package net.gridcoord.adapter.memory;

import net.gridcoord.core.error.UnauthorizedException;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.maintenance.ReconciliationLoop.ReconciliationReport;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.ModelQueueStats;
import net.gridcoord.core.model.RequestDescriptor;
import net.gridcoord.core.model.RequestState;
import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.model.SlotAssignment;
import net.gridcoord.core.model.SlotOutcome;
import net.gridcoord.core.model.SlotState;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.model.WorkerHealth;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 코디네이터 전체 흐름 시나리오
 * - 침묵한 워커의 작업이 회수되어 다른 워커에게 넘어가는 경로
 * - 한 슬롯이 끝내 실패하는 n=3 요청의 부분 성공
 * - 연속 실패 워커 차단 (실패 작업이 한 워커에게 몰리는 현상 방지)
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class LifecycleScenarioAcceptanceTest extends TestSupport {

    private static final String FLUX = "flux.1-krea-dev";

    @Test
    void s1_silentWorker_isReclaimed_andSecondWorkerCompletes() throws Exception {
        WorkerCapabilities c = caps(1, FLUX);
        String w1 = registerWorker("W1", c);
        String w2 = registerWorker("W2", c);
        String req = submit(KEY_ALICE, 1, FLUX);

        SlotAssignment first = pollOrFail(w1, c);
        assertEquals(Duration.ofSeconds(150), first.leaseTtl());

        // W1은 제출하지 않는다. TTL + 회수 주기 1회
        clock.advance(Duration.ofSeconds(150).plusMillis(5000));
        ReconciliationReport r = reconciliation.runOnce(Duration.ofDays(1));
        assertEquals(1, r.requeued);
        assertEquals(SlotState.PENDING, slot(first.slotId()).state());

        // 쿨다운 중인 W1에게는 다시 주지 않는다
        assertTrue(coordinator.pollForWork(w1, c).isEmpty());

        SlotAssignment second = pollOrFail(w2, c);
        assertEquals(first.slotId(), second.slotId());
        assertEquals(2, second.attempt());

        coordinator.submitResult(w2, second.slotId(), SlotOutcome.success("blob://flux/1.webp", 1234L, null));

        RequestStatus st = coordinator.getRequestStatus(req);
        assertEquals(RequestState.COMPLETE, st.state());
        assertEquals(SlotState.SUBMITTED_OK, st.slots().get(0).state());
        assertEquals(w2, st.slots().get(0).workerId());
        assertEquals(1, registry.get(w1).faults());
        assertEquals(1, registry.get(w2).successes());
    }

    @Test
    void s2_permanentFaultOnOneSlot_yieldsPartial() throws Exception {
        // 쿨다운 없이 같은 워커가 재시도를 모두 소진하게 한다
        rebuild(settings().toBuilder().faultCooldown(Duration.ZERO).build());
        WorkerCapabilities good = caps(3, "sdxl");
        WorkerCapabilities bad = caps(1, "sdxl");
        String wGood = registerWorker("good", good);
        String wBad = registerWorker("bad", bad);
        String req = submit(KEY_ALICE, 3, "sdxl");

        for (int i = 0; i < 2; i++) {
            SlotAssignment a = pollOrFail(wGood, good);
            coordinator.submitResult(wGood, a.slotId(), SlotOutcome.success("blob://ok-" + i, (long) i, null));
        }
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            SlotAssignment a = pollOrFail(wBad, bad);
            assertEquals(attempt, a.attempt());
            coordinator.submitResult(wBad, a.slotId(), SlotOutcome.fault("CUDA out of memory"));
        }

        RequestStatus st = coordinator.getRequestStatus(req);
        assertEquals(RequestState.PARTIAL, st.state());
        assertEquals(2, st.succeeded());
        assertEquals(1, st.failed());
        assertEquals(0, st.pending());
        assertTrue(st.done());
        assertThat(events.finished).singleElement()
                .satisfies(f -> assertEquals(RequestState.PARTIAL, f.state()));
    }

    @Test
    void s3_failingWorker_isCutOff_beforeItSwallowsTheQueue() throws Exception {
        rebuild(settings().toBuilder().faultCooldown(Duration.ZERO).maxAttempts(10).build());
        WorkerCapabilities c = caps(1, "sdxl");
        String failing = registerWorker("failing", c);
        String healthy = registerWorker("healthy", c);
        submit(KEY_ALICE, 10, "sdxl");

        int handed = 0;
        Optional<SlotAssignment> a;
        while ((a = coordinator.pollForWork(failing, c)).isPresent()) {
            handed++;
            coordinator.submitResult(failing, a.get().slotId(), SlotOutcome.fault("black image"));
        }
        assertEquals(settings.faultThreshold(), handed);

        int completed = 0;
        while ((a = coordinator.pollForWork(healthy, c)).isPresent()) {
            String slotId = a.get().slotId();
            coordinator.submitResult(healthy, slotId, SlotOutcome.success("blob://" + slotId, null, null));
            completed++;
        }
        assertEquals(10, completed);
        assertEquals(WorkerHealth.AUTO_PAUSED, registry.get(failing).health());
    }

    @Test
    void s4_submitRequest_validation() throws Exception {
        GenerationParams img = GenerationParams.image(512, 512, 30, null);

        assertThrows(UnauthorizedException.class, () -> coordinator.submitRequest(
                new RequestDescriptor("bogus", 1, img, List.of("sdxl"), false, null, null)));
        assertThrows(UnauthorizedException.class, () -> coordinator.submitRequest(
                new RequestDescriptor(null, 1, img, List.of("sdxl"), false, null, null)));
        assertThrows(ValidationException.class, () -> coordinator.submitRequest(
                new RequestDescriptor(KEY_ALICE, 0, img, List.of("sdxl"), false, null, null)));
        assertThrows(ValidationException.class, () -> coordinator.submitRequest(
                new RequestDescriptor(KEY_ALICE, settings.maxSlotsPerRequest() + 1, img, List.of(), false, null, null)));
        assertThrows(ValidationException.class, () -> coordinator.submitRequest(
                new RequestDescriptor(KEY_ALICE, 1, GenerationParams.image(0, 512, 30, null), List.of(), false, null, null)));
        assertThrows(ValidationException.class, () -> coordinator.submitRequest(
                new RequestDescriptor(KEY_ALICE, 1, GenerationParams.text(0), List.of(), false, null, null)));
        assertThrows(ValidationException.class, () -> coordinator.submitRequest(
                new RequestDescriptor(KEY_ALICE, 1, img, List.of(), false, "ftp://hook", null)));

        assertTrue(slots.findPending(100).isEmpty());
    }

    @Test
    void s5_slotCount_isFixedAtCreation() throws Exception {
        String req = submit(KEY_BOB, 4, "sdxl");
        RequestStatus st = coordinator.getRequestStatus(req);

        assertEquals(4, st.total());
        assertEquals(4, st.pending());
        assertEquals("bob", st.requesterId());
        assertEquals(List.of(0, 1, 2, 3), st.slots().stream().map(RequestStatus.SlotView::slotIndex).toList());
    }

    @Test
    void s6_queueStats_perModel() throws Exception {
        submit(KEY_ALICE, 2, "sdxl");
        clock.advance(Duration.ofSeconds(30));
        submit(KEY_BOB, 1, FLUX);
        WorkerCapabilities c = caps(1, "sdxl");
        pollOrFail(registerWorker("w1", c), c);
        clock.advance(Duration.ofSeconds(30));

        List<ModelQueueStats> stats = coordinator.queueStats();
        ModelQueueStats sdxl = stats.stream().filter(s -> s.model().equals("sdxl")).findFirst().orElseThrow();
        ModelQueueStats flux = stats.stream().filter(s -> s.model().equals(FLUX)).findFirst().orElseThrow();

        assertEquals(1, sdxl.pending());
        assertEquals(1, sdxl.leased());
        assertEquals(Duration.ofSeconds(60), sdxl.oldestPendingAge());
        assertEquals(1, flux.pending());
        assertEquals(0, flux.leased());
        assertEquals(Duration.ofSeconds(30), flux.oldestPendingAge());
    }

    @Test
    void s7_textWorkload_matchesTextWorkers() throws Exception {
        String req = coordinator.submitRequest(new RequestDescriptor(KEY_ALICE, 1,
                GenerationParams.text(2048), List.of("llama-3-8b"), false, "https://hooks.example/done", null));
        WorkerCapabilities imageOnly = new WorkerCapabilities(List.of("llama-3-8b"), 1, 1024L * 1024L, 0, false);
        WorkerCapabilities text = new WorkerCapabilities(List.of("llama-3-8b"), 1, 0L, 4096, false);
        String wImage = registerWorker("img", imageOnly);
        String wText = registerWorker("txt", text);

        assertTrue(coordinator.pollForWork(wImage, imageOnly).isEmpty());
        SlotAssignment a = pollOrFail(wText, text);
        // 2048 tokens = 4 units → 60s + 120s
        assertEquals(Duration.ofSeconds(180), a.leaseTtl());

        coordinator.submitResult(wText, a.slotId(), SlotOutcome.success("text://answer", null, null));
        assertEquals(RequestState.COMPLETE, coordinator.getRequestStatus(req).state());
        assertEquals("https://hooks.example/done", events.slots.get(0).webhookUrl());
        assertEquals(4.0, events.slots.get(0).workloadUnits());
    }
}
