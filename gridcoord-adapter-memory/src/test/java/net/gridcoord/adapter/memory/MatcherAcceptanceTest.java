package net.gridcoord.adapter.memory;

import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.RequestDescriptor;
import net.gridcoord.core.model.SlotAssignment;
import net.gridcoord.core.model.SlotOutcome;
import net.gridcoord.core.model.WorkerCapabilities;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Matcher 인수 테스트
 * - 공정성(최근 사용량), FIFO 동점 처리, 모델/크기/콘텐츠 필터, 쿨다운, 용량
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class MatcherAcceptanceTest extends TestSupport {

    @Test
    void a1_lightRecentUser_isServedBeforeHeavyUser() throws Exception {
        usage.recordUsage("alice", 50.0, T0);
        usage.recordUsage("bob", 1.0, T0);

        String aliceReq = submit(KEY_ALICE, 1, "sdxl");
        String bobReq = submit(KEY_BOB, 1, "sdxl");
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);

        SlotAssignment first = pollOrFail(w, c);
        assertEquals(bobReq, first.requestId());
        assertNotEquals(aliceReq, first.requestId());
    }

    @Test
    void a2_equalUsage_fallsBackToSubmissionOrder() throws Exception {
        String early = submit(KEY_ALICE, 1, "sdxl");
        clock.advance(Duration.ofSeconds(1));
        submit(KEY_BOB, 1, "sdxl");
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);

        assertEquals(early, pollOrFail(w, c).requestId());
    }

    @Test
    void a3_usageDecays_soHeavyUserRecovers() throws Exception {
        usage.recordUsage("alice", 8.0, T0);
        clock.advance(Duration.ofHours(5));
        usage.recordUsage("bob", 1.0, clock.now());

        // alice: 8 * 2^-5 = 0.25 < bob: 1.0
        String aliceReq = submit(KEY_ALICE, 1, "sdxl");
        submit(KEY_BOB, 1, "sdxl");
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);

        assertEquals(aliceReq, pollOrFail(w, c).requestId());
    }

    @Test
    void a4_modelAndSizeFilters() throws Exception {
        submit(KEY_ALICE, 1, "flux.1-krea-dev");
        coordinator.submitRequest(new RequestDescriptor(KEY_BOB, 1,
                GenerationParams.image(2048, 2048, 30, null), List.of("sdxl"), false, null, null));

        WorkerCapabilities small = caps(1, "sdxl");
        String w = registerWorker("w1", small);
        assertTrue(coordinator.pollForWork(w, small).isEmpty());

        WorkerCapabilities flux = caps(1, "sdxl", "flux.1-krea-dev");
        SlotAssignment a = pollOrFail(w, flux);
        assertEquals("flux.1-krea-dev", a.model());
    }

    @Test
    void a5_nsfwRequests_onlyGoToWorkersThatAcceptThem() throws Exception {
        coordinator.submitRequest(new RequestDescriptor(KEY_ALICE, 1,
                GenerationParams.image(512, 512, 30, null), List.of("sdxl"), true, null, null));

        WorkerCapabilities sfw = caps(1, "sdxl");
        WorkerCapabilities nsfw = new WorkerCapabilities(List.of("sdxl"), 1, 1024L * 1024L, 0, true);
        String w1 = registerWorker("w1", sfw);
        String w2 = registerWorker("w2", nsfw);

        assertTrue(coordinator.pollForWork(w1, sfw).isEmpty());
        assertTrue(coordinator.pollForWork(w2, nsfw).isPresent());
    }

    @Test
    void a6_anyModelRequest_takesWorkersFirstModel() throws Exception {
        submit(KEY_ALICE, 1);
        WorkerCapabilities c = caps(1, "llama-3-8b", "sdxl");
        String w = registerWorker("w1", c);

        assertEquals("llama-3-8b", pollOrFail(w, c).model());
    }

    @Test
    void a7_cooldown_keepsSlotAwayFromFaultingWorker_untilWindowPasses() throws Exception {
        WorkerCapabilities c = caps(1, "sdxl");
        String w1 = registerWorker("w1", c);
        submit(KEY_ALICE, 1, "sdxl");

        SlotAssignment a = pollOrFail(w1, c);
        coordinator.submitResult(w1, a.slotId(), SlotOutcome.fault("OOM"));

        assertTrue(coordinator.pollForWork(w1, c).isEmpty());
        clock.advance(settings.faultCooldown().minusSeconds(1));
        assertTrue(coordinator.pollForWork(w1, c).isEmpty());

        // 영구 배제가 아니라 쿨다운 이후에는 다시 받을 수 있다
        clock.advance(Duration.ofSeconds(1));
        SlotAssignment again = pollOrFail(w1, c);
        assertEquals(a.slotId(), again.slotId());
        assertEquals(2, again.attempt());
    }

    @Test
    void a8_cooldownSlot_doesNotBlockOtherWork() throws Exception {
        WorkerCapabilities c = caps(1, "sdxl");
        String w1 = registerWorker("w1", c);
        submit(KEY_ALICE, 1, "sdxl");
        SlotAssignment faulted = pollOrFail(w1, c);
        coordinator.submitResult(w1, faulted.slotId(), SlotOutcome.fault("OOM"));

        clock.advance(Duration.ofSeconds(5));
        String later = submit(KEY_BOB, 1, "sdxl");

        assertEquals(later, pollOrFail(w1, c).requestId());
    }

    @Test
    void a9_pausedOrFullWorker_getsNothing() throws Exception {
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);
        submit(KEY_ALICE, 3, "sdxl");

        registry.setPaused(w, true);
        assertTrue(coordinator.pollForWork(w, c).isEmpty());
        registry.setPaused(w, false);

        pollOrFail(w, c);
        assertTrue(coordinator.pollForWork(w, c).isEmpty(), "declared capacity 1 already in use");
    }

    @Test
    void b1_findSlotFor_skipsExcludedSlots_andNeverMutates() throws Exception {
        WorkerCapabilities c = caps(2, "sdxl");
        String w = registerWorker("w1", c);
        String req = submit(KEY_ALICE, 2, "sdxl");

        Optional<JobSlot> first = matcher.findSlotFor(w, c, Set.of());
        assertTrue(first.isPresent());
        assertEquals(0, first.get().slotIndex());

        Optional<JobSlot> second = matcher.findSlotFor(w, c, Set.of(first.get().id()));
        assertEquals(1, second.orElseThrow().slotIndex());

        assertEquals(2, coordinator.getRequestStatus(req).pending());
        assertTrue(matcher.findSlotFor("nobody", c, Set.of()).isEmpty());
    }

    @Test
    void b2_autoPausedWorker_isSkipped_evenWithWork() throws Exception {
        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);
        for (int i = 0; i < settings.faultThreshold(); i++) registry.markOutcome(w, false);
        submit(KEY_ALICE, 1, "sdxl");

        assertTrue(coordinator.pollForWork(w, c).isEmpty());
        assertEquals(1, slots.findPending(10).size());
    }

    @Test
    void b3_backlogOfOtherModels_doesNotHideServableSlot() throws Exception {
        rebuild(settings().toBuilder().matcherScanLimit(5).build());
        submit(KEY_ALICE, 12, "sdxl");
        clock.advance(Duration.ofSeconds(1));
        String fluxReq = submit(KEY_BOB, 1, "flux.1-krea-dev");

        WorkerCapabilities flux = caps(1, "flux.1-krea-dev");
        String w = registerWorker("w1", flux);

        SlotAssignment a = pollOrFail(w, flux);
        assertEquals(fluxReq, a.requestId());
        assertEquals("flux.1-krea-dev", a.model());
    }

    @Test
    void b4_heavyRequesterBacklog_doesNotCrowdOutLightRequester() throws Exception {
        rebuild(settings().toBuilder().matcherScanLimit(5).build());
        usage.recordUsage("alice", 50.0, T0);
        submit(KEY_ALICE, 12, "sdxl");
        clock.advance(Duration.ofSeconds(1));
        String bobReq = submit(KEY_BOB, 1, "sdxl");

        WorkerCapabilities c = caps(1, "sdxl");
        String w = registerWorker("w1", c);

        assertEquals(bobReq, pollOrFail(w, c).requestId());
    }

    @Test
    void b5_pendingWindow_ranksEachRequestersOldestSlotFirst() throws Exception {
        String aliceReq = submit(KEY_ALICE, 3, "sdxl");
        clock.advance(Duration.ofSeconds(1));
        String bobReq = submit(KEY_BOB, 2, "sdxl");

        List<JobSlot> window = tx.required(() -> slots.findPendingFor(caps(1, "sdxl"), 3));
        assertEquals(List.of(aliceReq, bobReq, aliceReq), window.stream().map(JobSlot::requestId).toList());
        assertEquals(List.of(0, 0, 1), window.stream().map(JobSlot::slotIndex).toList());

        assertTrue(tx.required(() -> slots.findPendingFor(caps(1, "llama-3-8b"), 3)).isEmpty());
    }
}
