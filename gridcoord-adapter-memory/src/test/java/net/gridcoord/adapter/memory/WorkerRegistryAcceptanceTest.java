package net.gridcoord.adapter.memory;

import net.gridcoord.core.error.NotFoundException;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.model.WorkerDescriptor;
import net.gridcoord.core.model.WorkerHealth;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkerRegistry 인수 테스트
 * - 등록 검증, 하트비트, 연속 실패 서킷 브레이커(auto-pause → probation → healthy)
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class WorkerRegistryAcceptanceTest extends TestSupport {

    private static final GenerationParams SMALL = GenerationParams.image(512, 512, 20, null);

    @Test
    void a1_register_rejectsEmptyOrZeroCapacity() {
        assertThrows(ValidationException.class, () -> registerWorker("w-empty",
                new WorkerCapabilities(List.of(), 1, 1_000_000L, 0, false)));
        assertThrows(ValidationException.class, () -> registerWorker("w-zero", caps(0, "sdxl")));
        assertThrows(ValidationException.class, () -> registerWorker("w-nothing",
                new WorkerCapabilities(List.of("sdxl"), 1, 0L, 0, false)));
        assertThrows(ValidationException.class, () -> registry.register(
                new WorkerDescriptor("owner", " ", caps(1, "sdxl"))));
    }

    @Test
    void a2_register_rejectsDuplicateName() throws Exception {
        registerWorker("w1", caps(1, "sdxl"));
        assertThrows(ValidationException.class, () -> registerWorker("w1", caps(2, "sdxl")));
    }

    @Test
    void a3_heartbeat_refreshesCapabilities_andUnknownIsNotFound() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));
        clock.advance(Duration.ofSeconds(30));

        Worker w = registry.updateHeartbeat(id, caps(2, "sdxl", "flux.1-krea-dev"));
        assertEquals(T0.plusSeconds(30), w.lastCheckInAt());
        assertEquals(2, w.capabilities().maxConcurrent());
        assertTrue(w.capabilities().serves("flux.1-krea-dev"));

        assertThrows(NotFoundException.class, () -> registry.updateHeartbeat("nope", caps(1, "sdxl")));
    }

    @Test
    void a4_faultStreak_reachingThreshold_autoPauses() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));

        for (int i = 0; i < settings.faultThreshold() - 1; i++) registry.markOutcome(id, false);
        assertEquals(WorkerHealth.HEALTHY, registry.get(id).health());
        assertTrue(registry.isEligible(id, "sdxl", SMALL));

        Worker paused = registry.markOutcome(id, false);
        assertEquals(WorkerHealth.AUTO_PAUSED, paused.health());
        assertEquals(T0.plus(settings.probationDelay()), paused.autoPausedUntil());
        assertEquals(settings.faultThreshold(), paused.faultStreak());
        assertFalse(registry.isEligible(id, "sdxl", SMALL));
        // 사용자 paused 플래그와는 별개
        assertFalse(paused.paused());
    }

    @Test
    void a5_success_clearsStreak() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));

        for (int i = 0; i < 4; i++) registry.markOutcome(id, false);
        Worker w = registry.markOutcome(id, true);
        assertEquals(0, w.faultStreak());
        assertEquals(4, w.faults());
        assertEquals(1, w.successes());

        for (int i = 0; i < 4; i++) registry.markOutcome(id, false);
        assertEquals(WorkerHealth.HEALTHY, registry.get(id).health());
    }

    @Test
    void a6_probation_afterDelay_thenSuccessRestoresHealth() throws Exception {
        String id = registerWorker("w1", caps(4, "sdxl"));
        for (int i = 0; i < settings.faultThreshold(); i++) registry.markOutcome(id, false);

        // 대기 시간 전 하트비트는 상태를 바꾸지 않는다
        clock.advance(settings.probationDelay().minusSeconds(1));
        assertEquals(WorkerHealth.AUTO_PAUSED, registry.updateHeartbeat(id, caps(4, "sdxl")).health());

        clock.advance(Duration.ofSeconds(1));
        Worker probation = registry.updateHeartbeat(id, caps(4, "sdxl"));
        assertEquals(WorkerHealth.PROBATION, probation.health());
        assertEquals(1, probation.effectiveCapacity());
        assertTrue(registry.isEligible(id, "sdxl", SMALL));

        Worker healed = registry.markOutcome(id, true);
        assertEquals(WorkerHealth.HEALTHY, healed.health());
        assertEquals(0, healed.faultStreak());
        assertEquals(4, healed.effectiveCapacity());
    }

    @Test
    void a7_probationFailure_extendsPause() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));
        for (int i = 0; i < settings.faultThreshold(); i++) registry.markOutcome(id, false);
        clock.advance(settings.probationDelay());
        registry.updateHeartbeat(id, caps(1, "sdxl"));

        Worker again = registry.markOutcome(id, false);
        assertEquals(WorkerHealth.AUTO_PAUSED, again.health());
        assertEquals(clock.now().plus(settings.probationDelay()), again.autoPausedUntil());
        assertFalse(registry.isEligible(id, "sdxl", SMALL));
    }

    @Test
    void a8_manualReset_clearsAutoPause() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));
        for (int i = 0; i < settings.faultThreshold(); i++) registry.markOutcome(id, false);

        Worker reset = registry.resetFaults(id);
        assertEquals(WorkerHealth.HEALTHY, reset.health());
        assertNull(reset.autoPausedUntil());
        assertEquals(0, reset.faultStreak());
        assertTrue(registry.isEligible(id, "sdxl", SMALL));
    }

    @Test
    void a9_operatorFlags_makeIneligible() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));

        registry.setPaused(id, true);
        assertFalse(registry.isEligible(id, "sdxl", SMALL));
        registry.setPaused(id, false);

        registry.setMaintenance(id, true);
        assertFalse(registry.isEligible(id, "sdxl", SMALL));
        registry.setMaintenance(id, false);
        assertTrue(registry.isEligible(id, "sdxl", SMALL));

        Worker gone = registry.deactivate(id);
        assertFalse(gone.active());
        assertFalse(registry.isEligible(id, "sdxl", SMALL));
        // 물리 삭제는 하지 않는다
        assertTrue(registry.find(id).isPresent());
    }

    @Test
    void b1_eligibility_checksModelSizeAndCapacity() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));

        assertFalse(registry.isEligible(id, "flux.1-krea-dev", SMALL));
        assertFalse(registry.isEligible(id, "sdxl", GenerationParams.image(2048, 2048, 20, null)));
        assertFalse(registry.isEligible("unknown", "sdxl", SMALL));

        submit(KEY_ALICE, 2, "sdxl");
        pollOrFail(id, caps(1, "sdxl"));
        // 선언 용량 1을 모두 사용 중
        assertFalse(registry.isEligible(id, "sdxl", SMALL));
    }

    @Test
    void b2_counters_areVersioned() throws Exception {
        String id = registerWorker("w1", caps(1, "sdxl"));
        long v0 = registry.get(id).version();

        registry.markOutcome(id, true);
        registry.markOutcome(id, false);

        Worker w = registry.get(id);
        assertEquals(v0 + 2, w.version());
        assertEquals(1, w.successes());
        assertEquals(1, w.faults());
    }
}
