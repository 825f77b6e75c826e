package net.gridcoord.app.web;

import net.gridcoord.app.web.dto.PopRequest;
import net.gridcoord.app.web.dto.PopResponse;
import net.gridcoord.app.web.dto.ProgressRequest;
import net.gridcoord.app.web.dto.SlotReceipt;
import net.gridcoord.app.web.dto.SubmitRequest;
import net.gridcoord.app.web.dto.WorkerRegistration;
import net.gridcoord.app.web.dto.WorkerUpdate;
import net.gridcoord.app.web.dto.WorkerView;
import net.gridcoord.bootstrap.props.GridCoordProperties;
import net.gridcoord.core.error.NotFoundException;
import net.gridcoord.core.error.UnauthorizedException;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.AccountVerdict;
import net.gridcoord.core.model.SlotAssignment;
import net.gridcoord.core.model.Worker;
import net.gridcoord.core.model.WorkerDescriptor;
import net.gridcoord.core.registry.WorkerRegistry;
import net.gridcoord.core.service.JobLifecycleCoordinator;
import net.gridcoord.core.service.WorkSignal;
import net.gridcoord.core.spi.AccountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * 워커 측 API. pop은 최대 gridcoord.api.pop-wait 만큼 새 작업 신호를 기다린다
 * (코어 pollForWork 자체는 블로킹하지 않는다).
 */
@RestController
@RequestMapping("/api/v2")
public class WorkerController {
    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final JobLifecycleCoordinator coordinator;
    private final WorkerRegistry workers;
    private final AccountService accounts;
    private final WorkSignal signal;
    private final Duration popWait;

    public WorkerController(JobLifecycleCoordinator coordinator,
                            AccountService accounts,
                            GridCoordProperties props) {
        this.coordinator = coordinator;
        this.workers = coordinator.workers();
        this.accounts = accounts;
        this.signal = coordinator.signal();
        this.popWait = props.getApi().getPopWait() == null ? Duration.ZERO : props.getApi().getPopWait();
    }

    @PostMapping("/workers")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, String> register(@RequestHeader(value = "apikey", required = false) String apiKey,
                                        @RequestBody(required = false) WorkerRegistration body) throws Exception {
        AccountVerdict owner = authenticate(apiKey);
        if (body == null || body.capabilities() == null) throw new ValidationException("worker capabilities are required");
        String id = workers.register(new WorkerDescriptor(owner.accountId(), body.name(), body.capabilities().toCapabilities()));
        return Map.of("id", id);
    }

    @GetMapping("/workers/{id}")
    public WorkerView worker(@PathVariable("id") String id) throws Exception {
        return WorkerView.of(workers.get(id));
    }

    @PutMapping("/workers/{id}")
    public WorkerView update(@RequestHeader(value = "apikey", required = false) String apiKey,
                             @PathVariable("id") String id,
                             @RequestBody WorkerUpdate body) throws Exception {
        Worker w = owned(apiKey, id);
        if (body.paused() != null) w = workers.setPaused(id, body.paused());
        if (body.maintenance() != null) w = workers.setMaintenance(id, body.maintenance());
        if (Boolean.TRUE.equals(body.resetFaults())) w = workers.resetFaults(id);
        return WorkerView.of(w);
    }

    @DeleteMapping("/workers/{id}")
    public WorkerView deactivate(@RequestHeader(value = "apikey", required = false) String apiKey,
                                 @PathVariable("id") String id) throws Exception {
        owned(apiKey, id);
        return WorkerView.of(workers.deactivate(id));
    }

    @PostMapping("/generate/pop")
    public PopResponse pop(@RequestBody PopRequest body) throws Exception {
        if (body.workerId() == null || body.capabilities() == null) {
            throw new ValidationException("workerId and capabilities are required");
        }
        long deadline = System.nanoTime() + popWait.toNanos();
        while (true) {
            long seen = signal.generation();
            Optional<SlotAssignment> a = coordinator.pollForWork(body.workerId(), body.capabilities().toCapabilities());
            if (a.isPresent()) return PopResponse.of(a.get());

            long left = deadline - System.nanoTime();
            if (left <= 0) return PopResponse.empty();
            if (!signal.awaitChange(seen, Duration.ofNanos(left))) return PopResponse.empty();
            log.debug("Worker {} woke up on new work signal", body.workerId());
        }
    }

    @PostMapping("/generate/submit")
    public SlotReceipt submit(@RequestBody SubmitRequest body) throws Exception {
        return SlotReceipt.of(coordinator.submitResult(body.workerId(), body.id(), body.toOutcome()));
    }

    @PostMapping("/generate/progress")
    public SlotReceipt progress(@RequestBody ProgressRequest body) throws Exception {
        return SlotReceipt.of(coordinator.reportProgress(body.workerId(), body.id(), body.currentStep(), body.totalSteps()));
    }

    // --- internals ---

    private AccountVerdict authenticate(String apiKey) throws Exception {
        if (apiKey == null || apiKey.isBlank()) throw new UnauthorizedException("api key is required");
        return accounts.authenticate(apiKey).orElseThrow(() -> new UnauthorizedException("invalid api key"));
    }

    /** 남의 워커는 존재하지 않는 것처럼 취급 */
    private Worker owned(String apiKey, String workerId) throws Exception {
        AccountVerdict caller = authenticate(apiKey);
        Worker w = workers.get(workerId);
        if (!caller.accountId().equals(w.ownerId())) throw new NotFoundException("worker not found: " + workerId);
        return w;
    }
}
