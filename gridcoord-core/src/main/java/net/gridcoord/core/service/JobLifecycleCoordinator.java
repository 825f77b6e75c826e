package net.gridcoord.core.service;

import net.gridcoord.core.error.AlreadyLeasedException;
import net.gridcoord.core.error.NotFoundException;
import net.gridcoord.core.error.UnauthorizedException;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.AccountVerdict;
import net.gridcoord.core.model.CloseReason;
import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.ModelQueueStats;
import net.gridcoord.core.model.RequestDescriptor;
import net.gridcoord.core.model.RequestState;
import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.model.SlotAssignment;
import net.gridcoord.core.model.SlotOutcome;
import net.gridcoord.core.model.WorkerCapabilities;
import net.gridcoord.core.registry.WorkerRegistry;
import net.gridcoord.core.spi.AccountService;
import net.gridcoord.core.spi.Clock;
import net.gridcoord.core.spi.JobRequestRepository;
import net.gridcoord.core.spi.JobSlotRepository;
import net.gridcoord.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 외부 API 계층이 호출하는 코디네이터 진입점.
 * 전송 방식에 무관하며 내부에서 블로킹하지 않는다 (long-poll 대기는 호출자가 WorkSignal로 구현).
 */
public final class JobLifecycleCoordinator {
    private static final Logger log = LoggerFactory.getLogger(JobLifecycleCoordinator.class);
    static final String ANY_MODEL = "*";
    private static final int STATS_SCAN_LIMIT = 10_000;

    private final JobRequestRepository requests;
    private final JobSlotRepository slots;
    private final WorkerRegistry workers;
    private final Matcher matcher;
    private final LeaseManager leases;
    private final AccountService accounts;
    private final WorkSignal signal;
    private final CoordinatorSettings settings;
    private final TxRunner tx;
    private final Clock clock;

    public JobLifecycleCoordinator(JobRequestRepository requests,
                                   JobSlotRepository slots,
                                   WorkerRegistry workers,
                                   Matcher matcher,
                                   LeaseManager leases,
                                   AccountService accounts,
                                   WorkSignal signal,
                                   CoordinatorSettings settings,
                                   TxRunner tx,
                                   Clock clock) {
        this.requests = requests;
        this.slots = slots;
        this.workers = workers;
        this.matcher = matcher;
        this.leases = leases;
        this.accounts = accounts;
        this.signal = signal;
        this.settings = settings;
        this.tx = tx;
        this.clock = clock;
    }

    /** 요청 접수: 인증 → 검증 → 요청 1건 + 슬롯 n개 생성. slotCount는 이후 바뀌지 않는다. */
    public String submitRequest(RequestDescriptor d) throws Exception {
        if (d == null) throw new ValidationException("request descriptor is required");
        AccountVerdict account = authenticate(d.apiKey());
        validate(d);

        Instant now = clock.now();
        Duration lifetime = lifetimeOf(d.lifetime());
        String requestId = UUID.randomUUID().toString();
        String webhook = d.webhookUrl() == null || d.webhookUrl().isBlank() ? null : d.webhookUrl();
        JobRequest req = new JobRequest(requestId, account.accountId(), account.trustTier(), d.n(), d.params(),
                d.models(), d.nsfw(), webhook, RequestState.ACTIVE, null,
                now, now.plus(lifetime), null, 0L);

        List<JobSlot> created = new ArrayList<>(d.n());
        for (int i = 0; i < d.n(); i++) {
            created.add(JobSlot.pendingOf(req, UUID.randomUUID().toString(), i));
        }
        tx.required(() -> {
            requests.insert(req);
            slots.insertAll(created);
            return null;
        });

        log.info("Request {} submitted by {} (n={}, models={}, kind={}, expires in {}s)",
                requestId, account.accountId(), d.n(), d.models(), d.params().kind(), lifetime.toSeconds());
        signal.notifyWork();
        return requestId;
    }

    /**
     * 워커 poll 1회. 하트비트를 갱신한 뒤 매칭과 리스를 시도한다.
     * 경합에 지면 다른 후보로 최대 maxLeaseRaces번까지 재시도하고, 맞는 작업이 없으면 empty.
     */
    public Optional<SlotAssignment> pollForWork(String workerId, WorkerCapabilities capabilities) throws Exception {
        if (workerId == null || workerId.isBlank()) throw new ValidationException("worker id is required");
        if (capabilities == null) throw new ValidationException("capabilities are required");
        workers.updateHeartbeat(workerId, capabilities);

        Set<String> lost = new HashSet<>();
        for (int race = 0; race < settings.maxLeaseRaces(); race++) {
            Optional<JobSlot> pick = matcher.findSlotFor(workerId, capabilities, lost);
            if (pick.isEmpty()) return Optional.empty();

            JobSlot candidate = pick.get();
            String model = capabilities.resolveModel(candidate.models());
            try {
                return leases.lease(candidate.id(), workerId, model).map(SlotAssignment::of);
            } catch (AlreadyLeasedException e) {
                log.debug("Worker {} lost the lease race for slot {}: {}", workerId, candidate.id(), e.getMessage());
                lost.add(candidate.id());
            }
        }
        return Optional.empty();
    }

    public JobSlot submitResult(String workerId, String slotId, SlotOutcome outcome) throws Exception {
        return leases.submitResult(workerId, slotId, outcome);
    }

    public JobSlot reportProgress(String workerId, String slotId, int currentStep, int totalSteps) throws Exception {
        return leases.reportProgress(workerId, slotId, currentStep, totalSteps);
    }

    public RequestStatus getRequestStatus(String requestId) throws Exception {
        return leases.statusOf(requestId);
    }

    /** 운영자/내부용 취소 (소유자 확인 없음) */
    public RequestStatus cancelRequest(String requestId) throws Exception {
        return leases.closeRequest(requestId, CloseReason.CANCELLED);
    }

    /** 클라이언트 취소: API 키의 계정이 요청 소유자여야 한다. 남의 요청은 존재하지 않는 것처럼 취급 */
    public RequestStatus cancelRequest(String requestId, String apiKey) throws Exception {
        AccountVerdict account = authenticate(apiKey);
        JobRequest req = tx.required(() -> requests.findById(requestId))
                .orElseThrow(() -> new NotFoundException("request not found: " + requestId));
        if (!req.requesterId().equals(account.accountId())) {
            throw new NotFoundException("request not found: " + requestId);
        }
        return cancelRequest(requestId);
    }

    /** 모델별 대기/진행 현황. 모델을 지정하지 않은 요청은 "*"로 집계한다. */
    public List<ModelQueueStats> queueStats() throws Exception {
        Instant now = clock.now();
        List<JobSlot> pending = tx.required(() -> slots.findPending(STATS_SCAN_LIMIT));
        List<JobSlot> leased = tx.required(() -> slots.findLeased(STATS_SCAN_LIMIT));

        Map<String, int[]> counts = new TreeMap<>();
        Map<String, Instant> oldest = new TreeMap<>();
        for (JobSlot s : pending) {
            for (String m : s.models().isEmpty() ? List.of(ANY_MODEL) : s.models()) {
                counts.computeIfAbsent(m, k -> new int[2])[0]++;
                oldest.merge(m, s.createdAt(), (a, b) -> a.isBefore(b) ? a : b);
            }
        }
        for (JobSlot s : leased) {
            String m = s.assignedModel() == null ? ANY_MODEL : s.assignedModel();
            counts.computeIfAbsent(m, k -> new int[2])[1]++;
        }

        List<ModelQueueStats> out = new ArrayList<>(counts.size());
        counts.forEach((model, c) -> {
            Instant first = oldest.get(model);
            Duration age = first == null ? Duration.ZERO : Duration.between(first, now);
            out.add(new ModelQueueStats(model, c[0], c[1], age.isNegative() ? Duration.ZERO : age));
        });
        return out;
    }

    public WorkerRegistry workers() {
        return workers;
    }

    public WorkSignal signal() {
        return signal;
    }

    // --- internals ---

    private AccountVerdict authenticate(String apiKey) throws Exception {
        if (apiKey == null || apiKey.isBlank()) throw new UnauthorizedException("api key is required");
        return accounts.authenticate(apiKey)
                .orElseThrow(() -> new UnauthorizedException("invalid api key"));
    }

    private void validate(RequestDescriptor d) {
        if (d.n() < 1) throw new ValidationException("n must be >= 1");
        if (d.n() > settings.maxSlotsPerRequest()) {
            throw new ValidationException("n must be <= " + settings.maxSlotsPerRequest());
        }
        GenerationParams p = d.params();
        if (p == null || p.kind() == null) throw new ValidationException("generation params are required");
        switch (p.kind()) {
            case IMAGE -> {
                if (p.width() <= 0 || p.height() <= 0) throw new ValidationException("width and height must be positive");
                if (p.steps() < 0) throw new ValidationException("steps must not be negative");
            }
            case TEXT -> {
                if (p.maxTokens() <= 0) throw new ValidationException("maxTokens must be positive");
            }
            default -> throw new ValidationException("unsupported workload kind");
        }
        if (d.models().stream().anyMatch(m -> m == null || m.isBlank())) {
            throw new ValidationException("model names must not be blank");
        }
        if (d.webhookUrl() != null && !d.webhookUrl().isBlank()
                && !(d.webhookUrl().startsWith("http://") || d.webhookUrl().startsWith("https://"))) {
            throw new ValidationException("webhook must be an http(s) url");
        }
        if (d.lifetime() != null && (d.lifetime().isZero() || d.lifetime().isNegative())) {
            throw new ValidationException("lifetime must be positive");
        }
    }

    private Duration lifetimeOf(Duration requested) {
        if (requested == null) return settings.defaultRequestLifetime();
        return requested.compareTo(settings.maxRequestLifetime()) > 0 ? settings.maxRequestLifetime() : requested;
    }
}
