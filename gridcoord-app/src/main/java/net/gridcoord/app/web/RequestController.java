package net.gridcoord.app.web;

import net.gridcoord.app.web.dto.GenerateAccepted;
import net.gridcoord.app.web.dto.GenerateRequest;
import net.gridcoord.app.web.dto.QueueStatsView;
import net.gridcoord.core.error.ValidationException;
import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.service.JobLifecycleCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** 클라이언트 측 API: 제출, 상태 조회, 취소, 대기열 현황 */
@RestController
@RequestMapping("/api/v2")
public class RequestController {
    private final JobLifecycleCoordinator coordinator;

    public RequestController(JobLifecycleCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/generate/async")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public GenerateAccepted submit(@RequestHeader(value = "apikey", required = false) String apiKey,
                                   @RequestBody(required = false) GenerateRequest body) throws Exception {
        if (body == null) throw new ValidationException("request body is required");
        return new GenerateAccepted(coordinator.submitRequest(body.toDescriptor(apiKey)));
    }

    @GetMapping("/generate/status/{id}")
    public RequestStatus status(@PathVariable("id") String id) throws Exception {
        return coordinator.getRequestStatus(id);
    }

    @DeleteMapping("/generate/status/{id}")
    public RequestStatus cancel(@RequestHeader(value = "apikey", required = false) String apiKey,
                                @PathVariable("id") String id) throws Exception {
        return coordinator.cancelRequest(id, apiKey);
    }

    @GetMapping("/status/queue")
    public List<QueueStatsView> queue() throws Exception {
        return coordinator.queueStats().stream().map(QueueStatsView::of).toList();
    }
}
