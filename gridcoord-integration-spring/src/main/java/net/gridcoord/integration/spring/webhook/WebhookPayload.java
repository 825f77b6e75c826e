package net.gridcoord.integration.spring.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.gridcoord.core.model.SlotOutcomeEvent;

import java.time.Instant;

/** 웹훅 본문. 필드 이름은 클라이언트가 이미 파싱하는 snake_case를 따른다 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookPayload(
        @JsonProperty("id") String slotId,
        @JsonProperty("request") String requestId,
        @JsonProperty("worker_id") String workerId,
        @JsonProperty("state") String state,
        @JsonProperty("model") String model,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("result") String resultRef,
        @JsonProperty("seed") Long seed,
        @JsonProperty("fault_reason") String faultReason,
        @JsonProperty("units") double workloadUnits,
        @JsonProperty("finished_at") Instant at
) {
    public static WebhookPayload of(SlotOutcomeEvent e) {
        return new WebhookPayload(e.slotId(), e.requestId(), e.workerId(), e.state().code(), e.model(),
                e.attempt(), e.resultRef(), e.seed(), e.faultReason(), e.workloadUnits(), e.at());
    }
}
