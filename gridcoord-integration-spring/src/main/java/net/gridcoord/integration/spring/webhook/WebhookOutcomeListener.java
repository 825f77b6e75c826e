package net.gridcoord.integration.spring.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.gridcoord.core.model.SlotOutcomeEvent;
import net.gridcoord.core.spi.OutcomeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * 종료된 슬롯 결과를 요청의 webhook URL로 POST 한다.
 * 실패는 재시도 후 로그로만 남기며 호출자에게 전파하지 않는다.
 */
public class WebhookOutcomeListener implements OutcomeListener {
    private static final Logger log = LoggerFactory.getLogger(WebhookOutcomeListener.class);

    private final RestClient client;
    private final ObjectMapper mapper;
    private final int attempts;

    public WebhookOutcomeListener(RestClient client, ObjectMapper mapper, int attempts) {
        this.client = client;
        this.mapper = mapper;
        this.attempts = Math.max(1, attempts);
    }

    /** 연결/읽기 타임아웃을 건 기본 클라이언트 */
    public static WebhookOutcomeListener withTimeout(ObjectMapper mapper, Duration timeout, int attempts) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return new WebhookOutcomeListener(RestClient.builder().requestFactory(factory).build(), mapper, attempts);
    }

    @Override
    public void onSlotTerminal(SlotOutcomeEvent event) {
        if (event.webhookUrl() == null || event.webhookUrl().isBlank()) return;
        deliver(event);
    }

    /** @return 전달 성공 여부 */
    public boolean deliver(SlotOutcomeEvent event) {
        String body;
        try {
            body = mapper.writeValueAsString(WebhookPayload.of(event));
        } catch (JsonProcessingException e) {
            log.warn("Webhook payload for slot {} could not be serialized: {}", event.slotId(), e.getMessage());
            return false;
        }

        for (int i = 1; i <= attempts; i++) {
            try {
                client.post()
                        .uri(event.webhookUrl())
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body)
                        .retrieve()
                        .toBodilessEntity();
                return true;
            } catch (RestClientException e) {
                log.debug("Webhook for slot {} failed: {}. Will retry {} more times...",
                        event.slotId(), e.getMessage(), attempts - i);
            }
        }
        log.warn("Webhook for slot {} of request {} not delivered after {} attempts",
                event.slotId(), event.requestId(), attempts);
        return false;
    }
}
