package net.gridcoord.core.model;

import java.time.Duration;
import java.util.List;

/**
 * 클라이언트 API 계층이 넘겨주는 제출 내용. apiKey는 AccountService로 검증된다.
 * lifetime이 null이면 기본 수명을 쓴다.
 */
public record RequestDescriptor(
        String apiKey,
        int n,
        GenerationParams params,
        List<String> models,
        boolean nsfw,
        String webhookUrl,
        Duration lifetime
) {
    public RequestDescriptor {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
