package net.gridcoord.app.web.dto;

import net.gridcoord.core.model.GenerationParams;
import net.gridcoord.core.model.RequestDescriptor;
import net.gridcoord.core.model.WorkloadKind;

import java.time.Duration;
import java.util.List;

/** POST /api/v2/generate/async 본문 */
public record GenerateRequest(
        Integer n,
        Params params,
        List<String> models,
        boolean nsfw,
        String webhook,
        Long lifetimeSeconds
) {
    public record Params(
            String kind,
            Integer width,
            Integer height,
            Integer maxTokens,
            Integer steps,
            String sampler
    ) {
        GenerationParams toParams() {
            WorkloadKind k = kind == null ? WorkloadKind.IMAGE : WorkloadKind.from(kind);
            return new GenerationParams(k, orZero(width), orZero(height), orZero(maxTokens), orZero(steps), sampler);
        }
    }

    public RequestDescriptor toDescriptor(String apiKey) {
        return new RequestDescriptor(apiKey,
                n == null ? 1 : n,
                params == null ? null : params.toParams(),
                models,
                nsfw,
                webhook,
                lifetimeSeconds == null ? null : Duration.ofSeconds(lifetimeSeconds));
    }

    private static int orZero(Integer v) {
        return v == null ? 0 : v;
    }
}
