package net.gridcoord.app.web.dto;

import net.gridcoord.core.model.WorkerCapabilities;

import java.util.List;

/** 워커가 등록/poll 때마다 선언하는 처리 능력 */
public record WorkerSpec(
        List<String> models,
        Integer maxConcurrent,
        Long maxPixels,
        Integer maxTokens,
        boolean acceptsNsfw
) {
    public WorkerCapabilities toCapabilities() {
        return new WorkerCapabilities(models,
                maxConcurrent == null ? 1 : maxConcurrent,
                maxPixels == null ? 0L : maxPixels,
                maxTokens == null ? 0 : maxTokens,
                acceptsNsfw);
    }
}
