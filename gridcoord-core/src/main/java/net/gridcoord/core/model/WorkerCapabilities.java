package net.gridcoord.core.model;

import java.util.List;

/**
 * 워커가 선언한 처리 능력. maxPixels/maxTokens 중 0 이하는 해당 종류를 처리하지 않음을 뜻한다.
 */
public record WorkerCapabilities(
        List<String> models,
        int maxConcurrent,
        long maxPixels,
        int maxTokens,
        boolean acceptsNsfw
) {
    public WorkerCapabilities {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public boolean serves(String model) {
        return models.contains(model);
    }

    public boolean fits(GenerationParams params) {
        return switch (params.kind()) {
            case IMAGE -> maxPixels > 0 && params.pixels() <= maxPixels;
            case TEXT -> maxTokens > 0 && params.maxTokens() <= maxTokens;
            case UNKNOWN -> false;
        };
    }

    /**
     * 요청 선호 모델 중 워커가 제공하는 첫 번째 모델. 요청이 모델을 지정하지 않았으면 워커의 첫 모델.
     * 겹치는 모델이 없으면 null.
     */
    public String resolveModel(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return models.isEmpty() ? null : models.get(0);
        }
        for (String m : requested) {
            if (models.contains(m)) return m;
        }
        return null;
    }
}
