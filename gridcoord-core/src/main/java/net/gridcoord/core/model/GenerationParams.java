package net.gridcoord.core.model;

/**
 * 슬롯 하나의 생성 파라미터. 이미지면 width/height, 텍스트면 maxTokens가 워크로드 크기를 결정한다.
 */
public record GenerationParams(
        WorkloadKind kind,
        int width,
        int height,
        int maxTokens,
        int steps,
        String sampler
) {
    public static GenerationParams image(int width, int height, int steps, String sampler) {
        return new GenerationParams(WorkloadKind.IMAGE, width, height, 0, steps, sampler);
    }

    public static GenerationParams text(int maxTokens) {
        return new GenerationParams(WorkloadKind.TEXT, 0, 0, maxTokens, 0, null);
    }

    public long pixels() {
        return (long) width * (long) height;
    }
}
