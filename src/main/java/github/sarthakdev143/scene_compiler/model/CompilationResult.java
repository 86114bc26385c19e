package github.sarthakdev143.scene_compiler.model;

public record CompilationResult(
        String script,
        String sceneClassName,
        QualityTier quality,
        String cacheKey,
        int omittedObjects) {
}
