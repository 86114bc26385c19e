package github.sarthakdev143.scene_compiler.dto;

import github.sarthakdev143.scene_compiler.model.QualityTier;

public record CompileResponse(
        String script,
        String sceneClassName,
        QualityTier quality,
        String cacheKey) {
}
