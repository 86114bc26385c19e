package github.sarthakdev143.scene_compiler.model.timeline;

import github.sarthakdev143.scene_compiler.model.TransformStyle;

public record TransformStep(
        String sourceId,
        String sourceVariable,
        String targetId,
        String targetVariable,
        TransformStyle style,
        double runTime) {
}
