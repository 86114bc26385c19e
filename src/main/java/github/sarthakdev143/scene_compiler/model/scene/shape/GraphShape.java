package github.sarthakdev143.scene_compiler.model.scene.shape;

import github.sarthakdev143.scene_compiler.model.scene.Range;

public record GraphShape(
        String formula,
        Range xRange,
        Range yRange,
        String axesId) implements LinkedShape {
}
