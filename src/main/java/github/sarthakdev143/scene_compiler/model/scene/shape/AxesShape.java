package github.sarthakdev143.scene_compiler.model.scene.shape;

import github.sarthakdev143.scene_compiler.model.scene.Range;

public record AxesShape(
        Range xRange,
        Range yRange,
        double xLength,
        double yLength,
        boolean showTicks,
        String xLabel,
        String yLabel) implements ShapeSpec {
}
