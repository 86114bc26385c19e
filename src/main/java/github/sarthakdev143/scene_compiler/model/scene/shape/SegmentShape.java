package github.sarthakdev143.scene_compiler.model.scene.shape;

public record SegmentShape(
        double x2,
        double y2) implements ShapeSpec {
}
