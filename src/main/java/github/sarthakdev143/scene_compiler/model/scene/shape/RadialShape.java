package github.sarthakdev143.scene_compiler.model.scene.shape;

public record RadialShape(double radius) implements ShapeSpec {
}
