package github.sarthakdev143.scene_compiler.model.scene.shape;

public record RectangleShape(
        double width,
        double height) implements ShapeSpec {
}
