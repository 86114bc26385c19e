package github.sarthakdev143.scene_compiler.model.scene.shape;

public record TextShape(
        String text,
        double fontSize,
        double width,
        double height) implements ShapeSpec {
}
