package github.sarthakdev143.scene_compiler.model.scene.shape;

public record LatexShape(
        String latex,
        double fontSize) implements ShapeSpec {
}
