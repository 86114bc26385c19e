package github.sarthakdev143.scene_compiler.model.scene.shape;

public record GraphCursorShape(
        double x0,
        String graphId,
        String axesId,
        double radius,
        boolean showDot,
        boolean showCrosshair,
        boolean showLabel) implements LinkedShape {
}
