package github.sarthakdev143.scene_compiler.model.scene.shape;

public record TangentLineShape(
        double x0,
        String graphId,
        String cursorId,
        String axesId,
        double derivativeStep,
        double visibleSpan,
        boolean showSlopeLabel) implements LinkedShape {
}
