package github.sarthakdev143.scene_compiler.model.scene.shape;

/**
 * Curved segment from the object position to (x2, y2) passing through (cx, cy) at its middle.
 */
public record ArcShape(
        double x2,
        double y2,
        double cx,
        double cy) implements ShapeSpec {
}
