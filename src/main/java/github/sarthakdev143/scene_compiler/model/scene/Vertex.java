package github.sarthakdev143.scene_compiler.model.scene;

/**
 * Polygon vertex relative to the owning object's position.
 */
public record Vertex(
        double x,
        double y,
        String label) {
}
