package github.sarthakdev143.scene_compiler.model.scene.shape;

/**
 * Per-type attributes of a scene object.
 */
public interface ShapeSpec {
}
