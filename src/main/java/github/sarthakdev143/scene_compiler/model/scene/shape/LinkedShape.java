package github.sarthakdev143.scene_compiler.model.scene.shape;

/**
 * Shapes of the math-graph family that reference other objects by id.
 */
public interface LinkedShape extends ShapeSpec {

    String axesId();

    default String graphId() {
        return null;
    }

    default String cursorId() {
        return null;
    }
}
