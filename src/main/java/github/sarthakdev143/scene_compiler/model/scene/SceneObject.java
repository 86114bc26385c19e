package github.sarthakdev143.scene_compiler.model.scene;

import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.scene.shape.ShapeSpec;

import java.util.List;

/**
 * Canonical scene object: common attributes plus a per-type {@link ShapeSpec}.
 */
public record SceneObject(
        String id,
        String name,
        ObjectType type,
        double x,
        double y,
        double rotation,
        double opacity,
        int zIndex,
        String fill,
        String stroke,
        double strokeWidth,
        double delay,
        double runTime,
        String animationType,
        String exitAnimationType,
        String transformFromId,
        String transformType,
        List<Keyframe> keyframes,
        ShapeSpec shape) {

    public SceneObject {
        keyframes = keyframes == null ? List.of() : List.copyOf(keyframes);
    }

    public boolean hasTransformSource() {
        return transformFromId != null;
    }

    public double endTime() {
        return delay + runTime;
    }

    public <T extends ShapeSpec> T shapeAs(Class<T> shapeType) {
        return shapeType.cast(shape);
    }
}
