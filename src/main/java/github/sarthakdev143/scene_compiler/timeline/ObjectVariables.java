package github.sarthakdev143.scene_compiler.timeline;

import github.sarthakdev143.scene_compiler.model.scene.SceneObject;

public final class ObjectVariables {

    private ObjectVariables() {
    }

    public static String of(int index, SceneObject object) {
        return (object.hasTransformSource() ? "target_" : "obj_") + index;
    }
}
