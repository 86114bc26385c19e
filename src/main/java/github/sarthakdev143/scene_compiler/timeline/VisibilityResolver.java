package github.sarthakdev143.scene_compiler.timeline;

import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which objects are on screen at a scene time. Transform targets have no end; their
 * sources disappear for good once the target's delay is reached.
 */
@Component
public class VisibilityResolver {

    public List<SceneObject> activeObjects(List<SceneObject> objects, double time) {
        Set<String> replaced = new HashSet<>();
        for (SceneObject object : objects) {
            if (object.hasTransformSource() && time >= object.delay()) {
                replaced.add(object.transformFromId());
            }
        }
        return objects.stream()
                .filter(object -> isActive(object, time, replaced))
                .toList();
    }

    private boolean isActive(SceneObject object, double time, Set<String> replaced) {
        if (time < object.delay()) {
            return false;
        }
        if (!object.hasTransformSource() && time >= object.endTime()) {
            return false;
        }
        return !replaced.contains(object.id());
    }
}
