package github.sarthakdev143.scene_compiler.model.scene;

import java.util.List;
import java.util.Optional;

public record Scene(
        String id,
        String name,
        double duration,
        List<SceneObject> objects) {

    public Scene {
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public Optional<SceneObject> findObject(String objectId) {
        if (objectId == null) {
            return Optional.empty();
        }
        return objects.stream().filter(object -> objectId.equals(object.id())).findFirst();
    }
}
