package github.sarthakdev143.scene_compiler.model.scene;

import java.util.List;
import java.util.Optional;

public record Project(
        String version,
        String name,
        ProjectSettings settings,
        List<Scene> scenes) {

    public Project {
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
    }

    public Optional<Scene> findScene(String sceneId) {
        if (sceneId == null) {
            return Optional.empty();
        }
        return scenes.stream().filter(scene -> sceneId.equals(scene.id())).findFirst();
    }
}
