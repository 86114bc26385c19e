package github.sarthakdev143.scene_compiler.model;

import github.sarthakdev143.scene_compiler.model.scene.Project;

import java.util.List;
import java.util.Map;

/**
 * A repaired project plus the pre-render issues of each scene, keyed by scene id.
 */
public record ValidationReport(
        Project project,
        Map<String, List<SceneIssue>> issues) {
}
