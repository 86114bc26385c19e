package github.sarthakdev143.scene_compiler.dto;

import github.sarthakdev143.scene_compiler.model.SceneIssue;

import java.util.List;
import java.util.Map;

/**
 * A project in its JSON shape, with either the warnings of an operation batch or the per-scene
 * issues of a validation run.
 */
public record ProjectResponse(
        Map<String, Object> project,
        List<String> warnings,
        Map<String, List<SceneIssue>> issues) {
}
