package github.sarthakdev143.scene_compiler.model.ops;

import github.sarthakdev143.scene_compiler.model.scene.Project;

import java.util.List;

public record ApplyResult(
        Project project,
        List<String> warnings) {

    public ApplyResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
