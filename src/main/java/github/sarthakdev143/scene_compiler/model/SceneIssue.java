package github.sarthakdev143.scene_compiler.model;

public record SceneIssue(
        IssueSeverity severity,
        String objectId,
        String message) {
}
