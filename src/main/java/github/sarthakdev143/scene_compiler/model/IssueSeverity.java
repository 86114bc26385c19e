package github.sarthakdev143.scene_compiler.model;

public enum IssueSeverity {
    WARNING,
    ERROR
}
