package github.sarthakdev143.scene_compiler.dto;

public record ParseRequest(
        String script) {
}
