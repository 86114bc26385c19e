package github.sarthakdev143.scene_compiler.model.scene;

public record ProjectSettings(
        int width,
        int height,
        int fps,
        String backgroundColor) {
}
