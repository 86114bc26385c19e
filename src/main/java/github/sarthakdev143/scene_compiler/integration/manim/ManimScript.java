package github.sarthakdev143.scene_compiler.integration.manim;

public record ManimScript(
        String text,
        int omittedObjects) {
}
