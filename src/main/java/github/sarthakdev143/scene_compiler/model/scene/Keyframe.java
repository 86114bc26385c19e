package github.sarthakdev143.scene_compiler.model.scene;

/**
 * Timestamped property mutation; {@code time} is absolute scene time in seconds.
 */
public record Keyframe(
        double time,
        String property,
        Object value) {
}
