package github.sarthakdev143.scene_compiler.linking;

/**
 * Limit reading at the smallest usable offset; {@code value} is NaN when the one-sided values disagree.
 */
public record LimitEstimate(
        double left,
        double right,
        double value,
        boolean exists) {
}
