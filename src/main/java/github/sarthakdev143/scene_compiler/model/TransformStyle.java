package github.sarthakdev143.scene_compiler.model;

public enum TransformStyle {
    TRANSFORM("Transform", false),
    REPLACEMENT_TRANSFORM("ReplacementTransform", true),
    FADE_TRANSFORM("FadeTransform", true),
    TRANSFORM_MATCHING_SHAPES("TransformMatchingShapes", true),
    CLOCKWISE_TRANSFORM("ClockwiseTransform", false),
    COUNTERCLOCKWISE_TRANSFORM("CounterclockwiseTransform", false);

    private final String animationName;
    private final boolean replacing;

    TransformStyle(String animationName, boolean replacing) {
        this.animationName = animationName;
        this.replacing = replacing;
    }

    /**
     * Unknown or missing names fall back to a plain {@link #TRANSFORM}.
     */
    public static TransformStyle fromInput(String input) {
        if (input == null || input.isBlank()) {
            return TRANSFORM;
        }
        for (TransformStyle style : values()) {
            if (style.animationName.equalsIgnoreCase(input.trim())) {
                return style;
            }
        }
        return TRANSFORM;
    }

    public String animationName() {
        return animationName;
    }

    public boolean isReplacing() {
        return replacing;
    }
}
