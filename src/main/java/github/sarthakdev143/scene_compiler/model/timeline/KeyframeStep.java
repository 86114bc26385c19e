package github.sarthakdev143.scene_compiler.model.timeline;

/**
 * Property edits applied to one variable in a single chained animation. Null fields are untouched;
 * moves, rotations and scaling are relative to the variable's tracked state.
 */
public record KeyframeStep(
        String objectId,
        String variable,
        Double shiftX,
        Double shiftY,
        Double rotateDegrees,
        Double scaleFactor,
        Double opacity,
        String color) {

    public boolean hasShift() {
        return shiftX != null || shiftY != null;
    }

    public boolean isEmpty() {
        return !hasShift() && rotateDegrees == null && scaleFactor == null && opacity == null && color == null;
    }
}
