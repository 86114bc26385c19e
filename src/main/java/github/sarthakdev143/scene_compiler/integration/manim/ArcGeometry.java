package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.linking.PlanePoint;

/**
 * Quadratic arc to cubic Bezier conversion.
 */
public final class ArcGeometry {

    public record CubicControls(PlanePoint first, PlanePoint second) {
    }

    private ArcGeometry() {
    }

    /**
     * Control point of the quadratic curve from {@code start} to {@code end} that passes through
     * {@code middle} at t = 0.5.
     */
    public static PlanePoint quadraticControlThrough(PlanePoint start, PlanePoint middle, PlanePoint end) {
        return middle.times(2.0).minus(start.plus(end).times(0.5));
    }

    /**
     * C1 = P0 + 2/3 (Q - P0), C2 = P2 + 2/3 (Q - P2).
     */
    public static CubicControls cubicControls(PlanePoint start, PlanePoint control, PlanePoint end) {
        return new CubicControls(
                start.plus(control.minus(start).times(2.0 / 3.0)),
                end.plus(control.minus(end).times(2.0 / 3.0)));
    }

    /**
     * Point of the cubic curve at t = 0.5.
     */
    public static PlanePoint cubicMidpoint(PlanePoint start, PlanePoint first, PlanePoint second, PlanePoint end) {
        return start.plus(first.times(3.0)).plus(second.times(3.0)).plus(end).times(0.125);
    }
}
