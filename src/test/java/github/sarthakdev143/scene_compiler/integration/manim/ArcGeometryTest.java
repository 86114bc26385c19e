package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.linking.PlanePoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ArcGeometryTest {

    private static final PlanePoint START = new PlanePoint(0.0, 0.0);
    private static final PlanePoint END = new PlanePoint(2.0, 0.0);

    @Test
    void cubicControlsSitTwoThirdsTowardTheQuadraticControl() {
        ArcGeometry.CubicControls controls = ArcGeometry.cubicControls(START, new PlanePoint(1.0, 3.0), END);

        assertThat(controls.first().x()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(controls.first().y()).isCloseTo(2.0, within(1e-9));
        assertThat(controls.second().x()).isCloseTo(4.0 / 3.0, within(1e-9));
        assertThat(controls.second().y()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void quadraticControlMakesTheCurvePassThroughTheMiddlePoint() {
        PlanePoint control = ArcGeometry.quadraticControlThrough(START, new PlanePoint(1.0, 1.0), END);

        assertThat(control.x()).isCloseTo(1.0, within(1e-9));
        assertThat(control.y()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void cubicMidpointRecoversTheAuthoredMiddlePoint() {
        PlanePoint middle = new PlanePoint(0.5, -1.5);
        PlanePoint control = ArcGeometry.quadraticControlThrough(START, middle, END);
        ArcGeometry.CubicControls controls = ArcGeometry.cubicControls(START, control, END);

        PlanePoint recovered = ArcGeometry.cubicMidpoint(START, controls.first(), controls.second(), END);

        assertThat(recovered.x()).isCloseTo(0.5, within(1e-9));
        assertThat(recovered.y()).isCloseTo(-1.5, within(1e-9));
    }
}
