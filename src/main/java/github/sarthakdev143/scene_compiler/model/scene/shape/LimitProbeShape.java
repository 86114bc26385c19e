package github.sarthakdev143.scene_compiler.model.scene.shape;

import github.sarthakdev143.scene_compiler.model.LimitDirection;

import java.util.List;

public record LimitProbeShape(
        double x0,
        String graphId,
        String cursorId,
        String axesId,
        LimitDirection direction,
        List<Double> deltaSchedule,
        double radius,
        boolean showPoints,
        boolean showReadout) implements LinkedShape {

    public LimitProbeShape {
        deltaSchedule = deltaSchedule == null ? List.of() : List.copyOf(deltaSchedule);
    }
}
