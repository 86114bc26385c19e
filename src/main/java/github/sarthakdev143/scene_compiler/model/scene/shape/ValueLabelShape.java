package github.sarthakdev143.scene_compiler.model.scene.shape;

import github.sarthakdev143.scene_compiler.model.ValueType;

public record ValueLabelShape(
        String graphId,
        String cursorId,
        String axesId,
        ValueType valueType,
        String customExpression,
        String labelPrefix,
        String labelSuffix,
        double fontSize,
        boolean showBackground,
        String backgroundFill,
        double backgroundOpacity) implements LinkedShape {
}
