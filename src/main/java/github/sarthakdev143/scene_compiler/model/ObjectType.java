package github.sarthakdev143.scene_compiler.model;

import java.util.Optional;

public enum ObjectType {
    RECTANGLE("rectangle", "Rectangle", "Create"),
    TRIANGLE("triangle", "Triangle", "DrawBorderThenFill"),
    CIRCLE("circle", "Circle", "GrowFromCenter"),
    POLYGON("polygon", "Polygon", "DrawBorderThenFill"),
    DOT("dot", "Dot", "GrowFromCenter"),
    LINE("line", "Line", "Create"),
    ARROW("arrow", "Arrow", "Create"),
    ARC("arc", "Arc", "Create"),
    TEXT("text", "Text", "Write"),
    LATEX("latex", "LaTeX", "Write"),
    AXES("axes", "Axes", "Create"),
    GRAPH("graph", "Graph", "Create"),
    GRAPH_CURSOR("graphCursor", "Graph Cursor", "GrowFromCenter"),
    TANGENT_LINE("tangentLine", "Tangent Line", "Create"),
    LIMIT_PROBE("limitProbe", "Limit Probe", "FadeIn"),
    VALUE_LABEL("valueLabel", "Value Label", "FadeIn");

    private final String wireName;
    private final String label;
    private final String defaultEntrance;

    ObjectType(String wireName, String label, String defaultEntrance) {
        this.wireName = wireName;
        this.label = label;
        this.defaultEntrance = defaultEntrance;
    }

    public static Optional<ObjectType> fromWireName(Object input) {
        if (!(input instanceof String value)) {
            return Optional.empty();
        }
        for (ObjectType type : values()) {
            if (type.wireName.equals(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public String defaultEntrance() {
        return defaultEntrance;
    }

    public boolean isLineLike() {
        return this == LINE || this == ARROW || this == ARC || this == GRAPH || this == TANGENT_LINE || this == AXES;
    }
}
