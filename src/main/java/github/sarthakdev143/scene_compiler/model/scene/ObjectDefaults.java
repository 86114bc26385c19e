package github.sarthakdev143.scene_compiler.model.scene;

import github.sarthakdev143.scene_compiler.model.ObjectType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default attributes of a freshly authored object, shared by the validator, the patch applier and the script parser.
 */
public final class ObjectDefaults {

    public static final double DEFAULT_RUN_TIME = 1.0;
    public static final double MIN_RUN_TIME = 0.1;
    public static final String AUTO_ANIMATION = "auto";
    public static final String DEFAULT_EXIT_ANIMATION = "FadeOut";
    public static final String WHITE = "#ffffff";
    public static final int DEFAULT_SIDES = 6;
    public static final int MIN_SIDES = 3;
    public static final int MAX_SIDES = 64;

    private ObjectDefaults() {
    }

    public static Map<String, Object> baseDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("x", 0.0);
        defaults.put("y", 0.0);
        defaults.put("rotation", 0.0);
        defaults.put("opacity", 1.0);
        defaults.put("zIndex", 0);
        defaults.put("delay", 0.0);
        defaults.put("runTime", DEFAULT_RUN_TIME);
        defaults.put("animationType", AUTO_ANIMATION);
        defaults.put("exitAnimationType", DEFAULT_EXIT_ANIMATION);
        defaults.put("keyframes", new ArrayList<>());
        return defaults;
    }

    /**
     * Type-specific defaults; positional defaults are relative to the object's (x, y).
     */
    public static Map<String, Object> typeDefaults(ObjectType type, double x, double y) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        switch (type) {
            case RECTANGLE -> {
                defaults.put("width", 2.0);
                defaults.put("height", 1.0);
                defaults.put("strokeWidth", 2.0);
            }
            case CIRCLE -> {
                defaults.put("radius", 1.0);
                defaults.put("strokeWidth", 2.0);
            }
            case DOT -> {
                defaults.put("radius", 0.1);
                defaults.put("fill", WHITE);
                defaults.put("strokeWidth", 0.0);
            }
            case TRIANGLE -> {
                defaults.put("vertices", List.of(
                        vertex(0.0, 1.0),
                        vertex(-0.866, -0.5),
                        vertex(0.866, -0.5)));
                defaults.put("strokeWidth", 2.0);
            }
            case POLYGON -> {
                defaults.put("sides", DEFAULT_SIDES);
                defaults.put("radius", 1.0);
                defaults.put("vertices", regularVertices(DEFAULT_SIDES, 1.0));
                defaults.put("strokeWidth", 2.0);
            }
            case LINE -> {
                defaults.put("x2", x + 2.0);
                defaults.put("y2", y);
                defaults.put("stroke", WHITE);
                defaults.put("strokeWidth", 3.0);
            }
            case ARROW -> {
                defaults.put("x2", x + 2.0);
                defaults.put("y2", y);
                defaults.put("stroke", "#fbbf24");
                defaults.put("strokeWidth", 3.0);
            }
            case ARC -> {
                defaults.put("x2", x + 2.0);
                defaults.put("y2", y);
                defaults.put("cx", x + 1.0);
                defaults.put("cy", y + 1.0);
                defaults.put("stroke", WHITE);
                defaults.put("strokeWidth", 2.0);
            }
            case TEXT -> {
                defaults.put("text", "Text");
                defaults.put("fontSize", 48.0);
                defaults.put("width", 2.0);
                defaults.put("height", 0.8);
                defaults.put("fill", WHITE);
                defaults.put("strokeWidth", 0.0);
            }
            case LATEX -> {
                defaults.put("latex", "x");
                defaults.put("fontSize", 48.0);
                defaults.put("fill", WHITE);
                defaults.put("strokeWidth", 0.0);
            }
            case AXES -> {
                defaults.put("xRange", range(-5.0, 5.0, 1.0));
                defaults.put("yRange", range(-3.0, 3.0, 1.0));
                defaults.put("xLength", 8.0);
                defaults.put("yLength", 4.0);
                defaults.put("showTicks", true);
                defaults.put("xLabel", "x");
                defaults.put("yLabel", "y");
                defaults.put("stroke", WHITE);
                defaults.put("strokeWidth", 2.0);
            }
            case GRAPH -> {
                defaults.put("formula", "x^2");
                defaults.put("xRange", range(-5.0, 5.0, 1.0));
                defaults.put("yRange", range(-5.0, 5.0, 1.0));
                defaults.put("stroke", "#3b82f6");
                defaults.put("strokeWidth", 2.0);
            }
            case GRAPH_CURSOR -> {
                defaults.put("x0", 0.0);
                defaults.put("fill", "#ef4444");
                defaults.put("radius", 0.08);
                defaults.put("showDot", true);
                defaults.put("showCrosshair", false);
                defaults.put("showLabel", false);
                defaults.put("strokeWidth", 0.0);
            }
            case TANGENT_LINE -> {
                defaults.put("x0", 0.0);
                defaults.put("derivativeStep", 0.001);
                defaults.put("visibleSpan", 2.0);
                defaults.put("showSlopeLabel", false);
                defaults.put("stroke", "#eab308");
                defaults.put("strokeWidth", 2.0);
            }
            case LIMIT_PROBE -> {
                defaults.put("x0", 0.0);
                defaults.put("direction", "both");
                defaults.put("deltaSchedule", List.of(1.0, 0.5, 0.1, 0.01));
                defaults.put("fill", "#22c55e");
                defaults.put("radius", 0.06);
                defaults.put("showPoints", true);
                defaults.put("showReadout", false);
                defaults.put("strokeWidth", 0.0);
            }
            case VALUE_LABEL -> {
                defaults.put("valueType", "slope");
                defaults.put("fontSize", 24.0);
                defaults.put("fill", WHITE);
                defaults.put("showBackground", true);
                defaults.put("backgroundFill", "#000000");
                defaults.put("backgroundOpacity", 0.6);
                defaults.put("strokeWidth", 0.0);
            }
        }
        return defaults;
    }

    /**
     * Fills every missing attribute in place. Shapes with neither fill nor stroke get a white outline.
     */
    public static void applyDefaults(ObjectType type, Map<String, Object> object) {
        baseDefaults().forEach(object::putIfAbsent);
        double x = PropertyBag.numberOr(object, "x", 0.0);
        double y = PropertyBag.numberOr(object, "y", 0.0);
        Double sides = PropertyBag.number(object, "sides");
        if (type == ObjectType.POLYGON && sides != null && object.get("vertices") == null) {
            int count = isSupportedSides(sides) ? sides.intValue() : DEFAULT_SIDES;
            object.put("sides", count);
            object.put("vertices", regularVertices(count, PropertyBag.numberOr(object, "radius", 1.0)));
        }
        typeDefaults(type, x, y).forEach(object::putIfAbsent);
        if (object.get("fill") == null && object.get("stroke") == null) {
            object.put("stroke", WHITE);
        }
    }

    public static boolean isSupportedSides(double sides) {
        return sides >= MIN_SIDES && sides <= MAX_SIDES;
    }

    /**
     * @throws IllegalArgumentException when {@code sides} is outside [{@value #MIN_SIDES}, {@value #MAX_SIDES}]
     */
    public static List<Object> regularVertices(int sides, double radius) {
        if (!isSupportedSides(sides)) {
            throw new IllegalArgumentException("sides must be between " + MIN_SIDES + " and " + MAX_SIDES);
        }
        List<Object> vertices = new ArrayList<>(sides);
        for (int i = 0; i < sides; i++) {
            double angle = (i * 2.0 * Math.PI) / sides - Math.PI / 2.0;
            vertices.add(vertex(round(radius * Math.cos(angle)), round(radius * Math.sin(angle))));
        }
        return vertices;
    }

    private static Map<String, Object> vertex(double x, double y) {
        Map<String, Object> vertex = new LinkedHashMap<>();
        vertex.put("x", x);
        vertex.put("y", y);
        return vertex;
    }

    private static Map<String, Object> range(double min, double max, double step) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("min", min);
        range.put("max", max);
        range.put("step", step);
        return range;
    }

    private static double round(double value) {
        double rounded = Math.round(value * 10_000.0) / 10_000.0;
        return rounded == 0.0 ? 0.0 : rounded;
    }
}
