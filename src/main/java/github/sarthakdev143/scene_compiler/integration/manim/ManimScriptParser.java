package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.linking.FormulaEvaluator;
import github.sarthakdev143.scene_compiler.linking.FormulaTranslator;
import github.sarthakdev143.scene_compiler.linking.PlanePoint;
import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.model.scene.ObjectDefaults;
import github.sarthakdev143.scene_compiler.model.scene.PropertyBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort reverse parse of a Manim script into {@code addObject} operations.
 * <p>
 * Each assignment whose right-hand side starts with a known constructor is handed to that
 * constructor's recognizer; chained and later mutation calls on the same variable are then folded
 * into the object in source order. Anything that cannot be read with confidence drops the whole
 * object instead of producing wrong values.
 */
@Component
public class ManimScriptParser {

    private static final Logger logger = LoggerFactory.getLogger(ManimScriptParser.class);

    private static final Pattern ASSIGNMENT_PATTERN = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    private static final Set<String> UNTRACKED_PLACEMENT = Set.of(
            "next_to", "to_edge", "to_corner", "align_to", "arrange", "arrange_in_grid", "surround");
    private static final String ANIMATE = "animate";
    private static final String PLOT = "plot";
    private static final PlanePoint DEFAULT_LINE_START = new PlanePoint(-1.0, 0.0);
    private static final PlanePoint DEFAULT_LINE_END = new PlanePoint(1.0, 0.0);

    private final FormulaTranslator formulaTranslator;
    private final ScriptValues values;
    private final Map<String, Recognizer> recognizers = new LinkedHashMap<>();

    public ManimScriptParser(ColorTable colorTable, FormulaEvaluator formulaEvaluator, FormulaTranslator formulaTranslator) {
        this.formulaTranslator = formulaTranslator;
        this.values = new ScriptValues(colorTable, formulaEvaluator);

        register("Circle", ObjectType.CIRCLE, this::readCircle);
        register("Square", ObjectType.RECTANGLE, this::readSquare);
        register("Rectangle", ObjectType.RECTANGLE, this::readRectangle);
        register("Dot", ObjectType.DOT, this::readDot);
        register("Line", ObjectType.LINE, this::readSegment);
        register("Arrow", ObjectType.ARROW, this::readSegment);
        register("Text", ObjectType.TEXT, this::readText);
        register("MathTex", ObjectType.LATEX, this::readLatex);
        register("Tex", ObjectType.LATEX, this::readLatex);
        register("Triangle", ObjectType.TRIANGLE, (arguments, object) -> readStyle(ObjectType.TRIANGLE, arguments, object));
        register("RegularPolygon", ObjectType.POLYGON, this::readRegularPolygon);
        register("Polygon", ObjectType.POLYGON, this::readPolygon);
        register("Axes", ObjectType.AXES, this::readAxes);
        register("CubicBezier", ObjectType.ARC, this::readCubicBezier);
        register("FunctionGraph", ObjectType.GRAPH, this::readFunctionGraph);
    }

    public List<SceneOperation> parse(String script) {
        if (script == null || script.isBlank()) {
            return List.of();
        }

        Map<String, ParsedObject> bindings = new HashMap<>();
        List<ParsedObject> parsed = new ArrayList<>();
        for (String statement : ScriptStatements.split(script)) {
            Matcher assignment = ASSIGNMENT_PATTERN.matcher(statement);
            if (assignment.matches()) {
                String variable = assignment.group(1);
                Optional<ParsedObject> object = recognize(variable, assignment.group(2), bindings);
                if (object.isPresent()) {
                    bindings.put(variable, object.get());
                    parsed.add(object.get());
                } else {
                    bindings.remove(variable);
                }
                continue;
            }
            CallChain.parse(statement).ifPresent(chain -> mutate(chain, bindings));
        }

        List<SceneOperation> operations = new ArrayList<>();
        for (ParsedObject object : parsed) {
            if (!object.discarded) {
                operations.add(SceneOperation.addObject(object.attributes));
            }
        }
        logger.debug("Recovered {} object(s) from script", operations.size());
        return operations;
    }

    private Optional<ParsedObject> recognize(String variable, String expression, Map<String, ParsedObject> bindings) {
        Optional<CallChain> parsedChain = CallChain.parse(expression);
        if (parsedChain.isEmpty()) {
            return Optional.empty();
        }
        CallChain chain = parsedChain.get();
        CallChain.Link head = chain.head();

        try {
            ParsedObject object;
            List<CallChain.Link> mutations;
            if (head.isCall() && recognizers.containsKey(head.name())) {
                Recognizer recognizer = recognizers.get(head.name());
                object = newObject(variable, recognizer.type());
                recognizer.reader().accept(ScriptArguments.parse(head.arguments()), object.attributes);
                mutations = chain.tail(1);
            } else if (!head.isCall() && chain.links().size() > 1 && PLOT.equals(chain.links().get(1).name())
                    && chain.links().get(1).isCall()) {
                object = newObject(variable, ObjectType.GRAPH);
                readPlot(ScriptArguments.parse(chain.links().get(1).arguments()), object.attributes, bindings.get(head.name()));
                mutations = chain.tail(2);
            } else {
                return Optional.empty();
            }

            ObjectDefaults.applyDefaults(object.type, object.attributes);
            for (CallChain.Link mutation : mutations) {
                applyMutation(object, mutation);
            }
            return Optional.of(object);
        } catch (ScriptValueException ex) {
            logger.debug("Skipping '{}': {}", variable, ex.getMessage());
            return Optional.empty();
        }
    }

    private void mutate(CallChain chain, Map<String, ParsedObject> bindings) {
        CallChain.Link head = chain.head();
        ParsedObject object = head.isCall() ? null : bindings.get(head.name());
        if (object == null || object.discarded) {
            return;
        }
        List<CallChain.Link> mutations = chain.tail(1);
        if (mutations.stream().anyMatch(link -> ANIMATE.equals(link.name()))) {
            return;
        }
        try {
            for (CallChain.Link mutation : mutations) {
                applyMutation(object, mutation);
            }
        } catch (ScriptValueException ex) {
            logger.debug("Dropping '{}' after an unreadable mutation: {}", object.variable, ex.getMessage());
            object.discarded = true;
        }
    }

    private void applyMutation(ParsedObject object, CallChain.Link mutation) {
        if (!mutation.isCall()) {
            return;
        }
        ScriptArguments arguments = ScriptArguments.parse(mutation.arguments());
        Map<String, Object> attributes = object.attributes;
        switch (mutation.name()) {
            case "move_to" -> moveTo(object, values.point(arguments.positional(0)));
            case "center" -> moveTo(object, new PlanePoint(0.0, 0.0));
            case "shift" -> {
                PlanePoint offset = new PlanePoint(0.0, 0.0);
                for (String vector : arguments.positional()) {
                    offset = offset.plus(values.point(vector));
                }
                shift(object, offset);
            }
            case "set_color" -> attributes.put(colorKey(object.type), values.color(arguments.argument("color", 0)));
            case "set_fill" -> {
                String color = arguments.argument("color", 0);
                if (color != null) {
                    attributes.put("fill", values.color(color));
                }
                String opacity = arguments.argument("opacity", 1);
                if (opacity != null) {
                    attributes.put("opacity", clampOpacity(values.number(opacity)));
                }
            }
            case "set_stroke" -> {
                String color = arguments.argument("color", 0);
                if (color != null) {
                    attributes.put("stroke", values.color(color));
                }
                String width = arguments.argument("width", 1);
                if (width != null) {
                    attributes.put("strokeWidth", values.number(width));
                }
            }
            case "set_opacity" -> attributes.put("opacity", clampOpacity(values.number(arguments.argument("opacity", 0))));
            case "scale" -> scale(object, values.number(arguments.argument("scale_factor", 0)));
            case "rotate" -> {
                double degrees = Math.toDegrees(values.number(arguments.argument("angle", 0)));
                double rotation = PropertyBag.numberOr(attributes, "rotation", 0.0) + degrees;
                attributes.put("rotation", Math.round(rotation * 1_000_000.0) / 1_000_000.0);
            }
            case "set_z_index" -> attributes.put("zIndex", (int) Math.round(values.number(arguments.argument("z_index", 0))));
            default -> {
                if (UNTRACKED_PLACEMENT.contains(mutation.name())) {
                    throw new ScriptValueException("position after ." + mutation.name() + "() cannot be tracked");
                }
                logger.debug("Ignoring .{}() on '{}'", mutation.name(), object.variable);
            }
        }
    }

    private void readCircle(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.CIRCLE, arguments, object);
        String radius = arguments.argument("radius", 0);
        object.put("radius", radius == null ? 1.0 : positive(values.number(radius), "radius"));
    }

    private void readSquare(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.RECTANGLE, arguments, object);
        String side = arguments.argument("side_length", 0);
        double length = side == null ? 2.0 : positive(values.number(side), "side_length");
        object.put("width", length);
        object.put("height", length);
    }

    private void readRectangle(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.RECTANGLE, arguments, object);
        String width = arguments.keyword("width");
        String height = arguments.keyword("height");
        object.put("width", width == null ? 2.0 : positive(values.number(width), "width"));
        object.put("height", height == null ? 1.0 : positive(values.number(height), "height"));
    }

    private void readDot(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.DOT, arguments, object);
        String point = arguments.argument("point", 0);
        if (point != null) {
            putPosition(object, values.point(point));
        }
        String radius = arguments.keyword("radius");
        if (radius != null) {
            object.put("radius", positive(values.number(radius), "radius"));
        }
    }

    private void readSegment(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.LINE, arguments, object);
        String start = arguments.argument("start", 0);
        String end = arguments.argument("end", 1);
        PlanePoint from = start == null ? DEFAULT_LINE_START : values.point(start);
        PlanePoint to = end == null ? DEFAULT_LINE_END : values.point(end);
        putPosition(object, from);
        object.put("x2", to.x());
        object.put("y2", to.y());
    }

    private void readText(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.TEXT, arguments, object);
        object.put("text", values.string(arguments.argument("text", 0)));
        String fontSize = arguments.keyword("font_size");
        if (fontSize != null) {
            object.put("fontSize", positive(values.number(fontSize), "font_size"));
        }
    }

    private void readLatex(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.LATEX, arguments, object);
        if (arguments.positional().isEmpty()) {
            throw new ScriptValueException("no tex strings");
        }
        List<String> parts = new ArrayList<>();
        for (String part : arguments.positional()) {
            parts.add(values.string(part));
        }
        object.put("latex", String.join(" ", parts));
        String fontSize = arguments.keyword("font_size");
        if (fontSize != null) {
            object.put("fontSize", positive(values.number(fontSize), "font_size"));
        }
    }

    private void readRegularPolygon(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.POLYGON, arguments, object);
        String sides = arguments.argument("n", 0);
        double count = sides == null ? ObjectDefaults.DEFAULT_SIDES : Math.round(values.number(sides));
        if (!ObjectDefaults.isSupportedSides(count)) {
            throw new ScriptValueException("polygon needs between " + ObjectDefaults.MIN_SIDES + " and "
                    + ObjectDefaults.MAX_SIDES + " sides");
        }
        object.put("sides", (int) count);
        String radius = arguments.keyword("radius");
        if (radius != null) {
            object.put("radius", positive(values.number(radius), "radius"));
        }
    }

    private void readPolygon(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.POLYGON, arguments, object);
        List<PlanePoint> points = new ArrayList<>();
        for (String vertex : arguments.positional()) {
            points.add(values.point(vertex));
        }
        if (points.size() < 3) {
            throw new ScriptValueException("polygon needs at least 3 vertices");
        }
        PlanePoint center = new PlanePoint(0.0, 0.0);
        for (PlanePoint point : points) {
            center = center.plus(point);
        }
        center = center.times(1.0 / points.size());

        List<Object> vertices = new ArrayList<>();
        for (PlanePoint point : points) {
            Map<String, Object> vertex = new LinkedHashMap<>();
            vertex.put("x", round(point.x() - center.x()));
            vertex.put("y", round(point.y() - center.y()));
            vertices.add(vertex);
        }
        putPosition(object, new PlanePoint(round(center.x()), round(center.y())));
        object.put("vertices", vertices);
        object.put("sides", points.size());
    }

    private void readAxes(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.AXES, arguments, object);
        String xRange = arguments.keyword("x_range");
        if (xRange != null) {
            object.put("xRange", range(xRange));
        }
        String yRange = arguments.keyword("y_range");
        if (yRange != null) {
            object.put("yRange", range(yRange));
        }
        String xLength = arguments.keyword("x_length");
        if (xLength != null) {
            object.put("xLength", positive(values.number(xLength), "x_length"));
        }
        String yLength = arguments.keyword("y_length");
        if (yLength != null) {
            object.put("yLength", positive(values.number(yLength), "y_length"));
        }
    }

    private void readCubicBezier(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.ARC, arguments, object);
        if (arguments.positional().size() != 4) {
            throw new ScriptValueException("cubic curve needs 4 points");
        }
        PlanePoint start = values.point(arguments.positional(0));
        PlanePoint first = values.point(arguments.positional(1));
        PlanePoint second = values.point(arguments.positional(2));
        PlanePoint end = values.point(arguments.positional(3));
        PlanePoint middle = ArcGeometry.cubicMidpoint(start, first, second, end);

        putPosition(object, start);
        object.put("x2", end.x());
        object.put("y2", end.y());
        object.put("cx", round(middle.x()));
        object.put("cy", round(middle.y()));
    }

    private void readFunctionGraph(ScriptArguments arguments, Map<String, Object> object) {
        readStyle(ObjectType.GRAPH, arguments, object);
        object.put("formula", formula(arguments.argument("function", 0)));
        String xRange = arguments.keyword("x_range");
        if (xRange != null) {
            object.put("xRange", range(xRange));
        }
    }

    private void readPlot(ScriptArguments arguments, Map<String, Object> object, ParsedObject axes) {
        if (axes == null || axes.type != ObjectType.AXES || axes.discarded) {
            throw new ScriptValueException("plot on something other than parsed axes");
        }
        readStyle(ObjectType.GRAPH, arguments, object);
        object.put("formula", formula(arguments.argument("function", 0)));
        object.put("axesId", axes.attributes.get("id"));
        String xRange = arguments.keyword("x_range");
        object.put("xRange", xRange != null ? range(xRange) : PropertyBag.deepCopy(axes.attributes.get("xRange")));
        object.put("yRange", PropertyBag.deepCopy(axes.attributes.get("yRange")));
    }

    private void readStyle(ObjectType type, ScriptArguments arguments, Map<String, Object> object) {
        String color = arguments.keyword("color");
        if (color != null) {
            object.put(colorKey(type), values.color(color));
        }
        String fillColor = arguments.keyword("fill_color");
        if (fillColor != null) {
            object.put("fill", values.color(fillColor));
        }
        String strokeColor = arguments.keyword("stroke_color");
        if (strokeColor != null) {
            object.put("stroke", values.color(strokeColor));
        }
        String strokeWidth = arguments.keyword("stroke_width");
        if (strokeWidth != null) {
            object.put("strokeWidth", values.number(strokeWidth));
        }
        // Without a fill color the fill opacity says nothing about how visible the object is.
        String fillOpacity = arguments.keyword("fill_opacity");
        if (fillOpacity != null && object.get("fill") != null) {
            object.put("opacity", clampOpacity(values.number(fillOpacity)));
        }
        String strokeOpacity = arguments.keyword("stroke_opacity");
        if (strokeOpacity != null && object.get("fill") == null) {
            object.put("opacity", clampOpacity(values.number(strokeOpacity)));
        }
    }

    private String formula(String lambda) {
        String formula = values.formula(lambda);
        if (formulaTranslator.toPython(formula).isEmpty()) {
            throw new ScriptValueException("formula outside the supported vocabulary: " + formula);
        }
        return formula;
    }

    private Map<String, Object> range(String raw) {
        List<Double> bounds = values.numbers(raw);
        if (bounds.size() < 2 || bounds.size() > 3) {
            throw new ScriptValueException("range needs 2 or 3 values: " + raw);
        }
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("min", bounds.get(0));
        range.put("max", bounds.get(1));
        if (bounds.size() == 3) {
            range.put("step", bounds.get(2));
        }
        return range;
    }

    private void moveTo(ParsedObject object, PlanePoint target) {
        shift(object, target.minus(center(object)));
    }

    private void shift(ParsedObject object, PlanePoint offset) {
        Map<String, Object> attributes = object.attributes;
        attributes.put("x", PropertyBag.numberOr(attributes, "x", 0.0) + offset.x());
        attributes.put("y", PropertyBag.numberOr(attributes, "y", 0.0) + offset.y());
        if (hasEndPoint(object.type)) {
            attributes.put("x2", PropertyBag.numberOr(attributes, "x2", 0.0) + offset.x());
            attributes.put("y2", PropertyBag.numberOr(attributes, "y2", 0.0) + offset.y());
        }
        if (object.type == ObjectType.ARC) {
            attributes.put("cx", PropertyBag.numberOr(attributes, "cx", 0.0) + offset.x());
            attributes.put("cy", PropertyBag.numberOr(attributes, "cy", 0.0) + offset.y());
        }
    }

    private void scale(ParsedObject object, double factor) {
        if (factor <= 0) {
            throw new ScriptValueException("non-positive scale factor " + factor);
        }
        Map<String, Object> attributes = object.attributes;
        for (String key : List.of("radius", "width", "height", "fontSize", "xLength", "yLength")) {
            Double value = PropertyBag.number(attributes, key);
            if (value != null) {
                attributes.put(key, value * factor);
            }
        }
        if (hasEndPoint(object.type)) {
            PlanePoint center = center(object);
            scaleAbout(attributes, "x", "y", center, factor);
            scaleAbout(attributes, "x2", "y2", center, factor);
            if (object.type == ObjectType.ARC) {
                scaleAbout(attributes, "cx", "cy", center, factor);
            }
        }
        List<Object> vertices = PropertyBag.list(attributes.get("vertices"));
        if (!vertices.isEmpty()) {
            List<Object> scaled = new ArrayList<>();
            for (Object raw : vertices) {
                Map<String, Object> vertex = PropertyBag.map(raw);
                if (vertex != null) {
                    vertex.put("x", PropertyBag.numberOr(vertex, "x", 0.0) * factor);
                    vertex.put("y", PropertyBag.numberOr(vertex, "y", 0.0) * factor);
                    scaled.add(vertex);
                }
            }
            attributes.put("vertices", scaled);
        }
    }

    private static void scaleAbout(Map<String, Object> attributes, String xKey, String yKey, PlanePoint center, double factor) {
        attributes.put(xKey, center.x() + (PropertyBag.numberOr(attributes, xKey, 0.0) - center.x()) * factor);
        attributes.put(yKey, center.y() + (PropertyBag.numberOr(attributes, yKey, 0.0) - center.y()) * factor);
    }

    private static PlanePoint center(ParsedObject object) {
        Map<String, Object> attributes = object.attributes;
        PlanePoint start = new PlanePoint(PropertyBag.numberOr(attributes, "x", 0.0), PropertyBag.numberOr(attributes, "y", 0.0));
        if (!hasEndPoint(object.type)) {
            return start;
        }
        PlanePoint end = new PlanePoint(PropertyBag.numberOr(attributes, "x2", 0.0), PropertyBag.numberOr(attributes, "y2", 0.0));
        return start.plus(end).times(0.5);
    }

    private static boolean hasEndPoint(ObjectType type) {
        return type == ObjectType.LINE || type == ObjectType.ARROW || type == ObjectType.ARC;
    }

    private static String colorKey(ObjectType type) {
        return type.isLineLike() ? "stroke" : "fill";
    }

    private static void putPosition(Map<String, Object> object, PlanePoint point) {
        object.put("x", point.x());
        object.put("y", point.y());
    }

    private static double positive(double value, String name) {
        if (value <= 0) {
            throw new ScriptValueException(name + " must be positive");
        }
        return value;
    }

    private static double clampOpacity(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        double rounded = Math.round(value * 10_000.0) / 10_000.0;
        return rounded == 0.0 ? 0.0 : rounded;
    }

    private void register(String constructor, ObjectType type, BiConsumer<ScriptArguments, Map<String, Object>> reader) {
        recognizers.put(constructor, new Recognizer(type, reader));
    }

    private static ParsedObject newObject(String variable, ObjectType type) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", UUID.randomUUID().toString());
        attributes.put("name", variable);
        attributes.put("type", type.wireName());
        return new ParsedObject(variable, type, attributes);
    }

    private record Recognizer(ObjectType type, BiConsumer<ScriptArguments, Map<String, Object>> reader) {
    }

    private static final class ParsedObject {
        private final String variable;
        private final ObjectType type;
        private final Map<String, Object> attributes;
        private boolean discarded;

        private ParsedObject(String variable, ObjectType type, Map<String, Object> attributes) {
            this.variable = variable;
            this.type = type;
            this.attributes = attributes;
        }
    }
}
