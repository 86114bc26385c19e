package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.integration.manim.ColorTable;
import github.sarthakdev143.scene_compiler.model.LimitDirection;
import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.ValueType;
import github.sarthakdev143.scene_compiler.model.scene.Keyframe;
import github.sarthakdev143.scene_compiler.model.scene.ObjectDefaults;
import github.sarthakdev143.scene_compiler.model.scene.Project;
import github.sarthakdev143.scene_compiler.model.scene.ProjectSettings;
import github.sarthakdev143.scene_compiler.model.scene.ProjectWriter;
import github.sarthakdev143.scene_compiler.model.scene.PropertyBag;
import github.sarthakdev143.scene_compiler.model.scene.Range;
import github.sarthakdev143.scene_compiler.model.scene.Scene;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.scene.Vertex;
import github.sarthakdev143.scene_compiler.model.scene.shape.ArcShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.AxesShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphCursorShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.LatexShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.LimitProbeShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.RadialShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.RectangleShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.SegmentShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.ShapeSpec;
import github.sarthakdev143.scene_compiler.model.scene.shape.TangentLineShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.TextShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.ValueLabelShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.VertexShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repairs arbitrary project data into a structurally valid {@link Project}. Never rejects input:
 * whatever cannot be repaired is dropped.
 */
@Component
public class ProjectValidator {

    private static final Logger logger = LoggerFactory.getLogger(ProjectValidator.class);

    public static final String SCHEMA_VERSION = "1.0.0";
    private static final String DEFAULT_PROJECT_NAME = "Untitled Project";
    private static final String DEFAULT_SCENE_NAME = "Untitled Scene";
    private static final String FIRST_SCENE_NAME = "Scene 1";
    private static final double DEFAULT_SCENE_DURATION_SECONDS = 5.0;
    private static final int DEFAULT_WIDTH = 1920;
    private static final int DEFAULT_HEIGHT = 1080;
    private static final int DEFAULT_FPS = 30;
    private static final String DEFAULT_BACKGROUND = "#1a1a2e";
    private static final int MIN_VERTICES = 3;

    private final ColorTable colorTable;

    public ProjectValidator(ColorTable colorTable) {
        this.colorTable = colorTable;
    }

    public Project validate(Project project) {
        if (project == null) {
            return validate((Object) null);
        }
        return validate(ProjectWriter.toRaw(project));
    }

    public Project validate(Object rawProject) {
        Map<String, Object> raw = PropertyBag.map(rawProject);
        if (raw == null) {
            logger.warn("Project data is not an object; starting from an empty project");
            raw = Map.of();
        }

        List<Scene> scenes = new ArrayList<>();
        List<Object> rawScenes = PropertyBag.list(raw.get("scenes"));
        for (int index = 0; index < rawScenes.size(); index++) {
            Map<String, Object> rawScene = PropertyBag.map(rawScenes.get(index));
            if (rawScene == null) {
                logger.warn("Dropping project.scenes[{}]: not an object", index);
                continue;
            }
            scenes.add(normalizeScene(index, rawScene));
        }
        if (scenes.isEmpty()) {
            scenes.add(new Scene(newId(), FIRST_SCENE_NAME, DEFAULT_SCENE_DURATION_SECONDS, List.of()));
        }

        return new Project(
                PropertyBag.textOr(raw, "version", SCHEMA_VERSION),
                PropertyBag.textOr(raw, "name", DEFAULT_PROJECT_NAME),
                normalizeSettings(PropertyBag.map(raw.get("settings"))),
                scenes);
    }

    private ProjectSettings normalizeSettings(Map<String, Object> settings) {
        return new ProjectSettings(
                positiveIntOrDefault(settings, "width", DEFAULT_WIDTH),
                positiveIntOrDefault(settings, "height", DEFAULT_HEIGHT),
                positiveIntOrDefault(settings, "fps", DEFAULT_FPS),
                colorOrDefault(settings, "backgroundColor", DEFAULT_BACKGROUND));
    }

    private Scene normalizeScene(int sceneIndex, Map<String, Object> rawScene) {
        Double duration = PropertyBag.number(rawScene, "duration");
        List<Object> rawObjects = PropertyBag.list(rawScene.get("objects"));

        List<ObjectType> types = new ArrayList<>();
        List<Map<String, Object>> bags = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int index = 0; index < rawObjects.size(); index++) {
            String path = "scenes[" + sceneIndex + "].objects[" + index + "]";
            Map<String, Object> bag = PropertyBag.map(rawObjects.get(index));
            if (bag == null) {
                logger.warn("Dropping {}: not an object", path);
                continue;
            }
            Optional<ObjectType> type = ObjectType.fromWireName(bag.get("type"));
            if (type.isEmpty()) {
                logger.warn("Dropping {}: unknown type {}", path, bag.get("type"));
                continue;
            }
            String id = PropertyBag.text(bag, "id");
            if (id == null || !ids.add(id)) {
                String repaired = newId();
                if (id != null) {
                    logger.warn("Reassigning duplicate id {} at {} to {}", id, path, repaired);
                }
                bag.put("id", repaired);
                ids.add(repaired);
            }
            types.add(type.get());
            bags.add(bag);
        }

        List<SceneObject> objects = new ArrayList<>();
        for (int index = 0; index < bags.size(); index++) {
            objects.add(normalizeObject(types.get(index), bags.get(index), ids));
        }

        return new Scene(
                PropertyBag.textOr(rawScene, "id", newId()),
                PropertyBag.textOr(rawScene, "name", DEFAULT_SCENE_NAME),
                duration != null && duration > 0 ? duration : DEFAULT_SCENE_DURATION_SECONDS,
                objects);
    }

    private SceneObject normalizeObject(ObjectType type, Map<String, Object> bag, Set<String> sceneIds) {
        String id = PropertyBag.text(bag, "id");
        double x = PropertyBag.numberOr(bag, "x", 0.0);
        double y = PropertyBag.numberOr(bag, "y", 0.0);
        Map<String, Object> defaults = ObjectDefaults.typeDefaults(type, x, y);

        String transformFromId = PropertyBag.text(bag, "transformFromId");
        if (transformFromId != null && (transformFromId.equals(id) || !sceneIds.contains(transformFromId))) {
            logger.warn("Object {} references missing transform source {}; reverting to a normal entrance", id, transformFromId);
            transformFromId = null;
        }

        String fill = colorOrDefault(bag, "fill", colorOrDefault(defaults, "fill", null));
        String stroke = colorOrDefault(bag, "stroke", colorOrDefault(defaults, "stroke", null));
        Double zIndex = PropertyBag.number(bag, "zIndex");

        return new SceneObject(
                id,
                PropertyBag.textOr(bag, "name", type.label()),
                type,
                x,
                y,
                PropertyBag.numberOr(bag, "rotation", 0.0),
                Math.max(0.0, Math.min(1.0, PropertyBag.numberOr(bag, "opacity", 1.0))),
                zIndex == null ? 0 : zIndex.intValue(),
                fill,
                stroke,
                nonNegativeOrDefault(bag, "strokeWidth", PropertyBag.numberOr(defaults, "strokeWidth", 2.0)),
                Math.max(0.0, PropertyBag.numberOr(bag, "delay", 0.0)),
                Math.max(ObjectDefaults.MIN_RUN_TIME, PropertyBag.numberOr(bag, "runTime", ObjectDefaults.DEFAULT_RUN_TIME)),
                PropertyBag.textOr(bag, "animationType", ObjectDefaults.AUTO_ANIMATION),
                transformFromId == null
                        ? PropertyBag.textOr(bag, "exitAnimationType", ObjectDefaults.DEFAULT_EXIT_ANIMATION)
                        : null,
                transformFromId,
                transformFromId == null ? null : PropertyBag.text(bag, "transformType"),
                normalizeKeyframes(PropertyBag.list(bag.get("keyframes"))),
                readShape(type, bag, defaults));
    }

    /**
     * Keyframes sharing (time, property) collapse to the last one listed, then sort stably by time.
     */
    List<Keyframe> normalizeKeyframes(List<Object> rawKeyframes) {
        Map<String, Keyframe> byTimeAndProperty = new LinkedHashMap<>();
        for (Object rawKeyframe : rawKeyframes) {
            Map<String, Object> keyframe = PropertyBag.map(rawKeyframe);
            Double time = PropertyBag.number(keyframe, "time");
            String property = PropertyBag.text(keyframe, "property");
            Object value = keyframe == null ? null : keyframe.get("value");
            if (value instanceof Number) {
                value = PropertyBag.number(value);
            }
            if (time == null || time < 0 || property == null
                    || !(value instanceof Double || value instanceof String || value instanceof Boolean)) {
                continue;
            }
            String key = time + "|" + property;
            byTimeAndProperty.remove(key);
            byTimeAndProperty.put(key, new Keyframe(time, property, value));
        }
        List<Keyframe> keyframes = new ArrayList<>(byTimeAndProperty.values());
        keyframes.sort(Comparator.comparingDouble(Keyframe::time));
        return keyframes;
    }

    private ShapeSpec readShape(ObjectType type, Map<String, Object> bag, Map<String, Object> defaults) {
        return switch (type) {
            case RECTANGLE -> new RectangleShape(
                    positiveOrDefault(bag, defaults, "width"),
                    positiveOrDefault(bag, defaults, "height"));
            case CIRCLE, DOT -> new RadialShape(positiveOrDefault(bag, defaults, "radius"));
            case TRIANGLE, POLYGON -> readVertexShape(type, bag, defaults);
            case LINE, ARROW -> new SegmentShape(
                    PropertyBag.numberOr(bag, "x2", PropertyBag.numberOr(defaults, "x2", 0.0)),
                    PropertyBag.numberOr(bag, "y2", PropertyBag.numberOr(defaults, "y2", 0.0)));
            case ARC -> new ArcShape(
                    PropertyBag.numberOr(bag, "x2", PropertyBag.numberOr(defaults, "x2", 0.0)),
                    PropertyBag.numberOr(bag, "y2", PropertyBag.numberOr(defaults, "y2", 0.0)),
                    PropertyBag.numberOr(bag, "cx", PropertyBag.numberOr(defaults, "cx", 0.0)),
                    PropertyBag.numberOr(bag, "cy", PropertyBag.numberOr(defaults, "cy", 0.0)));
            case TEXT -> new TextShape(
                    stringOrDefault(bag, defaults, "text"),
                    positiveOrDefault(bag, defaults, "fontSize"),
                    positiveOrDefault(bag, defaults, "width"),
                    positiveOrDefault(bag, defaults, "height"));
            case LATEX -> new LatexShape(
                    stringOrDefault(bag, defaults, "latex"),
                    positiveOrDefault(bag, defaults, "fontSize"));
            case AXES -> new AxesShape(
                    readRange(bag.get("xRange"), defaults.get("xRange")),
                    readRange(bag.get("yRange"), defaults.get("yRange")),
                    positiveOrDefault(bag, defaults, "xLength"),
                    positiveOrDefault(bag, defaults, "yLength"),
                    PropertyBag.flagOr(bag, "showTicks", true),
                    stringOrDefault(bag, defaults, "xLabel"),
                    stringOrDefault(bag, defaults, "yLabel"));
            case GRAPH -> new GraphShape(
                    PropertyBag.textOr(bag, "formula", (String) defaults.get("formula")),
                    readRange(bag.get("xRange"), defaults.get("xRange")),
                    readRange(bag.get("yRange"), defaults.get("yRange")),
                    PropertyBag.text(bag, "axesId"));
            case GRAPH_CURSOR -> new GraphCursorShape(
                    PropertyBag.numberOr(bag, "x0", 0.0),
                    PropertyBag.text(bag, "graphId"),
                    PropertyBag.text(bag, "axesId"),
                    positiveOrDefault(bag, defaults, "radius"),
                    PropertyBag.flagOr(bag, "showDot", true),
                    PropertyBag.flagOr(bag, "showCrosshair", false),
                    PropertyBag.flagOr(bag, "showLabel", false));
            case TANGENT_LINE -> new TangentLineShape(
                    PropertyBag.numberOr(bag, "x0", 0.0),
                    PropertyBag.text(bag, "graphId"),
                    PropertyBag.text(bag, "cursorId"),
                    PropertyBag.text(bag, "axesId"),
                    positiveOrDefault(bag, defaults, "derivativeStep"),
                    positiveOrDefault(bag, defaults, "visibleSpan"),
                    PropertyBag.flagOr(bag, "showSlopeLabel", false));
            case LIMIT_PROBE -> new LimitProbeShape(
                    PropertyBag.numberOr(bag, "x0", 0.0),
                    PropertyBag.text(bag, "graphId"),
                    PropertyBag.text(bag, "cursorId"),
                    PropertyBag.text(bag, "axesId"),
                    LimitDirection.fromInput(bag.get("direction")),
                    readDeltaSchedule(bag.get("deltaSchedule"), defaults.get("deltaSchedule")),
                    positiveOrDefault(bag, defaults, "radius"),
                    PropertyBag.flagOr(bag, "showPoints", true),
                    PropertyBag.flagOr(bag, "showReadout", false));
            case VALUE_LABEL -> new ValueLabelShape(
                    PropertyBag.text(bag, "graphId"),
                    PropertyBag.text(bag, "cursorId"),
                    PropertyBag.text(bag, "axesId"),
                    ValueType.fromInput(bag.get("valueType")),
                    PropertyBag.text(bag, "customExpression"),
                    bag.get("labelPrefix") instanceof String prefix ? prefix : null,
                    bag.get("labelSuffix") instanceof String suffix ? suffix : null,
                    positiveOrDefault(bag, defaults, "fontSize"),
                    PropertyBag.flagOr(bag, "showBackground", true),
                    colorOrDefault(bag, "backgroundFill", (String) defaults.get("backgroundFill")),
                    Math.max(0.0, Math.min(1.0, PropertyBag.numberOr(bag, "backgroundOpacity", 0.6))));
        };
    }

    private VertexShape readVertexShape(ObjectType type, Map<String, Object> bag, Map<String, Object> defaults) {
        Double sidesInput = PropertyBag.number(bag, "sides");
        int sides = sidesInput != null && ObjectDefaults.isSupportedSides(sidesInput)
                ? sidesInput.intValue()
                : type == ObjectType.TRIANGLE ? 3 : PropertyBag.number(defaults, "sides").intValue();
        double radius = positiveOrDefault(bag, Map.of("radius", 1.0), "radius");

        List<Vertex> vertices = readVertices(bag.get("vertices"));
        if (vertices.size() < MIN_VERTICES) {
            List<Object> fallback = type == ObjectType.POLYGON
                    ? ObjectDefaults.regularVertices(sides, radius)
                    : PropertyBag.list(defaults.get("vertices"));
            vertices = readVertices(fallback);
        }
        return new VertexShape(vertices, sides, radius);
    }

    private List<Vertex> readVertices(Object rawVertices) {
        List<Vertex> vertices = new ArrayList<>();
        for (Object rawVertex : PropertyBag.list(rawVertices)) {
            Map<String, Object> vertex = PropertyBag.map(rawVertex);
            Double x = PropertyBag.number(vertex, "x");
            Double y = PropertyBag.number(vertex, "y");
            if (x != null && y != null) {
                vertices.add(new Vertex(x, y, PropertyBag.text(vertex, "label")));
            }
        }
        return vertices;
    }

    private Range readRange(Object rawRange, Object fallbackRange) {
        Map<String, Object> fallback = PropertyBag.map(fallbackRange);
        Range defaultRange = new Range(
                PropertyBag.numberOr(fallback, "min", -5.0),
                PropertyBag.numberOr(fallback, "max", 5.0),
                PropertyBag.numberOr(fallback, "step", 1.0));

        Map<String, Object> range = PropertyBag.map(rawRange);
        Double min = PropertyBag.number(range, "min");
        Double max = PropertyBag.number(range, "max");
        if (min == null || max == null || min.equals(max)) {
            return defaultRange;
        }
        Double step = PropertyBag.number(range, "step");
        return new Range(
                Math.min(min, max),
                Math.max(min, max),
                step != null && step > 0 ? step : defaultRange.step());
    }

    private List<Double> readDeltaSchedule(Object rawSchedule, Object fallbackSchedule) {
        List<Double> schedule = new ArrayList<>();
        for (Object rawDelta : PropertyBag.list(rawSchedule)) {
            Double delta = PropertyBag.number(rawDelta);
            if (delta != null && delta != 0.0) {
                schedule.add(Math.abs(delta));
            }
        }
        if (!schedule.isEmpty()) {
            return schedule;
        }
        for (Object rawDelta : PropertyBag.list(fallbackSchedule)) {
            schedule.add(PropertyBag.number(rawDelta));
        }
        return schedule;
    }

    private String colorOrDefault(Map<String, Object> bag, String key, String defaultValue) {
        if (bag == null || !(bag.get(key) instanceof String color)) {
            return defaultValue;
        }
        return colorTable.normalize(color).orElse(defaultValue);
    }

    private double positiveOrDefault(Map<String, Object> bag, Map<String, Object> defaults, String key) {
        Double value = PropertyBag.number(bag, key);
        if (value != null && value > 0) {
            return value;
        }
        return PropertyBag.numberOr(defaults, key, 1.0);
    }

    private double nonNegativeOrDefault(Map<String, Object> bag, String key, double defaultValue) {
        Double value = PropertyBag.number(bag, key);
        return value != null && value >= 0 ? value : defaultValue;
    }

    private int positiveIntOrDefault(Map<String, Object> bag, String key, int defaultValue) {
        Double value = PropertyBag.number(bag, key);
        return value != null && value >= 1 ? value.intValue() : defaultValue;
    }

    private String stringOrDefault(Map<String, Object> bag, Map<String, Object> defaults, String key) {
        if (bag.get(key) instanceof String value) {
            return value;
        }
        return (String) defaults.get(key);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
