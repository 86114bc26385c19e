package github.sarthakdev143.scene_compiler.model.scene;

import github.sarthakdev143.scene_compiler.model.scene.shape.ArcShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.AxesShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphCursorShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.LatexShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.LimitProbeShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.RadialShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.RectangleShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.SegmentShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.TangentLineShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.TextShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.ValueLabelShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.VertexShape;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the canonical model back into the JSON property-bag shape it is read from.
 */
public final class ProjectWriter {

    private ProjectWriter() {
    }

    public static Map<String, Object> toRaw(Project project) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("version", project.version());
        raw.put("name", project.name());

        ProjectSettings settings = project.settings();
        if (settings != null) {
            Map<String, Object> rawSettings = new LinkedHashMap<>();
            rawSettings.put("width", settings.width());
            rawSettings.put("height", settings.height());
            rawSettings.put("fps", settings.fps());
            rawSettings.put("backgroundColor", settings.backgroundColor());
            raw.put("settings", rawSettings);
        }

        List<Object> scenes = new ArrayList<>();
        for (Scene scene : project.scenes()) {
            scenes.add(toRaw(scene));
        }
        raw.put("scenes", scenes);
        return raw;
    }

    public static Map<String, Object> toRaw(Scene scene) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", scene.id());
        raw.put("name", scene.name());
        raw.put("duration", scene.duration());
        List<Object> objects = new ArrayList<>();
        for (SceneObject object : scene.objects()) {
            objects.add(toRaw(object));
        }
        raw.put("objects", objects);
        return raw;
    }

    public static Map<String, Object> toRaw(SceneObject object) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", object.id());
        raw.put("name", object.name());
        raw.put("type", object.type().wireName());
        raw.put("x", object.x());
        raw.put("y", object.y());
        raw.put("rotation", object.rotation());
        raw.put("opacity", object.opacity());
        raw.put("zIndex", object.zIndex());
        putIfPresent(raw, "fill", object.fill());
        putIfPresent(raw, "stroke", object.stroke());
        raw.put("strokeWidth", object.strokeWidth());
        raw.put("delay", object.delay());
        raw.put("runTime", object.runTime());
        putIfPresent(raw, "animationType", object.animationType());
        putIfPresent(raw, "exitAnimationType", object.exitAnimationType());
        putIfPresent(raw, "transformFromId", object.transformFromId());
        putIfPresent(raw, "transformType", object.transformType());

        List<Object> keyframes = new ArrayList<>();
        for (Keyframe keyframe : object.keyframes()) {
            Map<String, Object> rawKeyframe = new LinkedHashMap<>();
            rawKeyframe.put("time", keyframe.time());
            rawKeyframe.put("property", keyframe.property());
            rawKeyframe.put("value", keyframe.value());
            keyframes.add(rawKeyframe);
        }
        raw.put("keyframes", keyframes);

        writeShape(raw, object);
        return raw;
    }

    private static void writeShape(Map<String, Object> raw, SceneObject object) {
        if (object.shape() instanceof RectangleShape rectangle) {
            raw.put("width", rectangle.width());
            raw.put("height", rectangle.height());
        } else if (object.shape() instanceof RadialShape radial) {
            raw.put("radius", radial.radius());
        } else if (object.shape() instanceof VertexShape polygon) {
            List<Object> vertices = new ArrayList<>();
            for (Vertex vertex : polygon.vertices()) {
                Map<String, Object> rawVertex = new LinkedHashMap<>();
                rawVertex.put("x", vertex.x());
                rawVertex.put("y", vertex.y());
                putIfPresent(rawVertex, "label", vertex.label());
                vertices.add(rawVertex);
            }
            raw.put("vertices", vertices);
            raw.put("sides", polygon.sides());
            raw.put("radius", polygon.radius());
        } else if (object.shape() instanceof SegmentShape segment) {
            raw.put("x2", segment.x2());
            raw.put("y2", segment.y2());
        } else if (object.shape() instanceof ArcShape arc) {
            raw.put("x2", arc.x2());
            raw.put("y2", arc.y2());
            raw.put("cx", arc.cx());
            raw.put("cy", arc.cy());
        } else if (object.shape() instanceof TextShape text) {
            raw.put("text", text.text());
            raw.put("fontSize", text.fontSize());
            raw.put("width", text.width());
            raw.put("height", text.height());
        } else if (object.shape() instanceof LatexShape latex) {
            raw.put("latex", latex.latex());
            raw.put("fontSize", latex.fontSize());
        } else if (object.shape() instanceof AxesShape axes) {
            raw.put("xRange", toRaw(axes.xRange()));
            raw.put("yRange", toRaw(axes.yRange()));
            raw.put("xLength", axes.xLength());
            raw.put("yLength", axes.yLength());
            raw.put("showTicks", axes.showTicks());
            putIfPresent(raw, "xLabel", axes.xLabel());
            putIfPresent(raw, "yLabel", axes.yLabel());
        } else if (object.shape() instanceof GraphShape graph) {
            raw.put("formula", graph.formula());
            raw.put("xRange", toRaw(graph.xRange()));
            raw.put("yRange", toRaw(graph.yRange()));
            putIfPresent(raw, "axesId", graph.axesId());
        } else if (object.shape() instanceof GraphCursorShape cursor) {
            raw.put("x0", cursor.x0());
            putIfPresent(raw, "graphId", cursor.graphId());
            putIfPresent(raw, "axesId", cursor.axesId());
            raw.put("radius", cursor.radius());
            raw.put("showDot", cursor.showDot());
            raw.put("showCrosshair", cursor.showCrosshair());
            raw.put("showLabel", cursor.showLabel());
        } else if (object.shape() instanceof TangentLineShape tangent) {
            raw.put("x0", tangent.x0());
            putIfPresent(raw, "graphId", tangent.graphId());
            putIfPresent(raw, "cursorId", tangent.cursorId());
            putIfPresent(raw, "axesId", tangent.axesId());
            raw.put("derivativeStep", tangent.derivativeStep());
            raw.put("visibleSpan", tangent.visibleSpan());
            raw.put("showSlopeLabel", tangent.showSlopeLabel());
        } else if (object.shape() instanceof LimitProbeShape probe) {
            raw.put("x0", probe.x0());
            putIfPresent(raw, "graphId", probe.graphId());
            putIfPresent(raw, "cursorId", probe.cursorId());
            putIfPresent(raw, "axesId", probe.axesId());
            raw.put("direction", probe.direction().toApiValue());
            raw.put("deltaSchedule", new ArrayList<>(probe.deltaSchedule()));
            raw.put("radius", probe.radius());
            raw.put("showPoints", probe.showPoints());
            raw.put("showReadout", probe.showReadout());
        } else if (object.shape() instanceof ValueLabelShape label) {
            putIfPresent(raw, "graphId", label.graphId());
            putIfPresent(raw, "cursorId", label.cursorId());
            putIfPresent(raw, "axesId", label.axesId());
            raw.put("valueType", label.valueType().toApiValue());
            putIfPresent(raw, "customExpression", label.customExpression());
            putIfPresent(raw, "labelPrefix", label.labelPrefix());
            putIfPresent(raw, "labelSuffix", label.labelSuffix());
            raw.put("fontSize", label.fontSize());
            raw.put("showBackground", label.showBackground());
            putIfPresent(raw, "backgroundFill", label.backgroundFill());
            raw.put("backgroundOpacity", label.backgroundOpacity());
        }
    }

    private static Map<String, Object> toRaw(Range range) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("min", range.min());
        raw.put("max", range.max());
        raw.put("step", range.step());
        return raw;
    }

    private static void putIfPresent(Map<String, Object> raw, String key, Object value) {
        if (value != null) {
            raw.put(key, value);
        }
    }
}
