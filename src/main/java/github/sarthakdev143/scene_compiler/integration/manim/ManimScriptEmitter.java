package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.linking.GraphMath;
import github.sarthakdev143.scene_compiler.linking.LimitEstimate;
import github.sarthakdev143.scene_compiler.linking.LinkResolver;
import github.sarthakdev143.scene_compiler.linking.PlanePoint;
import github.sarthakdev143.scene_compiler.linking.ResolvedLinks;
import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.scene.Project;
import github.sarthakdev143.scene_compiler.model.scene.ProjectSettings;
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
import github.sarthakdev143.scene_compiler.model.scene.shape.TangentLineShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.TextShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.ValueLabelShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.VertexShape;
import github.sarthakdev143.scene_compiler.model.timeline.CreationStep;
import github.sarthakdev143.scene_compiler.model.timeline.ExitStep;
import github.sarthakdev143.scene_compiler.model.timeline.KeyframeStep;
import github.sarthakdev143.scene_compiler.model.timeline.TimelineBatch;
import github.sarthakdev143.scene_compiler.model.timeline.TransformStep;
import github.sarthakdev143.scene_compiler.timeline.EventScheduler;
import github.sarthakdev143.scene_compiler.timeline.ObjectVariables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders a project as a Manim script: one {@code Scene} subclass per scene, constructor statements
 * for every renderable object, then the scheduled animation calls.
 */
@Component
public class ManimScriptEmitter {

    private static final Logger logger = LoggerFactory.getLogger(ManimScriptEmitter.class);

    private static final String INDENT = "        ";
    private static final String FALLBACK_CLASS_NAME = "Scene1";
    private static final String DEFAULT_STROKE = "#ffffff";
    private static final double TRAILING_WAIT_SECONDS = 1.0;
    private static final Set<String> RESERVED_CLASS_NAMES = Set.of(
            "Scene", "VGroup", "Text", "MathTex", "Tex", "Circle", "Rectangle", "Square", "Dot", "Line",
            "Arrow", "Polygon", "CubicBezier", "Axes", "DashedLine", "BackgroundRectangle", "Create",
            "Write", "FadeIn", "FadeOut", "Transform");

    private final ColorTable colorTable;
    private final LinkResolver linkResolver;
    private final EventScheduler eventScheduler;
    private final GraphMath graphMath;

    public ManimScriptEmitter(
            ColorTable colorTable,
            LinkResolver linkResolver,
            EventScheduler eventScheduler,
            GraphMath graphMath) {
        this.colorTable = colorTable;
        this.linkResolver = linkResolver;
        this.eventScheduler = eventScheduler;
        this.graphMath = graphMath;
    }

    public String emit(Project project, String activeSceneId) {
        return emitScript(project, activeSceneId).text();
    }

    public ManimScript emitScript(Project project, String activeSceneId) {
        List<String> classNames = sceneClassNames(project);
        int omitted = 0;
        StringBuilder script = new StringBuilder();
        script.append("from manim import *\n");
        script.append("import numpy as np\n");
        project.findScene(activeSceneId).ifPresent(active -> script
                .append("\n# Active scene: ")
                .append(classNames.get(project.scenes().indexOf(active)))
                .append('\n'));

        for (int index = 0; index < project.scenes().size(); index++) {
            script.append("\n\n");
            omitted += emitScene(script, project.scenes().get(index), classNames.get(index), project.settings());
        }
        return new ManimScript(script.toString(), omitted);
    }

    /**
     * Class name of the given scene, or of the first scene when the id is unknown.
     */
    public String sceneClassName(Project project, String sceneId) {
        List<String> classNames = sceneClassNames(project);
        if (classNames.isEmpty()) {
            return FALLBACK_CLASS_NAME;
        }
        int index = project.findScene(sceneId).map(project.scenes()::indexOf).orElse(0);
        return classNames.get(index);
    }

    public List<String> sceneClassNames(Project project) {
        List<String> classNames = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (Scene scene : project.scenes()) {
            String base = sanitizeClassName(scene.name());
            String candidate = base;
            int suffix = 2;
            while (!used.add(candidate)) {
                candidate = base + "_" + suffix++;
            }
            classNames.add(candidate);
        }
        return classNames;
    }

    static String sanitizeClassName(String name) {
        StringBuilder className = new StringBuilder();
        String cleaned = name == null ? "" : name.replaceAll("[^a-zA-Z0-9\\s]", "");
        for (String word : cleaned.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                className.append(Character.toUpperCase(word.charAt(0)))
                        .append(word.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        if (className.length() == 0) {
            return FALLBACK_CLASS_NAME;
        }
        if (Character.isDigit(className.charAt(0))) {
            className.insert(0, "Scene");
        }
        if (RESERVED_CLASS_NAMES.contains(className.toString())) {
            className.append("Scene");
        }
        return className.toString();
    }

    /**
     * Returns the number of objects left out of the scene.
     */
    private int emitScene(StringBuilder script, Scene scene, String className, ProjectSettings settings) {
        script.append("class ").append(className).append("(Scene):\n");
        script.append("    def construct(self):\n");
        if (scene.objects().isEmpty()) {
            script.append(INDENT).append("pass  # Empty scene\n");
            return 0;
        }
        if (settings != null && settings.backgroundColor() != null) {
            line(script, "self.camera.background_color = " + colorTable.scriptLiteral(settings.backgroundColor()));
        }

        List<SceneObject> objects = scene.objects();
        Map<String, ResolvedLinks> links = linkResolver.resolve(objects);
        Map<String, Integer> indexById = new HashMap<>();
        for (int index = 0; index < objects.size(); index++) {
            indexById.putIfAbsent(objects.get(index).id(), index);
        }

        Map<String, List<String>> statementsById = new LinkedHashMap<>();
        for (int index = 0; index < objects.size(); index++) {
            SceneObject object = objects.get(index);
            if (statementsById.containsKey(object.id())) {
                continue;
            }
            statementsById.put(object.id(), finiteConstructorStatements(
                    object,
                    ObjectVariables.of(index, object),
                    links.get(object.id()),
                    indexById,
                    objects));
        }
        omitFramelessDependants(objects, links, indexById, statementsById);

        int omitted = 0;
        for (Map.Entry<String, List<String>> entry : statementsById.entrySet()) {
            if (entry.getValue().isEmpty()) {
                omitted++;
                logger.debug("Omitting object {} from scene {}", entry.getKey(), scene.id());
            }
        }

        Set<String> emitted = new HashSet<>();
        for (SceneObject object : objects) {
            emitInDependencyOrder(script, object, statementsById, links, emitted);
        }

        List<TimelineBatch> batches = eventScheduler.schedule(
                objects,
                object -> !statementsById.getOrDefault(object.id(), List.of()).isEmpty());
        for (TimelineBatch batch : batches) {
            StringBuilder calls = new StringBuilder();
            try {
                emitBatch(calls, batch);
            } catch (NonFiniteNumberException ex) {
                logger.debug("Stopping animations of scene {} at {}s: {}", scene.id(), batch.time(), ex.getMessage());
                break;
            }
            script.append(calls);
        }
        line(script, "self.wait(" + number(TRAILING_WAIT_SECONDS) + ")");
        return omitted;
    }

    private List<String> finiteConstructorStatements(
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        try {
            return constructorStatements(object, variable, links, indexById, objects);
        } catch (NonFiniteNumberException ex) {
            logger.debug("Object {} ({}) has a value that cannot be written: {}",
                    object.id(), object.type().wireName(), ex.getMessage());
            return List.of();
        }
    }

    /**
     * Drops objects that draw through the coordinate frame of an object that was itself omitted.
     */
    private void omitFramelessDependants(
            List<SceneObject> objects,
            Map<String, ResolvedLinks> links,
            Map<String, Integer> indexById,
            Map<String, List<String>> statementsById) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (SceneObject object : objects) {
                ResolvedLinks resolved = links.get(object.id());
                List<String> statements = statementsById.get(object.id());
                if (resolved == null || resolved.frameOwner() == null || resolved.frameOwner() == object
                        || statements.isEmpty()
                        || !statementsById.getOrDefault(resolved.frameOwner().id(), List.of()).isEmpty()) {
                    continue;
                }
                Pattern frameReference = Pattern.compile(
                        "\\b" + Pattern.quote(frameVariable(resolved, indexById, objects)) + "\\b");
                if (statements.stream().anyMatch(statement -> frameReference.matcher(statement).find())) {
                    statementsById.put(object.id(), List.of());
                    changed = true;
                }
            }
        }
    }

    private void emitInDependencyOrder(
            StringBuilder script,
            SceneObject object,
            Map<String, List<String>> statementsById,
            Map<String, ResolvedLinks> links,
            Set<String> emitted) {
        if (!emitted.add(object.id())) {
            return;
        }
        ResolvedLinks resolved = links.get(object.id());
        if (resolved != null) {
            for (SceneObject dependency : new SceneObject[]{resolved.frameOwner(), resolved.graph(), resolved.cursor()}) {
                if (dependency != null && dependency != object) {
                    emitInDependencyOrder(script, dependency, statementsById, links, emitted);
                }
            }
        }
        for (String statement : statementsById.getOrDefault(object.id(), List.of())) {
            line(script, statement);
        }
    }

    private void emitBatch(StringBuilder script, TimelineBatch batch) {
        if (batch.waitBefore() > 0) {
            line(script, "self.wait(" + number(batch.waitBefore()) + ")");
        }
        if (!batch.creations().isEmpty()) {
            StringJoiner call = new StringJoiner(", ", "self.play(", ")");
            for (CreationStep step : batch.creations()) {
                call.add(step.animation() + "(" + step.variable() + ", run_time=" + number(step.runTime()) + ")");
            }
            line(script, call.toString());
        }
        if (!batch.transforms().isEmpty()) {
            StringJoiner call = new StringJoiner(", ", "self.play(", ")");
            for (TransformStep step : batch.transforms()) {
                call.add(step.style().animationName() + "(" + step.sourceVariable() + ", " + step.targetVariable()
                        + ", run_time=" + number(step.runTime()) + ")");
            }
            line(script, call.toString());
        }
        List<String> edits = new ArrayList<>();
        for (KeyframeStep step : batch.keyframeEdits()) {
            try {
                String edit = keyframeAnimation(step);
                if (edit != null) {
                    edits.add(edit);
                }
            } catch (NonFiniteNumberException ex) {
                logger.debug("Skipping keyframe edit of {} at {}s: {}", step.objectId(), batch.time(), ex.getMessage());
            }
        }
        if (!edits.isEmpty()) {
            double runTime = batch.duration()
                    - maxRunTime(batch.creations().stream().mapToDouble(CreationStep::runTime).toArray())
                    - maxRunTime(batch.transforms().stream().mapToDouble(TransformStep::runTime).toArray())
                    - maxRunTime(batch.exits().stream().mapToDouble(ExitStep::runTime).toArray());
            line(script, "self.play(" + String.join(", ", edits) + ", run_time=" + number(runTime) + ")");
        }
        if (!batch.exits().isEmpty()) {
            StringJoiner call = new StringJoiner(", ", "self.play(", ")");
            for (ExitStep step : batch.exits()) {
                call.add(step.animation() + "(" + step.variable() + ", run_time=" + number(step.runTime()) + ")");
            }
            line(script, call.toString());
        }
    }

    private String keyframeAnimation(KeyframeStep step) {
        StringBuilder chain = new StringBuilder(step.variable()).append(".animate");
        boolean changed = false;
        if (step.hasShift()) {
            chain.append(".shift(").append(point(step.shiftX(), step.shiftY())).append(')');
            changed = true;
        }
        if (step.rotateDegrees() != null) {
            chain.append(".rotate(").append(number(step.rotateDegrees())).append(" * DEGREES)");
            changed = true;
        }
        if (step.scaleFactor() != null) {
            chain.append(".scale(").append(number(step.scaleFactor())).append(')');
            changed = true;
        }
        if (step.opacity() != null) {
            chain.append(".set_opacity(").append(number(step.opacity())).append(')');
            changed = true;
        }
        if (step.color() != null) {
            String hex = colorTable.normalize(step.color())
                    .or(() -> colorTable.hexForConstant(step.color()))
                    .orElse(null);
            if (hex != null) {
                chain.append(".set_color(").append(colorTable.scriptLiteral(hex)).append(')');
                changed = true;
            }
        }
        return changed ? chain.toString() : null;
    }

    private List<String> constructorStatements(
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        List<String> statements = new ArrayList<>();
        switch (object.type()) {
            case RECTANGLE -> {
                RectangleShape rectangle = object.shapeAs(RectangleShape.class);
                statements.add(variable + " = Rectangle(width=" + number(rectangle.width()) + ", height="
                        + number(rectangle.height()) + ", " + closedStyle(object) + ")"
                        + placement(object) + transformSuffix(object));
            }
            case CIRCLE -> statements.add(variable + " = Circle(radius="
                    + number(object.shapeAs(RadialShape.class).radius()) + ", " + closedStyle(object) + ")"
                    + placement(object) + transformSuffix(object));
            case DOT -> statements.add(variable + " = Dot(point=" + point(object.x(), object.y())
                    + ", radius=" + number(object.shapeAs(RadialShape.class).radius())
                    + ", color=" + color(object.fill(), DEFAULT_STROKE)
                    + ", fill_opacity=" + number(object.opacity()) + ")" + transformSuffix(object));
            case TRIANGLE, POLYGON -> {
                StringJoiner points = new StringJoiner(", ");
                for (Vertex vertex : object.shapeAs(VertexShape.class).vertices()) {
                    points.add(point(object.x() + vertex.x(), object.y() + vertex.y()));
                }
                statements.add(variable + " = Polygon(" + points + ", " + closedStyle(object) + ")"
                        + transformSuffix(object));
            }
            case LINE, ARROW -> {
                SegmentShape segment = object.shapeAs(SegmentShape.class);
                boolean arrow = object.type() == ObjectType.ARROW;
                String constructor = arrow ? "Arrow" : "Line";
                String buff = arrow ? ", buff=0" : "";
                statements.add(variable + " = " + constructor + "(" + point(object.x(), object.y()) + ", "
                        + point(segment.x2(), segment.y2()) + buff + ", " + strokeStyle(object) + ")"
                        + transformSuffix(object));
            }
            case ARC -> {
                ArcShape arc = object.shapeAs(ArcShape.class);
                PlanePoint start = new PlanePoint(object.x(), object.y());
                PlanePoint end = new PlanePoint(arc.x2(), arc.y2());
                PlanePoint control = ArcGeometry.quadraticControlThrough(start, new PlanePoint(arc.cx(), arc.cy()), end);
                ArcGeometry.CubicControls cubic = ArcGeometry.cubicControls(start, control, end);
                statements.add(variable + " = CubicBezier(" + point(start) + ", " + point(cubic.first()) + ", "
                        + point(cubic.second()) + ", " + point(end) + ", " + strokeStyle(object) + ")"
                        + transformSuffix(object));
            }
            case TEXT -> {
                TextShape text = object.shapeAs(TextShape.class);
                statements.add(variable + " = Text(" + pythonString(text.text()) + ", font_size="
                        + number(text.fontSize()) + ", color=" + color(object.fill(), DEFAULT_STROKE) + ")"
                        + placement(object) + opacitySuffix(object) + transformSuffix(object));
            }
            case LATEX -> {
                LatexShape latex = object.shapeAs(LatexShape.class);
                statements.add(variable + " = MathTex(" + latexString(latex.latex()) + ", font_size="
                        + number(latex.fontSize()) + ", color=" + color(object.fill(), DEFAULT_STROKE) + ")"
                        + placement(object) + opacitySuffix(object) + transformSuffix(object));
            }
            case AXES -> emitAxes(statements, object, variable);
            case GRAPH -> emitGraph(statements, object, variable, links, indexById, objects);
            case GRAPH_CURSOR -> emitCursor(statements, object, variable, links, indexById, objects);
            case TANGENT_LINE -> emitTangent(statements, object, variable, links, indexById, objects);
            case LIMIT_PROBE -> emitLimitProbe(statements, object, variable, links, indexById, objects);
            case VALUE_LABEL -> emitValueLabel(statements, object, variable, links, indexById, objects);
        }
        return statements;
    }

    private void emitAxes(List<String> statements, SceneObject object, String variable) {
        AxesShape axes = object.shapeAs(AxesShape.class);
        String axesVariable = variable + "_axes";
        statements.add(axesVariable + " = Axes(x_range=" + range(axes.xRange()) + ", y_range=" + range(axes.yRange())
                + ", x_length=" + number(axes.xLength()) + ", y_length=" + number(axes.yLength())
                + ", axis_config={\"color\": " + color(object.stroke(), DEFAULT_STROKE)
                + ", \"stroke_width\": " + number(object.strokeWidth())
                + ", \"include_ticks\": " + (axes.showTicks() ? "True" : "False") + "})"
                + placement(object));
        if (isBlank(axes.xLabel()) && isBlank(axes.yLabel())) {
            statements.add(variable + " = " + axesVariable + transformSuffix(object));
        } else {
            statements.add(variable + " = VGroup(" + axesVariable + ", " + axesVariable + ".get_axis_labels(x_label="
                    + axisLabel(axes.xLabel()) + ", y_label=" + axisLabel(axes.yLabel()) + "))"
                    + transformSuffix(object));
        }
    }

    private static String axisLabel(String label) {
        return pythonString(isBlank(label) ? "" : label);
    }

    private void emitGraph(
            List<String> statements,
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        GraphShape graph = object.shapeAs(GraphShape.class);
        if (links == null || links.pythonFormula() == null) {
            return;
        }
        String plot = ".plot(lambda x: " + links.pythonFormula() + ", x_range=["
                + number(graph.xRange().min()) + ", " + number(graph.xRange().max()) + "], "
                + strokeStyle(object) + ")";
        if (links.axes() != null) {
            statements.add(variable + " = " + frameVariable(links, indexById, objects) + plot + transformSuffix(object));
            return;
        }
        String axesVariable = variable + "_axes";
        Range xRange = graph.xRange();
        Range yRange = graph.yRange();
        statements.add(axesVariable + " = Axes(x_range=" + range(xRange) + ", y_range=" + range(yRange)
                + ", x_length=" + number(xRange.span()) + ", y_length=" + number(yRange.span())
                + ").move_to(" + point(xRange.center(), yRange.center()) + ")");
        statements.add(variable + " = VGroup(" + axesVariable + ", " + axesVariable + plot + ")" + transformSuffix(object));
    }

    private void emitCursor(
            List<String> statements,
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        GraphCursorShape cursor = object.shapeAs(GraphCursorShape.class);
        String dotColor = color(object.fill(), DEFAULT_STROKE);
        double dotOpacity = cursor.showDot() ? object.opacity() : 0.0;

        if (links == null || links.graph() == null) {
            statements.add(variable + " = Dot(point=" + point(object.x(), object.y()) + ", radius="
                    + number(cursor.radius()) + ", color=" + dotColor + ", fill_opacity=" + number(dotOpacity) + ")"
                    + transformSuffix(object));
            return;
        }
        if (!links.hasDefinedAnchor()) {
            logger.debug("Cursor {} sits at an undefined point of its graph", object.id());
            return;
        }

        String frame = frameVariable(links, indexById, objects);
        String anchor = frame + ".c2p(" + number(links.anchorX()) + ", " + number(links.anchorY()) + ")";
        String dot = "Dot(" + anchor + ", radius=" + number(cursor.radius()) + ", color=" + dotColor
                + ", fill_opacity=" + number(dotOpacity) + ")";
        if (!cursor.showCrosshair() && !cursor.showLabel()) {
            statements.add(variable + " = " + dot + transformSuffix(object));
            return;
        }

        String dotVariable = variable + "_dot";
        statements.add(dotVariable + " = " + dot);
        StringJoiner group = new StringJoiner(", ", variable + " = VGroup(", ")" + transformSuffix(object));
        group.add(dotVariable);
        if (cursor.showCrosshair()) {
            group.add("DashedLine(" + frame + ".c2p(" + number(links.anchorX()) + ", 0), " + anchor
                    + ", color=" + dotColor + ", stroke_width=1)");
            group.add("DashedLine(" + frame + ".c2p(0, " + number(links.anchorY()) + "), " + anchor
                    + ", color=" + dotColor + ", stroke_width=1)");
        }
        if (cursor.showLabel()) {
            group.add("MathTex(" + latexString("(" + label(links.anchorX()) + ", " + label(links.anchorY()) + ")")
                    + ", font_size=24, color=" + dotColor + ").next_to(" + dotVariable + ", UR, buff=0.1)");
        }
        statements.add(group.toString());
    }

    private void emitTangent(
            List<String> statements,
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        TangentLineShape tangent = object.shapeAs(TangentLineShape.class);
        double span = tangent.visibleSpan();

        if (links == null || links.graph() == null) {
            statements.add(variable + " = Line(" + point(object.x() - span, object.y()) + ", "
                    + point(object.x() + span, object.y()) + ", " + strokeStyle(object) + ")"
                    + transformSuffix(object));
            return;
        }
        double slope = graphMath.slopeAt(links.formula(), links.anchorX(), tangent.derivativeStep());
        if (!links.hasDefinedAnchor() || !Double.isFinite(slope)) {
            logger.debug("Tangent line {} has no defined slope at x={}", object.id(), links.anchorX());
            return;
        }

        String frame = frameVariable(links, indexById, objects);
        String function = variable + "_f";
        String slopeVariable = variable + "_slope";
        double x0 = links.anchorX();
        String h = number(tangent.derivativeStep());
        statements.add(function + " = lambda x: " + links.pythonFormula());
        statements.add(slopeVariable + " = (" + function + "(" + number(x0) + " + " + h + ") - " + function + "("
                + number(x0) + " - " + h + ")) / (2 * " + h + ")");
        String line = "Line(" + frame + ".c2p(" + number(x0 - span) + ", " + function + "(" + number(x0) + ") - "
                + slopeVariable + " * " + number(span) + "), " + frame + ".c2p(" + number(x0 + span) + ", "
                + function + "(" + number(x0) + ") + " + slopeVariable + " * " + number(span) + "), "
                + strokeStyle(object) + ")";
        if (!tangent.showSlopeLabel()) {
            statements.add(variable + " = " + line + transformSuffix(object));
            return;
        }
        String lineVariable = variable + "_line";
        statements.add(lineVariable + " = " + line);
        statements.add(variable + " = VGroup(" + lineVariable + ", MathTex(" + latexString("m = " + label(slope))
                + ", font_size=28, color=" + color(object.stroke(), DEFAULT_STROKE) + ").next_to(" + lineVariable
                + ", UP, buff=0.1))" + transformSuffix(object));
    }

    private void emitLimitProbe(
            List<String> statements,
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        LimitProbeShape probe = object.shapeAs(LimitProbeShape.class);
        if (links == null || links.graph() == null || links.anchorX() == null) {
            logger.debug("Limit probe {} has no graph to sample", object.id());
            return;
        }
        String frame = frameVariable(links, indexById, objects);
        double x0 = links.anchorX();
        String markerColor = color(object.fill(), DEFAULT_STROKE);

        StringJoiner group = new StringJoiner(", ", variable + " = VGroup(", ")" + transformSuffix(object));
        int parts = 0;
        if (probe.showPoints()) {
            for (PlanePoint sample : graphMath.limitPoints(links.formula(), x0, probe.direction(), probe.deltaSchedule())) {
                group.add("Dot(" + frame + ".c2p(" + number(sample.x()) + ", " + number(sample.y()) + "), radius="
                        + number(probe.radius()) + ", color=" + markerColor + ")");
                parts++;
            }
        }
        if (probe.showReadout()) {
            LimitEstimate estimate = graphMath.estimateLimit(
                    links.formula(), x0, probe.direction(), probe.deltaSchedule());
            String readout = estimate.exists()
                    ? "\\lim_{x \\to " + label(x0) + "} f(x) \\approx " + label(estimate.value())
                    : "\\lim_{x \\to " + label(x0) + "} f(x) \\text{ does not exist}";
            double readoutY = estimate.exists() ? estimate.value() : 0.0;
            group.add("MathTex(" + latexString(readout) + ", font_size=28, color=" + markerColor + ").next_to("
                    + frame + ".c2p(" + number(x0) + ", " + number(readoutY) + "), UP, buff=0.3)");
            parts++;
        }
        if (parts == 0) {
            logger.debug("Limit probe {} has nothing to draw", object.id());
            return;
        }
        statements.add(group.toString());
    }

    private void emitValueLabel(
            List<String> statements,
            SceneObject object,
            String variable,
            ResolvedLinks links,
            Map<String, Integer> indexById,
            List<SceneObject> objects) {
        ValueLabelShape label = object.shapeAs(ValueLabelShape.class);
        Double value = labelValue(label, links);
        if (value == null || !Double.isFinite(value)) {
            logger.debug("Value label {} has no value to show", object.id());
            return;
        }
        String prefix = label.labelPrefix() == null ? label.valueType().defaultPrefix() : label.labelPrefix();
        String suffix = label.labelSuffix() == null ? "" : label.labelSuffix();
        String position = links != null && links.hasFrame() && links.hasDefinedAnchor()
                ? ".next_to(" + frameVariable(links, indexById, objects) + ".c2p(" + number(links.anchorX()) + ", "
                        + number(links.anchorY()) + "), UR, buff=0.2)"
                : ".move_to(" + point(object.x(), object.y()) + ")";
        String text = "Text(" + pythonString(prefix + label(value) + suffix) + ", font_size="
                + number(label.fontSize()) + ", color=" + color(object.fill(), DEFAULT_STROKE) + ")" + position;

        if (!label.showBackground()) {
            statements.add(variable + " = " + text + transformSuffix(object));
            return;
        }
        String textVariable = variable + "_text";
        statements.add(textVariable + " = " + text);
        statements.add(variable + " = VGroup(BackgroundRectangle(" + textVariable + ", color="
                + color(label.backgroundFill(), "#000000") + ", fill_opacity=" + number(label.backgroundOpacity())
                + ", buff=0.1), " + textVariable + ")" + transformSuffix(object));
    }

    private Double labelValue(ValueLabelShape label, ResolvedLinks links) {
        if (links == null) {
            return null;
        }
        Double x0 = links.anchorX();
        return switch (label.valueType()) {
            case X -> x0;
            case Y -> links.hasDefinedAnchor() ? links.anchorY() : null;
            case SLOPE -> links.graph() == null || x0 == null
                    ? null
                    : graphMath.slopeAt(links.formula(), x0, GraphMath.DEFAULT_DERIVATIVE_STEP);
            case CUSTOM -> label.customExpression() == null
                    ? null
                    : graphMath.valueAt(label.customExpression(), x0 == null ? 0.0 : x0);
        };
    }

    private String frameVariable(ResolvedLinks links, Map<String, Integer> indexById, List<SceneObject> objects) {
        SceneObject owner = links.frameOwner();
        int index = indexById.get(owner.id());
        return ObjectVariables.of(index, objects.get(index)) + "_axes";
    }

    private String closedStyle(SceneObject object) {
        StringBuilder style = new StringBuilder();
        if (object.fill() != null) {
            style.append("fill_color=").append(colorTable.scriptLiteral(object.fill())).append(", ");
        }
        style.append("fill_opacity=").append(number(object.fill() != null ? object.opacity() : 0.0));
        style.append(", stroke_color=").append(color(object.stroke(), DEFAULT_STROKE));
        style.append(", stroke_width=").append(number(object.strokeWidth()));
        if (object.opacity() < 1.0) {
            style.append(", stroke_opacity=").append(number(object.opacity()));
        }
        return style.toString();
    }

    private String strokeStyle(SceneObject object) {
        StringBuilder style = new StringBuilder();
        style.append("color=").append(color(object.stroke(), DEFAULT_STROKE));
        style.append(", stroke_width=").append(number(object.strokeWidth()));
        if (object.opacity() < 1.0) {
            style.append(", stroke_opacity=").append(number(object.opacity()));
        }
        return style.toString();
    }

    private String placement(SceneObject object) {
        return ".move_to(" + point(object.x(), object.y()) + ")";
    }

    private String opacitySuffix(SceneObject object) {
        return object.opacity() < 1.0 ? ".set_opacity(" + number(object.opacity()) + ")" : "";
    }

    private String transformSuffix(SceneObject object) {
        StringBuilder suffix = new StringBuilder();
        if (object.rotation() != 0.0) {
            suffix.append(".rotate(").append(number(object.rotation())).append(" * DEGREES)");
        }
        if (object.zIndex() != 0) {
            suffix.append(".set_z_index(").append(object.zIndex()).append(')');
        }
        return suffix.toString();
    }

    private String color(String hex, String fallback) {
        return colorTable.scriptLiteral(hex != null ? hex : fallback);
    }

    private static String range(Range range) {
        return "[" + number(range.min()) + ", " + number(range.max()) + ", " + number(range.step()) + "]";
    }

    private static String point(PlanePoint point) {
        return point(point.x(), point.y());
    }

    private static String point(double x, double y) {
        return "[" + number(x) + ", " + number(y) + ", 0]";
    }

    /**
     * Fixed-point literal rounded to four decimals.
     *
     * @throws NonFiniteNumberException for NaN and infinities, which have no Python literal
     */
    static String number(double value) {
        if (!Double.isFinite(value)) {
            throw new NonFiniteNumberException(value);
        }
        String formatted = BigDecimal.valueOf(value)
                .setScale(4, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        return "-0".equals(formatted) ? "0" : formatted;
    }

    private static String label(double value) {
        String formatted = String.format(Locale.ROOT, "%.2f", value);
        return "-0.00".equals(formatted) ? "0.00" : formatted;
    }

    static String pythonString(String value) {
        StringBuilder escaped = new StringBuilder("\"");
        for (char character : value.toCharArray()) {
            switch (character) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> escaped.append(character);
            }
        }
        return escaped.append('"').toString();
    }

    /**
     * Raw string when Python allows it; otherwise an escaped literal.
     */
    static String latexString(String latex) {
        int trailingBackslashes = 0;
        for (int index = latex.length() - 1; index >= 0 && latex.charAt(index) == '\\'; index--) {
            trailingBackslashes++;
        }
        boolean rawSafe = latex.indexOf('"') < 0 && latex.indexOf('\n') < 0 && latex.indexOf('\r') < 0
                && trailingBackslashes % 2 == 0;
        return rawSafe ? "r\"" + latex + "\"" : pythonString(latex);
    }

    private static double maxRunTime(double[] runTimes) {
        double max = 0.0;
        for (double runTime : runTimes) {
            max = Math.max(max, runTime);
        }
        return max;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void line(StringBuilder script, String statement) {
        script.append(INDENT).append(statement).append('\n');
    }

    static final class NonFiniteNumberException extends IllegalArgumentException {

        NonFiniteNumberException(double value) {
            super("value " + value + " is not finite");
        }
    }
}
