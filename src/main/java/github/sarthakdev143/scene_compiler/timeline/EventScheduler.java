package github.sarthakdev143.scene_compiler.timeline;

import github.sarthakdev143.scene_compiler.model.TransformStyle;
import github.sarthakdev143.scene_compiler.model.scene.Keyframe;
import github.sarthakdev143.scene_compiler.model.scene.ObjectDefaults;
import github.sarthakdev143.scene_compiler.model.scene.PropertyBag;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.timeline.CreationStep;
import github.sarthakdev143.scene_compiler.model.timeline.ExitStep;
import github.sarthakdev143.scene_compiler.model.timeline.KeyframeStep;
import github.sarthakdev143.scene_compiler.model.timeline.TimelineBatch;
import github.sarthakdev143.scene_compiler.model.timeline.TransformStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Turns per-object timing into ordered batches of concurrent animation calls.
 * <p>
 * Events are grouped by exact timestamp. Inside a batch the calls run in a fixed order:
 * creations, transforms, keyframe edits, exits.
 */
@Component
public class EventScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EventScheduler.class);

    static final double KEYFRAME_RUN_TIME = 0.5;
    static final double EXIT_RUN_TIME = 0.5;
    private static final double EPSILON = 1e-9;
    private static final Pattern ANIMATION_NAME_PATTERN = Pattern.compile("^[A-Z][A-Za-z]*$");

    private final VisibilityResolver visibilityResolver;

    public EventScheduler(VisibilityResolver visibilityResolver) {
        this.visibilityResolver = visibilityResolver;
    }

    public List<TimelineBatch> schedule(List<SceneObject> objects) {
        return schedule(objects, object -> true);
    }

    /**
     * Schedules only the objects accepted by {@code renderable}; variable names still follow each
     * object's index in the full list.
     */
    public List<TimelineBatch> schedule(List<SceneObject> objects, Predicate<SceneObject> renderable) {
        Map<String, String> ownVariable = new HashMap<>();
        List<SceneObject> scheduled = new ArrayList<>();
        TreeMap<Double, TimePoint> timePoints = new TreeMap<>();

        for (int index = 0; index < objects.size(); index++) {
            SceneObject object = objects.get(index);
            if (!renderable.test(object) || ownVariable.containsKey(object.id())) {
                continue;
            }
            ownVariable.put(object.id(), ObjectVariables.of(index, object));
            scheduled.add(object);

            timePoint(timePoints, object.delay()).entering.add(object);
            if (!object.hasTransformSource()) {
                timePoint(timePoints, object.endTime()).exiting.add(object);
            }
            for (Keyframe keyframe : object.keyframes()) {
                timePoint(timePoints, keyframe.time()).keyframes
                        .computeIfAbsent(object, ignored -> new LinkedHashMap<>())
                        .put(keyframe.property(), keyframe.value());
            }
        }

        SchedulerState state = new SchedulerState(ownVariable);
        List<TimelineBatch> batches = new ArrayList<>();
        double clock = 0.0;
        for (Map.Entry<Double, TimePoint> entry : timePoints.entrySet()) {
            double time = entry.getKey();
            TimelineBatch batch = buildBatch(time, entry.getValue(), state, scheduled);
            if (batch == null) {
                continue;
            }
            double wait = time - clock > EPSILON ? time - clock : 0.0;
            clock = Math.max(clock, time) + batch.duration();
            batches.add(new TimelineBatch(
                    time,
                    wait,
                    batch.duration(),
                    batch.creations(),
                    batch.transforms(),
                    batch.keyframeEdits(),
                    batch.exits()));
        }
        return batches;
    }

    private TimelineBatch buildBatch(double time, TimePoint point, SchedulerState state, List<SceneObject> scheduled) {
        List<CreationStep> creations = new ArrayList<>();
        List<TransformStep> transforms = new ArrayList<>();
        List<KeyframeStep> keyframeEdits = new ArrayList<>();
        List<ExitStep> exits = new ArrayList<>();

        for (SceneObject object : point.entering) {
            String variable = state.ownVariable.get(object.id());
            String sourceVariable = object.hasTransformSource() ? state.current.get(object.transformFromId()) : null;
            if (sourceVariable != null && state.visible.contains(sourceVariable)) {
                TransformStyle style = TransformStyle.fromInput(object.transformType());
                transforms.add(new TransformStep(
                        object.transformFromId(),
                        sourceVariable,
                        object.id(),
                        variable,
                        style,
                        object.runTime()));
                state.consumed.add(object.transformFromId());
                if (style.isReplacing()) {
                    state.repoint(sourceVariable, variable);
                    state.current.put(object.id(), variable);
                    state.visible.remove(sourceVariable);
                    state.visible.add(variable);
                    state.resetTracked(variable, object);
                } else {
                    state.current.put(object.id(), sourceVariable);
                    // the source mobject now carries the target's geometry
                    state.resetTracked(sourceVariable, object);
                }
            } else {
                if (object.hasTransformSource()) {
                    logger.debug("Transform source {} of {} is not on screen at {}s; using a plain entrance",
                            object.transformFromId(), object.id(), time);
                }
                creations.add(new CreationStep(object.id(), variable, entranceAnimation(object), object.runTime()));
                state.visible.add(variable);
            }
        }

        if (!point.keyframes.isEmpty()) {
            Set<String> activeIds = new HashSet<>();
            for (SceneObject active : visibilityResolver.activeObjects(scheduled, time)) {
                activeIds.add(active.id());
            }
            for (Map.Entry<SceneObject, Map<String, Object>> entry : point.keyframes.entrySet()) {
                SceneObject object = entry.getKey();
                String variable = state.current.get(object.id());
                if (!activeIds.contains(object.id()) || !state.visible.contains(variable)) {
                    logger.debug("Skipping keyframes of {} at {}s: object is not active", object.id(), time);
                    continue;
                }
                KeyframeStep step = keyframeStep(object, variable, entry.getValue(), state.tracked(variable, object));
                if (!step.isEmpty()) {
                    keyframeEdits.add(step);
                }
                Double opacity = PropertyBag.number(entry.getValue().get("opacity"));
                if (opacity != null && opacity <= 0.0) {
                    exits.add(new ExitStep(object.id(), variable, ObjectDefaults.DEFAULT_EXIT_ANIMATION, EXIT_RUN_TIME));
                    state.visible.remove(variable);
                }
            }
        }

        for (SceneObject object : point.exiting) {
            String variable = state.current.get(object.id());
            if (state.consumed.contains(object.id()) || !state.visible.contains(variable)) {
                continue;
            }
            exits.add(new ExitStep(object.id(), variable, exitAnimation(object), EXIT_RUN_TIME));
            state.visible.remove(variable);
        }

        if (creations.isEmpty() && transforms.isEmpty() && keyframeEdits.isEmpty() && exits.isEmpty()) {
            return null;
        }
        double duration = creations.stream().mapToDouble(CreationStep::runTime).max().orElse(0.0)
                + transforms.stream().mapToDouble(TransformStep::runTime).max().orElse(0.0)
                + (keyframeEdits.isEmpty() ? 0.0 : KEYFRAME_RUN_TIME)
                + exits.stream().mapToDouble(ExitStep::runTime).max().orElse(0.0);
        return new TimelineBatch(time, 0.0, duration, creations, transforms, keyframeEdits, exits);
    }

    private KeyframeStep keyframeStep(
            SceneObject object,
            String variable,
            Map<String, Object> changes,
            TrackedState tracked) {
        Double shiftX = null;
        Double shiftY = null;
        Double rotate = null;
        Double scale = null;
        Double opacity = null;
        String color = null;

        for (Map.Entry<String, Object> change : changes.entrySet()) {
            Double number = PropertyBag.number(change.getValue());
            switch (change.getKey()) {
                case "x" -> {
                    if (number != null && Math.abs(number - tracked.x) > EPSILON) {
                        shiftX = number - tracked.x;
                        tracked.x = number;
                    }
                }
                case "y" -> {
                    if (number != null && Math.abs(number - tracked.y) > EPSILON) {
                        shiftY = number - tracked.y;
                        tracked.y = number;
                    }
                }
                case "rotation" -> {
                    if (number != null && Math.abs(number - tracked.rotation) > EPSILON) {
                        rotate = number - tracked.rotation;
                        tracked.rotation = number;
                    }
                }
                case "scale" -> {
                    if (number != null && number > 0 && Math.abs(number - tracked.scale) > EPSILON) {
                        scale = number / tracked.scale;
                        tracked.scale = number;
                    }
                }
                case "opacity" -> {
                    if (number != null && number > 0) {
                        opacity = Math.min(1.0, number);
                    }
                }
                case "fill", "color" -> {
                    if (change.getValue() instanceof String value && !value.isBlank()) {
                        color = value;
                    }
                }
                default -> logger.debug("Ignoring keyframe property {} on {}", change.getKey(), object.id());
            }
        }
        if (shiftX != null && shiftY == null) {
            shiftY = 0.0;
        } else if (shiftY != null && shiftX == null) {
            shiftX = 0.0;
        }
        return new KeyframeStep(object.id(), variable, shiftX, shiftY, rotate, scale, opacity, color);
    }

    String entranceAnimation(SceneObject object) {
        String requested = object.animationType();
        if (requested == null
                || ObjectDefaults.AUTO_ANIMATION.equalsIgnoreCase(requested)
                || !ANIMATION_NAME_PATTERN.matcher(requested).matches()) {
            return object.type().defaultEntrance();
        }
        return requested;
    }

    String exitAnimation(SceneObject object) {
        String requested = object.exitAnimationType();
        if (requested == null || !ANIMATION_NAME_PATTERN.matcher(requested).matches()) {
            return ObjectDefaults.DEFAULT_EXIT_ANIMATION;
        }
        return requested;
    }

    private static TimePoint timePoint(TreeMap<Double, TimePoint> timePoints, double time) {
        double key = time == 0.0 ? 0.0 : time;
        return timePoints.computeIfAbsent(key, ignored -> new TimePoint());
    }

    private static final class TimePoint {
        private final List<SceneObject> entering = new ArrayList<>();
        private final List<SceneObject> exiting = new ArrayList<>();
        private final Map<SceneObject, Map<String, Object>> keyframes = new LinkedHashMap<>();
    }

    private static final class TrackedState {
        private double x;
        private double y;
        private double rotation;
        private double scale = 1.0;
    }

    private static final class SchedulerState {
        private final Map<String, String> ownVariable;
        private final Map<String, String> current;
        private final Set<String> visible = new HashSet<>();
        private final Set<String> consumed = new HashSet<>();
        private final Map<String, TrackedState> trackedByVariable = new HashMap<>();

        SchedulerState(Map<String, String> ownVariable) {
            this.ownVariable = ownVariable;
            this.current = new HashMap<>(ownVariable);
        }

        void repoint(String fromVariable, String toVariable) {
            current.replaceAll((id, variable) -> variable.equals(fromVariable) ? toVariable : variable);
        }

        TrackedState tracked(String variable, SceneObject owner) {
            return trackedByVariable.computeIfAbsent(variable, ignored -> startingState(owner));
        }

        void resetTracked(String variable, SceneObject owner) {
            trackedByVariable.put(variable, startingState(owner));
        }

        private static TrackedState startingState(SceneObject owner) {
            TrackedState state = new TrackedState();
            state.x = owner.x();
            state.y = owner.y();
            state.rotation = owner.rotation();
            return state;
        }
    }
}
