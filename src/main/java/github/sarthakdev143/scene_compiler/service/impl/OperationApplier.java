package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.ops.ApplyResult;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.model.scene.ObjectDefaults;
import github.sarthakdev143.scene_compiler.model.scene.Project;
import github.sarthakdev143.scene_compiler.model.scene.ProjectWriter;
import github.sarthakdev143.scene_compiler.model.scene.PropertyBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies patch operations to a copy of a project. A bad operation never aborts the batch: it is
 * skipped and reported as a warning, and the patched project is always revalidated.
 */
@Component
public class OperationApplier {

    private static final Logger logger = LoggerFactory.getLogger(OperationApplier.class);

    private static final double DEFAULT_SCENE_DURATION_SECONDS = 5.0;

    private final ProjectValidator projectValidator;
    private final ObjectPropertyNormalizer propertyNormalizer;

    public OperationApplier(ProjectValidator projectValidator, ObjectPropertyNormalizer propertyNormalizer) {
        this.projectValidator = projectValidator;
        this.propertyNormalizer = propertyNormalizer;
    }

    public ApplyResult apply(Project project, List<?> operations, String defaultSceneId) {
        Map<String, Object> next = ProjectWriter.toRaw(projectValidator.validate(project));
        List<String> warnings = new ArrayList<>();
        if (operations == null) {
            warnings.add("Operations must be a list");
            return new ApplyResult(projectValidator.validate(next), warnings);
        }

        for (Object raw : operations) {
            SceneOperation operation;
            try {
                operation = raw instanceof SceneOperation parsed ? parsed : SceneOperation.fromRaw(raw);
            } catch (IllegalArgumentException ex) {
                warnings.add("Skipped invalid op: " + raw);
                continue;
            }

            try {
                applyOne(next, operation, defaultSceneId);
            } catch (RuntimeException ex) {
                warnings.add("Op failed (" + operation.type().apiName() + "): " + ex.getMessage());
            }
        }

        for (String warning : warnings) {
            logger.warn(warning);
        }
        return new ApplyResult(projectValidator.validate(next), warnings);
    }

    private void applyOne(Map<String, Object> project, SceneOperation operation, String defaultSceneId) {
        List<Map<String, Object>> scenes = scenes(project);
        switch (operation.type()) {
            case ADD_SCENE -> {
                Map<String, Object> scene = new LinkedHashMap<>();
                scene.put("id", UUID.randomUUID().toString());
                scene.put("name", isBlank(operation.name()) ? "Scene " + (scenes.size() + 1) : operation.name().trim());
                scene.put("duration", operation.duration() != null && operation.duration() > 0
                        ? operation.duration()
                        : DEFAULT_SCENE_DURATION_SECONDS);
                scene.put("objects", new ArrayList<>());
                scenes.add(scene);
            }
            case DELETE_SCENE -> {
                Map<String, Object> scene = requireScene(scenes, required(operation.sceneId(), "sceneId"));
                if (scenes.size() <= 1) {
                    throw new IllegalArgumentException("the last scene cannot be deleted");
                }
                scenes.remove(scene);
            }
            case RENAME_SCENE -> {
                Map<String, Object> scene = requireScene(scenes, required(operation.sceneId(), "sceneId"));
                scene.put("name", required(operation.name(), "name"));
            }
            case SET_SCENE_DURATION -> {
                Map<String, Object> scene = resolveScene(scenes, operation.sceneId(), defaultSceneId);
                Double duration = operation.duration();
                if (duration == null || duration <= 0) {
                    throw new IllegalArgumentException("duration must be a positive number");
                }
                scene.put("duration", duration);
            }
            case ADD_OBJECT -> addObject(resolveScene(scenes, operation.sceneId(), defaultSceneId), operation);
            case UPDATE_OBJECT -> {
                Map<String, Object> scene = resolveScene(scenes, operation.sceneId(), defaultSceneId);
                Map<String, Object> object = requireObject(scene, required(operation.objectId(), "objectId"));
                if (operation.updates() == null) {
                    throw new IllegalArgumentException("updates are required");
                }
                Map<String, Object> updates = propertyNormalizer.normalize(operation.updates());
                updates.remove("id");
                updates.forEach((key, value) -> object.put(key, PropertyBag.deepCopy(value)));
            }
            case DELETE_OBJECT -> {
                Map<String, Object> scene = resolveScene(scenes, operation.sceneId(), defaultSceneId);
                Map<String, Object> object = requireObject(scene, required(operation.objectId(), "objectId"));
                objects(scene).remove(object);
            }
            case ADD_KEYFRAME -> addKeyframe(resolveScene(scenes, operation.sceneId(), defaultSceneId), operation);
        }
    }

    private void addObject(Map<String, Object> scene, SceneOperation operation) {
        if (operation.object() == null) {
            throw new IllegalArgumentException("object is required");
        }
        Map<String, Object> object = propertyNormalizer.normalize(PropertyBag.deepCopyMap(operation.object()));
        ObjectType type = ObjectType.fromWireName(object.get("type"))
                .orElseThrow(() -> new IllegalArgumentException("unknown object type: " + object.get("type")));

        if (PropertyBag.text(object, "id") == null) {
            object.put("id", UUID.randomUUID().toString());
        }
        if (!(object.get("name") instanceof String)) {
            long sameType = objects(scene).stream()
                    .filter(existing -> type.wireName().equals(existing.get("type")))
                    .count();
            object.put("name", type.label() + " " + (sameType + 1));
        }
        Double delay = PropertyBag.number(object, "delay");
        if (delay != null) {
            object.put("delay", Math.max(0.0, delay));
        }
        Double runTime = PropertyBag.number(object, "runTime");
        if (runTime != null) {
            object.put("runTime", Math.max(ObjectDefaults.MIN_RUN_TIME, runTime));
        }
        ObjectDefaults.applyDefaults(type, object);
        objects(scene).add(object);
    }

    private void addKeyframe(Map<String, Object> scene, SceneOperation operation) {
        Map<String, Object> object = requireObject(scene, required(operation.objectId(), "objectId"));
        Double time = operation.time();
        if (time == null || time < 0) {
            throw new IllegalArgumentException("time must be a non-negative number");
        }
        String property = required(operation.property(), "property");

        List<Object> keyframes = new ArrayList<>();
        for (Object raw : PropertyBag.list(object.get("keyframes"))) {
            Map<String, Object> keyframe = PropertyBag.map(raw);
            if (keyframe == null) {
                continue;
            }
            Double existingTime = PropertyBag.number(keyframe, "time");
            boolean sameSlot = existingTime != null && existingTime.doubleValue() == time
                    && property.equals(keyframe.get("property"));
            if (!sameSlot) {
                keyframes.add(keyframe);
            }
        }
        Map<String, Object> keyframe = new LinkedHashMap<>();
        keyframe.put("time", time);
        keyframe.put("property", property);
        keyframe.put("value", operation.value());
        keyframes.add(keyframe);
        keyframes.sort(Comparator.comparingDouble(raw -> PropertyBag.numberOr(PropertyBag.map(raw), "time", 0.0)));
        object.put("keyframes", keyframes);
    }

    private static Map<String, Object> resolveScene(List<Map<String, Object>> scenes, String sceneId, String defaultSceneId) {
        String resolved = sceneId != null ? sceneId : defaultSceneId;
        if (resolved == null) {
            if (scenes.isEmpty()) {
                throw new IllegalArgumentException("project has no scenes");
            }
            return scenes.get(0);
        }
        return requireScene(scenes, resolved);
    }

    private static Map<String, Object> requireScene(List<Map<String, Object>> scenes, String sceneId) {
        for (Map<String, Object> scene : scenes) {
            if (sceneId.equals(scene.get("id"))) {
                return scene;
            }
        }
        throw new IllegalArgumentException("scene not found: " + sceneId);
    }

    private static Map<String, Object> requireObject(Map<String, Object> scene, String objectId) {
        for (Map<String, Object> object : objects(scene)) {
            if (objectId.equals(object.get("id"))) {
                return object;
            }
        }
        throw new IllegalArgumentException("object not found: " + objectId);
    }

    private static List<Map<String, Object>> scenes(Map<String, Object> project) {
        return ownedMaps(project, "scenes");
    }

    private static List<Map<String, Object>> objects(Map<String, Object> scene) {
        return ownedMaps(scene, "objects");
    }

    /**
     * Replaces {@code parent[key]} with a mutable list of string-keyed copies of its maps and returns
     * that list; entries that are not maps are dropped.
     */
    private static List<Map<String, Object>> ownedMaps(Map<String, Object> parent, String key) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (Object raw : PropertyBag.list(parent.get(key))) {
            Map<String, Object> item = PropertyBag.map(raw);
            if (item != null) {
                items.add(item);
            }
        }
        parent.put(key, items);
        return items;
    }

    private static String required(String value, String field) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
