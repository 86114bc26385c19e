package github.sarthakdev143.scene_compiler.model.ops;

import github.sarthakdev143.scene_compiler.model.scene.PropertyBag;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One patch primitive against a project. Which fields matter depends on {@link #type()}; the rest stay {@code null}.
 */
public record SceneOperation(
        OperationType type,
        String sceneId,
        String objectId,
        Map<String, Object> object,
        Map<String, Object> updates,
        String name,
        Double duration,
        Double time,
        String property,
        Object value) {

    public static SceneOperation addObject(Map<String, Object> object) {
        return new SceneOperation(OperationType.ADD_OBJECT, null, null, object, null, null, null, null, null, null);
    }

    /**
     * Reads an operation from its JSON shape, accepting snake_case field names.
     *
     * @throws IllegalArgumentException when the input is not an object or names no known operation type
     */
    public static SceneOperation fromRaw(Object raw) {
        Map<String, Object> bag = PropertyBag.map(raw);
        if (bag == null) {
            throw new IllegalArgumentException("operation must be an object");
        }
        OperationType type = OperationType.fromInput(bag.get("type"))
                .orElseThrow(() -> new IllegalArgumentException("unknown operation type: " + bag.get("type")));

        Object value = bag.containsKey("value") ? bag.get("value") : null;
        return new SceneOperation(
                type,
                firstText(bag, "sceneId", "scene_id"),
                firstText(bag, "objectId", "object_id"),
                PropertyBag.map(bag.get("object")),
                PropertyBag.map(bag.get("updates")),
                bag.get("name") instanceof String name ? name : null,
                PropertyBag.number(bag.get("duration")),
                PropertyBag.number(bag.get("time")),
                bag.get("property") instanceof String property ? property : null,
                value);
    }

    public Map<String, Object> toRaw() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("type", type.apiName());
        putIfPresent(raw, "sceneId", sceneId);
        putIfPresent(raw, "objectId", objectId);
        putIfPresent(raw, "object", object);
        putIfPresent(raw, "updates", updates);
        putIfPresent(raw, "name", name);
        putIfPresent(raw, "duration", duration);
        putIfPresent(raw, "time", time);
        putIfPresent(raw, "property", property);
        putIfPresent(raw, "value", value);
        return raw;
    }

    private static String firstText(Map<String, Object> bag, String key, String alias) {
        String value = PropertyBag.text(bag, key);
        return value != null ? value : PropertyBag.text(bag, alias);
    }

    private static void putIfPresent(Map<String, Object> raw, String key, Object value) {
        if (value != null) {
            raw.put(key, value);
        }
    }
}
