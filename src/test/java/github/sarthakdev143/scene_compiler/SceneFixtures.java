package github.sarthakdev143.scene_compiler;

import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.scene.shape.RadialShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.ShapeSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for raw project maps and canonical scene objects used across tests.
 */
public final class SceneFixtures {

    private SceneFixtures() {
    }

    public static Map<String, Object> rawObject(String id, String type, Object... keyValues) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("id", id);
        object.put("type", type);
        for (int index = 0; index + 1 < keyValues.length; index += 2) {
            object.put((String) keyValues[index], keyValues[index + 1]);
        }
        return object;
    }

    @SafeVarargs
    public static Map<String, Object> rawScene(String id, String name, Map<String, Object>... objects) {
        Map<String, Object> scene = new LinkedHashMap<>();
        scene.put("id", id);
        scene.put("name", name);
        scene.put("duration", 5.0);
        scene.put("objects", new ArrayList<>(List.of(objects)));
        return scene;
    }

    @SafeVarargs
    public static Map<String, Object> rawProject(Map<String, Object>... scenes) {
        Map<String, Object> project = new LinkedHashMap<>();
        project.put("name", "Demo");
        project.put("scenes", new ArrayList<>(List.of(scenes)));
        return project;
    }

    public static Map<String, Object> range(double min, double max) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("min", min);
        range.put("max", max);
        range.put("step", 1.0);
        return range;
    }

    public static Map<String, Object> keyframe(double time, String property, Object value) {
        Map<String, Object> keyframe = new LinkedHashMap<>();
        keyframe.put("time", time);
        keyframe.put("property", property);
        keyframe.put("value", value);
        return keyframe;
    }

    public static SceneObject circle(String id, double delay, double runTime) {
        return object(id, ObjectType.CIRCLE, delay, runTime, null, new RadialShape(1.0));
    }

    public static SceneObject transformTarget(String id, String sourceId, double delay, double runTime) {
        return object(id, ObjectType.CIRCLE, delay, runTime, sourceId, new RadialShape(1.0));
    }

    public static SceneObject object(
            String id,
            ObjectType type,
            double delay,
            double runTime,
            String transformFromId,
            ShapeSpec shape) {
        return new SceneObject(
                id,
                id,
                type,
                0.0,
                0.0,
                0.0,
                1.0,
                0,
                null,
                "#ffffff",
                2.0,
                delay,
                runTime,
                "auto",
                transformFromId == null ? "FadeOut" : null,
                transformFromId,
                null,
                List.of(),
                shape);
    }
}
