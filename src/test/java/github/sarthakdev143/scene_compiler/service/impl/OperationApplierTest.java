package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.integration.manim.ColorTable;
import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.ops.ApplyResult;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.model.scene.Keyframe;
import github.sarthakdev143.scene_compiler.model.scene.Project;
import github.sarthakdev143.scene_compiler.model.scene.Scene;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.scene.shape.VertexShape;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static github.sarthakdev143.scene_compiler.SceneFixtures.rawObject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawProject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawScene;
import static org.assertj.core.api.Assertions.assertThat;

class OperationApplierTest {

    private ProjectValidator validator;
    private OperationApplier applier;
    private Project project;

    @BeforeEach
    void setUp() {
        ColorTable colorTable = ColorTable.defaults();
        validator = new ProjectValidator(colorTable);
        applier = new OperationApplier(validator, new ObjectPropertyNormalizer(colorTable));
        project = validator.validate((Object) rawProject(rawScene("s1", "Intro", rawObject("a", "circle"))));
    }

    @Test
    void addObjectNormalizesAliasesAndFillsDefaults() {
        ApplyResult result = applier.apply(project, List.of(op(
                "type", "addObject",
                "object", raw("type", "rectangle", "color", "blue", "borderColor", "RED",
                        "fillOpacity", 0.5, "strokeOpacity", 0.2, "delay", -1, "runTime", 0))), null);

        assertThat(result.warnings()).isEmpty();
        SceneObject rectangle = firstScene(result).objects().get(1);
        assertThat(rectangle.type()).isEqualTo(ObjectType.RECTANGLE);
        assertThat(rectangle.id()).isNotBlank();
        assertThat(rectangle.name()).isEqualTo("Rectangle 1");
        assertThat(rectangle.fill()).isEqualTo("#3b82f6");
        assertThat(rectangle.stroke()).isEqualTo("#ef4444");
        assertThat(rectangle.opacity()).isEqualTo(0.5);
        assertThat(rectangle.delay()).isEqualTo(0.0);
        assertThat(rectangle.runTime()).isEqualTo(0.1);
    }

    @Test
    void addedPolygonWithAnUnsupportedSideCountGetsTheDefaultShape() {
        ApplyResult result = applier.apply(project, List.of(op(
                "type", "addObject",
                "object", raw("type", "polygon", "sides", 2.0e9))), null);

        assertThat(result.warnings()).isEmpty();
        SceneObject polygon = firstScene(result).objects().get(1);
        assertThat(polygon.shapeAs(VertexShape.class).sides()).isEqualTo(6);
        assertThat(polygon.shapeAs(VertexShape.class).vertices()).hasSize(6);
    }

    @Test
    void canonicalPropertyWinsOverAlias() {
        ApplyResult result = applier.apply(project, List.of(op(
                "type", "addObject",
                "object", raw("type", "circle", "fill", "#22c55e", "fillColor", "#ef4444"))), null);

        assertThat(firstScene(result).objects().get(1).fill()).isEqualTo("#22c55e");
    }

    @Test
    void updateObjectMergesPropertiesButKeepsTheId() {
        ApplyResult result = applier.apply(project, List.of(op(
                "type", "updateObject",
                "objectId", "a",
                "updates", raw("id", "hijacked", "x", 3, "fillColor", "green"))), null);

        SceneObject circle = firstScene(result).objects().get(0);
        assertThat(circle.id()).isEqualTo("a");
        assertThat(circle.x()).isEqualTo(3.0);
        assertThat(circle.fill()).isEqualTo("#22c55e");
    }

    @Test
    void chainedObjectOperationsSeeEachOthersEdits() {
        ApplyResult result = applier.apply(project, List.of(
                op("type", "addObject", "object", raw("id", "b", "type", "dot")),
                op("type", "updateObject", "objectId", "b", "updates", raw("x", 2)),
                op("type", "addKeyframe", "objectId", "b", "time", 1.0, "property", "y", "value", 3),
                op("type", "deleteObject", "objectId", "a")), null);

        assertThat(result.warnings()).isEmpty();
        assertThat(firstScene(result).objects()).hasSize(1);
        SceneObject dot = firstScene(result).objects().get(0);
        assertThat(dot.id()).isEqualTo("b");
        assertThat(dot.x()).isEqualTo(2.0);
        assertThat(dot.keyframes()).containsExactly(new Keyframe(1.0, "y", 3.0));
    }

    @Test
    void snakeCaseOperationsAreAccepted() {
        ApplyResult result = applier.apply(project, List.of(op("type", "delete_object", "object_id", "a")), null);

        assertThat(result.warnings()).isEmpty();
        assertThat(firstScene(result).objects()).isEmpty();
    }

    @Test
    void addKeyframeReplacesTheSameSlotAndSortsByTime() {
        ApplyResult result = applier.apply(project, List.of(
                op("type", "addKeyframe", "objectId", "a", "time", 1.0, "property", "x", "value", 2),
                op("type", "addKeyframe", "objectId", "a", "time", 0.5, "property", "y", "value", 1),
                op("type", "addKeyframe", "objectId", "a", "time", 1.0, "property", "x", "value", 4)), null);

        assertThat(firstScene(result).objects().get(0).keyframes()).containsExactly(
                new Keyframe(0.5, "y", 1.0),
                new Keyframe(1.0, "x", 4.0));
    }

    @Test
    void invalidOperationsAreSkippedWithWarnings() {
        List<Object> operations = new ArrayList<>(Arrays.asList(
                "garbage",
                op("type", "explode"),
                op("type", "updateObject", "updates", raw()),
                op("type", "addObject", "object", raw("type", "hexagon")),
                op("type", "setSceneDuration", "duration", -1),
                op("type", "addObject", "object", raw("type", "dot"))));

        ApplyResult result = applier.apply(project, operations, null);

        assertThat(result.warnings()).containsExactly(
                "Skipped invalid op: garbage",
                "Skipped invalid op: {type=explode}",
                "Op failed (updateObject): objectId is required",
                "Op failed (addObject): unknown object type: hexagon",
                "Op failed (setSceneDuration): duration must be a positive number");
        assertThat(firstScene(result).objects()).extracting(SceneObject::type)
                .containsExactly(ObjectType.CIRCLE, ObjectType.DOT);
    }

    @Test
    void sceneOperationsManageTheSceneList() {
        ApplyResult result = applier.apply(project, List.of(
                op("type", "addScene"),
                op("type", "renameScene", "sceneId", "s1", "name", "Opening"),
                op("type", "setSceneDuration", "sceneId", "s1", "duration", 8)), null);

        assertThat(result.project().scenes()).extracting(Scene::name).containsExactly("Opening", "Scene 2");
        assertThat(result.project().scenes().get(0).duration()).isEqualTo(8.0);
        assertThat(result.project().scenes().get(1).duration()).isEqualTo(5.0);
    }

    @Test
    void deletingTheLastSceneIsRefused() {
        ApplyResult result = applier.apply(project, List.of(op("type", "deleteScene", "sceneId", "s1")), null);

        assertThat(result.warnings()).containsExactly("Op failed (deleteScene): the last scene cannot be deleted");
        assertThat(result.project().scenes()).extracting(Scene::id).containsExactly("s1");
    }

    @Test
    void defaultSceneIdTargetsOperationsWithoutASceneId() {
        Project twoScenes = validator.validate((Object) rawProject(
                rawScene("s1", "Intro"),
                rawScene("s2", "Outro")));

        ApplyResult result = applier.apply(twoScenes, List.of(
                SceneOperation.addObject(raw("type", "text", "text", "Bye"))), "s2");

        assertThat(result.project().scenes().get(0).objects()).isEmpty();
        assertThat(result.project().scenes().get(1).objects()).hasSize(1);
    }

    @Test
    void nullOperationListIsReported() {
        ApplyResult result = applier.apply(project, null, null);

        assertThat(result.warnings()).containsExactly("Operations must be a list");
        assertThat(result.project()).isEqualTo(project);
    }

    private static Map<String, Object> op(Object... keyValues) {
        return raw(keyValues);
    }

    private static Map<String, Object> raw(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int index = 0; index + 1 < keyValues.length; index += 2) {
            map.put((String) keyValues[index], keyValues[index + 1]);
        }
        return map;
    }

    private static Scene firstScene(ApplyResult result) {
        return result.project().scenes().get(0);
    }
}
