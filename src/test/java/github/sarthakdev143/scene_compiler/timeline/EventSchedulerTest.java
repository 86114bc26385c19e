package github.sarthakdev143.scene_compiler.timeline;

import github.sarthakdev143.scene_compiler.model.TransformStyle;
import github.sarthakdev143.scene_compiler.model.scene.Keyframe;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.timeline.CreationStep;
import github.sarthakdev143.scene_compiler.model.timeline.ExitStep;
import github.sarthakdev143.scene_compiler.model.timeline.KeyframeStep;
import github.sarthakdev143.scene_compiler.model.timeline.TimelineBatch;
import github.sarthakdev143.scene_compiler.model.timeline.TransformStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static github.sarthakdev143.scene_compiler.SceneFixtures.circle;
import static github.sarthakdev143.scene_compiler.SceneFixtures.transformTarget;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EventSchedulerTest {

    private EventScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new EventScheduler(new VisibilityResolver());
    }

    @Test
    void equalDelaysShareOneBatch() {
        List<TimelineBatch> batches = scheduler.schedule(List.of(
                circle("a", 0.0, 1.0),
                circle("b", 0.0, 2.0)));

        assertThat(batches).hasSize(3);
        TimelineBatch entrance = batches.get(0);
        assertThat(entrance.creations()).extracting(CreationStep::variable).containsExactly("obj_0", "obj_1");
        assertThat(entrance.creations()).extracting(CreationStep::animation)
                .containsExactly("GrowFromCenter", "GrowFromCenter");
        assertThat(entrance.duration()).isEqualTo(2.0);
        assertThat(entrance.waitBefore()).isEqualTo(0.0);
    }

    @Test
    void waitsCoverOnlyTheIdleGapBehindTheClock() {
        List<TimelineBatch> batches = scheduler.schedule(List.of(
                circle("a", 0.0, 1.0),
                circle("b", 3.0, 1.0)));

        assertThat(batches).extracting(TimelineBatch::time).containsExactly(0.0, 1.0, 3.0, 4.0);
        assertThat(batches).extracting(TimelineBatch::waitBefore).containsExactly(0.0, 0.0, 1.5, 0.0);
        assertThat(batches.get(1).exits()).extracting(ExitStep::variable).containsExactly("obj_0");
    }

    @Test
    void transformConsumesItsSource() {
        List<TimelineBatch> batches = scheduler.schedule(List.of(
                circle("a", 0.0, 1.0),
                transformTarget("t", "a", 0.5, 1.0)));

        assertThat(batches).hasSize(2);
        TransformStep transform = batches.get(1).transforms().get(0);
        assertThat(transform.sourceVariable()).isEqualTo("obj_0");
        assertThat(transform.targetVariable()).isEqualTo("target_1");
        assertThat(transform.style()).isEqualTo(TransformStyle.TRANSFORM);
        assertThat(batches).allSatisfy(batch -> assertThat(batch.exits()).isEmpty());
    }

    @Test
    void transformFromAnExitedSourceDegradesToAnEntrance() {
        List<TimelineBatch> batches = scheduler.schedule(List.of(
                circle("a", 0.0, 1.0),
                transformTarget("t", "a", 2.0, 1.0)));

        TimelineBatch last = batches.get(batches.size() - 1);
        assertThat(last.transforms()).isEmpty();
        assertThat(last.creations()).extracting(CreationStep::variable).containsExactly("target_1");
    }

    @Test
    void keyframesBecomeRelativeEditsAgainstTrackedState() {
        SceneObject moving = withKeyframes(circle("a", 0.0, 5.0), List.of(
                new Keyframe(1.0, "x", 2.0),
                new Keyframe(2.0, "x", 5.0),
                new Keyframe(2.0, "scale", 2.0),
                new Keyframe(3.0, "fill", "#ef4444")));

        List<TimelineBatch> batches = scheduler.schedule(List.of(moving));

        KeyframeStep first = batches.get(1).keyframeEdits().get(0);
        assertThat(first.shiftX()).isEqualTo(2.0);
        assertThat(first.shiftY()).isEqualTo(0.0);

        KeyframeStep second = batches.get(2).keyframeEdits().get(0);
        assertThat(second.shiftX()).isCloseTo(3.0, within(1e-9));
        assertThat(second.scaleFactor()).isEqualTo(2.0);
        assertThat(batches.get(2).duration()).isEqualTo(0.5);

        KeyframeStep third = batches.get(3).keyframeEdits().get(0);
        assertThat(third.hasShift()).isFalse();
        assertThat(third.color()).isEqualTo("#ef4444");
    }

    @Test
    void zeroOpacityKeyframeExitsOnce() {
        SceneObject fading = withKeyframes(circle("a", 0.0, 4.0), List.of(new Keyframe(2.0, "opacity", 0.0)));

        List<TimelineBatch> batches = scheduler.schedule(List.of(fading));

        assertThat(batches).hasSize(2);
        assertThat(batches.get(1).keyframeEdits()).isEmpty();
        assertThat(batches.get(1).exits()).extracting(ExitStep::animation).containsExactly("FadeOut");
    }

    @Test
    void entranceAnimationFallsBackToTheTypeDefault() {
        SceneObject custom = withAnimation(circle("a", 0.0, 1.0), "FadeIn");
        SceneObject invalid = withAnimation(circle("b", 0.0, 1.0), "fade-in()");

        assertThat(scheduler.entranceAnimation(custom)).isEqualTo("FadeIn");
        assertThat(scheduler.entranceAnimation(invalid)).isEqualTo("GrowFromCenter");
    }

    @Test
    void filteredObjectsKeepTheirIndexBasedVariables() {
        List<TimelineBatch> batches = scheduler.schedule(
                List.of(circle("a", 0.0, 1.0), circle("b", 0.0, 1.0)),
                object -> !"a".equals(object.id()));

        assertThat(batches.get(0).creations()).extracting(CreationStep::variable).containsExactly("obj_1");
    }

    @Test
    void morphedSourceTracksTheTargetPlacement() {
        SceneObject source = withKeyframes(circle("a", 0.0, 5.0), List.of(new Keyframe(1.0, "x", 3.0)));
        SceneObject target = placed(transformTarget("t", "a", 2.0, 2.0), 5.0, null,
                List.of(new Keyframe(3.0, "x", 6.0)));

        List<TimelineBatch> batches = scheduler.schedule(List.of(source, target));

        KeyframeStep afterMorph = batches.stream()
                .filter(batch -> batch.time() == 3.0)
                .findFirst()
                .orElseThrow()
                .keyframeEdits()
                .get(0);
        assertThat(afterMorph.variable()).isEqualTo("obj_0");
        assertThat(afterMorph.shiftX()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void replacementTargetTracksItsOwnPlacement() {
        SceneObject source = withKeyframes(circle("a", 0.0, 5.0), List.of(new Keyframe(1.0, "x", 3.0)));
        SceneObject target = placed(transformTarget("t", "a", 2.0, 2.0), 5.0, "ReplacementTransform",
                List.of(new Keyframe(3.0, "x", 6.0)));

        List<TimelineBatch> batches = scheduler.schedule(List.of(source, target));

        TimelineBatch morph = batches.stream().filter(batch -> batch.time() == 2.0).findFirst().orElseThrow();
        assertThat(morph.transforms()).extracting(TransformStep::style)
                .containsExactly(TransformStyle.REPLACEMENT_TRANSFORM);
        KeyframeStep afterMorph = batches.stream()
                .filter(batch -> batch.time() == 3.0)
                .findFirst()
                .orElseThrow()
                .keyframeEdits()
                .get(0);
        assertThat(afterMorph.variable()).isEqualTo("target_1");
        assertThat(afterMorph.shiftX()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void laterTransformFromAReplacedSourceStartsAtTheTarget() {
        SceneObject first = placed(transformTarget("b", "a", 0.5, 1.0), 0.0, "ReplacementTransform", List.of());
        SceneObject second = transformTarget("c", "a", 2.0, 1.0);

        List<TimelineBatch> batches = scheduler.schedule(List.of(circle("a", 0.0, 1.0), first, second));

        TransformStep chained = batches.stream()
                .filter(batch -> batch.time() == 2.0)
                .findFirst()
                .orElseThrow()
                .transforms()
                .get(0);
        assertThat(chained.sourceId()).isEqualTo("a");
        assertThat(chained.sourceVariable()).isEqualTo("target_1");
        assertThat(chained.targetVariable()).isEqualTo("target_2");
        assertThat(batches).allSatisfy(batch -> assertThat(batch.exits()).isEmpty());
    }

    private static SceneObject withKeyframes(SceneObject object, List<Keyframe> keyframes) {
        return new SceneObject(object.id(), object.name(), object.type(), object.x(), object.y(), object.rotation(),
                object.opacity(), object.zIndex(), object.fill(), object.stroke(), object.strokeWidth(), object.delay(),
                object.runTime(), object.animationType(), object.exitAnimationType(), object.transformFromId(),
                object.transformType(), keyframes, object.shape());
    }

    private static SceneObject withAnimation(SceneObject object, String animationType) {
        return new SceneObject(object.id(), object.name(), object.type(), object.x(), object.y(), object.rotation(),
                object.opacity(), object.zIndex(), object.fill(), object.stroke(), object.strokeWidth(), object.delay(),
                object.runTime(), animationType, object.exitAnimationType(), object.transformFromId(),
                object.transformType(), object.keyframes(), object.shape());
    }

    private static SceneObject placed(SceneObject object, double x, String transformType, List<Keyframe> keyframes) {
        return new SceneObject(object.id(), object.name(), object.type(), x, object.y(), object.rotation(),
                object.opacity(), object.zIndex(), object.fill(), object.stroke(), object.strokeWidth(), object.delay(),
                object.runTime(), object.animationType(), object.exitAnimationType(), object.transformFromId(),
                transformType, keyframes, object.shape());
    }
}
