package github.sarthakdev143.scene_compiler.timeline;

import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static github.sarthakdev143.scene_compiler.SceneFixtures.circle;
import static github.sarthakdev143.scene_compiler.SceneFixtures.transformTarget;
import static org.assertj.core.api.Assertions.assertThat;

class VisibilityResolverTest {

    private VisibilityResolver visibilityResolver;

    @BeforeEach
    void setUp() {
        visibilityResolver = new VisibilityResolver();
    }

    @Test
    void activeObjectsUseHalfOpenLifetimes() {
        SceneObject first = circle("a", 0.0, 1.0);
        SceneObject second = circle("b", 2.0, 1.0);
        List<SceneObject> objects = List.of(first, second);

        assertThat(visibilityResolver.activeObjects(objects, 0.0)).containsExactly(first);
        assertThat(visibilityResolver.activeObjects(objects, 0.99)).containsExactly(first);
        assertThat(visibilityResolver.activeObjects(objects, 1.0)).isEmpty();
        assertThat(visibilityResolver.activeObjects(objects, 2.5)).containsExactly(second);
    }

    @Test
    void transformTargetReplacesItsSourceAndNeverEnds() {
        SceneObject source = circle("a", 0.0, 10.0);
        SceneObject target = transformTarget("t", "a", 2.0, 1.0);
        List<SceneObject> objects = List.of(source, target);

        assertThat(visibilityResolver.activeObjects(objects, 1.0)).containsExactly(source);
        assertThat(visibilityResolver.activeObjects(objects, 2.0)).containsExactly(target);
        assertThat(visibilityResolver.activeObjects(objects, 100.0)).containsExactly(target);
    }
}
