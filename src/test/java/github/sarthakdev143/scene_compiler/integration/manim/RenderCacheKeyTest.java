package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.model.QualityTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RenderCacheKeyTest {

    private static final String SCRIPT = "from manim import *\n\nclass Intro(Scene):\n    def construct(self):\n        pass\n";

    @Test
    void sameInputsGiveTheSameKey() {
        String key = RenderCacheKey.of(SCRIPT, "Intro", QualityTier.LOW);

        assertThat(key).isEqualTo(RenderCacheKey.of(SCRIPT, "Intro", QualityTier.LOW));
        assertThat(key).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void keyChangesWithSceneQualityAndScript() {
        String key = RenderCacheKey.of(SCRIPT, "Intro", QualityTier.LOW);

        assertThat(RenderCacheKey.of(SCRIPT, "Intro", QualityTier.HIGH)).isNotEqualTo(key);
        assertThat(RenderCacheKey.of(SCRIPT, "Outro", QualityTier.LOW)).isNotEqualTo(key);
        assertThat(RenderCacheKey.of(SCRIPT + "\n", "Intro", QualityTier.LOW)).isNotEqualTo(key);
    }
}
