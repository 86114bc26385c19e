package github.sarthakdev143.scene_compiler.model.timeline;

import java.util.List;

/**
 * Animation calls sharing one timestamp. {@code waitBefore} is the idle gap the script waits
 * before this batch; {@code duration} is how far the batch advances the scene clock.
 */
public record TimelineBatch(
        double time,
        double waitBefore,
        double duration,
        List<CreationStep> creations,
        List<TransformStep> transforms,
        List<KeyframeStep> keyframeEdits,
        List<ExitStep> exits) {

    public TimelineBatch {
        creations = creations == null ? List.of() : List.copyOf(creations);
        transforms = transforms == null ? List.of() : List.copyOf(transforms);
        keyframeEdits = keyframeEdits == null ? List.of() : List.copyOf(keyframeEdits);
        exits = exits == null ? List.of() : List.copyOf(exits);
    }
}
