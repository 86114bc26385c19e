package github.sarthakdev143.scene_compiler.model.timeline;

public record ExitStep(
        String objectId,
        String variable,
        String animation,
        double runTime) {
}
