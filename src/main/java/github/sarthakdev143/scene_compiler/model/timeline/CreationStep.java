package github.sarthakdev143.scene_compiler.model.timeline;

public record CreationStep(
        String objectId,
        String variable,
        String animation,
        double runTime) {
}
