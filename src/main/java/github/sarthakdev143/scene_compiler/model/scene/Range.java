package github.sarthakdev143.scene_compiler.model.scene;

public record Range(
        double min,
        double max,
        double step) {

    public double span() {
        return max - min;
    }

    public double center() {
        return (min + max) / 2.0;
    }
}
