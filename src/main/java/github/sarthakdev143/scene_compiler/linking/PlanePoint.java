package github.sarthakdev143.scene_compiler.linking;

public record PlanePoint(double x, double y) {

    public PlanePoint plus(PlanePoint other) {
        return new PlanePoint(x + other.x, y + other.y);
    }

    public PlanePoint minus(PlanePoint other) {
        return new PlanePoint(x - other.x, y - other.y);
    }

    public PlanePoint times(double factor) {
        return new PlanePoint(x * factor, y * factor);
    }
}
