package github.sarthakdev143.scene_compiler.model.scene.shape;

import github.sarthakdev143.scene_compiler.model.scene.Vertex;

import java.util.List;

public record VertexShape(
        List<Vertex> vertices,
        int sides,
        double radius) implements ShapeSpec {

    public VertexShape {
        vertices = vertices == null ? List.of() : List.copyOf(vertices);
    }
}
