package github.sarthakdev143.scene_compiler.linking;

import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphShape;

/**
 * Outcome of link resolution for one math-graph object. Any reference may be {@code null} when it
 * was absent or dangling; {@code frameOwner} is the axes object (or, for unlinked graphs, the graph
 * itself) whose coordinate mapping the object uses.
 */
public record ResolvedLinks(
        SceneObject axes,
        SceneObject graph,
        SceneObject cursor,
        SceneObject frameOwner,
        String pythonFormula,
        Double anchorX,
        Double anchorY) {

    public boolean hasFrame() {
        return frameOwner != null;
    }

    public boolean usesImplicitFrame() {
        return frameOwner != null && frameOwner.type() == ObjectType.GRAPH;
    }

    public String formula() {
        return graph == null ? null : graph.shapeAs(GraphShape.class).formula();
    }

    public boolean hasDefinedAnchor() {
        return anchorX != null && anchorY != null && Double.isFinite(anchorY);
    }
}
