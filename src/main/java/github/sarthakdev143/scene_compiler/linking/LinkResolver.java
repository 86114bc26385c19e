package github.sarthakdev143.scene_compiler.linking;

import github.sarthakdev143.scene_compiler.model.ObjectType;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphCursorShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.LimitProbeShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.LinkedShape;
import github.sarthakdev143.scene_compiler.model.scene.shape.TangentLineShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves id links between axes, graphs, cursors and the objects derived from them. A link to a
 * missing object, or to an object of the wrong type, is dropped and the object renders unlinked.
 */
@Component
public class LinkResolver {

    private static final Logger logger = LoggerFactory.getLogger(LinkResolver.class);

    private final FormulaTranslator formulaTranslator;
    private final GraphMath graphMath;

    public LinkResolver(FormulaTranslator formulaTranslator, GraphMath graphMath) {
        this.formulaTranslator = formulaTranslator;
        this.graphMath = graphMath;
    }

    public Map<String, ResolvedLinks> resolve(List<SceneObject> objects) {
        Map<String, SceneObject> byId = new LinkedHashMap<>();
        for (SceneObject object : objects) {
            byId.putIfAbsent(object.id(), object);
        }

        Map<String, ResolvedLinks> resolved = new LinkedHashMap<>();
        for (SceneObject object : objects) {
            if (object.shape() instanceof LinkedShape shape) {
                resolved.put(object.id(), resolveObject(object, shape, byId));
            }
        }
        return resolved;
    }

    private ResolvedLinks resolveObject(SceneObject object, LinkedShape shape, Map<String, SceneObject> byId) {
        if (object.type() == ObjectType.GRAPH) {
            SceneObject axes = lookup(object, shape.axesId(), ObjectType.AXES, byId);
            String formula = ((GraphShape) shape).formula();
            return new ResolvedLinks(
                    axes,
                    object,
                    null,
                    axes != null ? axes : object,
                    formulaTranslator.toPython(formula).orElse(null),
                    null,
                    null);
        }

        SceneObject cursor = object.type() == ObjectType.GRAPH_CURSOR
                ? null
                : lookup(object, shape.cursorId(), ObjectType.GRAPH_CURSOR, byId);
        String graphId = shape.graphId() != null || cursor == null
                ? shape.graphId()
                : cursor.shapeAs(GraphCursorShape.class).graphId();
        SceneObject graph = usableGraph(object, graphId, byId);

        SceneObject axes = lookup(object, shape.axesId(), ObjectType.AXES, byId);
        if (axes == null && cursor != null) {
            axes = lookup(object, cursor.shapeAs(GraphCursorShape.class).axesId(), ObjectType.AXES, byId);
        }
        if (axes == null && graph != null) {
            axes = lookup(object, graph.shapeAs(GraphShape.class).axesId(), ObjectType.AXES, byId);
        }

        Double anchorX = anchorX(object, cursor);
        Double anchorY = null;
        String pythonFormula = null;
        if (graph != null) {
            String formula = graph.shapeAs(GraphShape.class).formula();
            pythonFormula = formulaTranslator.toPython(formula).orElse(null);
            if (anchorX != null) {
                anchorY = graphMath.valueAt(formula, anchorX);
            }
        }

        return new ResolvedLinks(
                axes,
                graph,
                cursor,
                axes != null ? axes : graph,
                pythonFormula,
                anchorX,
                anchorY);
    }

    private Double anchorX(SceneObject object, SceneObject cursor) {
        if (cursor != null) {
            return cursor.shapeAs(GraphCursorShape.class).x0();
        }
        if (object.shape() instanceof GraphCursorShape cursorShape) {
            return cursorShape.x0();
        }
        if (object.shape() instanceof TangentLineShape tangent) {
            return tangent.x0();
        }
        if (object.shape() instanceof LimitProbeShape probe) {
            return probe.x0();
        }
        return null;
    }

    /**
     * A graph can only anchor dependants when its formula survives translation.
     */
    private SceneObject usableGraph(SceneObject owner, String graphId, Map<String, SceneObject> byId) {
        SceneObject graph = lookup(owner, graphId, ObjectType.GRAPH, byId);
        if (graph != null && formulaTranslator.toPython(graph.shapeAs(GraphShape.class).formula()).isEmpty()) {
            logger.debug("Object {} links graph {} whose formula cannot be translated; rendering unlinked",
                    owner.id(), graphId);
            return null;
        }
        return graph;
    }

    private SceneObject lookup(SceneObject owner, String id, ObjectType expectedType, Map<String, SceneObject> byId) {
        if (id == null) {
            return null;
        }
        SceneObject target = byId.get(id);
        if (target == null || target.type() != expectedType || target.id().equals(owner.id())) {
            logger.debug("Dropping link {} -> {} (expected {})", owner.id(), id, expectedType.wireName());
            return null;
        }
        return target;
    }
}
