package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.linking.FormulaTranslator;
import github.sarthakdev143.scene_compiler.linking.LinkResolver;
import github.sarthakdev143.scene_compiler.linking.ResolvedLinks;
import github.sarthakdev143.scene_compiler.model.IssueSeverity;
import github.sarthakdev143.scene_compiler.model.SceneIssue;
import github.sarthakdev143.scene_compiler.model.scene.Scene;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.model.scene.shape.GraphShape;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pre-render checks. Reports what will render differently from what the author linked, without
 * changing the scene.
 */
@Component
public class SceneChecker {

    private final LinkResolver linkResolver;
    private final FormulaTranslator formulaTranslator;

    public SceneChecker(LinkResolver linkResolver, FormulaTranslator formulaTranslator) {
        this.linkResolver = linkResolver;
        this.formulaTranslator = formulaTranslator;
    }

    public List<SceneIssue> checkScene(Scene scene) {
        List<SceneIssue> issues = new ArrayList<>();
        if (scene.objects().isEmpty()) {
            issues.add(new SceneIssue(IssueSeverity.WARNING, null, "Scene '" + scene.name() + "' has no objects"));
            return issues;
        }

        Map<String, ResolvedLinks> links = linkResolver.resolve(scene.objects());
        for (SceneObject object : scene.objects()) {
            ResolvedLinks resolved = links.get(object.id());
            switch (object.type()) {
                case GRAPH -> checkGraph(issues, object, resolved);
                case GRAPH_CURSOR -> {
                    if (requireGraph(issues, object, resolved) && !resolved.hasDefinedAnchor()) {
                        issues.add(new SceneIssue(IssueSeverity.WARNING, object.id(),
                                describe(object) + " sits at an undefined point of its graph and will be left out"));
                    }
                }
                case TANGENT_LINE, LIMIT_PROBE, VALUE_LABEL -> requireGraph(issues, object, resolved);
                default -> {
                }
            }
        }
        return issues;
    }

    private void checkGraph(List<SceneIssue> issues, SceneObject graph, ResolvedLinks resolved) {
        String formula = graph.shapeAs(GraphShape.class).formula();
        if (formulaTranslator.toPython(formula).isEmpty()) {
            issues.add(new SceneIssue(IssueSeverity.ERROR, graph.id(),
                    describe(graph) + " has a formula that cannot be translated: " + formula));
        }
        if (resolved == null || resolved.axes() == null) {
            String axesId = graph.shapeAs(GraphShape.class).axesId();
            String message = axesId == null
                    ? describe(graph) + " is not linked to axes and will render on its own"
                    : describe(graph) + " links missing axes " + axesId + " and will render on its own";
            issues.add(new SceneIssue(IssueSeverity.WARNING, graph.id(), message));
        }
    }

    private static boolean requireGraph(List<SceneIssue> issues, SceneObject object, ResolvedLinks resolved) {
        if (resolved == null || resolved.graph() == null) {
            issues.add(new SceneIssue(IssueSeverity.ERROR, object.id(), describe(object) + " has no graph to follow"));
            return false;
        }
        return true;
    }

    private static String describe(SceneObject object) {
        return object.type().label() + " '" + object.name() + "'";
    }
}
