package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.integration.manim.ColorTable;
import github.sarthakdev143.scene_compiler.linking.FormulaEvaluator;
import github.sarthakdev143.scene_compiler.linking.FormulaTranslator;
import github.sarthakdev143.scene_compiler.linking.GraphMath;
import github.sarthakdev143.scene_compiler.linking.LinkResolver;
import github.sarthakdev143.scene_compiler.model.IssueSeverity;
import github.sarthakdev143.scene_compiler.model.SceneIssue;
import github.sarthakdev143.scene_compiler.model.scene.Scene;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static github.sarthakdev143.scene_compiler.SceneFixtures.rawObject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawProject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawScene;
import static org.assertj.core.api.Assertions.assertThat;

class SceneCheckerTest {

    private ProjectValidator validator;
    private SceneChecker checker;

    @BeforeEach
    void setUp() {
        FormulaTranslator translator = new FormulaTranslator();
        validator = new ProjectValidator(ColorTable.defaults());
        checker = new SceneChecker(new LinkResolver(translator, new GraphMath(new FormulaEvaluator())), translator);
    }

    @Test
    void emptySceneIsReportedOnce() {
        List<SceneIssue> issues = checker.checkScene(scene(rawScene("s1", "Blank")));

        assertThat(issues).containsExactly(new SceneIssue(IssueSeverity.WARNING, null, "Scene 'Blank' has no objects"));
    }

    @Test
    void fullyLinkedSceneHasNoIssues() {
        Scene scene = scene(rawScene("s1", "Calculus",
                rawObject("axes", "axes"),
                rawObject("graph", "graph", "formula", "x^2", "axesId", "axes"),
                rawObject("cursor", "graphCursor", "x0", 1, "graphId", "graph"),
                rawObject("tangent", "tangentLine", "x0", 1, "graphId", "graph"),
                rawObject("label", "valueLabel", "graphId", "graph", "cursorId", "cursor")));

        assertThat(checker.checkScene(scene)).isEmpty();
    }

    @Test
    void graphWithoutAxesRendersOnItsOwn() {
        Scene scene = scene(rawScene("s1", "Plot",
                rawObject("g", "graph", "name", "Parabola", "formula", "x^2"),
                rawObject("h", "graph", "name", "Line", "formula", "x", "axesId", "nope")));

        assertThat(checker.checkScene(scene)).containsExactly(
                new SceneIssue(IssueSeverity.WARNING, "g",
                        "Graph 'Parabola' is not linked to axes and will render on its own"),
                new SceneIssue(IssueSeverity.WARNING, "h",
                        "Graph 'Line' links missing axes nope and will render on its own"));
    }

    @Test
    void untranslatableFormulaIsAnError() {
        Scene scene = scene(rawScene("s1", "Plot",
                rawObject("axes", "axes"),
                rawObject("g", "graph", "name", "Mystery", "formula", "foo(x)", "axesId", "axes")));

        assertThat(checker.checkScene(scene)).containsExactly(
                new SceneIssue(IssueSeverity.ERROR, "g", "Graph 'Mystery' has a formula that cannot be translated: foo(x)"));
    }

    @Test
    void dependantsWithoutAGraphAreErrors() {
        Scene scene = scene(rawScene("s1", "Orphans",
                rawObject("c", "graphCursor", "name", "Cursor"),
                rawObject("t", "tangentLine", "name", "Tangent", "graphId", "missing")));

        assertThat(checker.checkScene(scene)).containsExactly(
                new SceneIssue(IssueSeverity.ERROR, "c", "Graph Cursor 'Cursor' has no graph to follow"),
                new SceneIssue(IssueSeverity.ERROR, "t", "Tangent Line 'Tangent' has no graph to follow"));
    }

    @Test
    void cursorAtAnUndefinedPointIsLeftOut() {
        Scene scene = scene(rawScene("s1", "Roots",
                rawObject("axes", "axes"),
                rawObject("g", "graph", "formula", "sqrt(x)", "axesId", "axes"),
                rawObject("c", "graphCursor", "name", "Probe", "x0", -4, "graphId", "g")));

        List<SceneIssue> issues = checker.checkScene(scene);

        assertThat(issues).containsExactly(new SceneIssue(IssueSeverity.WARNING, "c",
                "Graph Cursor 'Probe' sits at an undefined point of its graph and will be left out"));
    }

    @SafeVarargs
    private Scene scene(Map<String, Object>... scenes) {
        return validator.validate((Object) rawProject(scenes)).scenes().get(0);
    }
}
