package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.linking.FormulaEvaluator;
import github.sarthakdev143.scene_compiler.linking.FormulaTranslator;
import github.sarthakdev143.scene_compiler.linking.GraphMath;
import github.sarthakdev143.scene_compiler.linking.LinkResolver;
import github.sarthakdev143.scene_compiler.model.ops.OperationType;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.model.scene.Project;
import github.sarthakdev143.scene_compiler.service.impl.ProjectValidator;
import github.sarthakdev143.scene_compiler.timeline.EventScheduler;
import github.sarthakdev143.scene_compiler.timeline.VisibilityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static github.sarthakdev143.scene_compiler.SceneFixtures.rawObject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawProject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawScene;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ManimScriptParserTest {

    private ManimScriptParser parser;

    @BeforeEach
    void setUp() {
        parser = new ManimScriptParser(ColorTable.defaults(), new FormulaEvaluator(), new FormulaTranslator());
    }

    @Test
    void parseReadsCircleWithKeywordArguments() {
        List<SceneOperation> operations = parser.parse("c = Circle(radius=2, color=RED)");

        assertThat(operations).hasSize(1);
        assertThat(operations.get(0).type()).isEqualTo(OperationType.ADD_OBJECT);
        Map<String, Object> circle = operations.get(0).object();
        assertThat(circle.get("type")).isEqualTo("circle");
        assertThat(circle.get("name")).isEqualTo("c");
        assertThat(circle.get("radius")).isEqualTo(2.0);
        assertThat(circle.get("fill")).isEqualTo("#ef4444");
        assertThat(circle.get("id")).isInstanceOf(String.class);
    }

    @Test
    void parseFillsDefaultAttributes() {
        Map<String, Object> circle = single("c = Circle(radius=2, color=RED)");

        assertThat(circle.get("x")).isEqualTo(0.0);
        assertThat(circle.get("y")).isEqualTo(0.0);
        assertThat(circle.get("opacity")).isEqualTo(1.0);
        assertThat(circle.get("delay")).isEqualTo(0.0);
        assertThat(circle.get("runTime")).isEqualTo(1.0);
        assertThat(circle.get("animationType")).isEqualTo("auto");
        assertThat(circle.get("exitAnimationType")).isEqualTo("FadeOut");
        assertThat(circle.get("strokeWidth")).isEqualTo(2.0);
        assertThat(circle.get("keyframes")).isEqualTo(List.of());
    }

    @Test
    void parseFoldsLaterMutationsIntoTheObject() {
        Map<String, Object> circle = single("""
                c = Circle()
                c.shift(RIGHT * 2)
                c.set_color(BLUE)
                """);

        assertThat((Double) circle.get("x")).isCloseTo(2.0, within(1e-9));
        assertThat((Double) circle.get("y")).isCloseTo(0.0, within(1e-9));
        assertThat(circle.get("fill")).isEqualTo("#3b82f6");
    }

    @Test
    void parseReadsArrowEndpoints() {
        Map<String, Object> arrow = single("a = Arrow(LEFT, RIGHT * 3, color=YELLOW)");

        assertThat(arrow.get("type")).isEqualTo("arrow");
        assertThat(arrow.get("x")).isEqualTo(-1.0);
        assertThat(arrow.get("y")).isEqualTo(0.0);
        assertThat(arrow.get("x2")).isEqualTo(3.0);
        assertThat(arrow.get("y2")).isEqualTo(0.0);
        assertThat(arrow.get("stroke")).isEqualTo("#eab308");
    }

    @Test
    void lineShiftMovesBothEndpoints() {
        Map<String, Object> line = single("l = Line().shift(UP * 2)");

        assertThat(line.get("x")).isEqualTo(-1.0);
        assertThat(line.get("y")).isEqualTo(2.0);
        assertThat(line.get("x2")).isEqualTo(1.0);
        assertThat(line.get("y2")).isEqualTo(2.0);
    }

    @Test
    void parseReturnsOneOperationPerObjectInSourceOrder() {
        List<SceneOperation> operations = parser.parse("""
                from manim import *

                class Demo(Scene):
                    def construct(self):
                        title = Text("Hello", font_size=36)
                        box = Square(side_length=1.5, fill_color=GREEN, fill_opacity=0.5)
                        dot = Dot([1, -1, 0], color=YELLOW)  # marker
                        self.play(Write(title), Create(box))
                        self.wait(1)
                """);

        assertThat(operations).hasSize(3);
        Map<String, Object> title = operations.get(0).object();
        assertThat(title.get("type")).isEqualTo("text");
        assertThat(title.get("text")).isEqualTo("Hello");
        assertThat(title.get("fontSize")).isEqualTo(36.0);

        Map<String, Object> box = operations.get(1).object();
        assertThat(box.get("type")).isEqualTo("rectangle");
        assertThat(box.get("width")).isEqualTo(1.5);
        assertThat(box.get("height")).isEqualTo(1.5);
        assertThat(box.get("fill")).isEqualTo("#22c55e");
        assertThat(box.get("opacity")).isEqualTo(0.5);

        Map<String, Object> dot = operations.get(2).object();
        assertThat(dot.get("type")).isEqualTo("dot");
        assertThat(dot.get("x")).isEqualTo(1.0);
        assertThat(dot.get("y")).isEqualTo(-1.0);
        assertThat(dot.get("fill")).isEqualTo("#eab308");
    }

    @Test
    void rotationIsConvertedToDegrees() {
        Map<String, Object> square = single("s = Square().rotate(PI / 4)");

        assertThat(square.get("rotation")).isEqualTo(45.0);
    }

    @Test
    void plotOnParsedAxesLinksTheGraph() {
        List<SceneOperation> operations = parser.parse("""
                ax = Axes(x_range=[-3, 3, 1], y_range=[-2, 8, 2])
                curve = ax.plot(lambda x: x**2, color=BLUE)
                """);

        assertThat(operations).hasSize(2);
        Map<String, Object> axes = operations.get(0).object();
        Map<String, Object> graph = operations.get(1).object();
        assertThat(graph.get("type")).isEqualTo("graph");
        assertThat(graph.get("formula")).isEqualTo("x^2");
        assertThat(graph.get("axesId")).isEqualTo(axes.get("id"));
        assertThat(graph.get("stroke")).isEqualTo("#3b82f6");
        assertThat(graph.get("xRange")).isEqualTo(Map.of("min", -3.0, "max", 3.0, "step", 1.0));
    }

    @Test
    void functionGraphLambdaParameterIsRenamed() {
        Map<String, Object> graph = single("g = FunctionGraph(lambda t: np.sin(t), x_range=[-3, 3])");

        assertThat(graph.get("formula")).isEqualTo("sin(x)");
    }

    @Test
    void rawLatexStringIsKeptVerbatim() {
        Map<String, Object> latex = single("eq = MathTex(r\"\\frac{a}{b}\")");

        assertThat(latex.get("type")).isEqualTo("latex");
        assertThat(latex.get("latex")).isEqualTo("\\frac{a}{b}");
    }

    @Test
    void cubicBezierBecomesArcThroughItsMidpoint() {
        Map<String, Object> arc = single(
                "arc = CubicBezier([0, 0, 0], [0.6667, 1.3333, 0], [1.3333, 1.3333, 0], [2, 0, 0])");

        assertThat(arc.get("type")).isEqualTo("arc");
        assertThat(arc.get("x2")).isEqualTo(2.0);
        assertThat((Double) arc.get("cx")).isCloseTo(1.0, within(1e-3));
        assertThat((Double) arc.get("cy")).isCloseTo(1.0, within(1e-3));
    }

    @Test
    void relativePlacementDiscardsTheObject() {
        assertThat(parser.parse("""
                c = Circle()
                t = Text("label")
                t.next_to(c, UP)
                """)).hasSize(1);
        assertThat(parser.parse("t = Text(\"label\").to_edge(UP)")).isEmpty();
    }

    @Test
    void animateChainsDoNotMoveTheObject() {
        Map<String, Object> circle = single("""
                c = Circle()
                c.animate.shift(RIGHT)
                self.play(c.animate.shift(RIGHT))
                """);

        assertThat(circle.get("x")).isEqualTo(0.0);
    }

    @Test
    void unreadableValuesAndUnknownConstructorsAreSkipped() {
        assertThat(parser.parse("c = Circle(radius=some_variable)")).isEmpty();
        assertThat(parser.parse("g = VGroup(a, b)")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void deeplyNestedValuesAreSkippedWithoutFailing() {
        String open = "(".repeat(20000);
        String close = ")".repeat(20000);

        assertThat(parser.parse("c = Circle(radius=" + open + "1" + close + ")")).isEmpty();
        assertThat(parser.parse("d = Dot(point=" + open + "RIGHT" + close + ")")).isEmpty();
        assertThat(single("d = Dot(point=((RIGHT)))").get("x")).isEqualTo(1.0);
    }

    @Test
    void regularPolygonSideCountMustStayInRange() {
        assertThat(parser.parse("p = RegularPolygon(n=2000000000)")).isEmpty();
        assertThat(parser.parse("p = RegularPolygon(n=2)")).isEmpty();

        Map<String, Object> hexagon = single("p = RegularPolygon()");
        assertThat(hexagon.get("sides")).isEqualTo(6);
        assertThat((List<?>) hexagon.get("vertices")).hasSize(6);
    }

    @Test
    void emittedCircleParsesBack() {
        ColorTable colorTable = ColorTable.defaults();
        FormulaEvaluator evaluator = new FormulaEvaluator();
        GraphMath graphMath = new GraphMath(evaluator);
        ManimScriptEmitter emitter = new ManimScriptEmitter(
                colorTable,
                new LinkResolver(new FormulaTranslator(), graphMath),
                new EventScheduler(new VisibilityResolver()),
                graphMath);
        Project project = new ProjectValidator(colorTable).validate((Object) rawProject(rawScene("s1", "Intro",
                rawObject("a", "circle", "x", 1, "y", 2, "radius", 1.5, "fill", "#3b82f6"))));

        Map<String, Object> circle = single(emitter.emit(project, null));

        assertThat(circle.get("type")).isEqualTo("circle");
        assertThat(circle.get("x")).isEqualTo(1.0);
        assertThat(circle.get("y")).isEqualTo(2.0);
        assertThat(circle.get("radius")).isEqualTo(1.5);
        assertThat(circle.get("fill")).isEqualTo("#3b82f6");
        assertThat(circle.get("opacity")).isEqualTo(1.0);
    }

    private Map<String, Object> single(String script) {
        List<SceneOperation> operations = parser.parse(script);
        assertThat(operations).hasSize(1);
        return operations.get(0).object();
    }
}
