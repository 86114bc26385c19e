package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.integration.manim.ColorTable;
import github.sarthakdev143.scene_compiler.integration.manim.ManimScriptEmitter;
import github.sarthakdev143.scene_compiler.integration.manim.ManimScriptParser;
import github.sarthakdev143.scene_compiler.integration.manim.RenderCacheKey;
import github.sarthakdev143.scene_compiler.linking.FormulaEvaluator;
import github.sarthakdev143.scene_compiler.linking.FormulaTranslator;
import github.sarthakdev143.scene_compiler.linking.GraphMath;
import github.sarthakdev143.scene_compiler.linking.LinkResolver;
import github.sarthakdev143.scene_compiler.model.CompilationResult;
import github.sarthakdev143.scene_compiler.model.IssueSeverity;
import github.sarthakdev143.scene_compiler.model.QualityTier;
import github.sarthakdev143.scene_compiler.model.ValidationReport;
import github.sarthakdev143.scene_compiler.model.ops.ApplyResult;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.timeline.EventScheduler;
import github.sarthakdev143.scene_compiler.timeline.VisibilityResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static github.sarthakdev143.scene_compiler.SceneFixtures.rawObject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawProject;
import static github.sarthakdev143.scene_compiler.SceneFixtures.rawScene;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultSceneCompilerServiceTest {

    @Mock
    private ManimScriptParser scriptParser;

    private SimpleMeterRegistry meterRegistry;
    private DefaultSceneCompilerService service;

    @BeforeEach
    void setUp() {
        ColorTable colorTable = ColorTable.defaults();
        FormulaTranslator translator = new FormulaTranslator();
        GraphMath graphMath = new GraphMath(new FormulaEvaluator());
        LinkResolver linkResolver = new LinkResolver(translator, graphMath);
        VisibilityResolver visibilityResolver = new VisibilityResolver();
        ProjectValidator validator = new ProjectValidator(colorTable);
        meterRegistry = new SimpleMeterRegistry();
        service = new DefaultSceneCompilerService(
                validator,
                new ManimScriptEmitter(colorTable, linkResolver, new EventScheduler(visibilityResolver), graphMath),
                scriptParser,
                new OperationApplier(validator, new ObjectPropertyNormalizer(colorTable)),
                new SceneChecker(linkResolver, translator),
                visibilityResolver,
                meterRegistry);
    }

    @Test
    void compileReturnsScriptClassNameAndCacheKey() {
        Map<String, Object> project = rawProject(
                rawScene("s1", "Intro", rawObject("a", "circle")),
                rawScene("s2", "Outro", rawObject("b", "text", "text", "Bye")));

        CompilationResult result = service.compile(project, "s2", QualityTier.MEDIUM);

        assertThat(result.sceneClassName()).isEqualTo("Outro");
        assertThat(result.quality()).isEqualTo(QualityTier.MEDIUM);
        assertThat(result.script()).contains("class Outro(Scene):");
        assertThat(result.cacheKey()).isEqualTo(RenderCacheKey.of(result.script(), "Outro", QualityTier.MEDIUM));
        assertThat(result.omittedObjects()).isZero();
        assertThat(meterRegistry.counter("scene_compiler.compile.requests").count()).isEqualTo(1.0);
    }

    @Test
    void compileCountsOmittedObjects() {
        Map<String, Object> project = rawProject(rawScene("s1", "Plot",
                rawObject("g", "graph", "formula", "foo(x)")));

        CompilationResult result = service.compile(project, null, QualityTier.LOW);

        assertThat(result.omittedObjects()).isEqualTo(1);
        assertThat(meterRegistry.counter("scene_compiler.objects.omitted").count()).isEqualTo(1.0);
    }

    @Test
    void parseDelegatesToTheParserAndCountsOperations() {
        List<SceneOperation> operations = List.of(
                SceneOperation.addObject(Map.of("type", "circle")),
                SceneOperation.addObject(Map.of("type", "dot")));
        when(scriptParser.parse("c = Circle()\nd = Dot()")).thenReturn(operations);

        List<SceneOperation> parsed = service.parse("c = Circle()\nd = Dot()");

        assertThat(parsed).isEqualTo(operations);
        verify(scriptParser).parse("c = Circle()\nd = Dot()");
        assertThat(meterRegistry.counter("scene_compiler.parse.operations").count()).isEqualTo(2.0);
    }

    @Test
    void applyOperationsCountsWarnings() {
        Map<String, Object> project = rawProject(rawScene("s1", "Intro"));

        ApplyResult result = service.applyOperations(project, List.of(
                Map.of("type", "addObject", "object", Map.of("type", "circle")),
                Map.of("type", "deleteScene", "sceneId", "s1")), null);

        assertThat(result.project().scenes().get(0).objects()).hasSize(1);
        assertThat(result.warnings()).hasSize(1);
        assertThat(meterRegistry.counter("scene_compiler.operations.warnings").count()).isEqualTo(1.0);
    }

    @Test
    void validateReportsIssuesPerScene() {
        Map<String, Object> project = rawProject(
                rawScene("s1", "Blank"),
                rawScene("s2", "Orphans", rawObject("c", "graphCursor", "name", "Cursor")));

        ValidationReport report = service.validate(project);

        assertThat(report.issues()).containsOnlyKeys("s1", "s2");
        assertThat(report.issues().get("s1")).singleElement()
                .satisfies(issue -> assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING));
        assertThat(report.issues().get("s2")).singleElement()
                .satisfies(issue -> assertThat(issue.severity()).isEqualTo(IssueSeverity.ERROR));
    }

    @Test
    void activeObjectIdsFollowsDelaysAndExits() {
        Map<String, Object> project = rawProject(rawScene("s1", "Intro",
                rawObject("a", "circle", "delay", 0.0, "runTime", 1.0),
                rawObject("b", "circle", "delay", 3.0, "runTime", 1.0)));

        assertThat(service.activeObjectIds(project, null, 0.5)).containsExactly("a");
        assertThat(service.activeObjectIds(project, "s1", 3.2)).containsExactly("b");
    }

    @Test
    void activeObjectIdsRejectsUnknownScene() {
        Map<String, Object> project = rawProject(rawScene("s1", "Intro"));

        assertThatThrownBy(() -> service.activeObjectIds(project, "missing", 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Scene not found for id: missing");
    }
}
