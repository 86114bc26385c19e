package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.integration.manim.ManimScript;
import github.sarthakdev143.scene_compiler.integration.manim.ManimScriptEmitter;
import github.sarthakdev143.scene_compiler.integration.manim.ManimScriptParser;
import github.sarthakdev143.scene_compiler.integration.manim.RenderCacheKey;
import github.sarthakdev143.scene_compiler.model.CompilationResult;
import github.sarthakdev143.scene_compiler.model.QualityTier;
import github.sarthakdev143.scene_compiler.model.SceneIssue;
import github.sarthakdev143.scene_compiler.model.ValidationReport;
import github.sarthakdev143.scene_compiler.model.ops.ApplyResult;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.model.scene.Project;
import github.sarthakdev143.scene_compiler.model.scene.Scene;
import github.sarthakdev143.scene_compiler.model.scene.SceneObject;
import github.sarthakdev143.scene_compiler.service.SceneCompilerService;
import github.sarthakdev143.scene_compiler.timeline.VisibilityResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DefaultSceneCompilerService implements SceneCompilerService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSceneCompilerService.class);

    private final ProjectValidator projectValidator;
    private final ManimScriptEmitter scriptEmitter;
    private final ManimScriptParser scriptParser;
    private final OperationApplier operationApplier;
    private final SceneChecker sceneChecker;
    private final VisibilityResolver visibilityResolver;
    private final Counter compileRequestCounter;
    private final Counter parsedOperationCounter;
    private final Counter operationWarningCounter;
    private final Counter omittedObjectCounter;

    public DefaultSceneCompilerService(
            ProjectValidator projectValidator,
            ManimScriptEmitter scriptEmitter,
            ManimScriptParser scriptParser,
            OperationApplier operationApplier,
            SceneChecker sceneChecker,
            VisibilityResolver visibilityResolver,
            MeterRegistry meterRegistry) {
        this.projectValidator = projectValidator;
        this.scriptEmitter = scriptEmitter;
        this.scriptParser = scriptParser;
        this.operationApplier = operationApplier;
        this.sceneChecker = sceneChecker;
        this.visibilityResolver = visibilityResolver;
        this.compileRequestCounter = meterRegistry.counter("scene_compiler.compile.requests");
        this.parsedOperationCounter = meterRegistry.counter("scene_compiler.parse.operations");
        this.operationWarningCounter = meterRegistry.counter("scene_compiler.operations.warnings");
        this.omittedObjectCounter = meterRegistry.counter("scene_compiler.objects.omitted");
    }

    @Override
    public CompilationResult compile(Object rawProject, String activeSceneId, QualityTier quality) {
        compileRequestCounter.increment();
        Project project = projectValidator.validate(rawProject);
        ManimScript script = scriptEmitter.emitScript(project, activeSceneId);
        String sceneClassName = scriptEmitter.sceneClassName(project, activeSceneId);
        if (script.omittedObjects() > 0) {
            omittedObjectCounter.increment(script.omittedObjects());
        }

        logger.info(
                "Compiled project '{}' scenes={} sceneClass={} quality={} omittedObjects={}",
                project.name(),
                project.scenes().size(),
                sceneClassName,
                quality,
                script.omittedObjects());
        return new CompilationResult(
                script.text(),
                sceneClassName,
                quality,
                RenderCacheKey.of(script.text(), sceneClassName, quality),
                script.omittedObjects());
    }

    @Override
    public List<SceneOperation> parse(String script) {
        List<SceneOperation> operations = scriptParser.parse(script);
        parsedOperationCounter.increment(operations.size());
        logger.info("Parsed script into {} operation(s)", operations.size());
        return operations;
    }

    @Override
    public ApplyResult applyOperations(Object rawProject, List<?> operations, String defaultSceneId) {
        Project project = projectValidator.validate(rawProject);
        ApplyResult result = operationApplier.apply(project, operations, defaultSceneId);
        if (!result.warnings().isEmpty()) {
            operationWarningCounter.increment(result.warnings().size());
        }
        logger.info(
                "Applied {} operation(s) to project '{}' warnings={}",
                operations == null ? 0 : operations.size(),
                result.project().name(),
                result.warnings().size());
        return result;
    }

    @Override
    public ValidationReport validate(Object rawProject) {
        Project project = projectValidator.validate(rawProject);
        Map<String, List<SceneIssue>> issues = new LinkedHashMap<>();
        for (Scene scene : project.scenes()) {
            issues.put(scene.id(), sceneChecker.checkScene(scene));
        }
        return new ValidationReport(project, issues);
    }

    @Override
    public List<String> activeObjectIds(Object rawProject, String sceneId, double time) {
        Project project = projectValidator.validate(rawProject);
        Scene scene = sceneId == null
                ? project.scenes().get(0)
                : project.findScene(sceneId)
                        .orElseThrow(() -> new IllegalArgumentException("Scene not found for id: " + sceneId));
        return visibilityResolver.activeObjects(scene.objects(), time).stream()
                .map(SceneObject::id)
                .toList();
    }
}
