package github.sarthakdev143.scene_compiler.service;

import github.sarthakdev143.scene_compiler.model.CompilationResult;
import github.sarthakdev143.scene_compiler.model.QualityTier;
import github.sarthakdev143.scene_compiler.model.ValidationReport;
import github.sarthakdev143.scene_compiler.model.ops.ApplyResult;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;

import java.util.List;

public interface SceneCompilerService {

    CompilationResult compile(Object rawProject, String activeSceneId, QualityTier quality);

    List<SceneOperation> parse(String script);

    ApplyResult applyOperations(Object rawProject, List<?> operations, String defaultSceneId);

    ValidationReport validate(Object rawProject);

    /**
     * Ids of the objects visible at {@code time} in the given scene, or in the first scene when
     * {@code sceneId} is {@code null}.
     */
    List<String> activeObjectIds(Object rawProject, String sceneId, double time);
}
