package github.sarthakdev143.scene_compiler.controller;

import github.sarthakdev143.scene_compiler.dto.ActiveObjectsRequest;
import github.sarthakdev143.scene_compiler.dto.ActiveObjectsResponse;
import github.sarthakdev143.scene_compiler.dto.CompileRequest;
import github.sarthakdev143.scene_compiler.dto.CompileResponse;
import github.sarthakdev143.scene_compiler.dto.OperationsRequest;
import github.sarthakdev143.scene_compiler.dto.ParseRequest;
import github.sarthakdev143.scene_compiler.dto.ParseResponse;
import github.sarthakdev143.scene_compiler.dto.ProjectResponse;
import github.sarthakdev143.scene_compiler.model.CompilationResult;
import github.sarthakdev143.scene_compiler.model.QualityTier;
import github.sarthakdev143.scene_compiler.model.ValidationReport;
import github.sarthakdev143.scene_compiler.model.ops.ApplyResult;
import github.sarthakdev143.scene_compiler.model.ops.SceneOperation;
import github.sarthakdev143.scene_compiler.model.scene.ProjectWriter;
import github.sarthakdev143.scene_compiler.service.SceneCompilerService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/scene")
public class SceneCompilerController {

    private static final Logger logger = LoggerFactory.getLogger(SceneCompilerController.class);
    private static final int MAX_SCRIPT_LENGTH = 1_000_000;
    private static final int MAX_OPERATIONS = 500;

    private final SceneCompilerService sceneCompilerService;

    public SceneCompilerController(SceneCompilerService sceneCompilerService) {
        this.sceneCompilerService = sceneCompilerService;
    }

    @PostMapping("/compile")
    public ResponseEntity<?> compile(@RequestBody CompileRequest request) {
        try {
            requireProject(request == null ? null : request.project());
            QualityTier quality = QualityTier.fromInput(request.quality());
            CompilationResult result = sceneCompilerService.compile(request.project(), request.activeSceneId(), quality);
            return ResponseEntity.ok(new CompileResponse(
                    result.script(),
                    result.sceneClassName(),
                    result.quality(),
                    result.cacheKey()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Script compilation failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to compile the project. Please try again.");
        }
    }

    @PostMapping("/parse")
    public ResponseEntity<?> parse(@RequestBody ParseRequest request) {
        try {
            if (request == null || request.script() == null) {
                throw new IllegalArgumentException("Script is required.");
            }
            if (request.script().length() > MAX_SCRIPT_LENGTH) {
                throw new IllegalArgumentException("Script must be at most " + MAX_SCRIPT_LENGTH + " characters.");
            }
            List<Map<String, Object>> operations = sceneCompilerService.parse(request.script()).stream()
                    .map(SceneOperation::toRaw)
                    .toList();
            return ResponseEntity.ok(new ParseResponse(operations));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Script parsing failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to parse the script. Please try again.");
        }
    }

    @PostMapping("/operations")
    public ResponseEntity<?> applyOperations(@RequestBody OperationsRequest request) {
        try {
            requireProject(request == null ? null : request.project());
            if (request.operations() == null) {
                throw new IllegalArgumentException("Operations are required.");
            }
            if (request.operations().size() > MAX_OPERATIONS) {
                throw new IllegalArgumentException("At most " + MAX_OPERATIONS + " operations are allowed per request.");
            }
            ApplyResult result = sceneCompilerService.applyOperations(
                    request.project(),
                    request.operations(),
                    request.defaultSceneId());
            return ResponseEntity.ok(new ProjectResponse(
                    ProjectWriter.toRaw(result.project()),
                    result.warnings(),
                    null));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Applying operations failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to apply operations. Please try again.");
        }
    }

    @PostMapping("/validate")
    public ResponseEntity<?> validate(@RequestBody Map<String, Object> project) {
        try {
            requireProject(project);
            ValidationReport report = sceneCompilerService.validate(project);
            return ResponseEntity.ok(new ProjectResponse(
                    ProjectWriter.toRaw(report.project()),
                    null,
                    report.issues()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Project validation failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to validate the project. Please try again.");
        }
    }

    @PostMapping("/active")
    public ResponseEntity<?> activeObjects(@RequestBody ActiveObjectsRequest request) {
        try {
            requireProject(request == null ? null : request.project());
            Double time = request.time();
            if (time == null || !Double.isFinite(time) || time < 0) {
                throw new IllegalArgumentException("Time must be a non-negative number of seconds.");
            }
            List<String> objectIds = sceneCompilerService.activeObjectIds(request.project(), request.sceneId(), time);
            return ResponseEntity.ok(new ActiveObjectsResponse(objectIds));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Active object lookup failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to resolve active objects. Please try again.");
        }
    }

    private void requireProject(Map<String, Object> project) {
        if (project == null) {
            throw new IllegalArgumentException("Project is required.");
        }
    }
}
