package github.sarthakdev143.scene_compiler.dto;

import java.util.List;
import java.util.Map;

public record OperationsRequest(
        Map<String, Object> project,
        List<Object> operations,
        String defaultSceneId) {
}
