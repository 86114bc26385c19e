package github.sarthakdev143.scene_compiler.dto;

import java.util.Map;

public record CompileRequest(
        Map<String, Object> project,
        String activeSceneId,
        String quality) {
}
