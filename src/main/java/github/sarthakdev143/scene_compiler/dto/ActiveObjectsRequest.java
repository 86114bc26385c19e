package github.sarthakdev143.scene_compiler.dto;

import java.util.Map;

public record ActiveObjectsRequest(
        Map<String, Object> project,
        String sceneId,
        Double time) {
}
