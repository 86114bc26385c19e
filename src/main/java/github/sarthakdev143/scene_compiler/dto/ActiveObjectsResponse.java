package github.sarthakdev143.scene_compiler.dto;

import java.util.List;

public record ActiveObjectsResponse(
        List<String> objectIds) {
}
