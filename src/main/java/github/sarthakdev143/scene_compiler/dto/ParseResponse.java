package github.sarthakdev143.scene_compiler.dto;

import java.util.List;
import java.util.Map;

public record ParseResponse(
        List<Map<String, Object>> operations) {
}
