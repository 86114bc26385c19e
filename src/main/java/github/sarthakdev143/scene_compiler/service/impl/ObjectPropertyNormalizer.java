package github.sarthakdev143.scene_compiler.service.impl;

import github.sarthakdev143.scene_compiler.integration.manim.ColorTable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the alternate property names that operation producers tend to use into the canonical ones,
 * and resolves named colors to hex.
 */
@Component
public class ObjectPropertyNormalizer {

    private static final List<String> FILL_ALIASES = List.of("fillColor", "color");
    private static final List<String> STROKE_ALIASES = List.of("strokeColor", "borderColor");
    private static final List<String> OPACITY_ALIASES = List.of("fillOpacity");
    private static final String DROPPED_STROKE_OPACITY = "strokeOpacity";

    private final ColorTable colorTable;

    public ObjectPropertyNormalizer(ColorTable colorTable) {
        this.colorTable = colorTable;
    }

    /**
     * Returns a normalized copy; an explicit canonical value always wins over an alias.
     */
    public Map<String, Object> normalize(Map<String, Object> properties) {
        Map<String, Object> normalized = new LinkedHashMap<>(properties);
        fold(normalized, "fill", FILL_ALIASES);
        fold(normalized, "stroke", STROKE_ALIASES);
        fold(normalized, "opacity", OPACITY_ALIASES);
        normalized.remove(DROPPED_STROKE_OPACITY);

        resolveColor(normalized, "fill");
        resolveColor(normalized, "stroke");
        return normalized;
    }

    private void resolveColor(Map<String, Object> properties, String key) {
        if (properties.get(key) instanceof String color) {
            properties.put(key, colorTable.normalize(color)
                    .or(() -> colorTable.hexForConstant(color))
                    .orElse(color));
        }
    }

    private static void fold(Map<String, Object> properties, String canonical, List<String> aliases) {
        for (String alias : aliases) {
            Object value = properties.remove(alias);
            if (value != null && properties.get(canonical) == null) {
                properties.put(canonical, value);
            }
        }
    }
}
