package github.sarthakdev143.scene_compiler.model.scene;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers over the JSON-shaped property maps that arrive at the edges of the compiler.
 */
public final class PropertyBag {

    private PropertyBag() {
    }

    public static Double number(Object value) {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                parsed = Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    public static Double number(Map<String, Object> bag, String key) {
        return bag == null ? null : number(bag.get(key));
    }

    public static double numberOr(Map<String, Object> bag, String key, double fallback) {
        Double value = number(bag, key);
        return value == null ? fallback : value;
    }

    public static String text(Map<String, Object> bag, String key) {
        if (bag == null) {
            return null;
        }
        Object value = bag.get(key);
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        return null;
    }

    public static String textOr(Map<String, Object> bag, String key, String fallback) {
        String value = text(bag, key);
        return value == null ? fallback : value;
    }

    public static boolean flagOr(Map<String, Object> bag, String key, boolean fallback) {
        if (bag == null) {
            return fallback;
        }
        Object value = bag.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return false;
            }
        }
        return fallback;
    }

    public static Map<String, Object> map(Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (entry.getKey() instanceof String key) {
                copy.put(key, entry.getValue());
            }
        }
        return copy;
    }

    public static List<Object> list(Object value) {
        if (!(value instanceof List<?> raw)) {
            return List.of();
        }
        return new ArrayList<>(raw);
    }

    /**
     * Copies nested maps and lists so the result can be mutated without touching the caller's data.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?>) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map(value).forEach((key, nested) -> copy.put(key, deepCopy(nested)));
            return copy;
        }
        if (value instanceof List<?> raw) {
            List<Object> copy = new ArrayList<>(raw.size());
            for (Object nested : raw) {
                copy.add(deepCopy(nested));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> deepCopyMap(Map<String, Object> value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (value != null) {
            value.forEach((key, nested) -> copy.put(key, deepCopy(nested)));
        }
        return copy;
    }
}
