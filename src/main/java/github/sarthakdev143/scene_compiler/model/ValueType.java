package github.sarthakdev143.scene_compiler.model;

import java.util.Locale;

public enum ValueType {
    SLOPE("slope = "),
    Y("y = "),
    X("x = "),
    CUSTOM("");

    private final String defaultPrefix;

    ValueType(String defaultPrefix) {
        this.defaultPrefix = defaultPrefix;
    }

    public static ValueType fromInput(Object input) {
        if (!(input instanceof String value) || value.isBlank()) {
            return SLOPE;
        }
        try {
            return ValueType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return SLOPE;
        }
    }

    public String defaultPrefix() {
        return defaultPrefix;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
