package github.sarthakdev143.scene_compiler.model;

import java.util.Locale;

public enum LimitDirection {
    LEFT,
    RIGHT,
    BOTH;

    public static LimitDirection fromInput(Object input) {
        if (!(input instanceof String value) || value.isBlank()) {
            return BOTH;
        }
        try {
            return LimitDirection.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return BOTH;
        }
    }

    public boolean includesLeft() {
        return this != RIGHT;
    }

    public boolean includesRight() {
        return this != LEFT;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
