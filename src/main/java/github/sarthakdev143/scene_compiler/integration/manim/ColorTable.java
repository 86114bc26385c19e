package github.sarthakdev143.scene_compiler.integration.manim;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable color lookup shared by script emission, script parsing and property normalization.
 * <p>
 * Primary entries form a bijection between hex values and Manim color constants; aliases and
 * shade constants resolve to hex only.
 */
public final class ColorTable {

    private static final Pattern HEX_COLOR_PATTERN = Pattern.compile("^#(?:[0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

    private final Map<String, String> constantByHex;
    private final Map<String, String> hexByConstant;
    private final Map<String, String> hexByCssName;

    public ColorTable(
            Map<String, String> primaryConstants,
            Map<String, String> constantAliases,
            Map<String, String> cssNames) {
        Map<String, String> byHex = new LinkedHashMap<>();
        Map<String, String> byConstant = new LinkedHashMap<>();
        primaryConstants.forEach((constant, hex) -> {
            String normalizedHex = normalizeHex(hex);
            if (byHex.putIfAbsent(normalizedHex, constant) != null) {
                throw new IllegalArgumentException("Duplicate hex value in color table: " + hex);
            }
            byConstant.put(constant, normalizedHex);
        });
        constantAliases.forEach((constant, hex) -> byConstant.putIfAbsent(constant, normalizeHex(hex)));

        Map<String, String> byCss = new LinkedHashMap<>();
        cssNames.forEach((name, hex) -> byCss.put(name.toLowerCase(Locale.ROOT), normalizeHex(hex)));

        this.constantByHex = Map.copyOf(byHex);
        this.hexByConstant = Map.copyOf(byConstant);
        this.hexByCssName = Map.copyOf(byCss);
    }

    public static ColorTable defaults() {
        Map<String, String> primary = new LinkedHashMap<>();
        primary.put("WHITE", "#ffffff");
        primary.put("BLACK", "#000000");
        primary.put("RED", "#ef4444");
        primary.put("BLUE", "#3b82f6");
        primary.put("GREEN", "#22c55e");
        primary.put("YELLOW", "#eab308");
        primary.put("ORANGE", "#f97316");
        primary.put("PURPLE", "#a855f7");
        primary.put("PINK", "#ec4899");
        primary.put("TEAL", "#14b8a6");
        primary.put("GOLD", "#ca8a04");
        primary.put("MAROON", "#7f1d1d");
        primary.put("GREY", "#6b7280");

        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("GRAY", "#6b7280");
        shades(aliases, "BLUE", "#dbeafe", "#93c5fd", "#3b82f6", "#1d4ed8", "#1e3a8a");
        shades(aliases, "GREEN", "#dcfce7", "#86efac", "#22c55e", "#15803d", "#14532d");
        shades(aliases, "RED", "#fee2e2", "#fca5a5", "#ef4444", "#b91c1c", "#7f1d1d");
        shades(aliases, "YELLOW", "#fef9c3", "#fde047", "#eab308", "#a16207", "#713f12");

        Map<String, String> css = new LinkedHashMap<>();
        css.put("red", "#ef4444");
        css.put("blue", "#3b82f6");
        css.put("green", "#22c55e");
        css.put("yellow", "#eab308");
        css.put("orange", "#f97316");
        css.put("purple", "#a855f7");
        css.put("pink", "#ec4899");
        css.put("white", "#ffffff");
        css.put("black", "#000000");
        css.put("cyan", "#06b6d4");
        css.put("magenta", "#d946ef");
        css.put("lime", "#84cc16");
        css.put("teal", "#14b8a6");
        css.put("indigo", "#6366f1");
        css.put("violet", "#8b5cf6");
        css.put("gray", "#6b7280");
        css.put("grey", "#6b7280");
        css.put("gold", "#ca8a04");
        css.put("silver", "#a8a29e");
        css.put("navy", "#1e3a5f");
        css.put("maroon", "#7f1d1d");
        css.put("aqua", "#06b6d4");
        css.put("coral", "#f87171");
        css.put("salmon", "#fb923c");
        return new ColorTable(primary, aliases, css);
    }

    public Optional<String> constantFor(String hex) {
        if (!isHex(hex)) {
            return Optional.empty();
        }
        return Optional.ofNullable(constantByHex.get(normalizeHex(hex)));
    }

    public Optional<String> hexForConstant(String constant) {
        if (constant == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hexByConstant.get(constant.trim().toUpperCase(Locale.ROOT)));
    }

    public Optional<String> hexForCssName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hexByCssName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Accepts hex values as-is (lowercased) and resolves CSS names; anything else is unknown.
     */
    public Optional<String> normalize(String color) {
        if (color == null || color.isBlank()) {
            return Optional.empty();
        }
        if (isHex(color.trim())) {
            return Optional.of(normalizeHex(color.trim()));
        }
        return hexForCssName(color);
    }

    /**
     * Renders a color as a script expression: a named constant when one matches, else a quoted hex literal.
     */
    public String scriptLiteral(String hex) {
        String resolved = normalize(hex).orElse(hex);
        return constantFor(resolved).orElseGet(() -> "\"" + (isHex(resolved) ? normalizeHex(resolved) : resolved) + "\"");
    }

    public static boolean isHex(String value) {
        return value != null && HEX_COLOR_PATTERN.matcher(value).matches();
    }

    private static String normalizeHex(String hex) {
        String lower = hex.trim().toLowerCase(Locale.ROOT);
        if (lower.length() == 4) {
            return "#" + lower.charAt(1) + lower.charAt(1) + lower.charAt(2) + lower.charAt(2)
                    + lower.charAt(3) + lower.charAt(3);
        }
        return lower;
    }

    private static void shades(Map<String, String> aliases, String base, String... hexes) {
        char suffix = 'A';
        for (String hex : hexes) {
            aliases.put(base + "_" + suffix, hex);
            suffix++;
        }
    }
}
