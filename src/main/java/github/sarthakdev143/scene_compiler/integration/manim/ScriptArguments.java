package github.sarthakdev143.scene_compiler.integration.manim;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw positional and keyword arguments of one call, split at top-level commas.
 */
final class ScriptArguments {

    private static final Pattern KEYWORD_PATTERN = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)(.*)$", Pattern.DOTALL);

    private final List<String> positional;
    private final Map<String, String> keywords;

    private ScriptArguments(List<String> positional, Map<String, String> keywords) {
        this.positional = positional;
        this.keywords = keywords;
    }

    static ScriptArguments parse(String arguments) {
        List<String> positional = new ArrayList<>();
        Map<String, String> keywords = new LinkedHashMap<>();
        for (String part : splitTopLevel(arguments == null ? "" : arguments, ',')) {
            Matcher keyword = KEYWORD_PATTERN.matcher(part);
            if (keyword.matches()) {
                keywords.put(keyword.group(1), keyword.group(2).trim());
            } else {
                positional.add(part);
            }
        }
        return new ScriptArguments(positional, keywords);
    }

    List<String> positional() {
        return positional;
    }

    String positional(int index) {
        return index < positional.size() ? positional.get(index) : null;
    }

    String keyword(String name) {
        return keywords.get(name);
    }

    /**
     * Keyword argument, or the positional argument at {@code index} when the keyword is absent.
     */
    String argument(String name, int index) {
        String value = keyword(name);
        return value != null ? value : positional(index);
    }

    /**
     * Splits at {@code separator} outside brackets and string literals; blank parts are dropped.
     */
    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        char quote = 0;
        for (int index = 0; index < text.length(); index++) {
            char character = text.charAt(index);
            if (quote != 0) {
                if (character == '\\') {
                    index++;
                } else if (character == quote) {
                    quote = 0;
                }
                continue;
            }
            if (character == '"' || character == '\'') {
                quote = character;
            } else if (character == '(' || character == '[' || character == '{') {
                depth++;
            } else if (character == ')' || character == ']' || character == '}') {
                depth--;
            } else if (character == separator && depth == 0) {
                addPart(parts, text.substring(start, index));
                start = index + 1;
            }
        }
        addPart(parts, text.substring(start));
        return parts;
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1 when it is never closed.
     */
    static int matchingClose(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int index = open; index < text.length(); index++) {
            char character = text.charAt(index);
            if (quote != 0) {
                if (character == '\\') {
                    index++;
                } else if (character == quote) {
                    quote = 0;
                }
                continue;
            }
            if (character == '"' || character == '\'') {
                quote = character;
            } else if (character == '(' || character == '[' || character == '{') {
                depth++;
            } else if (character == ')' || character == ']' || character == '}') {
                depth--;
                if (depth == 0) {
                    return index;
                }
            }
        }
        return -1;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }
}
