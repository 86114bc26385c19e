package github.sarthakdev143.scene_compiler.integration.manim;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits script text into logical statements. Lines are joined while brackets are open or after a
 * trailing backslash; comments are dropped.
 */
final class ScriptStatements {

    private ScriptStatements() {
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;

        for (int index = 0; index < script.length(); index++) {
            char character = script.charAt(index);
            if (quote != 0) {
                current.append(character);
                if (character == '\\' && index + 1 < script.length()) {
                    current.append(script.charAt(++index));
                } else if (character == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (character) {
                case '"', '\'' -> {
                    quote = character;
                    current.append(character);
                }
                case '#' -> {
                    while (index + 1 < script.length() && script.charAt(index + 1) != '\n') {
                        index++;
                    }
                }
                case '(', '[', '{' -> {
                    depth++;
                    current.append(character);
                }
                case ')', ']', '}' -> {
                    depth = Math.max(0, depth - 1);
                    current.append(character);
                }
                case '\\' -> {
                    if (index + 1 < script.length() && script.charAt(index + 1) == '\n') {
                        index++;
                        current.append(' ');
                    } else {
                        current.append(character);
                    }
                }
                case '\n' -> {
                    if (depth > 0) {
                        current.append(' ');
                    } else {
                        flush(statements, current);
                    }
                }
                case '\r' -> {
                }
                default -> current.append(character);
            }
        }
        flush(statements, current);
        return statements;
    }

    private static void flush(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }
}
