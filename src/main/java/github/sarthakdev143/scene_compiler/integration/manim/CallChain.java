package github.sarthakdev143.scene_compiler.integration.manim;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An expression of the form {@code name(args).method(args).attribute...}. The first link is either a
 * call or a bare identifier.
 */
record CallChain(List<Link> links) {

    record Link(String name, String arguments) {

        boolean isCall() {
            return arguments != null;
        }
    }

    CallChain {
        links = List.copyOf(links);
    }

    Link head() {
        return links.get(0);
    }

    List<Link> tail(int from) {
        return links.subList(Math.min(from, links.size()), links.size());
    }

    static Optional<CallChain> parse(String expression) {
        String text = expression.trim();
        List<Link> links = new ArrayList<>();
        int index = 0;

        int end = identifierEnd(text, index);
        if (end == index) {
            return Optional.empty();
        }
        String name = text.substring(index, end);
        String arguments = null;
        index = end;

        while (true) {
            index = skipSpaces(text, index);
            if (index >= text.length()) {
                links.add(new Link(name, arguments));
                return Optional.of(new CallChain(links));
            }
            char character = text.charAt(index);
            if (character == '(' && arguments == null) {
                int close = ScriptArguments.matchingClose(text, index);
                if (close < 0) {
                    return Optional.empty();
                }
                arguments = text.substring(index + 1, close);
                index = close + 1;
            } else if (character == '.') {
                links.add(new Link(name, arguments));
                index = skipSpaces(text, index + 1);
                end = identifierEnd(text, index);
                if (end == index) {
                    return Optional.empty();
                }
                name = text.substring(index, end);
                arguments = null;
                index = end;
            } else {
                return Optional.empty();
            }
        }
    }

    private static int identifierEnd(String text, int start) {
        if (start >= text.length() || !Character.isJavaIdentifierStart(text.charAt(start)) || text.charAt(start) == '$') {
            return start;
        }
        int index = start + 1;
        while (index < text.length() && (Character.isLetterOrDigit(text.charAt(index)) || text.charAt(index) == '_')) {
            index++;
        }
        return index;
    }

    private static int skipSpaces(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }
}
