package github.sarthakdev143.scene_compiler.linking;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula such as {@code 2sin(x)^2 + 1} into tokens. {@code **} is read as {@code ^}.
 * Formulas longer than {@value #MAX_TOKENS} tokens or nested deeper than {@value #MAX_NESTING_DEPTH}
 * parentheses are rejected.
 */
final class FormulaLexer {

    static final int MAX_TOKENS = 512;
    static final int MAX_NESTING_DEPTH = 64;

    enum Kind {
        NUMBER,
        IDENTIFIER,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN
    }

    record Token(Kind kind, String text) {
    }

    private FormulaLexer() {
    }

    static List<Token> tokenize(String formula) {
        List<Token> tokens = new ArrayList<>();
        int index = 0;
        int depth = 0;
        while (index < formula.length()) {
            if (tokens.size() > MAX_TOKENS) {
                throw new FormulaException("Formula has more than " + MAX_TOKENS + " tokens");
            }
            char current = formula.charAt(index);
            if (Character.isWhitespace(current)) {
                index++;
            } else if (Character.isDigit(current) || current == '.') {
                int end = scanNumber(formula, index);
                tokens.add(new Token(Kind.NUMBER, formula.substring(index, end)));
                index = end;
            } else if (Character.isLetter(current) || current == '_') {
                int end = index;
                while (end < formula.length()
                        && (Character.isLetterOrDigit(formula.charAt(end)) || formula.charAt(end) == '_')) {
                    end++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, formula.substring(index, end)));
                index = end;
            } else if (current == '*' && index + 1 < formula.length() && formula.charAt(index + 1) == '*') {
                tokens.add(new Token(Kind.OPERATOR, "^"));
                index += 2;
            } else if ("+-*/^".indexOf(current) >= 0) {
                tokens.add(new Token(Kind.OPERATOR, String.valueOf(current)));
                index++;
            } else if (current == '(') {
                if (++depth > MAX_NESTING_DEPTH) {
                    throw new FormulaException("Formula nests deeper than " + MAX_NESTING_DEPTH + " parentheses");
                }
                tokens.add(new Token(Kind.LEFT_PAREN, "("));
                index++;
            } else if (current == ')') {
                depth--;
                tokens.add(new Token(Kind.RIGHT_PAREN, ")"));
                index++;
            } else {
                throw new FormulaException("Unexpected character '" + current + "' at " + index);
            }
        }
        if (tokens.size() > MAX_TOKENS) {
            throw new FormulaException("Formula has more than " + MAX_TOKENS + " tokens");
        }
        return tokens;
    }

    private static int scanNumber(String formula, int start) {
        int end = start;
        boolean seenDot = false;
        while (end < formula.length()) {
            char current = formula.charAt(end);
            if (Character.isDigit(current)) {
                end++;
            } else if (current == '.' && !seenDot) {
                seenDot = true;
                end++;
            } else {
                break;
            }
        }
        if (end == start + 1 && formula.charAt(start) == '.') {
            throw new FormulaException("Dangling '.' at " + start);
        }
        if (end < formula.length() && (formula.charAt(end) == 'e' || formula.charAt(end) == 'E')) {
            int exponent = end + 1;
            if (exponent < formula.length() && (formula.charAt(exponent) == '+' || formula.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < formula.length() && Character.isDigit(formula.charAt(exponent))) {
                end = exponent;
                while (end < formula.length() && Character.isDigit(formula.charAt(end))) {
                    end++;
                }
            }
        }
        return end;
    }
}
