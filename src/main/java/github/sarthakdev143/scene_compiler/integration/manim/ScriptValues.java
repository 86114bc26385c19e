package github.sarthakdev143.scene_compiler.integration.manim;

import github.sarthakdev143.scene_compiler.linking.FormulaEvaluator;
import github.sarthakdev143.scene_compiler.linking.PlanePoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Readers for argument values as they appear in scripts: numbers (with {@code PI}, {@code TAU} and
 * {@code DEGREES}), points and direction vectors, colors, string literals and single-argument lambdas.
 * Every reader throws {@link ScriptValueException} rather than guess.
 */
final class ScriptValues {

    private static final Map<String, PlanePoint> DIRECTIONS = Map.of(
            "ORIGIN", new PlanePoint(0.0, 0.0),
            "UP", new PlanePoint(0.0, 1.0),
            "DOWN", new PlanePoint(0.0, -1.0),
            "LEFT", new PlanePoint(-1.0, 0.0),
            "RIGHT", new PlanePoint(1.0, 0.0),
            "UL", new PlanePoint(-1.0, 1.0),
            "UR", new PlanePoint(1.0, 1.0),
            "DL", new PlanePoint(-1.0, -1.0),
            "DR", new PlanePoint(1.0, -1.0));
    private static final Pattern NUMERIC_PATTERN = Pattern.compile("[0-9.eE+\\-*/()\\s]+");
    private static final Pattern VECTOR_PATTERN = Pattern.compile("\\b(?:ORIGIN|UP|DOWN|LEFT|RIGHT|UL|UR|DL|DR)\\b|\\[");
    private static final Pattern LAMBDA_PATTERN = Pattern.compile("^lambda\\s+([A-Za-z_]\\w*)\\s*:\\s*(.+)$", Pattern.DOTALL);
    private static final String ARRAY_PREFIX = "np.array(";
    private static final int MAX_NESTING_DEPTH = 64;

    private final ColorTable colorTable;
    private final FormulaEvaluator evaluator;

    ScriptValues(ColorTable colorTable, FormulaEvaluator evaluator) {
        this.colorTable = colorTable;
        this.evaluator = evaluator;
    }

    double number(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ScriptValueException("missing number");
        }
        String expression = raw.trim()
                .replaceAll("\\b(?:np|math)\\.pi\\b", "pi")
                .replaceAll("\\bPI\\b", "pi")
                .replaceAll("\\bTAU\\b", "(2*pi)")
                .replaceAll("\\bDEGREES\\b", "(pi/180)");
        String remainder = expression.replaceAll("\\bpi\\b", "");
        if (!remainder.isBlank() && !NUMERIC_PATTERN.matcher(remainder).matches()) {
            throw new ScriptValueException("not a number: " + raw);
        }
        double value = evaluator.evaluate(expression, 0.0);
        if (!Double.isFinite(value)) {
            throw new ScriptValueException("not a number: " + raw);
        }
        return value;
    }

    /**
     * A coordinate list such as {@code [1, 2, 0]}, or a sum of scaled direction constants such as
     * {@code 2 * RIGHT + UP}.
     */
    PlanePoint point(String raw) {
        return point(raw, 0);
    }

    private PlanePoint point(String raw, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new ScriptValueException("point nests deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        if (raw == null || raw.isBlank()) {
            throw new ScriptValueException("missing point");
        }
        String text = unwrapArray(raw.trim());
        if (text.startsWith("[") && ScriptArguments.matchingClose(text, 0) == text.length() - 1) {
            List<String> elements = ScriptArguments.splitTopLevel(text.substring(1, text.length() - 1), ',');
            if (elements.size() < 2 || elements.size() > 3) {
                throw new ScriptValueException("expected 2 or 3 coordinates: " + raw);
            }
            return new PlanePoint(number(elements.get(0)), number(elements.get(1)));
        }
        return directionSum(text, depth + 1);
    }

    /**
     * A list literal of two or three numbers: {@code [min, max]} or {@code [min, max, step]}.
     */
    List<Double> numbers(String raw) {
        String text = raw == null ? "" : unwrapArray(raw.trim());
        if (!text.startsWith("[") || ScriptArguments.matchingClose(text, 0) != text.length() - 1) {
            throw new ScriptValueException("expected a list: " + raw);
        }
        List<Double> values = new ArrayList<>();
        for (String element : ScriptArguments.splitTopLevel(text.substring(1, text.length() - 1), ',')) {
            values.add(number(element));
        }
        return values;
    }

    String color(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ScriptValueException("missing color");
        }
        String text = raw.trim();
        if (isStringLiteral(text)) {
            String literal = string(text);
            return colorTable.normalize(literal)
                    .or(() -> colorTable.hexForConstant(literal))
                    .orElseThrow(() -> new ScriptValueException("unknown color: " + raw));
        }
        return colorTable.hexForConstant(text)
                .orElseThrow(() -> new ScriptValueException("unknown color: " + raw));
    }

    String string(String raw) {
        if (raw == null || !isStringLiteral(raw.trim())) {
            throw new ScriptValueException("not a string literal: " + raw);
        }
        String text = raw.trim();
        boolean rawString = text.charAt(0) == 'r' || text.charAt(0) == 'R';
        if (rawString) {
            text = text.substring(1);
        }
        String body = text.substring(1, text.length() - 1);
        return rawString ? body : unescape(body);
    }

    /**
     * Converts {@code lambda x: np.sin(x) ** 2} to the formula {@code sin(x)^2}.
     */
    String formula(String raw) {
        Matcher lambda = LAMBDA_PATTERN.matcher(raw == null ? "" : raw.trim());
        if (!lambda.matches()) {
            throw new ScriptValueException("not a lambda: " + raw);
        }
        String parameter = lambda.group(1);
        String body = lambda.group(2).trim();
        if (!"x".equals(parameter)) {
            if (Pattern.compile("\\bx\\b").matcher(body).find()) {
                throw new ScriptValueException("lambda body mixes x with parameter " + parameter);
            }
            body = body.replaceAll("\\b" + Pattern.quote(parameter) + "\\b", "x");
        }
        return body
                .replaceAll("\\b(?:np|math)\\.log\\s*\\(", "ln(")
                .replaceAll("\\b(?:np|math)\\.", "")
                .replace("**", "^")
                .replaceAll("\\s+", "");
    }

    static boolean isStringLiteral(String text) {
        String body = text.startsWith("r") || text.startsWith("R") ? text.substring(1) : text;
        if (body.length() < 2) {
            return false;
        }
        char quote = body.charAt(0);
        return (quote == '"' || quote == '\'') && body.charAt(body.length() - 1) == quote;
    }

    private PlanePoint directionSum(String text, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new ScriptValueException("point nests deeper than " + MAX_NESTING_DEPTH + " levels");
        }
        PlanePoint sum = new PlanePoint(0.0, 0.0);
        for (String term : signedTerms(text)) {
            sum = sum.plus(directionTerm(term, depth));
        }
        return sum;
    }

    private PlanePoint directionTerm(String term, int depth) {
        double sign = 1.0;
        String body = term.trim();
        while (body.startsWith("+") || body.startsWith("-")) {
            if (body.charAt(0) == '-') {
                sign = -sign;
            }
            body = body.substring(1).trim();
        }

        PlanePoint vector = null;
        double factor = sign;
        for (String part : ScriptArguments.splitTopLevel(body, '*')) {
            String operand = part.trim();
            if (!VECTOR_PATTERN.matcher(operand).find()) {
                factor *= number(operand);
                continue;
            }
            if (vector != null) {
                throw new ScriptValueException("product of two vectors: " + term);
            }
            if (DIRECTIONS.containsKey(operand)) {
                vector = DIRECTIONS.get(operand);
            } else if (operand.startsWith("(") && ScriptArguments.matchingClose(operand, 0) == operand.length() - 1) {
                vector = directionSum(operand.substring(1, operand.length() - 1), depth + 1);
            } else {
                vector = point(operand, depth + 1);
            }
        }
        if (vector == null) {
            throw new ScriptValueException("not a point: " + term);
        }
        return vector.times(factor);
    }

    /**
     * Splits at top-level binary {@code +} and {@code -}; each term keeps its leading sign.
     */
    private static List<String> signedTerms(String text) {
        List<String> terms = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int index = 0; index < text.length(); index++) {
            char character = text.charAt(index);
            if (character == '(' || character == '[') {
                depth++;
            } else if (character == ')' || character == ']') {
                depth--;
            } else if ((character == '+' || character == '-') && depth == 0 && isBinaryOperator(text, index)) {
                terms.add(text.substring(start, index));
                start = index;
            }
        }
        terms.add(text.substring(start));
        terms.removeIf(String::isBlank);
        return terms;
    }

    private static boolean isBinaryOperator(String text, int index) {
        int previous = index - 1;
        while (previous >= 0 && Character.isWhitespace(text.charAt(previous))) {
            previous--;
        }
        if (previous < 0 || "*/(+-".indexOf(text.charAt(previous)) >= 0) {
            return false;
        }
        char before = text.charAt(previous);
        boolean exponent = (before == 'e' || before == 'E') && previous > 0
                && (Character.isDigit(text.charAt(previous - 1)) || text.charAt(previous - 1) == '.');
        return !exponent;
    }

    private static String unwrapArray(String text) {
        if (text.startsWith(ARRAY_PREFIX)
                && ScriptArguments.matchingClose(text, ARRAY_PREFIX.length() - 1) == text.length() - 1) {
            return text.substring(ARRAY_PREFIX.length(), text.length() - 1).trim();
        }
        return text;
    }

    private static String unescape(String body) {
        StringBuilder text = new StringBuilder(body.length());
        for (int index = 0; index < body.length(); index++) {
            char character = body.charAt(index);
            if (character != '\\' || index + 1 >= body.length()) {
                text.append(character);
                continue;
            }
            char escaped = body.charAt(++index);
            switch (escaped) {
                case 'n' -> text.append('\n');
                case 't' -> text.append('\t');
                case 'r' -> text.append('\r');
                case '\\', '"', '\'' -> text.append(escaped);
                default -> text.append('\\').append(escaped);
            }
        }
        return text.toString();
    }
}
