package github.sarthakdev143.scene_compiler.linking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Evaluates formulas of the translator's vocabulary on the JVM, so plotted values can be resolved
 * at compile time. Grammar:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary | unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary ('^' unary)?
 * primary    := NUMBER | 'x' | constant | function '(' expression ')' | '(' expression ')'
 * </pre>
 */
@Component
public class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    public Optional<DoubleUnaryOperator> compile(String formula) {
        if (formula == null || formula.isBlank()) {
            return Optional.empty();
        }
        try {
            Parser parser = new Parser(FormulaLexer.tokenize(formula));
            DoubleUnaryOperator function = parser.parse();
            return Optional.of(function);
        } catch (FormulaException ex) {
            logger.debug("Formula '{}' cannot be evaluated: {}", formula, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns {@link Double#NaN} when the formula is invalid or undefined at {@code x}.
     */
    public double evaluate(String formula, double x) {
        return compile(formula).map(function -> function.applyAsDouble(x)).orElse(Double.NaN);
    }

    private static final class Parser {

        private final List<FormulaLexer.Token> tokens;
        private int position;

        Parser(List<FormulaLexer.Token> tokens) {
            this.tokens = tokens;
        }

        DoubleUnaryOperator parse() {
            DoubleUnaryOperator expression = parseExpression();
            if (position < tokens.size()) {
                throw new FormulaException("Unexpected token '" + tokens.get(position).text() + "'");
            }
            return expression;
        }

        private DoubleUnaryOperator parseExpression() {
            DoubleUnaryOperator left = parseTerm();
            while (peekOperator("+") || peekOperator("-")) {
                String operator = tokens.get(position++).text();
                DoubleUnaryOperator right = parseTerm();
                DoubleUnaryOperator lhs = left;
                left = "+".equals(operator)
                        ? x -> lhs.applyAsDouble(x) + right.applyAsDouble(x)
                        : x -> lhs.applyAsDouble(x) - right.applyAsDouble(x);
            }
            return left;
        }

        private DoubleUnaryOperator parseTerm() {
            DoubleUnaryOperator left = parseUnary();
            while (true) {
                DoubleUnaryOperator lhs = left;
                if (peekOperator("*") || peekOperator("/")) {
                    String operator = tokens.get(position++).text();
                    DoubleUnaryOperator right = parseUnary();
                    left = "*".equals(operator)
                            ? x -> lhs.applyAsDouble(x) * right.applyAsDouble(x)
                            : x -> lhs.applyAsDouble(x) / right.applyAsDouble(x);
                } else if (position < tokens.size() && FormulaTranslator.startsOperand(tokens.get(position))
                        && FormulaTranslator.endsOperand(tokens.get(position - 1))) {
                    DoubleUnaryOperator right = parseUnary();
                    left = x -> lhs.applyAsDouble(x) * right.applyAsDouble(x);
                } else {
                    return left;
                }
            }
        }

        private DoubleUnaryOperator parseUnary() {
            if (peekOperator("-")) {
                position++;
                DoubleUnaryOperator operand = parseUnary();
                return x -> -operand.applyAsDouble(x);
            }
            if (peekOperator("+")) {
                position++;
                return parseUnary();
            }
            return parsePower();
        }

        private DoubleUnaryOperator parsePower() {
            DoubleUnaryOperator base = parsePrimary();
            if (peekOperator("^")) {
                position++;
                DoubleUnaryOperator exponent = parseUnary();
                return x -> Math.pow(base.applyAsDouble(x), exponent.applyAsDouble(x));
            }
            return base;
        }

        private DoubleUnaryOperator parsePrimary() {
            if (position >= tokens.size()) {
                throw new FormulaException("Unexpected end of formula");
            }
            FormulaLexer.Token token = tokens.get(position++);
            switch (token.kind()) {
                case NUMBER -> {
                    double value = parseNumber(token.text());
                    return x -> value;
                }
                case LEFT_PAREN -> {
                    DoubleUnaryOperator inner = parseExpression();
                    expect(FormulaLexer.Kind.RIGHT_PAREN);
                    return inner;
                }
                case IDENTIFIER -> {
                    return parseName(token.text());
                }
                default -> throw new FormulaException("Unexpected token '" + token.text() + "'");
            }
        }

        private DoubleUnaryOperator parseName(String name) {
            if (position < tokens.size() && tokens.get(position).kind() == FormulaLexer.Kind.LEFT_PAREN
                    && FormulaTranslator.FUNCTIONS.containsKey(name)) {
                position++;
                DoubleUnaryOperator argument = parseExpression();
                expect(FormulaLexer.Kind.RIGHT_PAREN);
                DoubleUnaryOperator function = function(name);
                return x -> function.applyAsDouble(argument.applyAsDouble(x));
            }
            return switch (name) {
                case "x" -> x -> x;
                case "pi" -> x -> Math.PI;
                case "e" -> x -> Math.E;
                default -> throw new FormulaException("Unknown name '" + name + "'");
            };
        }

        private static DoubleUnaryOperator function(String name) {
            return switch (name) {
                case "sin" -> Math::sin;
                case "cos" -> Math::cos;
                case "tan" -> Math::tan;
                case "exp" -> Math::exp;
                case "log", "ln" -> Math::log;
                case "sqrt" -> Math::sqrt;
                case "abs" -> Math::abs;
                default -> throw new FormulaException("Unknown function '" + name + "'");
            };
        }

        private static double parseNumber(String text) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException ex) {
                throw new FormulaException("Invalid number '" + text + "'");
            }
        }

        private boolean peekOperator(String operator) {
            return position < tokens.size()
                    && tokens.get(position).kind() == FormulaLexer.Kind.OPERATOR
                    && operator.equals(tokens.get(position).text());
        }

        private void expect(FormulaLexer.Kind kind) {
            if (position >= tokens.size() || tokens.get(position).kind() != kind) {
                throw new FormulaException("Expected " + kind);
            }
            position++;
        }
    }
}
