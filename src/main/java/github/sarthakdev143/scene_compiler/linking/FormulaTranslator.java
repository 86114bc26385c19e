package github.sarthakdev143.scene_compiler.linking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Token-by-token rewrite of a user formula into a numpy expression over {@code x}.
 * No algebra happens here: {@code ^} becomes {@code **}, known names gain the {@code np.} prefix,
 * and anything outside the vocabulary makes the formula untranslatable.
 */
@Component
public class FormulaTranslator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaTranslator.class);

    static final String VARIABLE = "x";
    static final Map<String, String> FUNCTIONS = Map.of(
            "sin", "np.sin",
            "cos", "np.cos",
            "tan", "np.tan",
            "exp", "np.exp",
            "log", "np.log",
            "ln", "np.log",
            "sqrt", "np.sqrt",
            "abs", "np.abs");
    static final Map<String, String> CONSTANTS = Map.of(
            "pi", "np.pi",
            "e", "np.e");

    public Optional<String> toPython(String formula) {
        if (formula == null || formula.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(translate(FormulaLexer.tokenize(formula)));
        } catch (FormulaException ex) {
            logger.debug("Formula '{}' cannot be translated: {}", formula, ex.getMessage());
            return Optional.empty();
        }
    }

    private String translate(List<FormulaLexer.Token> tokens) {
        StringBuilder out = new StringBuilder();
        int depth = 0;
        FormulaLexer.Token previous = null;
        for (int index = 0; index < tokens.size(); index++) {
            FormulaLexer.Token token = tokens.get(index);
            FormulaLexer.Token next = index + 1 < tokens.size() ? tokens.get(index + 1) : null;
            if (startsOperand(token) && endsOperand(previous)) {
                out.append('*');
            }
            switch (token.kind()) {
                case NUMBER -> out.append(token.text());
                case IDENTIFIER -> out.append(translateName(token.text(), next));
                case OPERATOR -> out.append("^".equals(token.text()) ? "**" : token.text());
                case LEFT_PAREN -> {
                    depth++;
                    out.append('(');
                }
                case RIGHT_PAREN -> {
                    if (--depth < 0) {
                        throw new FormulaException("Unbalanced ')'");
                    }
                    out.append(')');
                }
            }
            previous = token;
        }
        if (depth != 0) {
            throw new FormulaException("Unbalanced '('");
        }
        if (out.length() == 0) {
            throw new FormulaException("Empty formula");
        }
        return out.toString();
    }

    private String translateName(String name, FormulaLexer.Token next) {
        if (FUNCTIONS.containsKey(name) && next != null && next.kind() == FormulaLexer.Kind.LEFT_PAREN) {
            return FUNCTIONS.get(name);
        }
        if (CONSTANTS.containsKey(name)) {
            return CONSTANTS.get(name);
        }
        if (VARIABLE.equals(name)) {
            return VARIABLE;
        }
        throw new FormulaException("Unknown name '" + name + "'");
    }

    static boolean startsOperand(FormulaLexer.Token token) {
        return token.kind() == FormulaLexer.Kind.NUMBER
                || token.kind() == FormulaLexer.Kind.IDENTIFIER
                || token.kind() == FormulaLexer.Kind.LEFT_PAREN;
    }

    static boolean endsOperand(FormulaLexer.Token token) {
        if (token == null) {
            return false;
        }
        return token.kind() == FormulaLexer.Kind.NUMBER
                || token.kind() == FormulaLexer.Kind.RIGHT_PAREN
                || (token.kind() == FormulaLexer.Kind.IDENTIFIER && !FUNCTIONS.containsKey(token.text()));
    }
}
