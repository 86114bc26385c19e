package github.sarthakdev143.scene_compiler.linking;

public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }
}
