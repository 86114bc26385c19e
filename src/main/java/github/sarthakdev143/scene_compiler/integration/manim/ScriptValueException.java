package github.sarthakdev143.scene_compiler.integration.manim;

/**
 * Raised when a recognized argument or mutation cannot be read with confidence.
 */
class ScriptValueException extends RuntimeException {

    ScriptValueException(String message) {
        super(message);
    }
}
