package util.evalcore;

import util.math.MathError;

/**
 * Thrown when an expression can't be parsed, carries the resulting parse error.
 */
public class ExpressionException extends Exception {

    private final transient MathError error;

    public ExpressionException(String reason) {
        super(reason);
        this.error = MathError.parse(reason);
    }

    public MathError getError() {
        return error;
    }
}
