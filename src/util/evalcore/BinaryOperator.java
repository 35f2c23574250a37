package util.evalcore;

import util.math.Arithmetic;
import util.math.MathResult;

import java.util.Arrays;
import java.util.Optional;

/**
 * The operators a single operation expression can hold, each linked to the primitive that solves it.
 */
public enum BinaryOperator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char token;

    BinaryOperator(char token) {
        this.token = token;
    }

    public char token() {
        return token;
    }

    /**
     * Find the operator that matches the given token
     * @param token A single character token like +
     * @return The operator or an empty optional if the token isn't a known operator
     */
    public static Optional<BinaryOperator> fromToken(String token) {
        if (token == null || token.length() != 1)
            return Optional.empty();
        return Arrays.stream(values()).filter(op -> op.token == token.charAt(0)).findFirst();
    }

    /**
     * Apply this operator on exactly two operands, a failed division is returned as is.
     */
    public MathResult apply(double left, double right) {
        return switch (this) {
            case ADD -> MathResult.of(Arithmetic.add(left, right));
            case SUBTRACT -> MathResult.of(Arithmetic.subtract(left, right));
            case MULTIPLY -> MathResult.of(Arithmetic.multiply(left, right));
            case DIVIDE -> Arithmetic.divide(left, right);
        };
    }
}
