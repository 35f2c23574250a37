package util.math;

/**
 * Describes why a calculation didn't produce a value.
 *
 * @param kind     The category of the failure
 * @param message  Human readable description, includes the operands involved
 * @param position For a division chain the fold position of the zero divisor, -1 otherwise
 */
public record MathError(Kind kind, String message, int position) {

    public enum Kind {DIVIDE_BY_ZERO, INVALID_DOMAIN, PARSE_ERROR}

    /**
     * Create the error for a division by zero
     * @param dividend The running result that was about to be divided
     * @param divisor The zero divisor, kept to show the sign
     * @param position Position of the divisor in the chain, b is 0
     * @return The error
     */
    public static MathError divideByZero(double dividend, double divisor, int position) {
        return new MathError(Kind.DIVIDE_BY_ZERO,
                "Divide by zero for divide(" + dividend + ", " + divisor + ") at position " + position, position);
    }

    public static MathError invalidDomain(double value) {
        return new MathError(Kind.INVALID_DOMAIN, "Can't get the square root of " + value, -1);
    }

    public static MathError parse(String reason) {
        return new MathError(Kind.PARSE_ERROR, reason, -1);
    }

    public boolean is(Kind kind) {
        return this.kind == kind;
    }

    @Override
    public String toString() {
        return kind + " -> " + message;
    }
}
