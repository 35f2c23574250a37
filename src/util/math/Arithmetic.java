package util.math;

/**
 * The basic arithmetic operations.
 * The add, subtract, multiply and divide ones take two operands and optionally more, these are processed
 * left to right so add(1,2,3) is ((1+2)+3).
 */
public class Arithmetic {

    private Arithmetic() {
        throw new IllegalStateException("Utility class");
    }

    public static double add(double a, double b, double... rest) {
        var result = a + b;
        if (rest != null) {
            for (var d : rest)
                result += d;
        }
        return result;
    }

    public static double subtract(double a, double b, double... rest) {
        var result = a - b;
        if (rest != null) {
            for (var d : rest)
                result -= d;
        }
        return result;
    }

    public static double multiply(double a, double b, double... rest) {
        var result = a * b;
        if (rest != null) {
            for (var d : rest)
                result *= d;
        }
        return result;
    }

    /**
     * Divide a by b and the result by each of the rest in order.
     *
     * @param a The dividend
     * @param b The first divisor
     * @param rest Further divisors
     * @return The quotient or a DIVIDE_BY_ZERO error for the first divisor that is zero
     */
    public static MathResult divide(double a, double b, double... rest) {
        if (b == 0.0)
            return MathResult.failed(MathError.divideByZero(a, b, 0));
        var result = a / b;
        if (rest != null) {
            for (int pos = 0; pos < rest.length; pos++) {
                if (rest[pos] == 0.0)
                    return MathResult.failed(MathError.divideByZero(result, rest[pos], pos + 1));
                result /= rest[pos];
            }
        }
        return MathResult.of(result);
    }

    /**
     * Calculate the square root.
     * Only an input of exactly zero is refused, negative input isn't checked and gives NaN.
     *
     * @param a The value to get the root of
     * @return The root or an INVALID_DOMAIN error if a is zero
     */
    public static MathResult sqrt(double a) {
        if (a == 0.0)
            return MathResult.failed(MathError.invalidDomain(a));
        return MathResult.of(Math.sqrt(a));
    }
}
