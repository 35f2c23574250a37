package util.math;

import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Outcome of a calculation, either a value or the error that prevented it.
 */
public final class MathResult {

    private final double value;
    private final MathError error;

    private MathResult(double value, MathError error) {
        this.value = value;
        this.error = error;
    }

    public static MathResult of(double value) {
        return new MathResult(value, null);
    }

    public static MathResult failed(MathError error) {
        if (error == null)
            throw new IllegalArgumentException("A failed result needs an error");
        return new MathResult(Double.NaN, error);
    }

    public boolean isValid() {
        return error == null;
    }

    public boolean isInvalid() {
        return error != null;
    }

    /**
     * Get the computed value, only allowed if this result is valid
     * @return The value
     * @throws IllegalStateException If this result holds an error instead
     */
    public double value() {
        if (error != null)
            throw new IllegalStateException("No value, calculation failed: " + error.message());
        return value;
    }

    public double orElse(double alt) {
        return error == null ? value : alt;
    }

    public Optional<MathError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Apply a function to the value if there is one, errors are passed on as is
     * @param op The function to apply
     * @return A new result with the altered value or this if it failed
     */
    public MathResult map(DoubleUnaryOperator op) {
        return error == null ? of(op.applyAsDouble(value)) : this;
    }

    @Override
    public String toString() {
        return error == null ? String.valueOf(value) : error.toString();
    }
}
