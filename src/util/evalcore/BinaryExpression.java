package util.evalcore;

import util.math.MathResult;

/**
 * A parsed expression that holds a single operation on two numbers.
 *
 * @param original The expression as it was given
 * @param left     The number in front of the operator
 * @param operator The operator
 * @param right    The number after the operator
 */
public record BinaryExpression(String original, double left, BinaryOperator operator, double right) {

    public MathResult solve() {
        return operator.apply(left, right);
    }

    @Override
    public String toString() {
        return left + " " + operator.token() + " " + right;
    }
}
