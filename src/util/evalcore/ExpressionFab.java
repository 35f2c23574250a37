package util.evalcore;

import org.apache.commons.lang3.math.NumberUtils;

import java.util.regex.Pattern;

/**
 * Turns a string of the form {@code <number> <operator> <number>} into a {@link BinaryExpression}.
 * Only a single operation is supported, so something like 2+2*2 is refused instead of being split up.
 */
public class ExpressionFab {

    // Number is digits with an optional decimal point and more digits, spaces allowed around the parts only
    static final String NUMBER = "(\\d+\\.?\\d*)";
    static final Pattern SINGLE_OPERATION = Pattern.compile("^\\s*" + NUMBER + "\\s*([^\\d\\s.])\\s*" + NUMBER + "\\s*$");

    private ExpressionFab() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Parse the expression
     *
     * @param expression The expression to parse, fe. 2 + 2
     * @return The parsed expression
     * @throws ExpressionException If the expression doesn't hold exactly two numbers and a known operator
     */
    public static BinaryExpression parse(String expression) throws ExpressionException {
        if (expression == null || expression.isBlank())
            throw new ExpressionException("Unable to parse an empty expression");

        var matcher = SINGLE_OPERATION.matcher(expression);
        if (!matcher.matches())
            throw new ExpressionException("Unable to parse expression \"" + expression + "\"");

        var operator = BinaryOperator.fromToken(matcher.group(2))
                .orElseThrow(() -> new ExpressionException(
                        "Unknown operator " + matcher.group(2) + " in expression \"" + expression + "\""));

        var left = toDouble(matcher.group(1), expression);
        var right = toDouble(matcher.group(3), expression);
        return new BinaryExpression(expression, left, operator, right);
    }

    private static double toDouble(String token, String expression) throws ExpressionException {
        var value = NumberUtils.toDouble(token, Double.NaN);
        if (Double.isNaN(value))
            throw new ExpressionException("Unable to parse \"" + token + "\" to a double in expression \"" + expression + "\"");
        return value;
    }
}
