package util.evalcore;

import org.tinylog.Logger;
import util.math.MathResult;

/**
 * Evaluates expressions that hold a single operation on two numbers, fe. 2 + 2 or 20/2.
 * Parsing errors are owned by this class, arithmetic errors are passed on as the primitives report them.
 */
public class ExpressionEvaluator {

    private static final ExpressionEvaluator DEFAULT = new ExpressionEvaluator(CalcSettings.DEFAULT);

    private final CalcSettings settings;

    public ExpressionEvaluator(CalcSettings settings) {
        this.settings = settings == null ? CalcSettings.DEFAULT : settings;
    }

    public ExpressionEvaluator() {
        this(CalcSettings.DEFAULT);
    }

    /**
     * Evaluate the expression with the default settings
     *
     * @param expression The expression to evaluate
     * @return The result or the error that prevented it
     */
    public static MathResult evaluateExpression(String expression) {
        return DEFAULT.eval(expression);
    }

    public MathResult eval(String expression) {
        BinaryExpression parsed;
        try {
            parsed = ExpressionFab.parse(expression);
        } catch (ExpressionException e) {
            if (settings.debug())
                Logger.info(settings.id() + " (expr) -> " + e.getMessage());
            return MathResult.failed(e.getError());
        }
        if (settings.debug())
            Logger.info(settings.id() + " (expr) -> Parsed " + parsed.original() + " to " + parsed);

        var result = parsed.solve();
        if (settings.debug())
            Logger.info(settings.id() + " (expr) -> " + parsed + " = " + result);
        return result;
    }

    public CalcSettings getSettings() {
        return settings;
    }
}
