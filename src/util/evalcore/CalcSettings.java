package util.evalcore;

import org.apache.commons.lang3.math.NumberUtils;
import org.tinylog.Logger;
import util.xml.XMLtools;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Settings for an {@link ExpressionEvaluator}, fe.
 * <pre>{@code
 * <calc>
 *     <expression id="calc" debug="false"/>
 * </calc>
 * }</pre>
 *
 * @param id    Prefix used in the log messages
 * @param debug True if the evaluator should log the stages of each evaluation
 */
public record CalcSettings(String id, boolean debug) {

    private static final String DEFAULT_ID = "calc";
    public static final CalcSettings DEFAULT = new CalcSettings(DEFAULT_ID, false);

    public CalcSettings {
        if (id == null || id.isBlank())
            id = DEFAULT_ID;
    }

    /**
     * Read the settings from the expression node in the xml, anything missing falls back to the default
     * @param xml The path to the xml file
     * @return The settings found
     */
    public static CalcSettings readFromXml(Path xml) {
        var docOpt = XMLtools.readXML(xml);
        if (docOpt.isEmpty())
            return DEFAULT;

        var root = docOpt.get().getDocumentElement();
        if (!root.getTagName().equals("calc")) {
            Logger.error("(settings) -> No calc root node in " + xml + ", using defaults");
            return DEFAULT;
        }
        var exprOpt = XMLtools.getFirstChildByTag(root, "expression");
        if (exprOpt.isEmpty()) {
            Logger.warn("(settings) -> No expression node in " + xml + ", using defaults");
            return DEFAULT;
        }
        var expr = exprOpt.get();
        var id = expr.hasAttribute("id") ? expr.getAttribute("id").trim() : DEFAULT_ID;
        var debug = parseBool(expr.getAttribute("debug")).orElseGet(() -> {
            if (expr.hasAttribute("debug"))
                Logger.warn("(settings) -> Invalid debug value '" + expr.getAttribute("debug") + "', using false");
            return false;
        });
        return new CalcSettings(id, debug);
    }

    static Optional<Boolean> parseBool(String value) {
        if (value == null || value.isBlank())
            return Optional.empty();

        return switch (value.toLowerCase().trim()) {
            case "yes", "true", "1", "on" -> Optional.of(true);
            case "no", "false", "0", "off" -> Optional.of(false);
            default -> NumberUtils.isParsable(value) ? Optional.of(NumberUtils.toDouble(value) != 0) : Optional.empty();
        };
    }
}
