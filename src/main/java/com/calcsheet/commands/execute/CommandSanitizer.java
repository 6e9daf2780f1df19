package com.calcsheet.commands.execute;

import com.calcsheet.math.ExpressionNormalizer;

import java.util.regex.Pattern;

/**
 * Cleans markup out of model-authored symbols and units before they become node fields.
 */
public final class CommandSanitizer {

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern SPACING = Pattern.compile("\\\\[;,!:]");
    private static final Pattern WRAPPER = Pattern.compile("\\\\(?:mathrm|text|mathit|mathbf|operatorname)\\{([^}]*)\\}");
    private static final Pattern COMMAND = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern BRACES = Pattern.compile("[{}]");

    private CommandSanitizer() {
    }

    /**
     * {@code \rho_{w}} becomes {@code rho_w}.
     */
    public static String sanitizeSymbol(String symbol) {
        if (symbol == null) {
            return "";
        }
        String s = ExpressionNormalizer.normalize(symbol);
        return NON_IDENTIFIER.matcher(s).replaceAll("").trim();
    }

    /**
     * {@code \; \mathrm{m}} becomes {@code m}, {@code \text{kg}} becomes {@code kg}.
     */
    public static String sanitizeUnit(String unit) {
        if (unit == null) {
            return null;
        }
        String u = SPACING.matcher(unit).replaceAll("");
        u = WRAPPER.matcher(u).replaceAll("$1");
        u = COMMAND.matcher(u).replaceAll("");
        u = BRACES.matcher(u).replaceAll("");
        return u.trim();
    }
}
