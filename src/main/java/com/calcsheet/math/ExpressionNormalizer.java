package com.calcsheet.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites markup math into the plain algebraic form the compute engine accepts.
 *
 * Rules run in a fixed order; later rules rely on the earlier ones:
 * <ol>
 *   <li>{@code \_} becomes {@code _}; spacing commands go away ({@code \,} reads as a product)</li>
 *   <li>Greek commands become bare names</li>
 *   <li>sub/superscript braces are flattened</li>
 *   <li>style wrappers are unwrapped</li>
 *   <li>{@code \frac{a}{b}} becomes {@code (a)/(b)}</li>
 *   <li>{@code \cdot} and {@code \times} become {@code *}</li>
 *   <li>{@code ^} becomes {@code **}</li>
 *   <li>{@code \left} / {@code \right} are dropped</li>
 *   <li>{@code \sum}, {@code \prod}, {@code \int} are dropped</li>
 *   <li>function commands become calls</li>
 *   <li>{@code x'} becomes {@code x_prime}</li>
 *   <li>leftover commands, braces and backslashes are stripped</li>
 *   <li>magnitude bars become {@code x_mag} or {@code Abs(...)}</li>
 *   <li>{@code _prime} moves to the end of compound names</li>
 * </ol>
 */
public final class ExpressionNormalizer {

    private static final Pattern SPACING = Pattern.compile("\\\\[;!:]");
    private static final Pattern GREEK = Pattern.compile(
        "\\\\(" + MathSymbols.GREEK_COMMANDS + ")(?=[^a-zA-Z]|$)");
    private static final Pattern SUBSCRIPT_GROUP = Pattern.compile("_\\{([^}]*)\\}");
    private static final Pattern SUPERSCRIPT_GROUP = Pattern.compile("\\^\\{([^}]*)\\}");
    private static final Pattern STYLE_WRAPPER = Pattern.compile(
        "\\\\(?:mathbf|mathrm|mathit|operatorname|text)\\{([^}]*)\\}");
    private static final Pattern FRACTION = Pattern.compile("\\\\frac\\{([^}]+)\\}\\{([^}]+)\\}");
    private static final Pattern PRODUCT_COMMAND = Pattern.compile("\\\\(?:cdot|times)");
    private static final Pattern GROUPING = Pattern.compile("\\\\left|\\\\right");
    private static final Pattern STRUCTURAL = Pattern.compile("\\\\(sum|prod|int)\\b");
    private static final Pattern FUNCTION_CALL = Pattern.compile(
        "\\\\(" + MathSymbols.FUNCTION_COMMANDS + ")\\{([^}]*)\\}");
    private static final Pattern FUNCTION_NAME = Pattern.compile(
        "\\\\(" + MathSymbols.FUNCTION_COMMANDS + ")\\b");
    private static final Pattern PRIME_MARK = Pattern.compile("([a-zA-Z])('+)");
    private static final Pattern COMMAND_WITH_GROUP = Pattern.compile("\\\\[a-zA-Z]+\\{([^}]*)\\}");
    private static final Pattern BARE_COMMAND = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern STRAY_MARKUP = Pattern.compile("[{}\\\\]");
    private static final Pattern MAGNITUDE_BARS = Pattern.compile("\\|\\s*([a-zA-Z][a-zA-Z0-9_]*)\\s*\\|");
    private static final Pattern ABS_OF_IDENTIFIER = Pattern.compile("\\bAbs\\(([a-zA-Z][a-zA-Z0-9_]*)\\)");
    private static final Pattern ABSOLUTE_VALUE = Pattern.compile("\\|([^|]+)\\|");
    private static final Pattern INNER_PRIME = Pattern.compile(
        "\\b([a-zA-Z][a-zA-Z0-9]*)_prime_([a-zA-Z0-9]+(?:_[a-zA-Z0-9]+)*)\\b");

    private static final List<RewriteRule> RULES = buildRules();

    private ExpressionNormalizer() {
    }

    public static String normalize(String expr) {
        if (expr == null || expr.isEmpty()) {
            return expr == null ? "" : expr;
        }
        String result = expr;
        for (RewriteRule rule : RULES) {
            result = rule.apply(result);
        }
        return result;
    }

    /**
     * Moves an inner {@code _prime_} segment to the end: {@code x_prime_cg -> x_cg_prime}.
     */
    public static String normalizePrimePosition(String expr) {
        if (expr == null || expr.isEmpty()) {
            return expr;
        }
        return INNER_PRIME.matcher(expr).replaceAll("$1_$2_prime");
    }

    public static List<RewriteRule> rules() {
        return RULES;
    }

    public static RewriteRule rule(String name) {
        for (RewriteRule rule : RULES) {
            if (rule.getName().equals(name)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown rewrite rule: " + name);
    }

    private static List<RewriteRule> buildRules() {
        List<RewriteRule> rules = new ArrayList<>();
        rules.add(new RewriteRule("escaped-underscore", s -> {
            String r = s.replace("\\_", "_");
            r = r.replace("\\,", "*");
            return SPACING.matcher(r).replaceAll("");
        }));
        rules.add(new RewriteRule("greek", s -> GREEK.matcher(s).replaceAll("$1")));
        rules.add(new RewriteRule("script-braces", s -> {
            String r = SUBSCRIPT_GROUP.matcher(s).replaceAll("_$1");
            return SUPERSCRIPT_GROUP.matcher(r).replaceAll("^$1");
        }));
        rules.add(new RewriteRule("style-wrappers", s -> STYLE_WRAPPER.matcher(s).replaceAll("$1")));
        rules.add(new RewriteRule("fraction", s -> FRACTION.matcher(s).replaceAll("($1)/($2)")));
        rules.add(new RewriteRule("product", s -> PRODUCT_COMMAND.matcher(s).replaceAll("*")));
        rules.add(new RewriteRule("power", s -> s.replace("^", "**")));
        rules.add(new RewriteRule("grouping", s -> GROUPING.matcher(s).replaceAll("")));
        rules.add(new RewriteRule("structural", s -> STRUCTURAL.matcher(s).replaceAll("")));
        rules.add(new RewriteRule("functions", s -> {
            String r = FUNCTION_CALL.matcher(s).replaceAll("$1($2)");
            return FUNCTION_NAME.matcher(r).replaceAll("$1");
        }));
        rules.add(new RewriteRule("prime-mark", s -> PRIME_MARK.matcher(s).replaceAll(
            match -> match.group(1) + "_prime".repeat(match.group(2).length()))));
        rules.add(new RewriteRule("leftover-markup", s -> {
            String r = COMMAND_WITH_GROUP.matcher(s).replaceAll("$1");
            r = BARE_COMMAND.matcher(r).replaceAll("");
            return STRAY_MARKUP.matcher(r).replaceAll("");
        }));
        rules.add(new RewriteRule("magnitude", s -> {
            String r = MAGNITUDE_BARS.matcher(s).replaceAll("$1_mag");
            r = ABS_OF_IDENTIFIER.matcher(r).replaceAll("$1_mag");
            Matcher m = ABSOLUTE_VALUE.matcher(r);
            return m.replaceAll(match -> Matcher.quoteReplacement("Abs(" + match.group(1) + ")"));
        }));
        rules.add(new RewriteRule("prime-position", ExpressionNormalizer::normalizePrimePosition));
        return Collections.unmodifiableList(rules);
    }

    /**
     * One named step of the rewrite sequence.
     */
    public static final class RewriteRule {
        private final String name;
        private final UnaryOperator<String> rewrite;

        RewriteRule(String name, UnaryOperator<String> rewrite) {
            this.name = name;
            this.rewrite = rewrite;
        }

        public String getName() {
            return name;
        }

        public String apply(String input) {
            return input == null ? null : rewrite.apply(input);
        }
    }
}
