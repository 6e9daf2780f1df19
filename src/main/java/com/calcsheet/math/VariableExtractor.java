package com.calcsheet.math;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands implicit multiplication ({@code bh -> b*h}, {@code 2x -> 2*x}) and harvests free identifiers.
 */
public final class VariableExtractor {

    private static final String PLACEHOLDER_PREFIX = "__RESERVED_";
    private static final String PLACEHOLDER_SUFFIX = "__";

    private static final Pattern SUBSCRIPTED = Pattern.compile("\\b([a-zA-Z]+(?:_[a-zA-Z0-9]+)+)\\b");
    private static final Pattern DIGIT_LETTER = Pattern.compile("(\\d)([a-zA-Z])(?!_)");
    private static final Pattern LETTER_PAREN = Pattern.compile("([a-zA-Z])\\(");
    private static final Pattern PAREN_FOLLOW = Pattern.compile("\\)([a-zA-Z(])");
    private static final Pattern LETTER_RUN = Pattern.compile("(?<![_A-Z])([a-z])([a-z])(?![_a-z])");
    private static final Pattern IDENTIFIER = Pattern.compile("\\b([a-zA-Z_][a-zA-Z0-9_]*)\\b");
    private static final int LETTER_RUN_PASSES = 4;

    private VariableExtractor() {
    }

    /**
     * Inserts explicit {@code *} where algebraic shorthand implies a product.
     * Function names, constants, Greek names and subscripted identifiers are left whole.
     */
    public static String addImplicitMultiplication(String expr) {
        if (expr == null || expr.isEmpty()) {
            return expr == null ? "" : expr;
        }

        String result = expr;
        Map<String, String> protectedWords = new LinkedHashMap<>();
        int placeholderIndex = 0;

        for (String word : MathSymbols.reservedLongestFirst()) {
            Pattern wordPattern = Pattern.compile("\\b" + Pattern.quote(word) + "\\b");
            Matcher m = wordPattern.matcher(result);
            if (m.find()) {
                String placeholder = PLACEHOLDER_PREFIX + (placeholderIndex++) + PLACEHOLDER_SUFFIX;
                protectedWords.put(placeholder, word);
                result = m.replaceAll(Matcher.quoteReplacement(placeholder));
            }
        }

        Set<String> subscripted = new LinkedHashSet<>();
        Matcher subMatcher = SUBSCRIPTED.matcher(result);
        while (subMatcher.find()) {
            subscripted.add(subMatcher.group(1));
        }
        for (String name : subscripted) {
            String placeholder = PLACEHOLDER_PREFIX + (placeholderIndex++) + PLACEHOLDER_SUFFIX;
            protectedWords.put(placeholder, name);
            result = Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(result)
                .replaceAll(Matcher.quoteReplacement(placeholder));
        }

        result = DIGIT_LETTER.matcher(result).replaceAll("$1*$2");
        result = LETTER_PAREN.matcher(result).replaceAll("$1*(");
        result = PAREN_FOLLOW.matcher(result).replaceAll(")*$1");
        // each pass splits one letter pair per run, so abcd needs several
        for (int i = 0; i < LETTER_RUN_PASSES; i++) {
            result = LETTER_RUN.matcher(result).replaceAll("$1*$2");
        }

        for (Map.Entry<String, String> entry : protectedWords.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Free identifiers of an expression, in first-seen order, without function or constant names.
     * Markup input is normalized first.
     */
    public static List<String> extractVariables(String expr) {
        if (expr == null || expr.isEmpty()) {
            return List.of();
        }
        String normalized = ExpressionNormalizer.normalize(expr);
        String processed = addImplicitMultiplication(normalized);

        Set<String> variables = new LinkedHashSet<>();
        Matcher m = IDENTIFIER.matcher(processed);
        while (m.find()) {
            String name = m.group(1);
            if (!MathSymbols.isFunctionOrConstant(name)) {
                variables.add(name);
            }
        }
        return new ArrayList<>(variables);
    }
}
