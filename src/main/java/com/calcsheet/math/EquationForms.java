package com.calcsheet.math;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical spellings of an equation for solving and for variable extraction.
 */
public final class EquationForms {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final Pattern MARKUP_CHARS = Pattern.compile("[\\\\|{}()]");
    private static final Pattern RHS_MARKUP_CHARS = Pattern.compile("[\\\\|{}]");
    private static final Pattern SYNTHETIC_LABEL = Pattern.compile("^eq_[a-zA-Z0-9_]+$");
    private static final Pattern ASSIGNMENT = Pattern.compile("^([a-zA-Z_][a-zA-Z0-9_]*)\\s*=\\s*(.+)$");
    private static final Pattern EQ_CALL = Pattern.compile("^Eq\\(\\s*(eq_[a-zA-Z0-9_]+)\\s*,\\s*(.+)\\)\\s*$");

    private EquationForms() {
    }

    /**
     * Left and right side of an equation after canonicalization.
     */
    public static final class Sides {
        private final String lhs;
        private final String rhs;

        public Sides(String lhs, String rhs) {
            this.lhs = lhs;
            this.rhs = rhs;
        }

        public String getLhs() {
            return lhs;
        }

        public String getRhs() {
            return rhs;
        }
    }

    public static Sides split(String expr) {
        int idx = expr.indexOf('=');
        if (idx < 0) {
            return new Sides(expr.trim(), "");
        }
        return new Sides(expr.substring(0, idx).trim(), expr.substring(idx + 1).trim());
    }

    /**
     * Canonical sides from the stored fields, falling back to the display markup.
     * A plain lhs whose markup spelled it with magnitude bars is upgraded to the {@code _mag} name.
     */
    public static Sides canonicalSides(String lhsField, String rhsField, String latex) {
        String lhs = lhsField == null ? "" : lhsField.trim();
        String rhs = rhsField == null ? "" : rhsField.trim();

        Sides fromLatex = latex != null && !latex.isBlank()
            ? split(ExpressionNormalizer.normalize(latex))
            : new Sides("", "");
        String latexLhs = fromLatex.getLhs();
        String latexRhs = fromLatex.getRhs();

        if (!lhs.isEmpty() && (MARKUP_CHARS.matcher(lhs).find() || !isIdentifier(lhs))) {
            String normalizedLhs = split(ExpressionNormalizer.normalize(lhs)).getLhs();
            if (isIdentifier(normalizedLhs)) {
                lhs = normalizedLhs;
            }
        }

        boolean magnitudeAlias = isIdentifier(latexLhs)
            && latexLhs.endsWith("_mag")
            && lhs.equals(latexLhs.substring(0, latexLhs.length() - "_mag".length()));

        if ((!isIdentifier(lhs) && isIdentifier(latexLhs)) || magnitudeAlias) {
            lhs = latexLhs;
        }

        if (rhs.isEmpty() && !latexRhs.isEmpty()) {
            rhs = latexRhs;
        } else if (!rhs.isEmpty() && RHS_MARKUP_CHARS.matcher(rhs).find()) {
            rhs = ExpressionNormalizer.normalize(rhs);
        }
        return new Sides(lhs, rhs);
    }

    /**
     * Rewrites a narrative equilibrium line such as {@code sum M_A = 0: R_D*L = 2W}
     * into {@code R_D*L - (2*W) = 0}, keeping only the part after the last colon.
     * Returns null when the text is not of that shape.
     */
    public static String parseNarrativeEquality(String expr) {
        if (expr == null) {
            return null;
        }
        String normalized = expr.trim();
        if (!normalized.contains(":") || !normalized.contains("=")) {
            return null;
        }
        String tail = normalized.substring(normalized.lastIndexOf(':') + 1).trim();
        int eqIndex = tail.indexOf('=');
        if (tail.isEmpty() || eqIndex < 0) {
            return null;
        }
        String left = tail.substring(0, eqIndex).trim();
        String right = tail.substring(eqIndex + 1).trim();
        if (left.isEmpty() || right.isEmpty()) {
            return null;
        }
        return VariableExtractor.addImplicitMultiplication(left)
            + " - (" + VariableExtractor.addImplicitMultiplication(right) + ") = 0";
    }

    /**
     * Equation text to hand to the solver.
     */
    public static String solveExpression(String lhsField, String rhsField, String latex, String canonical) {
        String narrativeFromLatex = latex != null && !latex.isBlank()
            ? parseNarrativeEquality(ExpressionNormalizer.normalize(latex))
            : null;

        String sympy = canonical == null ? "" : canonical.trim();
        if (!sympy.isEmpty()) {
            String normalized = sympy.contains("\\") ? ExpressionNormalizer.normalize(sympy) : sympy;
            if (narrativeFromLatex != null) {
                return narrativeFromLatex;
            }
            String narrative = parseNarrativeEquality(normalized);
            if (narrative != null) {
                return narrative;
            }
            Matcher assign = ASSIGNMENT.matcher(normalized);
            if (assign.matches() && SYNTHETIC_LABEL.matcher(assign.group(1)).matches()) {
                return assign.group(2).trim() + " = 0";
            }
            Matcher eqCall = EQ_CALL.matcher(normalized);
            if (eqCall.matches()) {
                return eqCall.group(2).trim() + " = 0";
            }
            return normalized;
        }

        Sides sides = canonicalSides(lhsField, rhsField, latex);
        String lhs = sides.getLhs();
        String rhs = sides.getRhs();
        if (narrativeFromLatex != null) {
            return narrativeFromLatex;
        }
        String narrative = parseNarrativeEquality(lhs + " = " + rhs);
        if (narrative != null) {
            return narrative;
        }
        if (SYNTHETIC_LABEL.matcher(lhs).matches() && !rhs.isEmpty()) {
            return rhs + " = 0";
        }
        if (!lhs.isEmpty() && !rhs.isEmpty()) {
            return lhs + " = " + rhs;
        }
        if (latex != null && !latex.isBlank()) {
            return ExpressionNormalizer.normalize(latex);
        }
        return rhs.isEmpty() ? lhs : rhs;
    }

    /**
     * Text whose identifiers are the variables an equation uses.
     * Synthetic {@code eq_*} labels are equation ids, not variables, so only the rhs is used for them.
     */
    public static String extractionExpression(String lhsField, String rhsField, String latex, String canonical) {
        Sides sides = canonicalSides(lhsField, rhsField, latex);
        String lhs = sides.getLhs();
        String rhs = sides.getRhs();
        if (rhs.isEmpty()) {
            return solveExpression(lhsField, rhsField, latex, canonical);
        }
        if (latex != null && !latex.isBlank()) {
            String narrative = parseNarrativeEquality(ExpressionNormalizer.normalize(latex));
            if (narrative != null) {
                return narrative;
            }
        }
        String narrative = parseNarrativeEquality(lhs + " = " + rhs);
        if (narrative != null) {
            return narrative;
        }
        if (SYNTHETIC_LABEL.matcher(lhs).matches()) {
            return rhs;
        }
        return lhs.isEmpty() ? rhs : lhs + " " + rhs;
    }

    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }
}
