package com.calcsheet.math;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names that are never split or reported as free variables.
 */
public final class MathSymbols {

    public static final Set<String> FUNCTIONS = ordered(
        // trigonometric
        "sin", "cos", "tan", "cot", "sec", "csc",
        "sinh", "cosh", "tanh", "coth", "sech", "csch",
        "arcsin", "arccos", "arctan", "arccot", "arcsec", "arccsc",
        "asin", "acos", "atan", "atan2",
        // logarithmic / exponential
        "log", "ln", "exp", "log10", "log2",
        // roots
        "sqrt", "cbrt", "root",
        "abs", "sign", "floor", "ceil", "round",
        "max", "min", "sum", "prod",
        "factorial", "gamma", "beta",
        "erf", "erfc",
        // solver-side names
        "Abs", "Symbol", "Integer", "Float", "Rational",
        "diff", "integrate", "limit", "series",
        "Matrix", "det", "trace"
    );

    public static final Set<String> CONSTANTS = ordered(
        "pi", "Pi", "PI",
        "inf", "Inf", "oo",
        "nan", "NaN",
        "true", "false", "True", "False"
    );

    public static final Set<String> GREEK_LETTERS = ordered(
        "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta",
        "iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "pi", "rho",
        "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega",
        "Alpha", "Beta", "Gamma", "Delta", "Epsilon", "Zeta", "Eta", "Theta",
        "Iota", "Kappa", "Lambda", "Mu", "Nu", "Xi", "Omicron", "Pi", "Rho",
        "Sigma", "Tau", "Upsilon", "Phi", "Chi", "Psi", "Omega"
    );

    /** Greek letters that have a markup command of their own. */
    static final String GREEK_COMMANDS =
        "alpha|beta|gamma|delta|epsilon|zeta|eta|theta|iota|kappa|lambda|mu|nu|xi|omicron|pi|rho"
            + "|sigma|tau|upsilon|phi|chi|psi|omega|Gamma|Delta|Theta|Lambda|Xi|Pi|Sigma|Phi|Psi|Omega";

    /** Functions whose markup command may wrap a brace group. */
    static final String FUNCTION_COMMANDS =
        "sqrt|sin|cos|tan|cot|sec|csc|sinh|cosh|tanh|arcsin|arccos|arctan|log|ln|exp|abs";

    private static final List<String> RESERVED_LONGEST_FIRST = buildReserved();

    private MathSymbols() {
    }

    public static boolean isFunctionOrConstant(String name) {
        return FUNCTIONS.contains(name) || CONSTANTS.contains(name);
    }

    /**
     * Functions, constants and Greek names, longest first. Ties keep declaration order.
     */
    public static List<String> reservedLongestFirst() {
        return RESERVED_LONGEST_FIRST;
    }

    private static List<String> buildReserved() {
        Set<String> all = new LinkedHashSet<>();
        all.addAll(FUNCTIONS);
        all.addAll(CONSTANTS);
        all.addAll(GREEK_LETTERS);
        List<String> sorted = new ArrayList<>(all);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return Collections.unmodifiableList(sorted);
    }

    private static Set<String> ordered(String... names) {
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set, names);
        return Collections.unmodifiableSet(set);
    }
}
