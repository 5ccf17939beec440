package com.cellml.text.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Formats CellML variable names as LaTeX identifiers.
 *
 * <p>Greek letter names become commands ({@code alpha} to {@code \alpha}). Underscore
 * separated parts become subscripts and superscripts:</p>
 * <pre>
 *   V_m        V_{m}
 *   i_Na_K     i_{Na,K}
 *   tau_m_inf  \tau_{m}^{inf}
 *   a_b_c_d    a_{b}^{c_{d}}
 * </pre>
 */
@UtilityClass
public class LatexIdentifierFormatter {

    private static final Set<String> GREEK_LETTERS = Set.of(
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta",
            "eta", "theta", "iota", "kappa", "lambda", "mu",
            "nu", "xi", "omicron", "pi", "rho", "sigma",
            "tau", "upsilon", "phi", "chi", "psi", "omega");

    public static String format(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        if (name.indexOf('_') < 0) {
            return escapeGreek(name);
        }

        String[] parts = name.split("_");
        String base = escapeGreek(parts[0]);
        List<String> subscripts = new ArrayList<>();
        String superscript = "";

        if (parts.length > 1) {
            subscripts.add(escapeGreek(parts[1]));
        }
        if (parts.length == 3 && parts[2].length() == 1) {
            subscripts.add(escapeGreek(parts[2]));
        } else if (parts.length > 2) {
            superscript = escapeGreek(parts[2]);
            if (parts.length > 3) {
                superscript += "_{" + escapeGreek(parts[3]) + "}";
            }
        }
        for (int i = 4; i < parts.length; i++) {
            subscripts.add(escapeGreek(parts[i]));
        }
        subscripts.removeIf(String::isEmpty);

        StringBuilder result = new StringBuilder(base);
        if (!subscripts.isEmpty()) {
            result.append("_{").append(String.join(",", subscripts)).append('}');
        }
        if (!superscript.isEmpty()) {
            result.append("^{").append(superscript).append('}');
        }
        return result.toString();
    }

    /**
     * {@code \name} for a Greek letter name (any case), otherwise the name unchanged.
     */
    public static String escapeGreek(String name) {
        return isGreekLetter(name) ? "\\" + name : name;
    }

    public static boolean isGreekLetter(String name) {
        return name != null && GREEK_LETTERS.contains(name.toLowerCase(Locale.ROOT));
    }
}
