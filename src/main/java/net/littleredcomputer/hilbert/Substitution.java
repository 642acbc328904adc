package net.littleredcomputer.hilbert;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual substitution of schema variables. Formulas are strings throughout this package, and
 * two formulas are the same exactly when their text is.
 */
public final class Substitution {
    private Substitution() {}

    private static Pattern tokenPattern(String variable) {
        return Pattern.compile("\\b" + Pattern.quote(variable) + "\\b");
    }

    /**
     * Replace every whole-token occurrence of each variable in the template with the formula
     * assigned to it. Longer variable names are replaced first, so that a short name can never
     * clobber part of a longer one.
     *
     * @param template formula text containing schema variables
     * @param assignment variable name to (ground) formula
     * @return the instantiated formula
     */
    public static String apply(String template, Map<String, String> assignment) {
        String formula = template;
        List<String> variables = new ArrayList<>(assignment.keySet());
        variables.sort(Comparator.comparingInt(String::length).reversed());
        for (String v : variables) {
            formula = tokenPattern(v).matcher(formula).replaceAll(Matcher.quoteReplacement(assignment.get(v)));
        }
        return formula;
    }

    /**
     * @return true if variable occurs in formula as a whole token
     */
    public static boolean containsVariable(String formula, String variable) {
        return tokenPattern(variable).matcher(formula).find();
    }
}
