package com.scicalc.mathfrontend.symbolic;

import java.util.regex.Pattern;

/**
 * Turns SymPy's LaTeX into something readable without a TeX renderer.
 */
public final class LatexFormatter {

    private static final Pattern COMMAND = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern SIMPLE_FRACTION = Pattern.compile("\\\\frac\\{([^}]+)\\}\\{([^}]+)\\}");

    private static final String[][] SYMBOLS = {
            {"\\pi", "π"},
            {"\\infty", "∞"},
            {"\\sqrt", "√"},
            {"\\pm", "±"},
            {"\\times", "×"},
            {"\\div", "÷"},
    };

    private LatexFormatter() {
    }

    public static String format(String latex) {
        if (latex == null) {
            return "";
        }
        String result = latex;
        for (String[] symbol : SYMBOLS) {
            result = result.replace(symbol[0], symbol[1]);
        }
        result = SIMPLE_FRACTION.matcher(result).replaceAll("($1)/($2)");
        result = result.replace("{", "").replace("}", "");
        return result.trim();
    }

    /** Drops every LaTeX command and brace, e.g. {@code \frac{1}{2}} becomes {@code 12}. */
    public static String toPlainText(String latex) {
        if (latex == null) {
            return "";
        }
        String result = COMMAND.matcher(latex).replaceAll("");
        return result.replace("{", "").replace("}", "").trim();
    }
}
