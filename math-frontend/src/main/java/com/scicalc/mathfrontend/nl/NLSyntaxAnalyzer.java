package com.scicalc.mathfrontend.nl;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans up natural-language math before translation: fixes misspelled math words, then
 * rewrites common phrases ("square root of", "divided by", ...) to their canonical form.
 */
public class NLSyntaxAnalyzer {

    private static final int MAX_EDIT_DISTANCE = 2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> VOCABULARY = new LinkedHashSet<>(Arrays.asList(
            // operations
            "calculate", "compute", "evaluate", "simplify", "solve", "find",
            "derivative", "derive", "differentiate", "diff", "integrate", "integral", "antiderivative",
            "factor", "factorize", "expand", "limit", "roots",
            // functions and quantities
            "sin", "sine", "cos", "cosine", "tan", "tangent",
            "log", "ln", "natural", "base", "sqrt", "square", "root", "cube", "cubic",
            "abs", "absolute", "magnitude", "factorial", "value", "number", "pi", "euler", "eulers",
            "mean", "median", "mode", "variance", "std", "dev", "standard", "deviation",
            "determinant", "inverse", "transpose",
            "percent", "power", "squared", "cubed", "dx",
            // connectives
            "what", "is", "the", "of", "with", "respect", "to", "for", "in", "from", "where",
            "and", "plus", "minus", "times", "multiplied", "divided", "added", "subtracted",
            "by", "over", "as", "approaches", "goes", "equals", "equal"));

    /** Longest phrases first, so "square root of" wins over any shorter overlap. */
    private static final List<Replacement> PHRASES = Arrays.asList(
            new Replacement("antiderivative of", "integrate"),
            new Replacement("square root of", "sqrt"),
            new Replacement("cubic root of", "cube root of"),
            new Replacement("derivative of", "diff"),
            new Replacement("multiplied by", "*"),
            new Replacement("integral of", "integrate"),
            new Replacement("derivative", "diff"),
            new Replacement("divided by", "/"),
            new Replacement("equal to", "="),
            new Replacement("equals", "="),
            new Replacement("times", "*"),
            new Replacement("minus", "-"),
            new Replacement("plus", "+"));

    /**
     * Replaces each misspelled word with the nearest vocabulary word, keeping numbers,
     * single letters and anything containing a non-letter (e.g. {@code x^2}, {@code d/dx}) as typed.
     */
    public String correct(String input) {
        if (input == null) {
            return "";
        }
        String text = input.trim();
        if (text.isEmpty()) {
            return text;
        }

        String[] words = WHITESPACE.split(text);
        for (int i = 0; i < words.length; i++) {
            String lower = words[i].toLowerCase(Locale.ROOT);
            if (lower.length() <= 1 || NUMBER.matcher(lower).matches() || !isAllLetters(lower)
                    || VOCABULARY.contains(lower)) {
                continue;
            }
            String match = closestWord(lower);
            if (match != null) {
                words[i] = match;
            }
        }
        return String.join(" ", words);
    }

    /**
     * Lowercases and rewrites phrases to canonical words or symbols. Text holding an
     * {@code =} with no "solve" is turned into a solve request.
     */
    public String standardize(String input) {
        if (input == null) {
            return "";
        }
        String text = input.trim().toLowerCase(Locale.ROOT);
        for (Replacement phrase : PHRASES) {
            text = phrase.apply(text);
        }
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();

        if (text.contains("=") && !text.contains("solve")) {
            return "solve " + text;
        }
        return text;
    }

    private static String closestWord(String token) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String word : VOCABULARY) {
            int distance = levenshtein(token, word);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = word;
            }
        }
        if (bestDistance > MAX_EDIT_DISTANCE) {
            return null;
        }
        // two edits on a two-letter word is a different word, not a typo
        if (token.length() < 3 && bestDistance > 1) {
            return null;
        }
        return best;
    }

    static int levenshtein(String a, String b) {
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static boolean isAllLetters(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isLetter(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static final class Replacement {
        private final Pattern pattern;
        private final String replacement;

        Replacement(String phrase, String replacement) {
            this.pattern = Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b");
            this.replacement = Matcher.quoteReplacement(replacement);
        }

        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }
}
