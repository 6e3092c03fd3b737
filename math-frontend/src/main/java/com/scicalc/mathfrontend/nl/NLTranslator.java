package com.scicalc.mathfrontend.nl;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scicalc.mathfrontend.engine.MathOperation;

/**
 * Rule-based translation of math phrased in English into calculator syntax.
 *
 * <p>The input is spell-corrected and standardized first, then offered to an ordered list of
 * matchers; the first one that recognises it wins. Input that already reads as an
 * expression is passed through untouched.
 */
public class NLTranslator {

    private static final Logger log = LoggerFactory.getLogger(NLTranslator.class);

    static final String DEFAULT_VARIABLE = "x";

    private static final List<String> FUNCTION_PREFIXES =
            Arrays.asList("sin(", "cos(", "tan(", "log(", "ln(", "sqrt(", "exp(");
    private static final String OPERATOR_CHARS = "+-*/^=";
    private static final String EXPRESSION_PUNCTUATION = "+-*/^().,=";
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    // calculus: group order is (expression, variable) unless noted
    private static final Pattern DIFF_WITH_RESPECT =
            Pattern.compile("\\b(?:differentiate|derive|diff) (.+?) with respect to (\\w+)");
    private static final Pattern D_DX_OF = Pattern.compile("\\bd/d(\\w+) of (.+)");
    private static final Pattern D_DX = Pattern.compile("\\bd/d(\\w+) (.+)");
    private static final Pattern DIFF = Pattern.compile("\\b(?:differentiate|derive|diff) (.+)");

    private static final Pattern INTEGRATE_D = Pattern.compile("\\bintegrate (.+?) d([a-z]\\w*)$");
    private static final Pattern INTEGRATE_WITH_RESPECT =
            Pattern.compile("\\bintegrate (.+?) with respect to (\\w+)");
    private static final Pattern INTEGRATE = Pattern.compile("\\bintegrate (.+)");

    private static final Pattern LIMIT =
            Pattern.compile("\\blimit of (.+?) as (\\w+) (?:approaches|goes to|->) (.+)");

    private static final Pattern SOLVE_FOR = Pattern.compile("\\bsolve (.+?) for (\\w+)$");
    private static final Pattern FIND_IN = Pattern.compile("\\bfind (\\w+) (?:in|from|where) (.+)");
    private static final Pattern SOLVE = Pattern.compile("\\bsolve (.+)");
    private static final Pattern ROOTS_OF = Pattern.compile("\\broots of (.+)");

    private static final Pattern FACTOR = Pattern.compile("\\b(?:factorize|factor) (.+)");
    private static final Pattern EXPAND = Pattern.compile("\\bexpand (.+)");

    private static final Pattern STATISTIC =
            Pattern.compile("\\b(mean|median|mode|variance|std dev|standard deviation) of (.+)");

    private static final Pattern DETERMINANT = Pattern.compile("\\bdeterminant of (.+)");
    private static final Pattern INVERSE = Pattern.compile("\\binverse of (.+)");
    private static final Pattern TRANSPOSE = Pattern.compile("\\btranspose of (.+)");

    private static final Pattern PERCENT_OF =
            Pattern.compile("(\\d+(?:\\.\\d+)?) ?(?:percent|%) of (\\d+(?:\\.\\d+)?)");

    private static final Pattern SQUARE_ROOT_OF = Pattern.compile("\\bsquare root of (.+)");
    private static final Pattern CUBE_ROOT_OF = Pattern.compile("\\bcube root of (.+)");
    private static final Pattern NTH_ROOT_OF = Pattern.compile("\\b(\\d+)(?:th|st|nd|rd) root of (.+)");
    private static final Pattern SQRT = Pattern.compile("\\bsqrt (.+)");

    private static final Pattern TO_THE_POWER_OF = Pattern.compile("(.+?) to the power of (.+)");
    private static final Pattern SQUARED = Pattern.compile("(.+?) squared\\b");
    private static final Pattern CUBED = Pattern.compile("(.+?) cubed\\b");

    private static final Pattern LOG_BASE = Pattern.compile("\\blog ?(?:base|b) ?(\\d+) of (.+)");
    private static final Pattern NATURAL_LOG = Pattern.compile("\\b(?:natural log|ln) of (.+)");
    private static final Pattern LOG_OF = Pattern.compile("\\blog of (.+)");

    private static final String[][] TRIG_NAMES = {
            {"sin", "sine"},
            {"cos", "cosine"},
            {"tan", "tangent"},
    };

    private static final List<String> ARITHMETIC_PREFIXES =
            Arrays.asList("what is ", "what's ", "calculate ", "compute ", "evaluate ");
    private static final String[][] ARITHMETIC_WORDS = {
            {"plus", "+"}, {"added to", "+"}, {"and", "+"},
            {"minus", "-"}, {"subtracted by", "-"},
            {"times", "*"}, {"multiplied by", "*"},
            {"divided by", "/"}, {"over", "/"},
    };

    private static final Pattern FACTORIAL_OF = Pattern.compile("\\bfactorial of (\\d+)");
    private static final Pattern N_FACTORIAL = Pattern.compile("(\\d+) factorial\\b");
    private static final Pattern ABSOLUTE_VALUE = Pattern.compile("\\b(?:absolute value|abs|magnitude) of (.+)");

    private static final String[][] EXPRESSION_WORDS = {
            {"squared", "^2"},
            {"cubed", "^3"},
            {"divided by", "/"},
            {"multiplied by", "*"},
            {"times", "*"},
            {"plus", "+"},
            {"minus", "-"},
            {"over", "/"},
            {"equal to", "="},
            {"equals", "="},
    };
    private static final Pattern SPACED_OPERATOR = Pattern.compile("\\s*([+*/^-])\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NLSyntaxAnalyzer analyzer;
    private final List<Function<String, NLTranslation>> cascade;

    public NLTranslator() {
        this(new NLSyntaxAnalyzer());
    }

    public NLTranslator(NLSyntaxAnalyzer analyzer) {
        this.analyzer = analyzer;
        this.cascade = Arrays.asList(
                this::tryCalculus,
                this::tryIntegrals,
                this::tryLimits,
                this::trySolve,
                this::tryAlgebra,
                this::tryStatistics,
                this::tryLinearAlgebra,
                this::tryPercentage,
                this::tryRoots,
                this::tryPowers,
                this::tryLogarithms,
                this::tryTrigonometry,
                this::tryArithmetic,
                this::tryConstants,
                this::tryFactorial,
                this::tryAbsoluteValue);
    }

    public NLTranslation translate(String input) {
        String raw = input == null ? "" : input.trim();
        String text = analyzer.standardize(analyzer.correct(raw));

        if (text.isEmpty()) {
            return NLTranslation.passthrough("");
        }
        // equations are standardized into solve requests, so they miss this check
        if (looksLikeExpression(text) && looksLikeExpression(raw)) {
            return NLTranslation.passthrough(raw);
        }

        for (Function<String, NLTranslation> matcher : cascade) {
            NLTranslation translation = matcher.apply(text);
            if (translation != null) {
                log.debug("Translated '{}' to {}", raw, translation);
                return translation;
            }
        }

        String cleaned = cleanToExpression(text);
        log.debug("No phrase matched '{}', falling back to '{}'", raw, cleaned);
        return new NLTranslation(cleaned, MathOperation.EVALUATE, null, !cleaned.isEmpty());
    }

    static boolean looksLikeExpression(String text) {
        if (text.isEmpty()) {
            return false;
        }
        if (PLAIN_NUMBER.matcher(text).matches()) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        boolean startsLikeMath = Character.isDigit(lower.charAt(0))
                || FUNCTION_PREFIXES.stream().anyMatch(lower::startsWith);
        if (!startsLikeMath) {
            return false;
        }

        boolean hasOperator = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                hasOperator = true;
            } else if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)
                    && EXPRESSION_PUNCTUATION.indexOf(c) < 0) {
                return false;
            }
        }
        return hasOperator;
    }

    private NLTranslation tryCalculus(String text) {
        Matcher m = DIFF_WITH_RESPECT.matcher(text);
        if (m.find()) {
            return differentiate(m.group(1), m.group(2));
        }
        m = D_DX_OF.matcher(text);
        if (m.find()) {
            return differentiate(m.group(2), m.group(1));
        }
        m = D_DX.matcher(text);
        if (m.find()) {
            return differentiate(m.group(2), m.group(1));
        }
        m = DIFF.matcher(text);
        if (m.find()) {
            return differentiate(m.group(1), DEFAULT_VARIABLE);
        }
        return null;
    }

    private NLTranslation tryIntegrals(String text) {
        Matcher m = INTEGRATE_D.matcher(text);
        if (m.find()) {
            return integrate(m.group(1), m.group(2));
        }
        m = INTEGRATE_WITH_RESPECT.matcher(text);
        if (m.find()) {
            return integrate(m.group(1), m.group(2));
        }
        m = INTEGRATE.matcher(text);
        if (m.find()) {
            return integrate(m.group(1), DEFAULT_VARIABLE);
        }
        return null;
    }

    private NLTranslation tryLimits(String text) {
        Matcher m = LIMIT.matcher(text);
        if (!m.find()) {
            return null;
        }
        String expression = cleanToExpression(m.group(1));
        return NLTranslation.evaluate("limit(" + expression + ", " + m.group(2) + ", " + m.group(3).trim() + ")");
    }

    private NLTranslation trySolve(String text) {
        Matcher m = SOLVE_FOR.matcher(text);
        if (m.find()) {
            return solve(m.group(1), m.group(2));
        }
        m = FIND_IN.matcher(text);
        if (m.find()) {
            return solve(m.group(2), m.group(1));
        }
        m = SOLVE.matcher(text);
        if (m.find()) {
            return solve(m.group(1), DEFAULT_VARIABLE);
        }
        m = ROOTS_OF.matcher(text);
        if (m.find()) {
            return solve(m.group(1), DEFAULT_VARIABLE);
        }
        return null;
    }

    private NLTranslation tryAlgebra(String text) {
        Matcher m = FACTOR.matcher(text);
        if (m.find()) {
            return simplify("factor(" + cleanToExpression(m.group(1)) + ")");
        }
        m = EXPAND.matcher(text);
        if (m.find()) {
            return simplify("expand(" + cleanToExpression(m.group(1)) + ")");
        }
        return null;
    }

    private NLTranslation tryStatistics(String text) {
        Matcher m = STATISTIC.matcher(text);
        if (!m.find()) {
            return null;
        }
        String function;
        switch (m.group(1)) {
            case "std dev":
            case "standard deviation":
                function = "stdev";
                break;
            default:
                function = m.group(1);
        }
        return NLTranslation.evaluate(function + "([" + m.group(2).trim() + "])");
    }

    private NLTranslation tryLinearAlgebra(String text) {
        Matcher m = DETERMINANT.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("det(" + cleanToExpression(m.group(1)) + ")");
        }
        m = INVERSE.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("inverse(" + cleanToExpression(m.group(1)) + ")");
        }
        m = TRANSPOSE.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("transpose(" + cleanToExpression(m.group(1)) + ")");
        }
        return null;
    }

    private NLTranslation tryPercentage(String text) {
        Matcher m = PERCENT_OF.matcher(text);
        if (!m.find()) {
            return null;
        }
        return NLTranslation.evaluate(m.group(2) + " * " + m.group(1) + " / 100");
    }

    private NLTranslation tryRoots(String text) {
        Matcher m = SQUARE_ROOT_OF.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("sqrt(" + cleanToExpression(m.group(1)) + ")");
        }
        m = CUBE_ROOT_OF.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("(" + cleanToExpression(m.group(1)) + ")^(1/3)");
        }
        m = NTH_ROOT_OF.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("(" + cleanToExpression(m.group(2)) + ")^(1/" + m.group(1) + ")");
        }
        m = SQRT.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("sqrt(" + cleanToExpression(m.group(1)) + ")");
        }
        return null;
    }

    private NLTranslation tryPowers(String text) {
        Matcher m = TO_THE_POWER_OF.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("(" + cleanToExpression(m.group(1)) + ")^(" + cleanToExpression(m.group(2)) + ")");
        }
        m = SQUARED.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("(" + cleanToExpression(m.group(1)) + ")^2");
        }
        m = CUBED.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("(" + cleanToExpression(m.group(1)) + ")^3");
        }
        return null;
    }

    private NLTranslation tryLogarithms(String text) {
        Matcher m = LOG_BASE.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("log(" + cleanToExpression(m.group(2)) + ")/log(" + m.group(1) + ")");
        }
        m = NATURAL_LOG.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("ln(" + cleanToExpression(m.group(1)) + ")");
        }
        m = LOG_OF.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("log(" + cleanToExpression(m.group(1)) + ")");
        }
        return null;
    }

    private NLTranslation tryTrigonometry(String text) {
        for (String[] names : TRIG_NAMES) {
            Matcher m = Pattern.compile("\\b(?:" + names[1] + "|" + names[0] + ") of (.+)").matcher(text);
            if (m.find()) {
                return NLTranslation.evaluate(names[0] + "(" + cleanToExpression(m.group(1)) + ")");
            }
        }
        return null;
    }

    private NLTranslation tryArithmetic(String text) {
        String remainder = text;
        boolean hadPrefix = false;
        for (String prefix : ARITHMETIC_PREFIXES) {
            if (remainder.startsWith(prefix)) {
                remainder = remainder.substring(prefix.length());
                hadPrefix = true;
                break;
            }
        }

        for (String[] word : ARITHMETIC_WORDS) {
            Matcher m = Pattern.compile("(.+?) " + word[0] + " (.+)").matcher(remainder);
            if (m.find()) {
                String left = cleanToExpression(m.group(1));
                String right = cleanToExpression(m.group(2));
                if (!left.isEmpty() && !right.isEmpty()) {
                    return NLTranslation.evaluate(left + " " + word[1] + " " + right);
                }
            }
        }

        // "what is 5 + 3" arrives here with its operators already standardized
        if (hadPrefix && !remainder.isBlank()) {
            return NLTranslation.evaluate(cleanToExpression(remainder));
        }
        return null;
    }

    private NLTranslation tryConstants(String text) {
        switch (text) {
            case "pi":
            case "value of pi":
                return NLTranslation.evaluate("pi");
            case "e":
            case "euler's number":
            case "eulers number":
                return NLTranslation.evaluate("E");
            default:
                return null;
        }
    }

    private NLTranslation tryFactorial(String text) {
        Matcher m = FACTORIAL_OF.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate(m.group(1) + "!");
        }
        m = N_FACTORIAL.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate(m.group(1) + "!");
        }
        return null;
    }

    private NLTranslation tryAbsoluteValue(String text) {
        Matcher m = ABSOLUTE_VALUE.matcher(text);
        if (m.find()) {
            return NLTranslation.evaluate("abs(" + cleanToExpression(m.group(1)) + ")");
        }
        return null;
    }

    /** Rewrites leftover operator words to symbols and tightens the spacing around them. */
    static String cleanToExpression(String fragment) {
        String result = fragment.trim();
        for (String[] word : EXPRESSION_WORDS) {
            result = result.replaceAll("\\b" + word[0] + "\\b", Matcher.quoteReplacement(word[1]));
        }
        result = SPACED_OPERATOR.matcher(result).replaceAll("$1");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    private static NLTranslation differentiate(String expression, String variable) {
        return new NLTranslation(cleanToExpression(expression), MathOperation.DIFFERENTIATE, variable.trim(), true);
    }

    private static NLTranslation integrate(String expression, String variable) {
        return new NLTranslation(cleanToExpression(expression), MathOperation.INTEGRATE, variable.trim(), true);
    }

    private static NLTranslation solve(String expression, String variable) {
        return new NLTranslation(cleanToExpression(expression), MathOperation.SOLVE, variable.trim(), true);
    }

    private static NLTranslation simplify(String expression) {
        return new NLTranslation(expression, MathOperation.SIMPLIFY, null, true);
    }
}
