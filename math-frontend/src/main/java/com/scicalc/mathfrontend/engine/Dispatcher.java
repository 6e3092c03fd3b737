package com.scicalc.mathfrontend.engine;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scicalc.mathfrontend.ast.BinaryOperator;
import com.scicalc.mathfrontend.ast.Node;
import com.scicalc.mathfrontend.parser.Parser;
import com.scicalc.mathfrontend.parser.ParserException;

/**
 * Parses an expression and evaluates it with the engine for the requested mode.
 *
 * <p>In numeric mode an equation or an unbound variable is retried once on the symbolic
 * engine. The decision is made on the {@link EvaluationIssue} tag of the numeric error.
 *
 * <p>The {@link #setMode(ComputationMode) mode} field belongs to a single owning caller.
 * Shared callers should pass the mode explicitly instead.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final MathEngine numericEngine;
    private final MathEngine symbolicEngine;

    private ComputationMode mode = ComputationMode.NUMERIC;

    public Dispatcher(MathEngine numericEngine, MathEngine symbolicEngine) {
        this.numericEngine = numericEngine;
        this.symbolicEngine = symbolicEngine;
    }

    public ComputationMode getMode() { return mode; }
    public void setMode(ComputationMode mode) { this.mode = mode; }

    public MathEngine engineFor(ComputationMode mode) {
        switch (mode) {
            case SYMBOLIC:
                return symbolicEngine;
            case NUMERIC:
            default:
                return numericEngine;
        }
    }

    public EvaluationReport evaluate(String expression) {
        return evaluate(expression, mode, EvaluationContext.empty(), MathOperation.EVALUATE, null);
    }

    public EvaluationReport evaluate(String expression, ComputationMode mode, EvaluationContext context,
                                     MathOperation operation, String variable) {
        String source = expression == null ? "" : expression;
        MathOperation op = operation == null ? MathOperation.EVALUATE : operation;
        Runtime runtime = Runtime.getRuntime();
        long startMemory = runtime.totalMemory() - runtime.freeMemory();
        long start = System.nanoTime();

        Node ast;
        try {
            ast = Parser.parse(source);
        } catch (ParserException e) {
            double parseMs = elapsedMs(start);
            EvaluationMetrics metrics = new EvaluationMetrics(parseMs, 0, parseMs,
                    memoryDeltaKb(runtime, startMemory), 0, source.length(), null, null);
            return report(source, EvaluationResult.error(e.getMessage()), metrics);
        }
        double parseMs = elapsedMs(start);

        long evalStart = System.nanoTime();
        EvaluationResult result;
        if (hasNestedEquals(ast, true)) {
            result = EvaluationResult.error("'=' is only allowed at the top level of an equation");
        } else {
            result = engineFor(mode).evaluate(ast, context, op, variable);

            if (mode == ComputationMode.NUMERIC && requiresSymbolic(result)) {
                MathOperation symbolicOp = op;
                String symbolicVariable = variable;
                if (op == MathOperation.EVALUATE && isEquation(ast)) {
                    symbolicOp = MathOperation.SOLVE;
                }
                if (symbolicVariable == null && symbolicOp != MathOperation.EVALUATE) {
                    symbolicVariable = firstVariable(ast);
                }
                log.info("Numeric evaluation of '{}' failed ({}), retrying as symbolic {}",
                        source, result.getIssue(), symbolicOp.label());
                result = symbolicEngine.evaluate(ast, context, symbolicOp, symbolicVariable);
            }
        }
        double evalMs = elapsedMs(evalStart);

        Double symbolicMs = null;
        Double conversionMs = null;
        Map<String, Double> metadata = result.getMetadata();
        if (metadata != null) {
            symbolicMs = metadata.get("python");
            conversionMs = metadata.get("conversion");
        }

        EvaluationMetrics metrics = new EvaluationMetrics(parseMs, evalMs, elapsedMs(start),
                memoryDeltaKb(runtime, startMemory), ast.nodeCount(), source.length(), symbolicMs, conversionMs);
        return report(source, result, metrics);
    }

    private static boolean requiresSymbolic(EvaluationResult result) {
        return result.hasIssue(EvaluationIssue.CANNOT_EVALUATE_EQUALITY)
                || result.hasIssue(EvaluationIssue.UNDEFINED_VARIABLE);
    }

    private static boolean isEquation(Node ast) {
        return ast instanceof Node.BinaryNode binary && binary.getOperator() == BinaryOperator.EQUALS;
    }

    // '=' may only be the root, and never inside either side of the equation
    private static boolean hasNestedEquals(Node node, boolean root) {
        if (node instanceof Node.BinaryNode binary) {
            if (binary.getOperator() == BinaryOperator.EQUALS && !root) {
                return true;
            }
            return hasNestedEquals(binary.getLeft(), false) || hasNestedEquals(binary.getRight(), false);
        }
        if (node instanceof Node.UnaryNode unary) {
            return hasNestedEquals(unary.getOperand(), false);
        }
        if (node instanceof Node.FunctionNode function) {
            return hasNestedEquals(function.getArgument(), false);
        }
        if (node instanceof Node.SymbolicFunctionNode symbolic) {
            return symbolic.getArguments().stream().anyMatch(argument -> hasNestedEquals(argument, false));
        }
        return false;
    }

    static String firstVariable(Node node) {
        if (node instanceof Node.VariableNode variable) {
            return variable.getName();
        }
        if (node instanceof Node.BinaryNode binary) {
            String left = firstVariable(binary.getLeft());
            return left != null ? left : firstVariable(binary.getRight());
        }
        if (node instanceof Node.UnaryNode unary) {
            return firstVariable(unary.getOperand());
        }
        if (node instanceof Node.FunctionNode function) {
            return firstVariable(function.getArgument());
        }
        if (node instanceof Node.SymbolicFunctionNode symbolic) {
            for (Node argument : symbolic.getArguments()) {
                String name = firstVariable(argument);
                if (name != null) return name;
            }
        }
        return null;
    }

    private EvaluationReport report(String expression, EvaluationResult result, EvaluationMetrics metrics) {
        EvaluationReport report = new EvaluationReport(result, metrics);
        if (log.isDebugEnabled()) {
            log.debug("Expression: {} | Result: {}{}{}", expression, report.getResultString().replace('\n', ' '),
                    System.lineSeparator(), ResultFormatter.formatMetrics(metrics));
        }
        return report;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static double memoryDeltaKb(Runtime runtime, long startBytes) {
        return Math.max(0, (runtime.totalMemory() - runtime.freeMemory() - startBytes) / 1024.0);
    }
}
