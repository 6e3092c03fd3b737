package com.scicalc.mathfrontend.engine;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scicalc.mathfrontend.ast.Node;
import com.scicalc.mathfrontend.symbolic.SymbolicClient;
import com.scicalc.mathfrontend.symbolic.SymbolicClientException;
import com.scicalc.mathfrontend.symbolic.SymbolicResult;
import com.scicalc.mathfrontend.symbolic.SympyExpressionConverter;

/**
 * Hands the AST to the SymPy collaborator. Every collaborator failure, timeouts included,
 * comes back as an error result; nothing is thrown to the caller.
 */
public class SymbolicEngine implements MathEngine {

    private static final Logger log = LoggerFactory.getLogger(SymbolicEngine.class);

    static final String DEFAULT_VARIABLE = "x";

    private final SymbolicClient client;

    public SymbolicEngine(SymbolicClient client) {
        this.client = client;
    }

    @Override
    public EvaluationResult evaluate(Node ast, EvaluationContext context, MathOperation operation, String variable) {
        MathOperation op = operation == null ? MathOperation.EVALUATE : operation;

        long conversionStart = System.nanoTime();
        String expression = SympyExpressionConverter.convert(ast);
        double conversionMs = elapsedMs(conversionStart);
        log.debug("Converted AST to SymPy expression '{}'", expression);

        String target = needsVariable(op) ? (variable != null ? variable : DEFAULT_VARIABLE) : null;

        long callStart = System.nanoTime();
        try {
            SymbolicResult result = client.request(op, expression, target);
            Map<String, Double> metadata = new LinkedHashMap<>();
            metadata.put("conversion", conversionMs);
            metadata.put("python", elapsedMs(callStart));
            return EvaluationResult.symbolic(result.getResult(), result.getLatex(), metadata);
        } catch (SymbolicClientException e) {
            log.warn("Symbolic {} of '{}' failed ({}): {}", op.label(), expression, e.getReason(), e.getMessage());
            if (e.getReason() == SymbolicClientException.Reason.TIMEOUT) {
                return EvaluationResult.error("Symbolic evaluation timeout");
            }
            return EvaluationResult.error(e.getMessage());
        }
    }

    @Override
    public ComputationMode mode() {
        return ComputationMode.SYMBOLIC;
    }

    @Override
    public String engineName() {
        return "SymbolicEngine";
    }

    private static boolean needsVariable(MathOperation op) {
        return op == MathOperation.SOLVE || op == MathOperation.DIFFERENTIATE || op == MathOperation.INTEGRATE;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
