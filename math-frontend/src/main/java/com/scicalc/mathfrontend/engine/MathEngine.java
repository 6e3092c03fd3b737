package com.scicalc.mathfrontend.engine;

import com.scicalc.mathfrontend.ast.Node;

/**
 * An evaluator for parsed expressions. Exactly two exist, one per {@link ComputationMode}.
 */
public interface MathEngine {

    /**
     * @param variable the variable an operation such as solve or differentiate works on; may be null
     */
    EvaluationResult evaluate(Node ast, EvaluationContext context, MathOperation operation, String variable);

    default EvaluationResult evaluate(Node ast, EvaluationContext context) {
        return evaluate(ast, context, MathOperation.EVALUATE, null);
    }

    ComputationMode mode();

    String engineName();
}
