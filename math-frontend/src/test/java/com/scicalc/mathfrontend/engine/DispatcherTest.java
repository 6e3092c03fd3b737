package com.scicalc.mathfrontend.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.scicalc.mathfrontend.ast.Node;

class DispatcherTest {

    /** Records every call and answers with a fixed symbolic result. */
    private static class RecordingSymbolicEngine implements MathEngine {
        final List<MathOperation> operations = new ArrayList<>();
        final List<String> variables = new ArrayList<>();

        @Override
        public EvaluationResult evaluate(Node ast, EvaluationContext context, MathOperation operation, String variable) {
            operations.add(operation);
            variables.add(variable);
            return EvaluationResult.symbolic("[7]", "\\left[ 7\\right]", Map.of("conversion", 0.1, "python", 4.0));
        }

        @Override
        public ComputationMode mode() {
            return ComputationMode.SYMBOLIC;
        }

        @Override
        public String engineName() {
            return "RecordingSymbolicEngine";
        }
    }

    private RecordingSymbolicEngine symbolic;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        symbolic = new RecordingSymbolicEngine();
        dispatcher = new Dispatcher(new NumericEngine(), symbolic);
    }

    @Test
    void numericExpressionNeverReachesSymbolicEngine() {
        EvaluationReport report = dispatcher.evaluate("2 + 3 * 4");

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getResult().getNumber()).isEqualTo(14.0);
        assertThat(report.getResultString()).isEqualTo("14");
        assertThat(report.getMetrics().getAstNodeCount()).isEqualTo(5);
        assertThat(report.getMetrics().getExpressionLength()).isEqualTo(9);
        assertThat(report.getMetrics().getSymbolicCallTimeMs()).isNull();
        assertThat(symbolic.operations).isEmpty();
    }

    @Test
    void equationFallsBackToSymbolicSolveExactlyOnce() {
        EvaluationReport report = dispatcher.evaluate("3*x - 5 = 16");

        assertThat(symbolic.operations).containsExactly(MathOperation.SOLVE);
        assertThat(symbolic.variables).containsExactly("x");
        assertThat(report.getResult().getType()).isEqualTo(EvaluationResult.Type.SYMBOLIC);
        assertThat(report.getMetrics().getSymbolicCallTimeMs()).isEqualTo(4.0);
        assertThat(report.getMetrics().getConversionTimeMs()).isEqualTo(0.1);
    }

    @Test
    void solveVariableIsFirstVariableInExpression() {
        dispatcher.evaluate("2t + 1 = 9");

        assertThat(symbolic.variables).containsExactly("t");
    }

    @Test
    void unboundVariableFallsBackAsEvaluation() {
        dispatcher.evaluate("x + 1");

        assertThat(symbolic.operations).containsExactly(MathOperation.EVALUATE);
        assertThat(symbolic.variables).containsExactly((String) null);
    }

    @Test
    void boundVariableStaysNumeric() {
        EvaluationReport report = dispatcher.evaluate("x + 1", ComputationMode.NUMERIC,
                EvaluationContext.withBindings(Map.of("x", 2.0)), MathOperation.EVALUATE, null);

        assertThat(report.getResult().getNumber()).isEqualTo(3.0);
        assertThat(symbolic.operations).isEmpty();
    }

    @Test
    void arithmeticErrorsDoNotFallBack() {
        EvaluationReport report = dispatcher.evaluate("1/0");

        assertThat(report.getResult().hasIssue(EvaluationIssue.DIVISION_BY_ZERO)).isTrue();
        assertThat(report.getResultString()).isEqualTo("Error: Division by zero");
        assertThat(symbolic.operations).isEmpty();
    }

    @Test
    void nestedEqualsIsRejected() {
        EvaluationReport report = dispatcher.evaluate("1 = 2 = 3");

        assertThat(report.getResult().isError()).isTrue();
        assertThat(report.getResult().getIssue()).isNull();
        assertThat(symbolic.operations).isEmpty();
    }

    @Test
    void parseFailureIsReportedAsError() {
        EvaluationReport report = dispatcher.evaluate("2 +");

        assertThat(report.getResult().isError()).isTrue();
        assertThat(report.getResult().getErrorMessage()).isEqualTo("Unexpected end of input, expected expression");
        assertThat(report.getMetrics().getAstNodeCount()).isZero();
        assertThat(report.getMetrics().getEvalTimeMs()).isZero();
    }

    @Test
    void symbolicModeGoesStraightToSymbolicEngine() {
        dispatcher.setMode(ComputationMode.SYMBOLIC);

        EvaluationReport report = dispatcher.evaluate("2 + 2");

        assertThat(dispatcher.getMode()).isEqualTo(ComputationMode.SYMBOLIC);
        assertThat(symbolic.operations).containsExactly(MathOperation.EVALUATE);
        assertThat(report.getResult().getType()).isEqualTo(EvaluationResult.Type.SYMBOLIC);
    }

    @Test
    void explicitOperationAndVariablePassThrough() {
        dispatcher.evaluate("x^2 * y", ComputationMode.SYMBOLIC, EvaluationContext.empty(),
                MathOperation.DIFFERENTIATE, "y");

        assertThat(symbolic.operations).containsExactly(MathOperation.DIFFERENTIATE);
        assertThat(symbolic.variables).containsExactly("y");
    }

    @Test
    void engineForSelectsByMode() {
        assertThat(dispatcher.engineFor(ComputationMode.NUMERIC).mode()).isEqualTo(ComputationMode.NUMERIC);
        assertThat(dispatcher.engineFor(ComputationMode.SYMBOLIC)).isSameAs(symbolic);
    }
}
