package com.scicalc.mathfrontend.engine;

import com.scicalc.mathfrontend.ast.BinaryOperator;
import com.scicalc.mathfrontend.ast.MathFunction;
import com.scicalc.mathfrontend.ast.Node;
import com.scicalc.mathfrontend.ast.UnaryOperator;

/**
 * Double-precision tree walk. Failures surface as error results tagged with an
 * {@link EvaluationIssue}; no NaN or infinity ever leaves this class as a number.
 */
public class NumericEngine implements MathEngine {

    @Override
    public EvaluationResult evaluate(Node ast, EvaluationContext context, MathOperation operation, String variable) {
        if (operation != null && operation != MathOperation.EVALUATE) {
            return EvaluationResult.notImplemented("Numeric engine cannot " + operation.label() + " expressions");
        }
        try {
            return EvaluationResult.number(evaluateNode(ast, context == null ? EvaluationContext.empty() : context));
        } catch (EvaluationException e) {
            return EvaluationResult.error(e.getMessage(), e.getIssue());
        }
    }

    @Override
    public ComputationMode mode() {
        return ComputationMode.NUMERIC;
    }

    @Override
    public String engineName() {
        return "NumericEngine";
    }

    private double evaluateNode(Node node, EvaluationContext context) throws EvaluationException {
        if (node instanceof Node.NumberNode number) {
            return number.getValue();
        }
        if (node instanceof Node.ConstantNode constant) {
            return constant.getConstant().getValue();
        }
        if (node instanceof Node.VariableNode variable) {
            Double value = context.lookup(variable.getName());
            if (value == null) {
                throw EvaluationException.undefinedVariable(variable.getName());
            }
            return finite(value);
        }
        if (node instanceof Node.UnaryNode unary) {
            double value = evaluateNode(unary.getOperand(), context);
            return unary.getOperator() == UnaryOperator.NEGATE ? -value : value;
        }
        if (node instanceof Node.BinaryNode binary) {
            double left = evaluateNode(binary.getLeft(), context);
            double right = evaluateNode(binary.getRight(), context);
            return evaluateBinary(left, binary.getOperator(), right);
        }
        if (node instanceof Node.FunctionNode function) {
            double argument = evaluateNode(function.getArgument(), context);
            return evaluateFunction(function.getFunction(), argument);
        }
        if (node instanceof Node.SymbolicFunctionNode symbolic) {
            throw EvaluationException.symbolicComputationRequired(
                    "Function '" + symbolic.getName() + "' is not supported in numeric mode");
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    private double evaluateBinary(double left, BinaryOperator op, double right) throws EvaluationException {
        switch (op) {
            case ADD:
                return finite(left + right);
            case SUBTRACT:
                return finite(left - right);
            case MULTIPLY:
                return finite(left * right);
            case DIVIDE:
                if (right == 0) {
                    throw EvaluationException.divisionByZero();
                }
                return finite(left / right);
            case POWER:
                return finite(Math.pow(left, right));
            case EQUALS:
                throw EvaluationException.cannotEvaluateEquality();
            default:
                throw new IllegalArgumentException("Unsupported operator: " + op);
        }
    }

    private double evaluateFunction(MathFunction function, double argument) throws EvaluationException {
        double result;
        switch (function) {
            case SIN:
                result = Math.sin(argument);
                break;
            case COS:
                result = Math.cos(argument);
                break;
            case TAN:
                result = Math.tan(argument);
                break;
            case LOG:
                if (!(argument > 0)) {
                    throw EvaluationException.domainError("log requires positive argument");
                }
                result = Math.log10(argument);
                break;
            case LN:
                if (!(argument > 0)) {
                    throw EvaluationException.domainError("ln requires positive argument");
                }
                result = Math.log(argument);
                break;
            case SQRT:
                if (!(argument >= 0)) {
                    throw EvaluationException.domainError("sqrt requires non-negative argument");
                }
                result = Math.sqrt(argument);
                break;
            default:
                throw new IllegalArgumentException("Unsupported function: " + function);
        }
        return finite(result);
    }

    private static double finite(double value) throws EvaluationException {
        if (!Double.isFinite(value)) {
            throw EvaluationException.overflow();
        }
        return value;
    }
}
