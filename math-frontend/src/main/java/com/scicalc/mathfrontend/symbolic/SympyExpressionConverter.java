package com.scicalc.mathfrontend.symbolic;

import java.util.stream.Collectors;

import com.scicalc.mathfrontend.ast.MathConstant;
import com.scicalc.mathfrontend.ast.Node;
import com.scicalc.mathfrontend.ast.UnaryOperator;

/**
 * Renders an AST in the syntax the SymPy service parses: {@code **} for powers,
 * {@code Eq(l, r)} for equations, {@code log(x, 10)} for base-10 logs.
 */
public final class SympyExpressionConverter {

    private SympyExpressionConverter() {
    }

    public static String convert(Node node) {
        if (node instanceof Node.NumberNode number) {
            return formatNumber(number.getValue());
        }
        if (node instanceof Node.ConstantNode constant) {
            return constant.getConstant() == MathConstant.PI ? "pi" : "E";
        }
        if (node instanceof Node.VariableNode variable) {
            return variable.getName();
        }
        if (node instanceof Node.UnaryNode unary) {
            String operand = convert(unary.getOperand());
            if (unary.getOperator() == UnaryOperator.POSITIVE) {
                return operand;
            }
            return "-" + wrap(unary.getOperand(), operand);
        }
        if (node instanceof Node.BinaryNode binary) {
            return convertBinary(binary);
        }
        if (node instanceof Node.FunctionNode function) {
            String argument = convert(function.getArgument());
            switch (function.getFunction()) {
                case LOG: return "log(" + argument + ", 10)";
                case LN: return "log(" + argument + ")";
                default: return function.getFunction().functionName() + "(" + argument + ")";
            }
        }
        if (node instanceof Node.SymbolicFunctionNode symbolic) {
            return symbolic.getName() + "(" + symbolic.getArguments().stream()
                    .map(SympyExpressionConverter::convert)
                    .collect(Collectors.joining(", ")) + ")";
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    private static String convertBinary(Node.BinaryNode binary) {
        Node leftNode = binary.getLeft();
        Node rightNode = binary.getRight();
        String left = convert(leftNode);
        String right = convert(rightNode);

        switch (binary.getOperator()) {
            case ADD: return left + " + " + right;
            case SUBTRACT: return left + " - " + wrap(rightNode, right);
            case MULTIPLY: return wrap(leftNode, left) + "*" + wrap(rightNode, right);
            case DIVIDE: return wrap(leftNode, left) + "/" + wrap(rightNode, right);
            case POWER: return wrapBase(leftNode, left) + "**" + wrap(rightNode, right);
            case EQUALS: return "Eq(" + left + ", " + right + ")";
            default: throw new IllegalArgumentException("Unsupported operator: " + binary.getOperator());
        }
    }

    private static String wrap(Node node, String text) {
        return node instanceof Node.BinaryNode ? "(" + text + ")" : text;
    }

    // ** binds tighter than a leading sign: -x**2 is -(x**2)
    private static String wrapBase(Node base, String text) {
        boolean signed = base instanceof Node.UnaryNode
                || (base instanceof Node.NumberNode number && number.getValue() < 0);
        return signed ? "(" + text + ")" : wrap(base, text);
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
