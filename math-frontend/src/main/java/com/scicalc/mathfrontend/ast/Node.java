package com.scicalc.mathfrontend.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable expression tree produced by the parser. Every node owns its children exclusively
 * and remembers the source span it was parsed from.
 */
public abstract class Node {

    private final SourcePosition position;

    protected Node(SourcePosition position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public SourcePosition getPosition() { return position; }

    /** Number of nodes in this subtree, this node included. */
    public abstract int nodeCount();

    public static class NumberNode extends Node {
        private final double value;

        public NumberNode(double value, SourcePosition position) {
            super(position);
            this.value = value;
        }

        public double getValue() { return value; }

        @Override
        public int nodeCount() { return 1; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof NumberNode other)) return false;
            return Double.compare(value, other.value) == 0 && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(value, getPosition()); }

        @Override
        public String toString() { return String.valueOf(value); }
    }

    public static class BinaryNode extends Node {
        private final Node left;
        private final BinaryOperator operator;
        private final Node right;

        public BinaryNode(Node left, BinaryOperator operator, Node right, SourcePosition position) {
            super(position);
            this.left = Objects.requireNonNull(left, "left");
            this.operator = Objects.requireNonNull(operator, "operator");
            this.right = Objects.requireNonNull(right, "right");
        }

        public Node getLeft() { return left; }
        public BinaryOperator getOperator() { return operator; }
        public Node getRight() { return right; }

        @Override
        public int nodeCount() { return 1 + left.nodeCount() + right.nodeCount(); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryNode other)) return false;
            return operator == other.operator && left.equals(other.left) && right.equals(other.right)
                    && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(left, operator, right, getPosition()); }

        @Override
        public String toString() { return "(" + left + " " + operator.getSymbol() + " " + right + ")"; }
    }

    public static class UnaryNode extends Node {
        private final UnaryOperator operator;
        private final Node operand;

        public UnaryNode(UnaryOperator operator, Node operand, SourcePosition position) {
            super(position);
            this.operator = Objects.requireNonNull(operator, "operator");
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        public UnaryOperator getOperator() { return operator; }
        public Node getOperand() { return operand; }

        @Override
        public int nodeCount() { return 1 + operand.nodeCount(); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof UnaryNode other)) return false;
            return operator == other.operator && operand.equals(other.operand) && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(operator, operand, getPosition()); }

        @Override
        public String toString() { return "(" + operator.getSymbol() + operand + ")"; }
    }

    public static class FunctionNode extends Node {
        private final MathFunction function;
        private final Node argument;

        public FunctionNode(MathFunction function, Node argument, SourcePosition position) {
            super(position);
            this.function = Objects.requireNonNull(function, "function");
            this.argument = Objects.requireNonNull(argument, "argument");
        }

        public MathFunction getFunction() { return function; }
        public Node getArgument() { return argument; }

        @Override
        public int nodeCount() { return 1 + argument.nodeCount(); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionNode other)) return false;
            return function == other.function && argument.equals(other.argument) && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(function, argument, getPosition()); }

        @Override
        public String toString() { return function.functionName() + "(" + argument + ")"; }
    }

    public static class ConstantNode extends Node {
        private final MathConstant constant;

        public ConstantNode(MathConstant constant, SourcePosition position) {
            super(position);
            this.constant = Objects.requireNonNull(constant, "constant");
        }

        public MathConstant getConstant() { return constant; }

        @Override
        public int nodeCount() { return 1; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ConstantNode other)) return false;
            return constant == other.constant && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(constant, getPosition()); }

        @Override
        public String toString() { return constant.constantName(); }
    }

    public static class VariableNode extends Node {
        private final String name;

        public VariableNode(String name, SourcePosition position) {
            super(position);
            this.name = Objects.requireNonNull(name, "name");
        }

        public String getName() { return name; }

        @Override
        public int nodeCount() { return 1; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof VariableNode other)) return false;
            return name.equals(other.name) && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(name, getPosition()); }

        @Override
        public String toString() { return name; }
    }

    /**
     * Call of a function only the symbolic collaborator knows (e.g. {@code gamma(x)}).
     * The parser never produces it; callers build it for the symbolic path.
     */
    public static class SymbolicFunctionNode extends Node {
        private final String name;
        private final List<Node> arguments;

        public SymbolicFunctionNode(String name, List<Node> arguments, SourcePosition position) {
            super(position);
            this.name = Objects.requireNonNull(name, "name");
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        public String getName() { return name; }
        public List<Node> getArguments() { return arguments; }

        @Override
        public int nodeCount() {
            int count = 1;
            for (Node argument : arguments) {
                count += argument.nodeCount();
            }
            return count;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SymbolicFunctionNode other)) return false;
            return name.equals(other.name) && arguments.equals(other.arguments) && getPosition().equals(other.getPosition());
        }

        @Override
        public int hashCode() { return Objects.hash(name, arguments, getPosition()); }

        @Override
        public String toString() {
            return name + "(" + arguments.stream().map(Node::toString).collect(Collectors.joining(", ")) + ")";
        }
    }
}
