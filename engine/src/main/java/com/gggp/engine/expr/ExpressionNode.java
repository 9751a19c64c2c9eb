package com.gggp.engine.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of an evaluatable arithmetic expression tree.
 *
 * <p>Finished trees are made of {@link Kind#OPERATOR}, {@link Kind#VARIABLE} and {@link
 * Kind#CONSTANT} nodes. {@link Kind#OPERATOR_TOKEN} and {@link Kind#LITERAL} only come out of
 * translating derivation fragments that sit in an unexpected place, and refuse to evaluate.
 */
public final class ExpressionNode {

    public enum Kind {
        OPERATOR,
        VARIABLE,
        CONSTANT,
        OPERATOR_TOKEN,
        LITERAL
    }

    private final Kind kind;
    private final String value;
    private final List<ExpressionNode> children;

    public ExpressionNode(Kind kind, String value, List<ExpressionNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.children = List.copyOf(children);
    }

    public static ExpressionNode operator(String symbol, ExpressionNode left, ExpressionNode right) {
        return new ExpressionNode(Kind.OPERATOR, symbol, List.of(left, right));
    }

    public static ExpressionNode variable(String name) {
        return new ExpressionNode(Kind.VARIABLE, name, List.of());
    }

    public static ExpressionNode constant(String literal) {
        return new ExpressionNode(Kind.CONSTANT, literal, List.of());
    }

    public static ExpressionNode constant(double value) {
        return constant(Double.toString(value));
    }

    public Kind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public List<ExpressionNode> children() {
        return children;
    }

    /**
     * Evaluates the expression under the given variable bindings.
     *
     * @throws EvaluationException if a variable is unbound, a constant is not numeric, an operator
     *     is unknown or lacks two operands, a denominator is near zero, or the node kind cannot be
     *     evaluated
     */
    public double evaluate(Map<String, Double> bindings) {
        switch (kind) {
            case VARIABLE -> {
                Double bound = bindings.get(value);
                if (bound == null) {
                    throw new EvaluationException("Variable " + value + " missing from context");
                }
                return bound;
            }
            case CONSTANT -> {
                try {
                    return Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new EvaluationException("Constant " + value + " is not numeric", e);
                }
            }
            case OPERATOR -> {
                Operator operator =
                        Operator.fromSymbol(value)
                                .orElseThrow(
                                        () -> new EvaluationException(
                                                "Operator " + value + " not registered"));
                if (children.size() != 2) {
                    throw new EvaluationException("Operator nodes require exactly two operands");
                }
                double left = children.get(0).evaluate(bindings);
                double right = children.get(1).evaluate(bindings);
                return operator.apply(left, right);
            }
            default -> throw new EvaluationException("Unsupported expression node kind " + kind);
        }
    }

    /** Variable names referenced below this node, left to right, duplicates included. */
    public List<String> collectVariables() {
        List<String> result = new ArrayList<>();
        collectVariables(result);
        return result;
    }

    private void collectVariables(List<String> sink) {
        if (kind == Kind.VARIABLE) {
            sink.add(value);
            return;
        }
        for (ExpressionNode child : children) {
            child.collectVariables(sink);
        }
    }

    /** Infix rendering, fully parenthesised, e.g. {@code ((x * x) + 1)}. */
    @Override
    public String toString() {
        if (kind == Kind.OPERATOR && children.size() == 2) {
            return "(" + children.get(0) + " " + value + " " + children.get(1) + ")";
        }
        return value;
    }
}
