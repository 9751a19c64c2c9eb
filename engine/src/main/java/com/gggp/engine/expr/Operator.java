package com.gggp.engine.expr;

import java.util.Optional;
import java.util.function.DoubleBinaryOperator;

/** Closed set of binary arithmetic operators an expression tree can apply. */
public enum Operator {
    ADD("+", (a, b) -> a + b),
    SUBTRACT("-", (a, b) -> a - b),
    MULTIPLY("*", (a, b) -> a * b),
    DIVIDE("/", Operator::safeDivide);

    /** Denominators smaller than this in magnitude are treated as a division by zero. */
    public static final double DIVISION_EPSILON = 1e-12;

    private final String symbol;
    private final DoubleBinaryOperator function;

    Operator(String symbol, DoubleBinaryOperator function) {
        this.symbol = symbol;
        this.function = function;
    }

    public String symbol() {
        return symbol;
    }

    public double apply(double left, double right) {
        return function.applyAsDouble(left, right);
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    private static double safeDivide(double left, double right) {
        if (Math.abs(right) < DIVISION_EPSILON) {
            throw new EvaluationException("Division by zero in expression evaluation");
        }
        return left / right;
    }
}
