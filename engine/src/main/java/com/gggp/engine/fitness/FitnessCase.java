package com.gggp.engine.fitness;

import java.util.Map;
import java.util.Objects;

/**
 * One supervised example: variable bindings and the value the expression should produce for them.
 */
public record FitnessCase(Map<String, Double> inputs, double target) {

    public FitnessCase {
        inputs = Map.copyOf(Objects.requireNonNull(inputs, "inputs"));
    }

    public static FitnessCase of(String variable, double value, double target) {
        return new FitnessCase(Map.of(variable, value), target);
    }
}
