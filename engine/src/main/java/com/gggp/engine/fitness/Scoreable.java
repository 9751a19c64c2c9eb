package com.gggp.engine.fitness;

import com.gggp.engine.expr.ExpressionNode;
import com.gggp.engine.metrics.ComplexityMetrics;

/** Something a {@link FitnessEvaluator} can score: an expression, its size, and a place for the result. */
public interface Scoreable {

    ExpressionNode expression();

    ComplexityMetrics complexity();

    void recordFitness(double rawFitness, double adjustedFitness);
}
