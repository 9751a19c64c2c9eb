package com.gggp.engine.fitness;

import com.gggp.engine.expr.EvaluationException;
import com.gggp.engine.expr.ExpressionNode;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores expressions by their negated mean squared error over a fixed set of fitness cases, and
 * individuals by that error minus a parsimony penalty proportional to their size.
 *
 * <p>An expression that fails to evaluate on any case scores {@link Double#NEGATIVE_INFINITY}; no
 * partial credit is given for the cases that did evaluate.
 */
public final class FitnessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FitnessEvaluator.class);

    private final List<FitnessCase> cases;
    private final double penaltyCoefficient;

    public FitnessEvaluator(List<FitnessCase> cases) {
        this(cases, 0.0);
    }

    public FitnessEvaluator(List<FitnessCase> cases, double penaltyCoefficient) {
        this.cases = List.copyOf(Objects.requireNonNull(cases, "cases"));
        if (this.cases.isEmpty()) {
            throw new IllegalArgumentException("At least one fitness case is required");
        }
        if (!(penaltyCoefficient >= 0.0)) {
            throw new IllegalArgumentException(
                    "penaltyCoefficient must be non-negative, got " + penaltyCoefficient);
        }
        this.penaltyCoefficient = penaltyCoefficient;
    }

    public List<FitnessCase> cases() {
        return cases;
    }

    public double penaltyCoefficient() {
        return penaltyCoefficient;
    }

    /** Returns the negated mean squared error of {@code expression}; higher is better. */
    public double evaluateExpression(ExpressionNode expression) {
        double sumOfSquares = 0.0;
        for (FitnessCase fitnessCase : cases) {
            double value;
            try {
                value = expression.evaluate(fitnessCase.inputs());
            } catch (EvaluationException e) {
                log.trace("Disqualified {}: {}", expression, e.getMessage());
                return Double.NEGATIVE_INFINITY;
            }
            double error = value - fitnessCase.target();
            sumOfSquares += error * error;
        }
        double mse = sumOfSquares / cases.size();
        if (Double.isNaN(mse)) {
            return Double.NEGATIVE_INFINITY;
        }
        return -mse;
    }

    /**
     * Scores {@code target}, stores the raw and adjusted fitness on it and returns the adjusted
     * value.
     */
    public double evaluate(Scoreable target) {
        Objects.requireNonNull(target, "target");
        double rawFitness = evaluateExpression(target.expression());
        double adjustedFitness = rawFitness - penaltyCoefficient * target.complexity().scalar();
        target.recordFitness(rawFitness, adjustedFitness);
        return adjustedFitness;
    }

    /** Same fitness cases, different parsimony pressure. */
    public FitnessEvaluator withPenalty(double penaltyCoefficient) {
        return new FitnessEvaluator(cases, penaltyCoefficient);
    }
}
