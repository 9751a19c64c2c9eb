package com.gggp.engine.core;

import com.gggp.engine.expr.ExpressionBuilder;
import com.gggp.engine.expr.ExpressionNode;
import com.gggp.engine.fitness.FitnessEvaluator;
import com.gggp.engine.fitness.Scoreable;
import com.gggp.engine.grammar.Grammar;
import com.gggp.engine.metrics.ComplexityMetrics;
import com.gggp.engine.tree.DerivationTree;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * A candidate solution: a derivation tree, the expression built from it and its complexity.
 * Only the fitness values change after construction; each evaluation overwrites them.
 */
public final class Individual implements Scoreable {

    private final DerivationTree derivation;
    private final ExpressionNode expression;
    private final ComplexityMetrics complexity;
    private Double rawFitness;
    private Double adjustedFitness;

    public Individual(
            DerivationTree derivation, ExpressionNode expression, ComplexityMetrics complexity) {
        this.derivation = Objects.requireNonNull(derivation, "derivation");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.complexity = Objects.requireNonNull(complexity, "complexity");
    }

    /** Builds the expression and complexity of {@code derivation}, which the new individual owns. */
    public static Individual fromDerivation(DerivationTree derivation, ExpressionBuilder builder) {
        return new Individual(
                derivation, builder.build(derivation), ComplexityMetrics.compute(derivation));
    }

    public static Individual generate(
            Grammar grammar, ExpressionBuilder builder, Random random, int maxDepth) {
        return fromDerivation(grammar.generate(random, maxDepth), builder);
    }

    /**
     * Returns the live derivation tree, not a copy. Callers must not modify it: the expression and
     * complexity were computed from it. The variation operators work on a {@link
     * DerivationTree#deepCopy() deep copy}.
     */
    public DerivationTree derivation() {
        return derivation;
    }

    @Override
    public ExpressionNode expression() {
        return expression;
    }

    @Override
    public ComplexityMetrics complexity() {
        return complexity;
    }

    @Override
    public void recordFitness(double rawFitness, double adjustedFitness) {
        this.rawFitness = rawFitness;
        this.adjustedFitness = adjustedFitness;
    }

    public double evaluate(FitnessEvaluator evaluator) {
        return evaluator.evaluate(this);
    }

    public boolean isEvaluated() {
        return adjustedFitness != null;
    }

    public OptionalDouble rawFitness() {
        return rawFitness == null ? OptionalDouble.empty() : OptionalDouble.of(rawFitness);
    }

    public OptionalDouble adjustedFitness() {
        return adjustedFitness == null ? OptionalDouble.empty() : OptionalDouble.of(adjustedFitness);
    }

    @Override
    public String toString() {
        return "Individual{expr="
                + expression
                + ", complexity="
                + complexity
                + ", adjustedFitness="
                + adjustedFitness
                + "}";
    }
}
