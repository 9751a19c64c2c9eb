package com.gggp.engine.select;

import com.gggp.engine.core.Individual;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/** Fitness comparison with a parsimony tie-break, and tournament selection built on it. */
public final class Selection {

    public static final double DEFAULT_TOLERANCE = 1e-12;
    public static final int DEFAULT_TOURNAMENT_SIZE = 3;

    private Selection() {}

    public static Individual preferFittest(Individual a, Individual b) {
        return preferFittest(a, b, DEFAULT_TOLERANCE);
    }

    /**
     * Returns the individual with the higher adjusted fitness. Fitness values within {@code
     * tolerance} of each other count as a tie, which goes to the smaller complexity; {@code a} wins
     * if both are equally complex.
     *
     * @throws IllegalStateException if either individual has not been evaluated
     */
    public static Individual preferFittest(Individual a, Individual b, double tolerance) {
        if (!a.isEvaluated() || !b.isEvaluated()) {
            throw new IllegalStateException("Individuals must be evaluated before comparison");
        }
        double diff = a.adjustedFitness().getAsDouble() - b.adjustedFitness().getAsDouble();
        if (diff > tolerance) {
            return a;
        }
        if (diff < -tolerance) {
            return b;
        }
        return a.complexity().compareTo(b.complexity()) <= 0 ? a : b;
    }

    public static Individual tournament(List<Individual> population, Random random) {
        return tournament(population, DEFAULT_TOURNAMENT_SIZE, random);
    }

    /**
     * Samples {@code tournamentSize} distinct individuals uniformly and returns the one {@link
     * #preferFittest} ranks first.
     *
     * @throws IllegalArgumentException if the tournament is empty or larger than the population
     */
    public static Individual tournament(
            List<Individual> population, int tournamentSize, Random random) {
        Objects.requireNonNull(random, "random");
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("Tournament size must be positive");
        }
        if (population.size() < tournamentSize) {
            throw new IllegalArgumentException("Tournament size cannot exceed population size");
        }
        // Floyd's sampling: k distinct indices from k draws, without touching the rest.
        int n = population.size();
        Set<Integer> chosen = new LinkedHashSet<>();
        for (int j = n - tournamentSize; j < n; j++) {
            int t = random.nextInt(j + 1);
            chosen.add(chosen.contains(t) ? j : t);
        }
        Individual winner = null;
        for (int index : chosen) {
            Individual contender = population.get(index);
            winner = winner == null ? contender : preferFittest(winner, contender);
        }
        return winner;
    }
}
