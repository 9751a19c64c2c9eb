package com.gggp.engine.core;

import com.gggp.engine.expr.ArithmeticTreeBuilder;
import com.gggp.engine.expr.ExpressionBuilder;
import com.gggp.engine.fitness.FitnessEvaluator;
import com.gggp.engine.grammar.Grammar;
import com.gggp.engine.mut.Variation;
import com.gggp.engine.select.Selection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size generational population. Each transition fills every slot either with the child of
 * two tournament winners (with probability {@link Config#crossoverRate}) or with a mutant of one
 * tournament winner, then discards the previous generation. There is no elitism.
 *
 * <p>All randomness comes from the {@link Random} handed to the constructor.
 */
public final class Population {

    private static final Logger log = LoggerFactory.getLogger(Population.class);

    public static final class Config {
        public int size = 50;
        public double crossoverRate = 0.9;
        /** Reported alongside the run; every slot not filled by crossover is filled by mutation. */
        public double mutationRate = 0.1;
        public int maxDepth = 6;
        public int tournamentSize = Selection.DEFAULT_TOURNAMENT_SIZE;

        void validate() {
            if (size < 1) {
                throw new IllegalArgumentException("size must be positive, got " + size);
            }
            checkRate("crossoverRate", crossoverRate);
            checkRate("mutationRate", mutationRate);
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
            }
            if (tournamentSize < 1 || tournamentSize > size) {
                throw new IllegalArgumentException(
                        "tournamentSize must be in [1, " + size + "], got " + tournamentSize);
            }
        }

        private static void checkRate(String name, double rate) {
            if (!(rate >= 0.0 && rate <= 1.0)) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got " + rate);
            }
        }
    }

    private final FitnessEvaluator evaluator;
    private final Config config;
    private final Random random;
    private final Variation.Recombinator crossover;
    private final Variation.Mutator mutation;

    private List<Individual> individuals;
    private int generation;

    public Population(Grammar grammar, FitnessEvaluator evaluator, Config config, Random random) {
        this(grammar, evaluator, new ArithmeticTreeBuilder(), config, random);
    }

    public Population(
            Grammar grammar,
            FitnessEvaluator evaluator,
            ExpressionBuilder builder,
            Config config,
            Random random) {
        Objects.requireNonNull(grammar, "grammar");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(builder, "builder");
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
        config.validate();
        this.crossover = new Variation.SubtreeCrossover(builder);
        this.mutation = new Variation.SubtreeMutation(grammar, builder, config.maxDepth);

        List<Individual> initial = new ArrayList<>(config.size);
        for (int i = 0; i < config.size; i++) {
            initial.add(Individual.generate(grammar, builder, random, config.maxDepth));
        }
        this.individuals = initial;
        log.debug(
                "Initialized population: size={}, crossoverRate={}, mutationRate={}, maxDepth={}",
                config.size,
                config.crossoverRate,
                config.mutationRate,
                config.maxDepth);
    }

    public List<Individual> individuals() {
        return Collections.unmodifiableList(individuals);
    }

    public int size() {
        return individuals.size();
    }

    /** Number of completed calls to {@link #evolveOneGeneration()}. */
    public int generation() {
        return generation;
    }

    public void evaluate() {
        for (Individual individual : individuals) {
            individual.evaluate(evaluator);
        }
    }

    /**
     * Returns the individual with the highest adjusted fitness, the earliest one on ties.
     *
     * @throws IllegalStateException if some individual has not been evaluated
     */
    public Individual best() {
        Individual best = null;
        for (Individual individual : individuals) {
            if (!individual.isEvaluated()) {
                throw new IllegalStateException("Population must be evaluated before best()");
            }
            if (best == null
                    || individual.adjustedFitness().getAsDouble()
                            > best.adjustedFitness().getAsDouble()) {
                best = individual;
            }
        }
        return best;
    }

    public void evolveOneGeneration() {
        List<Individual> next = new ArrayList<>(config.size);
        int crossovers = 0;
        while (next.size() < config.size) {
            if (random.nextDouble() < config.crossoverRate) {
                Individual first = Selection.tournament(individuals, config.tournamentSize, random);
                Individual second = Selection.tournament(individuals, config.tournamentSize, random);
                next.add(crossover.recombine(first, second, random));
                crossovers++;
            } else {
                Individual parent = Selection.tournament(individuals, config.tournamentSize, random);
                next.add(mutation.mutate(parent, random));
            }
        }
        individuals = next;
        generation++;
        log.debug(
                "Generation {}: {} crossovers, {} mutations",
                generation,
                crossovers,
                config.size - crossovers);
    }
}
