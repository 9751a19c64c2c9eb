package com.gggp.demo;

import com.gggp.engine.core.Individual;
import com.gggp.engine.core.Population;
import com.gggp.engine.fitness.FitnessCase;
import com.gggp.engine.fitness.FitnessEvaluator;
import com.gggp.engine.grammar.ArithmeticGrammar;
import com.gggp.engine.grammar.Grammar;
import com.gggp.engine.select.Selection;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Evolves an expression for x² over five sample points and reports the best of each generation. */
public final class SymbolicRegressionDemo {

    private static final Logger log = LoggerFactory.getLogger(SymbolicRegressionDemo.class);

    static final class Options {
        int generations = 30;
        int population = 100;
        long seed = 42L;
        double penalty = 0.01;
    }

    private SymbolicRegressionDemo() {
        // Utility class
    }

    public static void main(String[] args) {
        Options options = parseOptions(args);
        log.info(
                "Starting run: generations={}, population={}, seed={}, penalty={}",
                options.generations,
                options.population,
                options.seed,
                options.penalty);

        List<FitnessCase> cases =
                List.of(
                        FitnessCase.of("x", -2, 4),
                        FitnessCase.of("x", -1, 1),
                        FitnessCase.of("x", 0, 0),
                        FitnessCase.of("x", 1, 1),
                        FitnessCase.of("x", 2, 4));
        Grammar grammar =
                ArithmeticGrammar.build(List.of("x"), List.of("0", "1", "2"), List.of("+", "-", "*"));
        FitnessEvaluator evaluator = new FitnessEvaluator(cases, options.penalty);

        Population.Config config = new Population.Config();
        config.size = options.population;
        Population population = new Population(grammar, evaluator, config, new Random(options.seed));

        for (int gen = 0; gen < options.generations; gen++) {
            population.evaluate();
            System.out.println(formatReport(gen, population.best()));
            population.evolveOneGeneration();
        }
        log.info("Finished after {} generations", options.generations);
    }

    static String formatReport(int generation, Individual best) {
        return String.format(
                Locale.ROOT,
                "Gen %02d | Fitness=%.4f | Size=%d | Expr=%s",
                generation,
                best.adjustedFitness().orElse(Double.NaN),
                best.complexity().nodeCount(),
                best.expression());
    }

    static Options parseOptions(String[] args) {
        Options options = new Options();
        if (args == null) {
            return options;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            try {
                if (arg.startsWith("--generations=")) {
                    int value = Integer.parseInt(valueOf(arg));
                    if (value < 0) {
                        reject(arg, "must not be negative");
                    } else {
                        options.generations = value;
                    }
                } else if (arg.startsWith("--population=")) {
                    int value = Integer.parseInt(valueOf(arg));
                    if (value < Selection.DEFAULT_TOURNAMENT_SIZE) {
                        reject(arg, "must be at least " + Selection.DEFAULT_TOURNAMENT_SIZE);
                    } else {
                        options.population = value;
                    }
                } else if (arg.startsWith("--seed=")) {
                    options.seed = Long.parseLong(valueOf(arg));
                } else if (arg.startsWith("--penalty=")) {
                    double value = Double.parseDouble(valueOf(arg));
                    if (!(value >= 0.0)) {
                        reject(arg, "must be a non-negative number");
                    } else {
                        options.penalty = value;
                    }
                } else {
                    System.err.println("Ignoring unknown argument: " + arg);
                }
            } catch (NumberFormatException e) {
                reject(arg, "is not a number");
            }
        }
        return options;
    }

    private static void reject(String arg, String reason) {
        System.err.println("Invalid value for " + arg + " (" + reason + "), keeping default");
    }

    private static String valueOf(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }
}
