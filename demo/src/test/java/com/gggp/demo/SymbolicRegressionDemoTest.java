package com.gggp.demo;

import static org.junit.jupiter.api.Assertions.*;

import com.gggp.engine.core.Individual;
import com.gggp.engine.expr.ExpressionNode;
import com.gggp.engine.metrics.ComplexityMetrics;
import com.gggp.engine.tree.DerivationTree;
import org.junit.jupiter.api.Test;

final class SymbolicRegressionDemoTest {

    @Test
    void parsesKnownOptions() {
        SymbolicRegressionDemo.Options options =
                SymbolicRegressionDemo.parseOptions(
                        new String[] {"--generations=5", "--population=12", "--seed=7", "--penalty=0.5"});
        assertEquals(5, options.generations);
        assertEquals(12, options.population);
        assertEquals(7L, options.seed);
        assertEquals(0.5, options.penalty);
    }

    @Test
    void keepsDefaultsOnBadInput() {
        SymbolicRegressionDemo.Options options =
                SymbolicRegressionDemo.parseOptions(new String[] {"--generations=many", "--verbose", null});
        assertEquals(30, options.generations);
        assertEquals(100, options.population);
        assertEquals(42L, options.seed);
        assertEquals(0.01, options.penalty);
        assertEquals(30, SymbolicRegressionDemo.parseOptions(null).generations);
    }

    @Test
    void keepsDefaultsOnOutOfRangeValues() {
        for (String[] args : new String[][] {
                {"--population=2"}, {"--population=0"}, {"--penalty=-1"}, {"--penalty=NaN"},
                {"--generations=-3"}}) {
            SymbolicRegressionDemo.Options options = SymbolicRegressionDemo.parseOptions(args);
            assertEquals(30, options.generations, args[0]);
            assertEquals(100, options.population, args[0]);
            assertEquals(0.01, options.penalty, args[0]);
        }
        assertEquals(3, SymbolicRegressionDemo.parseOptions(new String[] {"--population=3"}).population);
        assertEquals(0, SymbolicRegressionDemo.parseOptions(new String[] {"--generations=0"}).generations);
    }

    @Test
    void outOfRangeValuesDoNotAbortRun() {
        assertDoesNotThrow(() -> SymbolicRegressionDemo.main(
                new String[] {"--generations=1", "--population=2", "--penalty=-1"}));
    }

    @Test
    void formatsReportLine() {
        Individual best =
                new Individual(
                        new DerivationTree(new DerivationTree.Node("<expr>")),
                        ExpressionNode.operator("*", ExpressionNode.variable("x"), ExpressionNode.variable("x")),
                        new ComplexityMetrics(10, 5, 3));
        best.recordFitness(0.0, -0.1);
        assertEquals(
                "Gen 03 | Fitness=-0.1000 | Size=10 | Expr=(x * x)",
                SymbolicRegressionDemo.formatReport(3, best));
    }

    @Test
    void runsShortEvolution() {
        assertDoesNotThrow(
                () -> SymbolicRegressionDemo.main(new String[] {"--generations=2", "--population=10"}));
    }
}
