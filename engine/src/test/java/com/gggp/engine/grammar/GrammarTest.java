package com.gggp.engine.grammar;

import static org.junit.jupiter.api.Assertions.*;

import com.gggp.engine.expr.ArithmeticTreeBuilder;
import com.gggp.engine.expr.ExpressionNode;
import com.gggp.engine.grammar.Grammar.Production;
import com.gggp.engine.metrics.ComplexityMetrics;
import com.gggp.engine.tree.DerivationTree;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class GrammarTest {

    @Test
    void nonTerminalsAreRecognisedByAngleBrackets() {
        assertTrue(Grammar.isNonTerminal("<expr>"));
        assertFalse(Grammar.isNonTerminal("x"));
        assertFalse(Grammar.isNonTerminal("+"));
        assertFalse(Grammar.isNonTerminal("<"));
        assertFalse(Grammar.isNonTerminal("<expr"));
    }

    @Test
    void productionClassifiesTerminalOnlyAndSelfRecursive() {
        Production terminal = Production.of("a", "b");
        Production recursive = Production.of("<s>", "a");
        assertTrue(terminal.isTerminalOnly());
        assertFalse(recursive.isTerminalOnly());
        assertTrue(recursive.isSelfRecursive("<s>"));
        assertFalse(recursive.isSelfRecursive("<t>"));
        assertEquals(Production.of("a", "b"), terminal);
    }

    @Test
    void injectTerminalsReplacesExistingProductions() {
        Grammar grammar = ArithmeticGrammar.build(List.of("x1", "x2"), List.of("1", "2"));
        grammar.injectTerminals(ArithmeticGrammar.VAR, List.of("x3", "x4"));

        List<Production> productions = grammar.productionsFor(ArithmeticGrammar.VAR);
        assertEquals(List.of(Production.of("x3"), Production.of("x4")), productions);
    }

    @Test
    void injectTerminalsRejectsEmptyList() {
        Grammar grammar = new Grammar("<s>");
        assertThrows(GrammarException.class, () -> grammar.injectTerminals("<s>", List.of()));
    }

    @Test
    void setRulesReplacesProductions() {
        Grammar grammar = new Grammar("<s>");
        grammar.addRule("<s>", "a");
        grammar.setRules("<s>", List.of(List.of("b"), List.of("c", "d")));
        assertEquals(
                List.of(Production.of("b"), Production.of("c", "d")), grammar.productionsFor("<s>"));
        assertTrue(grammar.productionsFor("<missing>").isEmpty());
    }

    @Test
    void generateRejectsNonPositiveDepth() {
        Grammar grammar = ArithmeticGrammar.build(List.of("x"), List.of("1"));
        assertThrows(IllegalArgumentException.class, () -> grammar.generate(new Random(0), 0));
    }

    @Test
    void generateFailsOnNonTerminalWithoutProductions() {
        Grammar grammar = new Grammar("<s>");
        grammar.addRule("<s>", "<undefined>");
        GrammarException error =
                assertThrows(GrammarException.class, () -> grammar.generate(new Random(0), 3));
        assertTrue(error.getMessage().contains("<undefined>"));
    }

    @Test
    void terminalStartSymbolYieldsSingleLeaf() {
        DerivationTree tree = new Grammar("a").generate(new Random(0), 1);
        assertTrue(tree.root.isLeaf());
        assertEquals("a", tree.root.symbol);
    }

    @Test
    void depthLimitPrefersTerminalOnlyProductions() {
        Grammar grammar = new Grammar("<s>");
        grammar.addRule("<s>", "<s>", "<s>");
        grammar.addRule("<s>", "a");

        for (int seed = 0; seed < 20; seed++) {
            DerivationTree tree = grammar.generate(new Random(seed), 1);
            // At depth 0 anything goes, at depth 1 only the terminal rule remains.
            assertTrue(ComplexityMetrics.compute(tree).depth() <= 3, "seed " + seed);
        }
    }

    @Test
    void depthLimitFallsBackToNonRecursiveProductions() {
        Grammar grammar = new Grammar("<s>");
        grammar.addRule("<s>", "<s>", "<t>");
        grammar.addRule("<s>", "<t>");
        grammar.addRule("<t>", "b");

        for (int seed = 0; seed < 20; seed++) {
            DerivationTree tree = grammar.generate(new Random(seed), 1);
            DerivationTree.Node root = tree.root;
            for (DerivationTree.Node child : root.children) {
                if (child.symbol.equals("<s>")) {
                    assertEquals(1, child.children.size(), "non-recursive rule at the limit");
                    assertEquals("<t>", child.children.get(0).symbol);
                }
            }
        }
    }

    @Test
    void sameSeedGivesSameTree() {
        Grammar grammar = ArithmeticGrammar.build(List.of("x"), List.of("1", "2"));
        String first = grammar.generate(new Random(11), 5).toString();
        String second = grammar.generate(new Random(11), 5).toString();
        assertEquals(first, second);
    }

    @Test
    void generatedTreesHavePositiveSizeAndDepth() {
        Grammar grammar = ArithmeticGrammar.build(List.of("x"), List.of("0", "1"));
        for (int seed = 0; seed < 50; seed++) {
            ComplexityMetrics metrics =
                    ComplexityMetrics.compute(grammar.generate(new Random(seed), 1 + seed % 6));
            assertTrue(metrics.nodeCount() >= 1);
            assertTrue(metrics.depth() >= 1);
        }
    }

    @Test
    void generatedExpressionsOnlyUseGrammarVariables() {
        Grammar grammar = ArithmeticGrammar.build(List.of("x1", "x2"), List.of("1", "2"));
        ArithmeticTreeBuilder builder = new ArithmeticTreeBuilder();
        for (int seed = 0; seed < 50; seed++) {
            ExpressionNode expression = builder.build(grammar.generate(new Random(seed), 4));
            Set<String> used = Set.copyOf(expression.collectVariables());
            assertTrue(Set.of("x1", "x2").containsAll(used), "unexpected variables " + used);
        }
    }

    @Test
    void arithmeticGrammarUsesDefaultOperatorsWhenNoneGiven() {
        Grammar grammar = ArithmeticGrammar.build(List.of("x"), List.of("1"), List.of());
        Set<String> operators =
                grammar.productionsFor(ArithmeticGrammar.OP).stream()
                        .map(production -> production.tokens.get(0))
                        .collect(Collectors.toSet());
        assertEquals(Set.of("+", "-", "*", "/"), operators);
        assertEquals(
                List.of(ArithmeticGrammar.EXPR, ArithmeticGrammar.OPERATION, ArithmeticGrammar.VAR,
                        ArithmeticGrammar.CONST, ArithmeticGrammar.OP),
                List.copyOf(grammar.nonTerminals()));
    }
}
