package com.gggp.engine.gen;

import com.gggp.engine.grammar.Grammar;
import com.gggp.engine.grammar.Grammar.Production;
import com.gggp.engine.grammar.GrammarException;
import com.gggp.engine.tree.DerivationTree;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Tree generators that expand grammar symbols into derivation trees.
 */
public final class TreeGenerators {

    private TreeGenerators() {}

    public interface TreeGenerator {
        DerivationTree generate(String symbol, int maxDepth, Random random);
    }

    /**
     * Picks productions uniformly at random, steering away from growth once the depth limit is
     * reached instead of truncating the tree.
     *
     * <p>Below {@code maxDepth} every production is eligible. At or past it, terminal-only
     * productions are preferred; failing those, productions that do not mention the symbol being
     * expanded; failing those, all productions. The bound is therefore soft: a grammar that can
     * only grow through other non-terminals may still exceed it.
     */
    public static final class DepthBoundedGenerator implements TreeGenerator {
        private final Grammar grammar;

        public DepthBoundedGenerator(Grammar grammar) {
            this.grammar = Objects.requireNonNull(grammar, "grammar");
        }

        @Override
        public DerivationTree generate(String symbol, int maxDepth, Random random) {
            Objects.requireNonNull(random, "random");
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
            }
            return new DerivationTree(expand(symbol, 0, maxDepth, random));
        }

        private DerivationTree.Node expand(String symbol, int depth, int maxDepth, Random random) {
            if (!Grammar.isNonTerminal(symbol)) {
                return new DerivationTree.Node(symbol);
            }
            List<Production> productions = grammar.productionsFor(symbol);
            if (productions.isEmpty()) {
                throw new GrammarException("No productions registered for symbol " + symbol);
            }
            List<Production> options = eligible(symbol, productions, depth, maxDepth);
            Production production = options.get(random.nextInt(options.size()));
            DerivationTree.Node node = new DerivationTree.Node(symbol);
            for (String token : production.tokens) {
                node.children.add(expand(token, depth + 1, maxDepth, random));
            }
            return node;
        }

        static List<Production> eligible(
                String symbol, List<Production> productions, int depth, int maxDepth) {
            if (depth < maxDepth) {
                return productions;
            }
            List<Production> terminalOnly =
                    productions.stream().filter(Production::isTerminalOnly).toList();
            if (!terminalOnly.isEmpty()) {
                return terminalOnly;
            }
            List<Production> nonRecursive =
                    productions.stream().filter(p -> !p.isSelfRecursive(symbol)).toList();
            return nonRecursive.isEmpty() ? productions : nonRecursive;
        }
    }
}
