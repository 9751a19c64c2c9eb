package com.gggp.engine.mut;

import com.gggp.engine.core.Individual;
import com.gggp.engine.expr.ExpressionBuilder;
import com.gggp.engine.grammar.Grammar;
import com.gggp.engine.tree.DerivationTree;
import com.gggp.engine.util.TreeOps;
import java.util.Objects;
import java.util.Random;

/**
 * Grammar-aware variation operators. They work on derivation trees, never on expressions, and
 * always hand back a new individual whose expression and complexity are rebuilt from its tree.
 * Parents are left untouched.
 */
public final class Variation {

    private Variation() {}

    public interface Mutator {
        Individual mutate(Individual parent, Random random);
    }

    public interface Recombinator {
        Individual recombine(Individual first, Individual second, Random random);
    }

    /**
     * Grafts a random subtree of the second parent over a random subtree of the first. Produces
     * one child; the rest of the second parent's material is dropped.
     */
    public static final class SubtreeCrossover implements Recombinator {
        private final ExpressionBuilder builder;

        public SubtreeCrossover(ExpressionBuilder builder) {
            this.builder = Objects.requireNonNull(builder, "builder");
        }

        @Override
        public Individual recombine(Individual first, Individual second, Random random) {
            DerivationTree a = first.derivation().deepCopy();
            DerivationTree b = second.derivation().deepCopy();
            DerivationTree.Node cut = TreeOps.randomSubtree(a.root, random);
            DerivationTree.Node donor = TreeOps.randomSubtree(b.root, random);
            return Individual.fromDerivation(TreeOps.replace(a, cut, donor), builder);
        }
    }

    /**
     * Replaces a randomly chosen subtree with a tree freshly grown from the grammar's start
     * symbol, whatever symbol the replaced node carried.
     */
    public static final class SubtreeMutation implements Mutator {
        private final Grammar grammar;
        private final ExpressionBuilder builder;
        private final int maxDepth;

        public SubtreeMutation(Grammar grammar, ExpressionBuilder builder, int maxDepth) {
            this.grammar = Objects.requireNonNull(grammar, "grammar");
            this.builder = Objects.requireNonNull(builder, "builder");
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
            }
            this.maxDepth = maxDepth;
        }

        @Override
        public Individual mutate(Individual parent, Random random) {
            DerivationTree tree = parent.derivation().deepCopy();
            DerivationTree.Node target = TreeOps.randomSubtree(tree.root, random);
            DerivationTree.Node replacement = grammar.generate(random, maxDepth).root;
            return Individual.fromDerivation(TreeOps.replace(tree, target, replacement), builder);
        }
    }
}
