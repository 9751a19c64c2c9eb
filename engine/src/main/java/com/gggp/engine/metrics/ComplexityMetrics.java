package com.gggp.engine.metrics;

import com.gggp.engine.tree.DerivationTree;
import java.util.Comparator;

/**
 * Structural size of a derivation tree. The natural order is lexicographic over node count,
 * depth and terminal count; selection uses it to break fitness ties in favour of smaller trees.
 *
 * @param nodeCount number of nodes, at least 1
 * @param depth number of levels, the root being level 1
 * @param terminalCount number of leaves whose symbol is a terminal token
 */
public record ComplexityMetrics(int nodeCount, int depth, int terminalCount)
        implements Comparable<ComplexityMetrics> {

    private static final Comparator<ComplexityMetrics> ORDER =
            Comparator.comparingInt(ComplexityMetrics::nodeCount)
                    .thenComparingInt(ComplexityMetrics::depth)
                    .thenComparingInt(ComplexityMetrics::terminalCount);

    public static ComplexityMetrics compute(DerivationTree tree) {
        return compute(tree.root);
    }

    public static ComplexityMetrics compute(DerivationTree.Node node) {
        if (node.isLeaf()) {
            return new ComplexityMetrics(1, 1, node.isTerminal() ? 1 : 0);
        }
        int nodeCount = 1;
        int maxChildDepth = 0;
        int terminalCount = 0;
        for (DerivationTree.Node child : node.children) {
            ComplexityMetrics metrics = compute(child);
            nodeCount += metrics.nodeCount;
            maxChildDepth = Math.max(maxChildDepth, metrics.depth);
            terminalCount += metrics.terminalCount;
        }
        return new ComplexityMetrics(nodeCount, 1 + maxChildDepth, terminalCount);
    }

    /** The quantity the parsimony penalty is proportional to. */
    public double scalar() {
        return nodeCount;
    }

    @Override
    public int compareTo(ComplexityMetrics other) {
        return ORDER.compare(this, other);
    }
}
