package com.gggp.engine.util;

import com.gggp.engine.tree.DerivationTree;
import java.util.List;
import java.util.Random;

/**
 * Tree utilities used for structural replacements during crossover and mutation.
 */
public final class TreeOps {

    private TreeOps() {}

    /** Picks one node of the tree uniformly at random; the root is a candidate like any other. */
    public static DerivationTree.Node randomSubtree(DerivationTree.Node root, Random random) {
        List<DerivationTree.Node> nodes = root.preOrder();
        return nodes.get(random.nextInt(nodes.size()));
    }

    /**
     * Returns a copy of {@code tree} in which the node identical to {@code oldSubtree} is replaced
     * by a copy of {@code newSubtree}. Matching is by reference, so {@code oldSubtree} has to be a
     * node taken from {@code tree} itself. The input tree is left unchanged.
     */
    public static DerivationTree replace(
            DerivationTree tree, DerivationTree.Node oldSubtree, DerivationTree.Node newSubtree) {
        DerivationTree.Node copy = replaceRec(tree.root, oldSubtree, newSubtree);
        return new DerivationTree(copy);
    }

    private static DerivationTree.Node replaceRec(
            DerivationTree.Node current, DerivationTree.Node oldSubtree, DerivationTree.Node newSubtree) {
        if (current == oldSubtree) {
            return newSubtree.deepCopy();
        }
        DerivationTree.Node node = new DerivationTree.Node(current.symbol);
        for (DerivationTree.Node child : current.children) {
            node.children.add(replaceRec(child, oldSubtree, newSubtree));
        }
        return node;
    }
}
