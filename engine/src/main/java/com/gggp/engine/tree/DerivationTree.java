package com.gggp.engine.tree;

import com.gggp.engine.grammar.Grammar;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * Derivation tree produced by expanding a grammar, together with an unparser that renders the
 * tree's yield. Nodes own their children exclusively; trees never share sub-structure.
 */
public final class DerivationTree {

    public static final class Node {
        public final String symbol;
        public final List<Node> children = new ArrayList<>();

        public Node(String symbol) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
        }

        public Node(String symbol, List<Node> children) {
            this(symbol);
            this.children.addAll(children);
        }

        public boolean isLeaf() {
            return children.isEmpty();
        }

        /** True when the symbol is a terminal token, regardless of whether the node has children. */
        public boolean isTerminal() {
            return !Grammar.isNonTerminal(symbol);
        }

        public Node deepCopy() {
            Node copy = new Node(symbol);
            for (Node child : children) {
                copy.children.add(child.deepCopy());
            }
            return copy;
        }

        public List<Node> preOrder() {
            List<Node> result = new ArrayList<>();
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(this);
            while (!stack.isEmpty()) {
                Node current = stack.pop();
                result.add(current);
                ListIterator<Node> iterator = current.children.listIterator(current.children.size());
                while (iterator.hasPrevious()) {
                    stack.push(iterator.previous());
                }
            }
            return result;
        }

        @Override
        public String toString() {
            if (children.isEmpty()) {
                return symbol;
            }
            StringBuilder sb = new StringBuilder(symbol).append('(');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(children.get(i));
            }
            return sb.append(')').toString();
        }
    }

    public final Node root;

    public DerivationTree(Node root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public DerivationTree deepCopy() {
        return new DerivationTree(root.deepCopy());
    }

    public interface Unparser {
        String unparse(Node node);
    }

    /** Joins the leaf tokens of a tree, left to right, with single spaces. */
    public static final class YieldUnparser implements Unparser {

        @Override
        public String unparse(Node node) {
            StringBuilder sb = new StringBuilder();
            render(node, sb);
            return sb.toString();
        }

        private void render(Node node, StringBuilder sb) {
            if (node.isLeaf()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(node.symbol);
                return;
            }
            for (Node child : node.children) {
                render(child, sb);
            }
        }
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
