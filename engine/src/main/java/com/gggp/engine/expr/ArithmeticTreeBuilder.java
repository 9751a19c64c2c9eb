package com.gggp.engine.expr;

import static com.gggp.engine.grammar.ArithmeticGrammar.CONST;
import static com.gggp.engine.grammar.ArithmeticGrammar.EXPR;
import static com.gggp.engine.grammar.ArithmeticGrammar.OP;
import static com.gggp.engine.grammar.ArithmeticGrammar.OPERATION;
import static com.gggp.engine.grammar.ArithmeticGrammar.VAR;

import com.gggp.engine.expr.ExpressionNode.Kind;
import com.gggp.engine.grammar.Grammar;
import com.gggp.engine.tree.DerivationTree;
import java.util.List;

/**
 * Builds expression trees from derivations of {@link com.gggp.engine.grammar.ArithmeticGrammar}.
 *
 * <p>Crossover and mutation may graft any subtree anywhere, so the builder is lenient about what
 * sits under a {@code <var>}, {@code <const>} or {@code <op>}: it takes the first token it finds.
 * Whether that token makes sense is left to evaluation.
 */
public final class ArithmeticTreeBuilder implements ExpressionBuilder {

    @Override
    public ExpressionNode build(DerivationTree.Node node) {
        switch (node.symbol) {
            case EXPR -> {
                if (node.children.isEmpty()) {
                    throw new MalformedDerivationException(EXPR + " nodes must have children");
                }
                return build(node.children.get(0));
            }
            case OPERATION -> {
                if (node.children.size() != 3) {
                    throw new MalformedDerivationException(
                            OPERATION + " expects " + OP + " and two " + EXPR + " children, got "
                                    + node.children.size());
                }
                String operator = extractToken(node.children.get(0));
                ExpressionNode left = build(node.children.get(1));
                ExpressionNode right = build(node.children.get(2));
                return ExpressionNode.operator(operator, left, right);
            }
            case VAR -> {
                return new ExpressionNode(Kind.VARIABLE, extractToken(firstChild(node)), List.of());
            }
            case CONST -> {
                return new ExpressionNode(Kind.CONSTANT, extractToken(firstChild(node)), List.of());
            }
            case OP -> {
                return new ExpressionNode(
                        Kind.OPERATOR_TOKEN, extractToken(firstChild(node)), List.of());
            }
            default -> {
                if (!Grammar.isNonTerminal(node.symbol)) {
                    return new ExpressionNode(Kind.LITERAL, node.symbol, List.of());
                }
                if (node.children.size() == 1) {
                    return build(node.children.get(0));
                }
                throw new MalformedDerivationException("Unhandled node symbol " + node.symbol);
            }
        }
    }

    private static DerivationTree.Node firstChild(DerivationTree.Node node) {
        if (node.children.isEmpty()) {
            throw new MalformedDerivationException(node.symbol + " nodes must have children");
        }
        return node.children.get(0);
    }

    private static String extractToken(DerivationTree.Node node) {
        DerivationTree.Node current = node;
        while (!current.isLeaf()) {
            current = current.children.get(0);
        }
        if (!current.isTerminal()) {
            throw new MalformedDerivationException(
                    "Unable to extract token from " + current.symbol);
        }
        return current.symbol;
    }
}
