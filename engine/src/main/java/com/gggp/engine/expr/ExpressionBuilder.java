package com.gggp.engine.expr;

import com.gggp.engine.tree.DerivationTree;

/**
 * Translates a derivation tree into an expression tree. A builder is tied to the shape of one
 * grammar; a different grammar needs its own builder.
 */
public interface ExpressionBuilder {

    /**
     * @throws MalformedDerivationException if the tree does not match the grammar the builder
     *     understands
     */
    ExpressionNode build(DerivationTree.Node derivation);

    default ExpressionNode build(DerivationTree derivation) {
        return build(derivation.root);
    }
}
