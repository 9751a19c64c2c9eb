package com.gggp.engine.expr;

/** A derivation tree does not have the shape an {@link ExpressionBuilder} expects. */
public final class MalformedDerivationException extends RuntimeException {

    public MalformedDerivationException(String message) {
        super(message);
    }
}
