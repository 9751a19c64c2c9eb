package com.gggp.engine.expr;

/**
 * Raised while evaluating an expression tree: unbound variables, unparsable constants, unknown
 * operators, wrong operator arity and near-zero denominators.
 */
public final class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
