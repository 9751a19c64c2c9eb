package com.gggp.engine.grammar;

/** Raised when a grammar cannot be used as requested, e.g. a non-terminal has no productions. */
public final class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }
}
