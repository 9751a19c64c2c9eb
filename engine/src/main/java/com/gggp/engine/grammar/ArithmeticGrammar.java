package com.gggp.engine.grammar;

import com.gggp.engine.expr.Operator;
import java.util.Arrays;
import java.util.List;

/**
 * Reference grammar for symbolic regression:
 *
 * <pre>
 * &lt;expr&gt;      ::= &lt;operation&gt; | &lt;var&gt; | &lt;const&gt;
 * &lt;operation&gt; ::= &lt;op&gt; &lt;expr&gt; &lt;expr&gt;
 * </pre>
 *
 * with {@code <var>}, {@code <const>} and {@code <op>} bound through terminal injection.
 */
public final class ArithmeticGrammar {

    public static final String EXPR = "<expr>";
    public static final String OPERATION = "<operation>";
    public static final String VAR = "<var>";
    public static final String CONST = "<const>";
    public static final String OP = "<op>";

    public static final List<String> DEFAULT_OPERATIONS =
            Arrays.stream(Operator.values()).map(Operator::symbol).toList();

    private ArithmeticGrammar() {}

    public static Grammar build(List<String> variables, List<String> constants) {
        return build(variables, constants, DEFAULT_OPERATIONS);
    }

    public static Grammar build(
            List<String> variables, List<String> constants, List<String> operations) {
        Grammar grammar = new Grammar(EXPR);
        grammar.addRule(EXPR, OPERATION);
        grammar.addRule(EXPR, VAR);
        grammar.addRule(EXPR, CONST);
        grammar.addRule(OPERATION, OP, EXPR, EXPR);

        grammar.injectTerminals(VAR, variables);
        grammar.injectTerminals(CONST, constants);
        grammar.injectTerminals(
                OP, operations == null || operations.isEmpty() ? DEFAULT_OPERATIONS : operations);
        return grammar;
    }
}
