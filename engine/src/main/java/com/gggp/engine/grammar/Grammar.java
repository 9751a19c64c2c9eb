package com.gggp.engine.grammar;

import com.gggp.engine.gen.TreeGenerators;
import com.gggp.engine.tree.DerivationTree;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * In-memory representation of a context-free grammar over string symbols.
 *
 * <p>Symbols enclosed in angle brackets (for example {@code <expr>}) are non-terminals, every
 * other symbol is a terminal token. Grammars are assembled in code; there is no textual grammar
 * format. Productions keep their registration order so that a seeded {@link Random} always picks
 * the same expansions.
 */
public final class Grammar {

    /** One way of expanding a non-terminal: an ordered, immutable sequence of symbols. */
    public static final class Production {
        public final List<String> tokens;

        public Production(List<String> tokens) {
            this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        }

        public static Production of(String... tokens) {
            return new Production(List.of(tokens));
        }

        public boolean isTerminalOnly() {
            return tokens.stream().noneMatch(Grammar::isNonTerminal);
        }

        public boolean isSelfRecursive(String symbol) {
            return tokens.contains(symbol);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            return o instanceof Production other && tokens.equals(other.tokens);
        }

        @Override
        public int hashCode() {
            return tokens.hashCode();
        }

        @Override
        public String toString() {
            return String.join(" ", tokens);
        }
    }

    private final String start;
    private final Map<String, List<Production>> byLhs = new LinkedHashMap<>();

    public Grammar(String start) {
        this.start = Objects.requireNonNull(start, "start");
    }

    public static boolean isNonTerminal(String symbol) {
        return symbol.length() >= 2 && symbol.startsWith("<") && symbol.endsWith(">");
    }

    public String start() {
        return start;
    }

    public void addRule(String nonTerminal, List<String> tokens) {
        Objects.requireNonNull(nonTerminal, "nonTerminal");
        byLhs.computeIfAbsent(nonTerminal, key -> new ArrayList<>()).add(new Production(tokens));
    }

    public void addRule(String nonTerminal, String... tokens) {
        addRule(nonTerminal, List.of(tokens));
    }

    /** Replaces every production of {@code nonTerminal} with the given expansions. */
    public void setRules(String nonTerminal, List<List<String>> expansions) {
        Objects.requireNonNull(nonTerminal, "nonTerminal");
        List<Production> productions = new ArrayList<>();
        for (List<String> expansion : expansions) {
            productions.add(new Production(expansion));
        }
        byLhs.put(nonTerminal, productions);
    }

    /**
     * Binds {@code nonTerminal} to a set of literal values: all of its productions are replaced by
     * one single-token production per terminal. The rest of the grammar is left untouched, which
     * is how variables, constants and operators are plugged into an otherwise generic grammar.
     */
    public void injectTerminals(String nonTerminal, List<String> terminals) {
        Objects.requireNonNull(nonTerminal, "nonTerminal");
        if (terminals == null || terminals.isEmpty()) {
            throw new GrammarException("No terminals provided for " + nonTerminal);
        }
        List<Production> productions = new ArrayList<>(terminals.size());
        for (String terminal : terminals) {
            productions.add(Production.of(Objects.requireNonNull(terminal, "terminal")));
        }
        byLhs.put(nonTerminal, productions);
    }

    public List<Production> productionsFor(String nonTerminal) {
        List<Production> productions = byLhs.get(nonTerminal);
        return productions == null ? List.of() : Collections.unmodifiableList(productions);
    }

    public Set<String> nonTerminals() {
        return Collections.unmodifiableSet(byLhs.keySet());
    }

    /**
     * Generates a random derivation tree rooted at the start symbol.
     *
     * @param random source of every random choice made during expansion
     * @param maxDepth soft depth bound, must be at least 1
     * @throws IllegalArgumentException if {@code maxDepth < 1}
     * @throws GrammarException if a reachable non-terminal has no productions
     */
    public DerivationTree generate(Random random, int maxDepth) {
        return new TreeGenerators.DepthBoundedGenerator(this).generate(start, maxDepth, random);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<Production>> entry : byLhs.entrySet()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.getKey()).append(" ::= ");
            List<Production> productions = entry.getValue();
            for (int i = 0; i < productions.size(); i++) {
                if (i > 0) {
                    sb.append(" | ");
                }
                sb.append(productions.get(i));
            }
        }
        return sb.toString();
    }
}
