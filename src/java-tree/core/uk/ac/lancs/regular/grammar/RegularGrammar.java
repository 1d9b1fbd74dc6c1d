/*
 * Copyright 2018,2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.regular.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import uk.ac.lancs.regular.fsa.Alphabets;
import uk.ac.lancs.regular.fsa.NondeterministicAutomaton;

/**
 * Represents a regular grammar of fixed orientation. A grammar is
 * validated on construction, and can be converted into an equivalent
 * finite automaton.
 * 
 * @author simpsons
 */
public final class RegularGrammar {
    /**
     * The preferred name of the state introduced by
     * {@link #toAutomaton()} as the target of terminal productions
     */
    public static final String SYNTHETIC_FINAL = "[Final]";

    private final Set<String> variables;
    private final Set<String> terminals;
    private final List<Production> productions;
    private final String start;
    private final GrammarType type;

    /**
     * Create a regular grammar.
     * 
     * @param variables the non-terminal symbols
     * 
     * @param terminals the terminal symbols, each a single character
     * 
     * @param productions the productions, in order
     * 
     * @param start the start variable
     * 
     * @param type the orientation of every production
     * 
     * @throws InvalidGrammarException if the start variable is not
     * declared, variables and terminals overlap, a terminal is not a
     * single character, or a production has an undeclared symbol or
     * the wrong orientation
     */
    public RegularGrammar(Collection<String> variables,
                          Collection<String> terminals,
                          List<Production> productions, String start,
                          GrammarType type) {
        if (type == null) throw new NullPointerException("type");
        this.variables =
            Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        this.terminals =
            Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
        this.productions =
            Collections.unmodifiableList(new ArrayList<>(productions));
        this.start = start;
        this.type = type;

        if (start == null || !this.variables.contains(start))
            throw new InvalidGrammarException("start variable " + start
                + " must be in variables " + this.variables);

        Set<String> common = new LinkedHashSet<>(this.variables);
        common.retainAll(this.terminals);
        if (!common.isEmpty())
            throw new InvalidGrammarException("variables and terminals"
                + " must be disjoint; both contain " + common);

        for (String terminal : this.terminals)
            if (!Alphabets.isSymbol(terminal))
                throw new InvalidGrammarException("terminal \"" + terminal
                    + "\" must be a single character");

        for (Production prod : this.productions) {
            if (!this.variables.contains(prod.left()))
                throw new InvalidGrammarException("left side of " + prod
                    + " must be a variable");
            if (prod.type() != type)
                throw new InvalidGrammarException("production " + prod
                    + " must be " + type);
            if (prod.isTerminal() && !this.terminals.contains(prod.terminal()))
                throw new InvalidGrammarException("terminal "
                    + prod.terminal() + " of " + prod
                    + " must be in terminals " + this.terminals);
            if (prod.hasVariable()
                && !this.variables.contains(prod.variable()))
                throw new InvalidGrammarException("variable "
                    + prod.variable() + " of " + prod
                    + " must be in variables " + this.variables);
        }
    }

    /**
     * Get the variables.
     * 
     * @return the non-terminal symbols
     */
    public Set<String> variables() {
        return variables;
    }

    /**
     * Get the terminals.
     * 
     * @return the terminal symbols
     */
    public Set<String> terminals() {
        return terminals;
    }

    /**
     * Get the productions.
     * 
     * @return the productions in order
     */
    public List<Production> productions() {
        return productions;
    }

    /**
     * Get the start variable.
     * 
     * @return the start variable
     */
    public String start() {
        return start;
    }

    /**
     * Get the orientation.
     * 
     * @return the orientation of all productions
     */
    public GrammarType type() {
        return type;
    }

    /**
     * Get the productions of a variable.
     * 
     * @param variable the variable
     * 
     * @return the productions with the variable on the left side, in
     * order
     */
    public List<Production> productionsFor(String variable) {
        List<Production> result = new ArrayList<>();
        for (Production prod : productions)
            if (prod.left().equals(variable)) result.add(prod);
        return result;
    }

    /**
     * Get the variables with an epsilon production. Only direct
     * epsilon productions are considered.
     * 
     * @return the variables that can derive the empty string directly
     */
    public Set<String> nullableVariables() {
        Set<String> result = new LinkedHashSet<>();
        for (Production prod : productions)
            if (prod.isEpsilon()) result.add(prod.left());
        return result;
    }

    /**
     * Determine whether the start variable has an epsilon production.
     * 
     * @return {@code true} if the start variable is nullable
     */
    public boolean derivesEpsilon() {
        return nullableVariables().contains(start);
    }

    /**
     * Convert this grammar to an equivalent automaton. Each variable
     * becomes a state, the terminals become the alphabet, and the start
     * variable becomes the start state. A variable with an epsilon
     * production is final. Terminal productions lead to a single extra
     * final state, created only if needed.
     * 
     * <p>
     * A right-linear production <samp>A &rarr; aB</samp> becomes an
     * edge from <samp>A</samp> to <samp>B</samp> on <samp>a</samp>. A
     * left-linear production <samp>A &rarr; Ba</samp> becomes an edge
     * from <samp>B</samp> to <samp>A</samp> on <samp>a</samp>. The
     * left-linear mapping does not in general preserve the language,
     * and is retained as a known limitation.
     * 
     * @return a non-deterministic automaton derived from the grammar
     */
    public NondeterministicAutomaton toAutomaton() {
        Set<String> states = new LinkedHashSet<>(variables);
        Map<String, Map<String, Set<String>>> transitions =
            new LinkedHashMap<>();
        Set<String> finals = new LinkedHashSet<>();
        String extraFinal = null;

        for (Production prod : productions) {
            if (prod.isEpsilon()) {
                finals.add(prod.left());
                continue;
            }

            final String from, to;
            if (prod.hasVariable()) {
                if (type == GrammarType.RIGHT_LINEAR) {
                    from = prod.left();
                    to = prod.variable();
                } else {
                    from = prod.variable();
                    to = prod.left();
                }
            } else {
                if (extraFinal == null) {
                    extraFinal = freshFinal();
                    states.add(extraFinal);
                    finals.add(extraFinal);
                }
                from = prod.left();
                to = extraFinal;
            }
            transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .computeIfAbsent(prod.terminal(), k -> new LinkedHashSet<>())
                .add(to);
        }

        final String synth = extraFinal;
        logger.fine(() -> String
            .format("%s grammar of %d productions yields %d states,"
                + " finals %s%s", type, productions.size(), states.size(),
                    finals, synth == null ? "" : " (added " + synth + ")"));
        return new NondeterministicAutomaton(terminals, states, transitions,
                                             start, finals);
    }

    private String freshFinal() {
        String name = SYNTHETIC_FINAL;
        while (variables.contains(name))
            name += "'";
        return name;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        out.append("Regular Grammar ").append(type).append('\n');
        out.append("Variables: ")
            .append(String.join(",", new TreeSet<>(variables))).append('\n');
        out.append("Terminals: ")
            .append(String.join(",", new TreeSet<>(terminals))).append('\n');
        out.append("Start Variable: ").append(start).append('\n');
        out.append("Productions:");
        for (Production prod : productions)
            out.append("\n ").append(prod);
        return out.toString();
    }

    private static final Logger logger =
        Logger.getLogger(RegularGrammar.class.getName());
}
