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

package uk.ac.lancs.regular.fsa;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A deterministic finite automaton. Exactly one state is current at any
 * time, and the transition relation is a partial function. For
 * example, this accepts strings over <samp>{a, b}</samp> with an even
 * number of <samp>a</samp>s and an odd number of <samp>b</samp>s:
 * 
 * <pre>
 * DeterministicAutomaton dfa = DeterministicAutomaton.builder()
 *     .alphabet("a", "b").start("q00").finalState("q01")
 *     .transition("q00", "a", "q10").transition("q00", "b", "q01")
 *     .transition("q01", "a", "q11").transition("q01", "b", "q00")
 *     .transition("q10", "a", "q00").transition("q10", "b", "q11")
 *     .transition("q11", "a", "q01").transition("q11", "b", "q10")
 *     .build();
 * </pre>
 * 
 * @author simpsons
 */
public final class DeterministicAutomaton implements Acceptor {
    private final TransitionFunction delta;
    private final Set<String> finalStates;

    /**
     * Create a deterministic automaton.
     * 
     * @param alphabet the input alphabet
     * 
     * @param states the states, or {@code null} if they are to be
     * inferred from the other arguments
     * 
     * @param transitions a mapping from each source state to a mapping
     * from symbol to target state
     * 
     * @param start the start state
     * 
     * @param finalStates the accepting states
     * 
     * @throws IllegalArgumentException if a transition symbol is not in
     * the alphabet, or states are declared and a mentioned state is
     * not among them
     */
    public DeterministicAutomaton(Collection<String> alphabet,
                                  Collection<String> states,
                                  Map<String, ? extends Map<String, String>> transitions,
                                  String start,
                                  Collection<String> finalStates) {
        Set<String> finals = new LinkedHashSet<>(finalStates);
        this.delta = new TransitionFunction(alphabet, states, transitions,
                                            start, finals);
        this.finalStates = Collections.unmodifiableSet(finals);
    }

    @Override
    public Set<String> alphabet() {
        return delta.alphabet();
    }

    @Override
    public Set<String> states() {
        return delta.states();
    }

    @Override
    public String start() {
        return delta.start();
    }

    @Override
    public Set<String> finalStates() {
        return finalStates;
    }

    @Override
    public Map<String, Map<String, Set<String>>> transitions() {
        return delta.canonical();
    }

    /**
     * Get the next state from a state on a symbol.
     * 
     * @param state the current state
     * 
     * @param symbol the input symbol
     * 
     * @return the next state
     * 
     * @throws UnknownStateException if the state is not a member
     * 
     * @throws SymbolNotInAlphabetException if the symbol is not in the
     * alphabet
     * 
     * @throws NoTransitionException if there is no edge from the state
     * on the symbol
     */
    public String step(String state, String symbol) {
        return delta.step(state, symbol);
    }

    /**
     * {@inheritDoc}
     * 
     * @throws NoTransitionException if the input leads to a missing
     * transition
     */
    @Override
    public boolean accepts(CharSequence input) {
        List<String> trace = delta.trace(input);
        return finalStates.contains(trace.get(trace.size() - 1));
    }

    @Override
    public String toString() {
        return "DFA" + delta.transitions() + " from " + delta.start()
            + " to " + finalStates;
    }

    /**
     * Start building a deterministic automaton.
     * 
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates the parts of a deterministic automaton.
     * 
     * @author simpsons
     */
    public static final class Builder {
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> states = new LinkedHashSet<>();
        private final Map<String, Map<String, String>> transitions =
            new LinkedHashMap<>();
        private final Set<String> finalStates = new LinkedHashSet<>();
        private String start;

        Builder() {}

        /**
         * Add symbols to the alphabet.
         * 
         * @param symbols the new symbols
         * 
         * @return this object
         */
        public Builder alphabet(String... symbols) {
            alphabet.addAll(Arrays.asList(symbols));
            return this;
        }

        /**
         * Add states that might not be mentioned elsewhere.
         * 
         * @param states the new states
         * 
         * @return this object
         */
        public Builder state(String... states) {
            this.states.addAll(Arrays.asList(states));
            return this;
        }

        /**
         * Set the start state.
         * 
         * @param start the start state
         * 
         * @return this object
         */
        public Builder start(String start) {
            this.start = start;
            states.add(start);
            return this;
        }

        /**
         * Add final states.
         * 
         * @param states the new final states
         * 
         * @return this object
         */
        public Builder finalState(String... states) {
            finalStates.addAll(Arrays.asList(states));
            this.states.addAll(Arrays.asList(states));
            return this;
        }

        /**
         * Add a transition.
         * 
         * @param from the source state
         * 
         * @param symbol the symbol consumed
         * 
         * @param to the target state
         * 
         * @return this object
         * 
         * @throws IllegalArgumentException if there is already a
         * different transition from the source on the symbol
         */
        public Builder transition(String from, String symbol, String to) {
            String old = transitions
                .computeIfAbsent(from, k -> new LinkedHashMap<>())
                .putIfAbsent(symbol, to);
            if (old != null && !old.equals(to))
                throw new IllegalArgumentException("non-deterministic: "
                    + from + " on '" + symbol + "' to " + old + " and "
                    + to);
            states.add(from);
            states.add(to);
            return this;
        }

        /**
         * Create the automaton.
         * 
         * @return the new automaton
         * 
         * @throws IllegalStateException if no start state has been set
         */
        public DeterministicAutomaton build() {
            if (start == null)
                throw new IllegalStateException("start state must be set");
            return new DeterministicAutomaton(alphabet, states, transitions,
                                              start, finalStates);
        }
    }
}
