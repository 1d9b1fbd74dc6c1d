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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds the deterministic core of a finite-state machine: alphabet,
 * states, start state and a partial function from state and symbol to
 * next state. Deterministic acceptors and both kinds of output machine
 * delegate their simulation to an instance of this class.
 * 
 * @author simpsons
 */
public final class TransitionFunction {
    private final Set<String> alphabet;
    private final Set<String> states;
    private final String start;
    private final Map<String, Map<String, String>> delta;
    private final Map<String, Map<String, Set<String>>> canonical;

    /**
     * Create a transition function.
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
     * @param marked further states that must exist, such as final
     * states
     * 
     * @throws IllegalArgumentException if a transition is labelled
     * with a symbol outside the alphabet (including
     * {@link FiniteStateMachine#EPSILON}), or if states are declared
     * and a mentioned state is not among them
     */
    public TransitionFunction(Collection<String> alphabet,
                              Collection<String> states,
                              Map<String, ? extends Map<String, String>> transitions,
                              String start, Collection<String> marked) {
        if (start == null) throw new NullPointerException("start");
        if (transitions == null) throw new NullPointerException("transitions");
        this.alphabet = Alphabets.of(alphabet);
        this.start = start;

        Set<String> mentioned = new LinkedHashSet<>();
        mentioned.add(start);
        Map<String, Map<String, String>> delta = new LinkedHashMap<>();
        Map<String, Map<String, Set<String>>> canonical =
            new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, String>> entry : transitions
            .entrySet()) {
            String from = entry.getKey();
            if (from == null) throw new NullPointerException("source state");
            mentioned.add(from);
            Map<String, String> edges = new LinkedHashMap<>();
            Map<String, Set<String>> canonicalEdges = new LinkedHashMap<>();
            for (Map.Entry<String, String> edge : entry.getValue()
                .entrySet()) {
                String symbol = edge.getKey();
                String to = edge.getValue();
                if (!this.alphabet.contains(symbol))
                    throw new IllegalArgumentException("transition from "
                        + from + " on '" + symbol + "' not in alphabet "
                        + this.alphabet);
                if (to == null)
                    throw new NullPointerException("target of " + from
                        + " on " + symbol);
                mentioned.add(to);
                edges.put(symbol, to);
                canonicalEdges.put(symbol, Collections.singleton(to));
            }
            delta.put(from, Collections.unmodifiableMap(edges));
            canonical.put(from, Collections.unmodifiableMap(canonicalEdges));
        }
        mentioned.addAll(marked);
        this.states = Alphabets.states(states, mentioned);
        this.delta = Collections.unmodifiableMap(delta);
        this.canonical = Collections.unmodifiableMap(canonical);
    }

    /**
     * Get the input alphabet.
     * 
     * @return the alphabet
     */
    public Set<String> alphabet() {
        return alphabet;
    }

    /**
     * Get the states.
     * 
     * @return the states
     */
    public Set<String> states() {
        return states;
    }

    /**
     * Get the start state.
     * 
     * @return the start state
     */
    public String start() {
        return start;
    }

    /**
     * Get the transitions with each target wrapped in a singleton set.
     * 
     * @return the canonical transition relation
     * 
     * @see FiniteStateMachine#transitions()
     */
    public Map<String, Map<String, Set<String>>> canonical() {
        return canonical;
    }

    /**
     * Get the transitions.
     * 
     * @return an unmodifiable mapping from source state to symbol to
     * target state
     */
    public Map<String, Map<String, String>> transitions() {
        return delta;
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
        if (!states.contains(state)) throw new UnknownStateException(state);
        if (!alphabet.contains(symbol))
            throw new SymbolNotInAlphabetException(symbol, alphabet);
        String next = delta.getOrDefault(state, Collections.emptyMap())
            .get(symbol);
        if (next == null) throw new NoTransitionException(state, symbol);
        return next;
    }

    /**
     * Run input from the start state, recording each state visited.
     * Each character is checked against the alphabet before the step
     * it drives is attempted.
     * 
     * @param input the input string
     * 
     * @return the start state followed by the state reached after each
     * symbol
     * 
     * @throws InvalidInputSymbolException if the input contains a
     * character outside the alphabet
     * 
     * @throws NoTransitionException if the input leads to a missing
     * transition
     */
    public List<String> trace(CharSequence input) {
        List<String> symbols = Alphabets.split(input);
        List<String> result = new ArrayList<>(symbols.size() + 1);
        String state = start;
        result.add(state);
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            if (!alphabet.contains(symbol))
                throw new InvalidInputSymbolException(i, symbol, alphabet);
            state = step(state, symbol);
            result.add(state);
        }
        return result;
    }
}
