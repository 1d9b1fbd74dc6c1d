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

package uk.ac.lancs.regular.output;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import uk.ac.lancs.regular.fsa.Acceptor;
import uk.ac.lancs.regular.fsa.Alphabets;
import uk.ac.lancs.regular.fsa.TransitionFunction;

/**
 * A deterministic machine that emits a value on entering each state.
 * It is also an acceptor, with final states like a deterministic
 * automaton.
 * 
 * @author simpsons
 */
public final class MooreMachine implements Acceptor {
    /**
     * The output of a state for which none was given, namely the empty
     * string
     */
    public static final String NO_OUTPUT = "";

    private final TransitionFunction delta;
    private final Set<String> finalStates;
    private final Map<String, String> outputs;

    /**
     * Create a Moore machine.
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
     * @param outputs the output of each state; states without an entry
     * output {@link #NO_OUTPUT}
     * 
     * @throws IllegalArgumentException if a transition symbol is not in
     * the alphabet, or states are declared and a mentioned state is
     * not among them
     * 
     * @throws NullPointerException if an output value is {@code null}
     */
    public MooreMachine(Collection<String> alphabet, Collection<String> states,
                        Map<String, ? extends Map<String, String>> transitions,
                        String start, Collection<String> finalStates,
                        Map<String, String> outputs) {
        Set<String> finals = new LinkedHashSet<>(finalStates);
        Set<String> marked = new LinkedHashSet<>(finals);
        marked.addAll(outputs.keySet());
        for (Map.Entry<String, String> entry : outputs.entrySet())
            Objects.requireNonNull(entry.getValue(),
                                   () -> "output of " + entry.getKey());
        this.delta =
            new TransitionFunction(alphabet, states, transitions, start, marked);
        this.finalStates = Collections.unmodifiableSet(finals);
        this.outputs =
            Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
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
     * Get the outputs of all states that have one.
     * 
     * @return an unmodifiable mapping from state to output
     */
    public Map<String, String> outputs() {
        return outputs;
    }

    /**
     * Get the output of a state.
     * 
     * @param state the state
     * 
     * @return the state's output, or {@link #NO_OUTPUT} if it has none
     * or is unknown
     */
    public String output(String state) {
        return outputs.getOrDefault(state, NO_OUTPUT);
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
     * @see TransitionFunction#step(String, String)
     */
    public String step(String state, String symbol) {
        return delta.step(state, symbol);
    }

    /**
     * Run input through the machine, collecting output.
     * 
     * @param input the input string
     * 
     * @return the output of the start state, followed by the output of
     * the state reached after each input symbol
     * 
     * @throws uk.ac.lancs.regular.fsa.InvalidInputSymbolException if
     * the input contains a character outside the alphabet, even after
     * a point where a transition would be missing
     * 
     * @throws uk.ac.lancs.regular.fsa.NoTransitionException if the
     * input leads to a missing transition
     */
    public List<String> process(CharSequence input) {
        Alphabets.check(input, delta.alphabet());
        List<String> trace = delta.trace(input);
        List<String> result = new ArrayList<>(trace.size());
        for (String state : trace)
            result.add(output(state));
        return result;
    }

    /**
     * {@inheritDoc}
     * 
     * @throws uk.ac.lancs.regular.fsa.NoTransitionException if the
     * input leads to a missing transition
     */
    @Override
    public boolean accepts(CharSequence input) {
        List<String> trace = delta.trace(input);
        return finalStates.contains(trace.get(trace.size() - 1));
    }

    @Override
    public String toString() {
        return "Moore" + delta.transitions() + " from " + delta.start()
            + " emitting " + outputs;
    }

    /**
     * Start building a Moore machine.
     * 
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates the parts of a Moore machine.
     * 
     * @author simpsons
     */
    public static final class Builder {
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> states = new LinkedHashSet<>();
        private final Map<String, Map<String, String>> transitions =
            new LinkedHashMap<>();
        private final Set<String> finalStates = new LinkedHashSet<>();
        private final Map<String, String> outputs = new LinkedHashMap<>();
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
         * Set the output of a state.
         * 
         * @param state the state
         * 
         * @param value the value emitted on entering the state
         * 
         * @return this object
         * 
         * @throws NullPointerException if either argument is
         * {@code null}
         */
        public Builder output(String state, String value) {
            outputs.put(Objects.requireNonNull(state, "state"),
                        Objects.requireNonNull(value, "value"));
            states.add(state);
            return this;
        }

        /**
         * Create the machine.
         * 
         * @return the new machine
         * 
         * @throws IllegalStateException if no start state has been set
         */
        public MooreMachine build() {
            if (start == null)
                throw new IllegalStateException("start state must be set");
            return new MooreMachine(alphabet, states, transitions, start,
                                    finalStates, outputs);
        }
    }
}
