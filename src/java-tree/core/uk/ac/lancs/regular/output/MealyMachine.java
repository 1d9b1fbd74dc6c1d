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

import uk.ac.lancs.regular.fsa.Alphabets;
import uk.ac.lancs.regular.fsa.FiniteStateMachine;
import uk.ac.lancs.regular.fsa.NotAnAcceptorException;
import uk.ac.lancs.regular.fsa.TransitionFunction;

/**
 * A deterministic machine that emits a value on each transition. The
 * output is attached to the edge taken, so the start state emits
 * nothing. A Mealy machine has no final states, and is not an
 * acceptor.
 * 
 * @author simpsons
 */
public final class MealyMachine implements FiniteStateMachine {
    /**
     * The output of an edge for which none was given, namely the empty
     * string
     */
    public static final String NO_OUTPUT = "";

    /**
     * Describes the result of a single transition.
     * 
     * @author simpsons
     */
    public static final class Step {
        /**
         * The state reached
         */
        public final String state;

        /**
         * The value emitted on the edge taken
         */
        public final String output;

        /**
         * Describe a transition result.
         * 
         * @param state the state reached
         * 
         * @param output the value emitted
         */
        public Step(String state, String output) {
            if (state == null) throw new NullPointerException("state");
            if (output == null) throw new NullPointerException("output");
            this.state = state;
            this.output = output;
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 53 * hash + state.hashCode();
            hash = 53 * hash + output.hashCode();
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (obj == null) return false;
            if (getClass() != obj.getClass()) return false;
            final Step other = (Step) obj;
            return state.equals(other.state) && output.equals(other.output);
        }

        @Override
        public String toString() {
            return state + "/" + output;
        }
    }

    private final TransitionFunction delta;
    private final Map<String, Map<String, String>> outputs;

    /**
     * Create a Mealy machine.
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
     * @param outputs a mapping from each source state to a mapping from
     * symbol to the value emitted on that edge; edges without an entry
     * output {@link #NO_OUTPUT}
     * 
     * @throws IllegalArgumentException if a transition or output
     * symbol is not in the alphabet, or states are declared and a
     * mentioned state is not among them
     * 
     * @throws NullPointerException if an output value is {@code null}
     */
    public MealyMachine(Collection<String> alphabet, Collection<String> states,
                        Map<String, ? extends Map<String, String>> transitions,
                        String start,
                        Map<String, ? extends Map<String, String>> outputs) {
        this.delta = new TransitionFunction(alphabet, states, transitions,
                                            start, outputs.keySet());
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, String>> entry : outputs
            .entrySet()) {
            for (Map.Entry<String, String> edge : entry.getValue()
                .entrySet()) {
                String symbol = edge.getKey();
                if (!delta.alphabet().contains(symbol))
                    throw new IllegalArgumentException("output of "
                        + entry.getKey() + " on '" + symbol
                        + "' not in alphabet " + delta.alphabet());
                Objects.requireNonNull(edge.getValue(), () -> "output of "
                    + entry.getKey() + " on '" + symbol + "'");
            }
            copy.put(entry.getKey(), Collections
                .unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.outputs = Collections.unmodifiableMap(copy);
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
    public Map<String, Map<String, Set<String>>> transitions() {
        return delta.canonical();
    }

    /**
     * Get the outputs of all edges that have one.
     * 
     * @return an unmodifiable mapping from state to symbol to output
     */
    public Map<String, Map<String, String>> outputs() {
        return outputs;
    }

    /**
     * Get the output of an edge.
     * 
     * @param state the source state
     * 
     * @param symbol the symbol consumed
     * 
     * @return the value emitted, or {@link #NO_OUTPUT} if none is set
     */
    public String output(String state, String symbol) {
        return outputs.getOrDefault(state, Collections.emptyMap())
            .getOrDefault(symbol, NO_OUTPUT);
    }

    /**
     * Take a single transition.
     * 
     * @param state the current state
     * 
     * @param symbol the input symbol
     * 
     * @return the state reached and the value emitted
     * 
     * @see TransitionFunction#step(String, String)
     */
    public Step step(String state, String symbol) {
        String next = delta.step(state, symbol);
        return new Step(next, output(state, symbol));
    }

    /**
     * Run input through the machine, collecting output.
     * 
     * @param input the input string
     * 
     * @return the value emitted by each transition, one per input
     * symbol
     * 
     * @throws uk.ac.lancs.regular.fsa.InvalidInputSymbolException if
     * the input contains a character outside the alphabet
     * 
     * @throws uk.ac.lancs.regular.fsa.NoTransitionException if the
     * input leads to a missing transition
     */
    public List<String> process(CharSequence input) {
        List<String> symbols = Alphabets.check(input, delta.alphabet());
        List<String> result = new ArrayList<>(symbols.size());
        String state = delta.start();
        for (String symbol : symbols) {
            Step step = step(state, symbol);
            result.add(step.output);
            state = step.state;
        }
        return result;
    }

    /**
     * Refuse to accept or reject input, as a Mealy machine has no final
     * states.
     * 
     * @param input ignored
     * 
     * @return never
     * 
     * @throws NotAnAcceptorException always
     */
    @Override
    public boolean accepts(CharSequence input) {
        throw new NotAnAcceptorException("a Mealy machine"
            + " produces output but does not accept or reject input");
    }

    @Override
    public String toString() {
        return "Mealy" + delta.transitions() + " from " + delta.start()
            + " emitting " + outputs;
    }

    /**
     * Start building a Mealy machine.
     * 
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates the parts of a Mealy machine.
     * 
     * @author simpsons
     */
    public static final class Builder {
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> states = new LinkedHashSet<>();
        private final Map<String, Map<String, String>> transitions =
            new LinkedHashMap<>();
        private final Map<String, Map<String, String>> outputs =
            new LinkedHashMap<>();
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
         * Add a transition with no output.
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
         * Add a transition that emits a value.
         * 
         * @param from the source state
         * 
         * @param symbol the symbol consumed
         * 
         * @param to the target state
         * 
         * @param value the value emitted
         * 
         * @return this object
         * 
         * @throws IllegalArgumentException if there is already a
         * different transition or output from the source on the symbol
         * 
         * @throws NullPointerException if the value is {@code null}
         */
        public Builder transition(String from, String symbol, String to,
                                  String value) {
            Objects.requireNonNull(value, "value");
            String old = outputs.getOrDefault(from, Collections.emptyMap())
                .get(symbol);
            if (old != null && !old.equals(value))
                throw new IllegalArgumentException("conflicting output: "
                    + from + " on '" + symbol + "' emits " + old + " and "
                    + value);
            transition(from, symbol, to);
            outputs.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .put(symbol, value);
            return this;
        }

        /**
         * Create the machine.
         * 
         * @return the new machine
         * 
         * @throws IllegalStateException if no start state has been set
         */
        public MealyMachine build() {
            if (start == null)
                throw new IllegalStateException("start state must be set");
            return new MealyMachine(alphabet, states, transitions, start,
                                    outputs);
        }
    }
}
