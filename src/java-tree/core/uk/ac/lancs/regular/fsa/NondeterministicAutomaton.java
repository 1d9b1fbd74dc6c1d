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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A non-deterministic finite automaton, possibly with epsilon edges. A
 * set of states is current at any time, and it is always closed under
 * epsilon edges.
 * 
 * <p>
 * The raw transition data supplied on construction may give each
 * target as a single state, a list of states or a set of states. These
 * are normalized into sets once, as the automaton is created.
 * 
 * @author simpsons
 */
public final class NondeterministicAutomaton implements Acceptor {
    private final Set<String> alphabet;
    private final Set<String> states;
    private final String start;
    private final Set<String> finalStates;
    private final Map<String, Map<String, Set<String>>> delta;

    /**
     * Create a non-deterministic automaton.
     * 
     * @param alphabet the input alphabet, excluding
     * {@link FiniteStateMachine#EPSILON}
     * 
     * @param states the states, or {@code null} if they are to be
     * inferred from the other arguments
     * 
     * @param transitions a mapping from each source state to a mapping
     * from label to targets, where each label is a symbol of the
     * alphabet or {@link FiniteStateMachine#EPSILON}, and each targets
     * value is a {@link String} or a {@link Collection} of them
     * 
     * @param start the start state
     * 
     * @param finalStates the accepting states
     * 
     * @throws IllegalArgumentException if a label is neither in the
     * alphabet nor epsilon, if a targets value has the wrong type, or
     * if states are declared and a mentioned state is not among them
     */
    public NondeterministicAutomaton(Collection<String> alphabet,
                                     Collection<String> states,
                                     Map<String, ? extends Map<String, ?>> transitions,
                                     String start,
                                     Collection<String> finalStates) {
        if (start == null) throw new NullPointerException("start");
        if (transitions == null) throw new NullPointerException("transitions");
        this.alphabet = Alphabets.of(alphabet);
        this.start = start;

        Set<String> mentioned = new LinkedHashSet<>();
        mentioned.add(start);
        Map<String, Map<String, Set<String>>> delta = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, ?>> entry : transitions
            .entrySet()) {
            String from = entry.getKey();
            if (from == null) throw new NullPointerException("source state");
            mentioned.add(from);
            Map<String, Set<String>> edges = new LinkedHashMap<>();
            for (Map.Entry<String, ?> edge : entry.getValue().entrySet()) {
                String label = edge.getKey();
                if (!EPSILON.equals(label) && !this.alphabet.contains(label))
                    throw new IllegalArgumentException("transition from "
                        + from + " on '" + label + "' not in alphabet "
                        + this.alphabet);
                Set<String> targets = normalize(from, label, edge.getValue());
                mentioned.addAll(targets);
                edges.put(label, targets);
            }
            delta.put(from, Collections.unmodifiableMap(edges));
        }
        Set<String> finals = new LinkedHashSet<>(finalStates);
        mentioned.addAll(finals);
        this.states = Alphabets.states(states, mentioned);
        this.finalStates = Collections.unmodifiableSet(finals);
        this.delta = Collections.unmodifiableMap(delta);
    }

    private static Set<String> normalize(String from, String label,
                                         Object targets) {
        if (targets instanceof String) {
            logger.finer(() -> String
                .format("coercing %s on '%s' to singleton", from, label));
            return Collections.singleton((String) targets);
        }
        if (targets instanceof Collection) {
            Set<String> result = new LinkedHashSet<>();
            for (Object target : (Collection<?>) targets) {
                if (!(target instanceof String))
                    throw new IllegalArgumentException("bad target of "
                        + from + " on '" + label + "': " + target);
                result.add((String) target);
            }
            return Collections.unmodifiableSet(result);
        }
        throw new IllegalArgumentException("bad targets of " + from
            + " on '" + label + "': " + targets);
    }

    @Override
    public Set<String> alphabet() {
        return alphabet;
    }

    @Override
    public Set<String> states() {
        return states;
    }

    @Override
    public String start() {
        return start;
    }

    @Override
    public Set<String> finalStates() {
        return finalStates;
    }

    @Override
    public Map<String, Map<String, Set<String>>> transitions() {
        return delta;
    }

    /**
     * Compute the states reachable from a set of states through epsilon
     * edges alone.
     * 
     * @param states the initial states
     * 
     * @return the initial states and all states reachable from them
     * through epsilon edges
     */
    public Set<String> epsilonClosure(Collection<String> states) {
        Set<String> closure = new LinkedHashSet<>(states);
        Deque<String> stack = new ArrayDeque<>(states);
        while (!stack.isEmpty()) {
            String state = stack.pop();
            Map<String, Set<String>> edges = delta.get(state);
            if (edges == null) continue;
            for (String next : edges.getOrDefault(EPSILON,
                                                  Collections.emptySet())) {
                /* Each state is pushed at most once. */
                if (closure.add(next)) stack.push(next);
            }
        }
        return closure;
    }

    /**
     * Get the states directly reachable from a state on a symbol. No
     * epsilon closure is applied.
     * 
     * @param state the source state
     * 
     * @param symbol the input symbol
     * 
     * @return the target states, possibly empty
     * 
     * @throws SymbolNotInAlphabetException if the state has outgoing
     * edges and the symbol is not in the alphabet
     */
    public Set<String> step(String state, String symbol) {
        Map<String, Set<String>> edges = delta.get(state);
        if (edges == null) return Collections.emptySet();
        if (!alphabet.contains(symbol))
            throw new SymbolNotInAlphabetException(symbol, alphabet);
        return edges.getOrDefault(symbol, Collections.emptySet());
    }

    /**
     * Advance a set of states on a symbol.
     * 
     * @param states the current states
     * 
     * @param symbol the input symbol
     * 
     * @return the epsilon closure of the union of the targets of each
     * current state on the symbol
     * 
     * @throws SymbolNotInAlphabetException if the symbol is not in the
     * alphabet
     */
    public Set<String> stepSet(Collection<String> states, String symbol) {
        Set<String> next = new LinkedHashSet<>();
        for (String state : states)
            next.addAll(step(state, symbol));
        return epsilonClosure(next);
    }

    /**
     * {@inheritDoc}
     * 
     * <p>
     * Simulation stops early and rejects as soon as no state is
     * current.
     */
    @Override
    public boolean accepts(CharSequence input) {
        Set<String> current = epsilonClosure(Collections.singleton(start));
        List<String> symbols = Alphabets.split(input);
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            if (!alphabet.contains(symbol))
                throw new InvalidInputSymbolException(i, symbol, alphabet);
            current = stepSet(current, symbol);
            if (current.isEmpty()) return false;
        }
        return !Collections.disjoint(current, finalStates);
    }

    @Override
    public String toString() {
        return "NFA" + delta + " from " + start + " to " + finalStates;
    }

    /**
     * Start building a non-deterministic automaton.
     * 
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates the parts of a non-deterministic automaton.
     * 
     * @author simpsons
     */
    public static final class Builder {
        private final Set<String> alphabet = new LinkedHashSet<>();
        private final Set<String> states = new LinkedHashSet<>();
        private final Map<String, Map<String, Set<String>>> transitions =
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
            return alphabet(Arrays.asList(symbols));
        }

        /**
         * Add symbols to the alphabet.
         * 
         * @param symbols the new symbols
         * 
         * @return this object
         */
        public Builder alphabet(Collection<String> symbols) {
            alphabet.addAll(symbols);
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
         * Add transitions from one state on one label.
         * 
         * @param from the source state
         * 
         * @param label the symbol consumed, or
         * {@link FiniteStateMachine#EPSILON}
         * 
         * @param to the target states
         * 
         * @return this object
         */
        public Builder transition(String from, String label, String... to) {
            transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                .computeIfAbsent(label, k -> new LinkedHashSet<>())
                .addAll(Arrays.asList(to));
            states.add(from);
            states.addAll(Arrays.asList(to));
            return this;
        }

        /**
         * Add epsilon transitions from one state.
         * 
         * @param from the source state
         * 
         * @param to the target states
         * 
         * @return this object
         */
        public Builder epsilon(String from, String... to) {
            return transition(from, EPSILON, to);
        }

        /**
         * Create the automaton.
         * 
         * @return the new automaton
         * 
         * @throws IllegalStateException if no start state has been set
         */
        public NondeterministicAutomaton build() {
            if (start == null)
                throw new IllegalStateException("start state must be set");
            return new NondeterministicAutomaton(alphabet, states,
                                                 transitions, start,
                                                 finalStates);
        }
    }

    private static final Logger logger =
        Logger.getLogger(NondeterministicAutomaton.class.getName());
}
