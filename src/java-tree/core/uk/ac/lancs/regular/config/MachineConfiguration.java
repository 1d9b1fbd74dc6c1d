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

package uk.ac.lancs.regular.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.regular.fsa.DeterministicAutomaton;
import uk.ac.lancs.regular.fsa.FiniteStateMachine;
import uk.ac.lancs.regular.fsa.NondeterministicAutomaton;
import uk.ac.lancs.regular.grammar.GrammarType;
import uk.ac.lancs.regular.grammar.Production;
import uk.ac.lancs.regular.grammar.RegularGrammar;
import uk.ac.lancs.regular.output.MealyMachine;
import uk.ac.lancs.regular.output.MooreMachine;

/**
 * Builds machines and grammars from configuration. The following
 * parameters describe an automaton:
 * 
 * <dl>
 * 
 * <dt><samp>type</samp></dt>
 * 
 * <dd><samp>dfa</samp>, <samp>nfa</samp>, <samp>moore</samp>,
 * <samp>mealy</samp> or <samp>grammar</samp></dd>
 * 
 * <dt><samp>alphabet</samp></dt>
 * 
 * <dd>space- or comma-separated symbols</dd>
 * 
 * <dt><samp>states</samp></dt>
 * 
 * <dd>optional space- or comma-separated states; if absent, the states
 * are those mentioned elsewhere</dd>
 * 
 * <dt><samp>start</samp></dt>
 * 
 * <dd>the start state</dd>
 * 
 * <dt><samp>final</samp></dt>
 * 
 * <dd>space- or comma-separated final states</dd>
 * 
 * <dt><samp>transition.<var>state</var>.<var>symbol</var></samp></dt>
 * 
 * <dd>the target of an edge, or (for <samp>nfa</samp>) a space- or
 * comma-separated list of targets; the symbol <samp>epsilon</samp>
 * labels an epsilon edge</dd>
 * 
 * <dt><samp>output.<var>state</var></samp></dt>
 * 
 * <dd>the output of a state of a Moore machine</dd>
 * 
 * <dt><samp>output.<var>state</var>.<var>symbol</var></samp></dt>
 * 
 * <dd>the output of an edge of a Mealy machine</dd>
 * 
 * </dl>
 * 
 * <p>
 * The state part of a transition or output key is everything up to
 * the last dot, so state names may contain dots. A key ending in two
 * dots, such as <samp>transition.q0..</samp>, gives the edge on the
 * symbol <samp>.</samp> itself.
 * 
 * <p>
 * Lists are split at commas and whitespace, so neither can be an
 * alphabet symbol, state or target here. Such machines can be
 * described in JSON with {@link uk.ac.lancs.regular.json.MachineJSON}.
 * 
 * <p>
 * A grammar is described by <samp>orientation</samp>
 * (<samp>right-linear</samp> or <samp>left-linear</samp>),
 * <samp>variables</samp>, <samp>terminals</samp>, <samp>start</samp>,
 * and <samp>production.<var>n</var></samp> entries such as
 * <samp>S -&gt; 0S</samp>, applied in numeric order of
 * <var>n</var>.
 * 
 * @author simpsons
 */
public final class MachineConfiguration {
    private MachineConfiguration() {}

    /**
     * The symbol used in transition keys to denote an epsilon edge
     */
    public static final String EPSILON_KEY = "epsilon";

    /**
     * Build a machine or grammar.
     * 
     * @param conf the configuration describing it
     * 
     * @return a {@link FiniteStateMachine} or a {@link RegularGrammar}
     * 
     * @throws IllegalArgumentException if the type is missing or
     * unknown, or the description is invalid
     */
    public static Object load(Configuration conf) {
        String type = required(conf, "type");
        final Object result;
        switch (type) {
        case "dfa":
            result = dfa(conf);
            break;

        case "nfa":
            result = nfa(conf);
            break;

        case "moore":
            result = moore(conf);
            break;

        case "mealy":
            result = mealy(conf);
            break;

        case "grammar":
            result = grammar(conf);
            break;

        default:
            throw new IllegalArgumentException("unknown type: " + type);
        }
        logger.fine(() -> String.format("configured %s from %s", type,
                                        conf));
        return result;
    }

    /**
     * Build a deterministic automaton.
     * 
     * @param conf the configuration describing it
     * 
     * @return the automaton
     */
    public static DeterministicAutomaton dfa(Configuration conf) {
        return new DeterministicAutomaton(requiredList(conf, "alphabet"),
                                          conf.getList("states"),
                                          edges(conf, "transition"),
                                          required(conf, "start"),
                                          optionalList(conf, "final"));
    }

    /**
     * Build a non-deterministic automaton.
     * 
     * @param conf the configuration describing it
     * 
     * @return the automaton
     */
    public static NondeterministicAutomaton nfa(Configuration conf) {
        Map<String, Map<String, List<String>>> transitions =
            new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : edges(conf,
                                                                  "transition")
                                                                      .entrySet()) {
            Map<String, List<String>> targets = new LinkedHashMap<>();
            for (Map.Entry<String, String> edge : entry.getValue()
                .entrySet()) {
                List<String> items = new ArrayList<>();
                for (String item : Configuration.LIST_SEPARATOR
                    .split(edge.getValue().trim()))
                    if (!item.isEmpty()) items.add(item);
                targets.put(edge.getKey(), items);
            }
            transitions.put(entry.getKey(), targets);
        }
        return new NondeterministicAutomaton(requiredList(conf, "alphabet"),
                                             conf.getList("states"),
                                             transitions,
                                             required(conf, "start"),
                                             optionalList(conf, "final"));
    }

    /**
     * Build a Moore machine.
     * 
     * @param conf the configuration describing it
     * 
     * @return the machine
     */
    public static MooreMachine moore(Configuration conf) {
        Configuration outputConf = conf.subview("output");
        Map<String, String> outputs = new LinkedHashMap<>();
        for (String state : outputConf.keys())
            outputs.put(state, outputConf.get(state));
        return new MooreMachine(requiredList(conf, "alphabet"),
                                conf.getList("states"),
                                edges(conf, "transition"),
                                required(conf, "start"),
                                optionalList(conf, "final"), outputs);
    }

    /**
     * Build a Mealy machine.
     * 
     * @param conf the configuration describing it
     * 
     * @return the machine
     */
    public static MealyMachine mealy(Configuration conf) {
        return new MealyMachine(requiredList(conf, "alphabet"),
                                conf.getList("states"),
                                edges(conf, "transition"),
                                required(conf, "start"),
                                edges(conf, "output"));
    }

    /**
     * Build a regular grammar.
     * 
     * @param conf the configuration describing it
     * 
     * @return the grammar
     * 
     * @throws uk.ac.lancs.regular.grammar.InvalidGrammarException if
     * the grammar fails validation
     */
    public static RegularGrammar grammar(Configuration conf) {
        GrammarType type =
            GrammarType.forLabel(required(conf, "orientation"));
        Configuration prodConf = conf.subview("production");
        List<String> indices = new ArrayList<>(prodConf.keys());
        Collections.sort(indices, MachineConfiguration::compareIndices);
        List<Production> productions = new ArrayList<>(indices.size());
        for (String index : indices)
            productions.add(Production.parse(prodConf.get(index), type));
        return new RegularGrammar(requiredList(conf, "variables"),
                                  requiredList(conf, "terminals"),
                                  productions, required(conf, "start"),
                                  type);
    }

    private static int compareIndices(String a, String b) {
        try {
            return Long.compare(Long.parseLong(a), Long.parseLong(b));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("production index"
                + " must be a number: production." + a + " or production."
                + b, ex);
        }
    }

    /**
     * Collect edge-keyed parameters. Each key under the prefix is split
     * at its last dot into a state and a symbol, except that a key
     * ending in two dots has the dot as its symbol.
     */
    private static Map<String, Map<String, String>>
        edges(Configuration conf, String prefix) {
        Configuration sub = conf.subview(prefix);
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (String key : sub.keys()) {
            final String state, symbol;
            if (key.endsWith("..")) {
                state = key.substring(0, key.length() - 2);
                symbol = ".";
            } else {
                int dot = key.lastIndexOf('.');
                if (dot <= 0 || dot == key.length() - 1)
                    throw new IllegalArgumentException("bad key " + prefix
                        + "." + key + "; expected " + prefix
                        + ".<state>.<symbol>");
                state = key.substring(0, dot);
                symbol = key.substring(dot + 1).equals(EPSILON_KEY) ?
                    FiniteStateMachine.EPSILON : key.substring(dot + 1);
            }
            if (state.isEmpty())
                throw new IllegalArgumentException("bad key " + prefix + "."
                    + key + "; expected " + prefix + ".<state>.<symbol>");
            result.computeIfAbsent(state, k -> new LinkedHashMap<>())
                .put(symbol, sub.get(key).trim());
        }
        return result;
    }

    private static String required(Configuration conf, String key) {
        String value = conf.get(key);
        if (value == null || value.trim().isEmpty())
            throw new IllegalArgumentException("missing parameter: " + key);
        return value.trim();
    }

    private static List<String> requiredList(Configuration conf,
                                             String key) {
        List<String> value = conf.getList(key);
        if (value == null)
            throw new IllegalArgumentException("missing parameter: " + key);
        return value;
    }

    private static List<String> optionalList(Configuration conf,
                                             String key) {
        List<String> value = conf.getList(key);
        return value == null ? Collections.emptyList() : value;
    }

    private static final Logger logger =
        Logger.getLogger(MachineConfiguration.class.getName());
}
