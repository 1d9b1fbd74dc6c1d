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

package uk.ac.lancs.regular.json;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import uk.ac.lancs.regular.fsa.Acceptor;
import uk.ac.lancs.regular.fsa.DeterministicAutomaton;
import uk.ac.lancs.regular.fsa.FiniteStateMachine;
import uk.ac.lancs.regular.fsa.NondeterministicAutomaton;
import uk.ac.lancs.regular.grammar.GrammarType;
import uk.ac.lancs.regular.grammar.Production;
import uk.ac.lancs.regular.grammar.RegularGrammar;
import uk.ac.lancs.regular.output.MealyMachine;
import uk.ac.lancs.regular.output.MooreMachine;

/**
 * Reads and writes JSON descriptions of machines and grammars. Every
 * description is an object whose <samp>type</samp> field is one of
 * <samp>dfa</samp>, <samp>nfa</samp>, <samp>moore</samp>,
 * <samp>mealy</samp> or <samp>grammar</samp>. An automaton
 * description has the following fields:
 * 
 * <dl>
 * 
 * <dt><samp>alphabet</samp></dt>
 * 
 * <dd>an array of single-character strings</dd>
 * 
 * <dt><samp>states</samp></dt>
 * 
 * <dd>an optional array of state names; if absent, the states are
 * those mentioned elsewhere</dd>
 * 
 * <dt><samp>start</samp></dt>
 * 
 * <dd>the start state</dd>
 * 
 * <dt><samp>final</samp></dt>
 * 
 * <dd>an array of final states; ignored for Mealy machines</dd>
 * 
 * <dt><samp>transitions</samp></dt>
 * 
 * <dd>an object mapping each source state to an object mapping each
 * symbol to a target state, or (for <samp>nfa</samp>) to a target or an
 * array of targets, with the empty key labelling epsilon edges</dd>
 * 
 * <dt><samp>output</samp></dt>
 * 
 * <dd>for <samp>moore</samp>, an object mapping state to output; for
 * <samp>mealy</samp>, an object mapping state to an object mapping
 * symbol to output</dd>
 * 
 * </dl>
 * 
 * <p>
 * A grammar description has <samp>orientation</samp>
 * (<samp>right-linear</samp> or <samp>left-linear</samp>),
 * <samp>variables</samp>, <samp>terminals</samp>, <samp>start</samp>
 * and <samp>productions</samp>, the last an array of objects with
 * <samp>left</samp> and optional <samp>terminal</samp> and
 * <samp>variable</samp> fields.
 * 
 * <p>
 * Structurally malformed descriptions are reported with
 * {@link IllegalArgumentException} naming the offending field.
 * 
 * @author simpsons
 */
public final class MachineJSON {
    private MachineJSON() {}

    /**
     * Read a description.
     * 
     * @param in the source of JSON text
     * 
     * @return a {@link FiniteStateMachine} or a {@link RegularGrammar},
     * according to the description's type
     * 
     * @throws IOException if an I/O error occurs
     * 
     * @throws ParseException if the text is not valid JSON
     * 
     * @throws IllegalArgumentException if the JSON is not an object, or
     * does not describe a valid machine or grammar
     */
    public static Object read(Reader in) throws IOException, ParseException {
        JSONParser parser = new JSONParser();
        Object root = parser.parse(in);
        if (!(root instanceof JSONObject))
            throw new IllegalArgumentException("description"
                + " must be a JSON object");
        return fromJSON((JSONObject) root);
    }

    /**
     * Read a machine description.
     * 
     * @param in the source of JSON text
     * 
     * @return the described machine
     * 
     * @throws IOException if an I/O error occurs
     * 
     * @throws ParseException if the text is not valid JSON
     * 
     * @throws IllegalArgumentException if the text describes a grammar
     * or an invalid machine
     */
    public static FiniteStateMachine readMachine(Reader in)
        throws IOException,
            ParseException {
        Object result = read(in);
        if (!(result instanceof FiniteStateMachine))
            throw new IllegalArgumentException("not a machine: " + result);
        return (FiniteStateMachine) result;
    }

    /**
     * Read a grammar description.
     * 
     * @param in the source of JSON text
     * 
     * @return the described grammar
     * 
     * @throws IOException if an I/O error occurs
     * 
     * @throws ParseException if the text is not valid JSON
     * 
     * @throws IllegalArgumentException if the text describes a machine
     * or an invalid grammar
     */
    public static RegularGrammar readGrammar(Reader in)
        throws IOException,
            ParseException {
        Object result = read(in);
        if (!(result instanceof RegularGrammar))
            throw new IllegalArgumentException("not a grammar: " + result);
        return (RegularGrammar) result;
    }

    /**
     * Interpret a parsed description.
     * 
     * @param root the description
     * 
     * @return a {@link FiniteStateMachine} or a {@link RegularGrammar}
     * 
     * @throws IllegalArgumentException if the type is missing or
     * unknown, or the description is invalid
     */
    public static Object fromJSON(JSONObject root) {
        String type = string(root, "type");
        final Object result;
        switch (type) {
        case "dfa":
            result = dfa(root);
            break;

        case "nfa":
            result = nfa(root);
            break;

        case "moore":
            result = moore(root);
            break;

        case "mealy":
            result = mealy(root);
            break;

        case "grammar":
            result = grammar(root);
            break;

        default:
            throw new IllegalArgumentException("unknown type: " + type);
        }
        logger.fine(() -> String.format("loaded %s description", type));
        return result;
    }

    /**
     * Interpret a deterministic automaton description.
     * 
     * @param root the description
     * 
     * @return the automaton
     */
    public static DeterministicAutomaton dfa(JSONObject root) {
        return new DeterministicAutomaton(strings(root, "alphabet"),
                                          optionalStrings(root, "states"),
                                          singleTransitions(root,
                                                            "transitions"),
                                          string(root, "start"),
                                          strings(root, "final"));
    }

    /**
     * Interpret a non-deterministic automaton description.
     * 
     * @param root the description
     * 
     * @return the automaton
     */
    public static NondeterministicAutomaton nfa(JSONObject root) {
        Map<String, Map<String, Object>> transitions = new LinkedHashMap<>();
        for (Map.Entry<String, JSONObject> entry : objects(root,
                                                           "transitions")
                                                               .entrySet()) {
            Map<String, Object> edges = new LinkedHashMap<>();
            @SuppressWarnings("unchecked")
            Map<Object, Object> raw = entry.getValue();
            for (Map.Entry<Object, Object> edge : raw.entrySet())
                edges.put((String) edge.getKey(), edge.getValue());
            transitions.put(entry.getKey(), edges);
        }
        return new NondeterministicAutomaton(strings(root, "alphabet"),
                                             optionalStrings(root, "states"),
                                             transitions,
                                             string(root, "start"),
                                             strings(root, "final"));
    }

    /**
     * Interpret a Moore machine description.
     * 
     * @param root the description
     * 
     * @return the machine
     */
    public static MooreMachine moore(JSONObject root) {
        Map<String, String> outputs = new LinkedHashMap<>();
        Object raw = root.get("output");
        if (raw != null) outputs.putAll(stringMap(raw, "output"));
        return new MooreMachine(strings(root, "alphabet"),
                                optionalStrings(root, "states"),
                                singleTransitions(root, "transitions"),
                                string(root, "start"),
                                optionalList(root, "final"), outputs);
    }

    /**
     * Interpret a Mealy machine description.
     * 
     * @param root the description
     * 
     * @return the machine
     */
    public static MealyMachine mealy(JSONObject root) {
        Map<String, Map<String, String>> outputs =
            root.get("output") == null ? new LinkedHashMap<>()
                : singleTransitions(root, "output");
        return new MealyMachine(strings(root, "alphabet"),
                                optionalStrings(root, "states"),
                                singleTransitions(root, "transitions"),
                                string(root, "start"), outputs);
    }

    /**
     * Interpret a grammar description.
     * 
     * @param root the description
     * 
     * @return the grammar
     * 
     * @throws uk.ac.lancs.regular.grammar.InvalidGrammarException if
     * the grammar fails validation
     */
    public static RegularGrammar grammar(JSONObject root) {
        GrammarType type = GrammarType.forLabel(string(root, "orientation"));
        List<Production> productions = new ArrayList<>();
        for (JSONObject prod : objectList(root, "productions")) {
            String left = string(prod, "left");
            String terminal = optionalString(prod, "terminal");
            String variable = optionalString(prod, "variable");
            if (terminal == null) {
                if (variable != null)
                    throw new IllegalArgumentException("production of "
                        + left + " has variable but no terminal");
                productions.add(Production.epsilon(left, type));
            } else if (variable == null) {
                productions.add(Production.terminal(left, terminal, type));
            } else if (type == GrammarType.RIGHT_LINEAR) {
                productions
                    .add(Production.rightLinear(left, terminal, variable));
            } else {
                productions
                    .add(Production.leftLinear(left, terminal, variable));
            }
        }
        return new RegularGrammar(strings(root, "variables"),
                                  strings(root, "terminals"), productions,
                                  string(root, "start"), type);
    }

    /**
     * Describe a deterministic automaton.
     * 
     * @param machine the automaton
     * 
     * @return the description
     */
    public static JSONObject toJSON(DeterministicAutomaton machine) {
        return acceptorJSON("dfa", machine, false);
    }

    /**
     * Describe a non-deterministic automaton. Targets are always
     * written as arrays.
     * 
     * @param machine the automaton
     * 
     * @return the description
     */
    public static JSONObject toJSON(NondeterministicAutomaton machine) {
        return acceptorJSON("nfa", machine, true);
    }

    /**
     * Describe a Moore machine.
     * 
     * @param machine the machine
     * 
     * @return the description
     */
    @SuppressWarnings("unchecked")
    public static JSONObject toJSON(MooreMachine machine) {
        JSONObject result = acceptorJSON("moore", machine, false);
        JSONObject output = new JSONObject();
        output.putAll(machine.outputs());
        result.put("output", output);
        return result;
    }

    /**
     * Describe a Mealy machine.
     * 
     * @param machine the machine
     * 
     * @return the description
     */
    @SuppressWarnings("unchecked")
    public static JSONObject toJSON(MealyMachine machine) {
        JSONObject result = machineJSON("mealy", machine, false);
        JSONObject output = new JSONObject();
        for (Map.Entry<String, Map<String, String>> entry : machine
            .outputs().entrySet()) {
            JSONObject edges = new JSONObject();
            edges.putAll(entry.getValue());
            output.put(entry.getKey(), edges);
        }
        result.put("output", output);
        return result;
    }

    /**
     * Describe a grammar.
     * 
     * @param grammar the grammar
     * 
     * @return the description
     */
    @SuppressWarnings("unchecked")
    public static JSONObject toJSON(RegularGrammar grammar) {
        JSONObject result = new JSONObject();
        result.put("type", "grammar");
        result.put("orientation", grammar.type().label());
        result.put("variables", array(grammar.variables()));
        result.put("terminals", array(grammar.terminals()));
        result.put("start", grammar.start());
        JSONArray productions = new JSONArray();
        for (Production prod : grammar.productions()) {
            JSONObject item = new JSONObject();
            item.put("left", prod.left());
            if (prod.isTerminal()) item.put("terminal", prod.terminal());
            if (prod.hasVariable()) item.put("variable", prod.variable());
            productions.add(item);
        }
        result.put("productions", productions);
        return result;
    }

    /**
     * Write a description as JSON text.
     * 
     * @param description the description
     * 
     * @param out the destination
     * 
     * @throws IOException if an I/O error occurs
     */
    public static void write(JSONObject description, Writer out)
        throws IOException {
        description.writeJSONString(out);
        out.flush();
    }

    @SuppressWarnings("unchecked")
    private static JSONObject acceptorJSON(String type, Acceptor machine,
                                           boolean multi) {
        JSONObject result = machineJSON(type, machine, multi);
        result.put("final", array(machine.finalStates()));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static JSONObject machineJSON(String type,
                                          FiniteStateMachine machine,
                                          boolean multi) {
        JSONObject result = new JSONObject();
        result.put("type", type);
        result.put("alphabet", array(machine.alphabet()));
        result.put("states", array(machine.states()));
        result.put("start", machine.start());
        JSONObject transitions = new JSONObject();
        for (Map.Entry<String, Map<String, Set<String>>> entry : machine
            .transitions().entrySet()) {
            JSONObject edges = new JSONObject();
            for (Map.Entry<String, Set<String>> edge : entry.getValue()
                .entrySet()) {
                if (multi)
                    edges.put(edge.getKey(), array(edge.getValue()));
                else
                    edges.put(edge.getKey(),
                              edge.getValue().iterator().next());
            }
            transitions.put(entry.getKey(), edges);
        }
        result.put("transitions", transitions);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static JSONArray array(Collection<String> items) {
        JSONArray result = new JSONArray();
        result.addAll(items);
        return result;
    }

    private static String string(JSONObject root, String key) {
        Object value = root.get(key);
        if (!(value instanceof String))
            throw new IllegalArgumentException("\"" + key
                + "\" must be a string: " + value);
        return (String) value;
    }

    private static String optionalString(JSONObject root, String key) {
        if (root.get(key) == null) return null;
        return string(root, key);
    }

    private static List<String> strings(JSONObject root, String key) {
        Object value = root.get(key);
        if (!(value instanceof JSONArray))
            throw new IllegalArgumentException("\"" + key
                + "\" must be an array: " + value);
        List<String> result = new ArrayList<>();
        for (Object item : (JSONArray) value) {
            if (!(item instanceof String))
                throw new IllegalArgumentException("\"" + key
                    + "\" must contain strings: " + item);
            result.add((String) item);
        }
        return result;
    }

    private static List<String> optionalStrings(JSONObject root,
                                                String key) {
        if (root.get(key) == null) return null;
        return strings(root, key);
    }

    private static List<String> optionalList(JSONObject root, String key) {
        List<String> result = optionalStrings(root, key);
        return result == null ? new ArrayList<>() : result;
    }

    private static Map<String, JSONObject> objects(JSONObject root,
                                                   String key) {
        Object value = root.get(key);
        if (!(value instanceof JSONObject))
            throw new IllegalArgumentException("\"" + key
                + "\" must be an object: " + value);
        Map<String, JSONObject> result = new LinkedHashMap<>();
        @SuppressWarnings("unchecked")
        Map<Object, Object> raw = (JSONObject) value;
        for (Map.Entry<Object, Object> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof JSONObject))
                throw new IllegalArgumentException("\"" + key + "\" entry "
                    + entry.getKey() + " must be an object");
            result.put((String) entry.getKey(),
                       (JSONObject) entry.getValue());
        }
        return result;
    }

    private static List<JSONObject> objectList(JSONObject root,
                                               String key) {
        Object value = root.get(key);
        if (!(value instanceof JSONArray))
            throw new IllegalArgumentException("\"" + key
                + "\" must be an array: " + value);
        List<JSONObject> result = new ArrayList<>();
        for (Object item : (JSONArray) value) {
            if (!(item instanceof JSONObject))
                throw new IllegalArgumentException("\"" + key
                    + "\" must contain objects: " + item);
            result.add((JSONObject) item);
        }
        return result;
    }

    private static Map<String, String> stringMap(Object value, String key) {
        if (!(value instanceof JSONObject))
            throw new IllegalArgumentException("\"" + key
                + "\" must be an object: " + value);
        Map<String, String> result = new LinkedHashMap<>();
        @SuppressWarnings("unchecked")
        Map<Object, Object> raw = (JSONObject) value;
        for (Map.Entry<Object, Object> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof String))
                throw new IllegalArgumentException("\"" + key + "\" entry "
                    + entry.getKey() + " must be a string");
            result.put((String) entry.getKey(), (String) entry.getValue());
        }
        return result;
    }

    private static Map<String, Map<String, String>>
        singleTransitions(JSONObject root, String key) {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (Map.Entry<String, JSONObject> entry : objects(root, key)
            .entrySet())
            result.put(entry.getKey(),
                       stringMap(entry.getValue(),
                                 key + "." + entry.getKey()));
        return result;
    }

    private static final Logger logger =
        Logger.getLogger(MachineJSON.class.getName());
}
