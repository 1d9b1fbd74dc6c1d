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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class TestNondeterministicAutomaton {
    static NondeterministicAutomaton epsilonLoop() {
        return NondeterministicAutomaton.builder().alphabet("a", "b")
            .start("q0").finalState("q2").epsilon("q0", "q1")
            .transition("q0", "a", "q0").transition("q1", "b", "q2")
            .epsilon("q2", "q0").build();
    }

    private static Set<String> set(String... items) {
        return new HashSet<>(Arrays.asList(items));
    }

    @Test
    public void testEpsilonLoop() {
        NondeterministicAutomaton nfa = epsilonLoop();
        assertFalse(nfa.accepts(""));
        assertTrue(nfa.accepts("b"));
        assertTrue(nfa.accepts("aab"));
        assertTrue(nfa.accepts("bb"));
        assertFalse(nfa.accepts("a"));
        assertFalse(nfa.accepts("ba"));
    }

    @Test
    public void testEpsilonClosure() {
        NondeterministicAutomaton nfa = epsilonLoop();
        assertEquals(set("q0", "q1"),
                     nfa.epsilonClosure(Collections.singleton("q0")));
        assertEquals(set("q0", "q1", "q2"),
                     nfa.epsilonClosure(Collections.singleton("q2")));
        assertEquals(set("q1"),
                     nfa.epsilonClosure(Collections.singleton("q1")));
    }

    @Test
    public void testEpsilonCycleTerminates() {
        NondeterministicAutomaton nfa = NondeterministicAutomaton.builder()
            .alphabet("a").start("p").finalState("r").epsilon("p", "q")
            .epsilon("q", "p").epsilon("q", "r").build();
        assertEquals(set("p", "q", "r"),
                     nfa.epsilonClosure(Collections.singleton("p")));
        assertTrue(nfa.accepts(""));
    }

    @Test
    public void testStep() {
        NondeterministicAutomaton nfa = epsilonLoop();
        assertEquals(set("q0"), nfa.step("q0", "a"));
        assertEquals(Collections.emptySet(), nfa.step("q0", "b"));
    }

    @Test
    public void testStepFromStateWithoutEdges() {
        NondeterministicAutomaton nfa = NondeterministicAutomaton.builder()
            .alphabet("a").start("p").finalState("q")
            .transition("p", "a", "q").build();
        assertEquals(Collections.emptySet(), nfa.step("q", "a"));
    }

    @Test(expected = SymbolNotInAlphabetException.class)
    public void testStepSymbolNotInAlphabet() {
        epsilonLoop().step("q0", "c");
    }

    @Test
    public void testStepSet() {
        NondeterministicAutomaton nfa = epsilonLoop();
        assertEquals(set("q0", "q1", "q2"),
                     nfa.stepSet(set("q0", "q1"), "b"));
    }

    @Test(expected = InvalidInputSymbolException.class)
    public void testInvalidInput() {
        epsilonLoop().accepts("ac");
    }

    @Test
    public void testTargetNormalization() {
        Map<String, Map<String, Object>> trans = new LinkedHashMap<>();
        Map<String, Object> fromP = new LinkedHashMap<>();
        fromP.put("a", "q");
        fromP.put("b", Arrays.asList("q", "r", "q"));
        trans.put("p", fromP);
        NondeterministicAutomaton nfa =
            new NondeterministicAutomaton(Arrays.asList("a", "b"), null,
                                          trans, "p", Arrays.asList("r"));
        assertEquals(Collections.singleton("q"),
                     nfa.transitions().get("p").get("a"));
        assertEquals(set("q", "r"), nfa.transitions().get("p").get("b"));
        assertTrue(nfa.accepts("b"));
        assertFalse(nfa.accepts("a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadTargetType() {
        Map<String, Map<String, Object>> trans = new LinkedHashMap<>();
        trans.put("p", Collections.singletonMap("a", 7));
        new NondeterministicAutomaton(Arrays.asList("a"), null, trans, "p",
                                      Arrays.asList("p"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLabelOutsideAlphabet() {
        NondeterministicAutomaton.builder().alphabet("a").start("p")
            .transition("p", "b", "p").build();
    }

    @Test
    public void testFinalStart() {
        NondeterministicAutomaton nfa = NondeterministicAutomaton.builder()
            .alphabet("a").start("p").finalState("p").build();
        assertTrue(nfa.accepts(""));
        assertFalse(nfa.accepts("a"));
    }
}
