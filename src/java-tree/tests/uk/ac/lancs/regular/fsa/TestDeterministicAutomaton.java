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
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class TestDeterministicAutomaton {
    /**
     * Accepts strings with an even number of <samp>a</samp>s and an odd
     * number of <samp>b</samp>s. State names give the parities of
     * <samp>a</samp> and <samp>b</samp>.
     */
    static DeterministicAutomaton evenAOddB() {
        return DeterministicAutomaton.builder().alphabet("a", "b")
            .start("ee").finalState("eo").transition("ee", "a", "oe")
            .transition("ee", "b", "eo").transition("eo", "a", "oo")
            .transition("eo", "b", "ee").transition("oe", "a", "ee")
            .transition("oe", "b", "oo").transition("oo", "a", "eo")
            .transition("oo", "b", "oe").build();
    }

    @Test
    public void testEvenAOddB() {
        DeterministicAutomaton dfa = evenAOddB();
        assertTrue(dfa.accepts("b"));
        assertFalse(dfa.accepts(""));
        assertTrue(dfa.accepts("aab"));
        assertFalse(dfa.accepts("ba"));
        assertTrue(dfa.accepts("babab"));
        assertFalse(dfa.accepts("ab"));
    }

    @Test
    public void testStep() {
        DeterministicAutomaton dfa = evenAOddB();
        assertEquals("oe", dfa.step("ee", "a"));
        assertEquals("ee", dfa.step("eo", "b"));
    }

    @Test(expected = UnknownStateException.class)
    public void testStepUnknownState() {
        evenAOddB().step("zz", "a");
    }

    @Test
    public void testStepSymbolNotInAlphabet() {
        try {
            evenAOddB().step("ee", "c");
            fail("symbol accepted");
        } catch (SymbolNotInAlphabetException ex) {
            assertEquals("c", ex.getSymbol());
        }
    }

    @Test
    public void testStepNoTransition() {
        DeterministicAutomaton dfa = DeterministicAutomaton.builder()
            .alphabet("a", "b").start("p").finalState("q")
            .transition("p", "a", "q").build();
        try {
            dfa.step("p", "b");
            fail("missing transition taken");
        } catch (NoTransitionException ex) {
            assertEquals("p", ex.getState());
            assertEquals("b", ex.getSymbol());
        }
    }

    @Test(expected = NoTransitionException.class)
    public void testAcceptsNoTransition() {
        DeterministicAutomaton.builder().alphabet("a", "b").start("p")
            .finalState("q").transition("p", "a", "q").build()
            .accepts("ab");
    }

    @Test
    public void testInvalidInputSymbol() {
        try {
            evenAOddB().accepts("abxa");
            fail("invalid symbol accepted");
        } catch (InvalidInputSymbolException ex) {
            assertEquals(2, ex.getPosition());
            assertEquals("x", ex.getSymbol());
        }
    }

    @Test
    public void testInvalidInputReportedBeforeMissingTransition() {
        DeterministicAutomaton dfa = DeterministicAutomaton.builder()
            .alphabet("a", "b").start("p").finalState("q")
            .transition("p", "a", "q").build();
        try {
            dfa.accepts("z");
            fail("invalid symbol accepted");
        } catch (InvalidInputSymbolException ex) {
            assertEquals(0, ex.getPosition());
        }
    }

    @Test
    public void testCanonicalTransitions() {
        Map<String, Map<String, Set<String>>> trans =
            evenAOddB().transitions();
        assertEquals(Collections.singleton("oe"), trans.get("ee").get("a"));
        assertEquals(4, trans.size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testTransitionsUnmodifiable() {
        evenAOddB().transitions().clear();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConflictingTransition() {
        DeterministicAutomaton.builder().transition("p", "a", "q")
            .transition("p", "a", "r");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTransitionOutsideAlphabet() {
        DeterministicAutomaton.builder().alphabet("a").start("p")
            .transition("p", "b", "p").build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEpsilonRejected() {
        DeterministicAutomaton.builder().alphabet("a").start("p")
            .transition("p", FiniteStateMachine.EPSILON, "p").build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUndeclaredState() {
        Map<String, Map<String, String>> trans = new HashMap<>();
        trans.put("p", Collections.singletonMap("a", "q"));
        new DeterministicAutomaton(Arrays.asList("a"), Arrays.asList("p"),
                                   trans, "p", Collections.emptySet());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMultiCharacterSymbol() {
        DeterministicAutomaton.builder().alphabet("ab").start("p").build();
    }

    @Test(expected = IllegalStateException.class)
    public void testNoStart() {
        DeterministicAutomaton.builder().alphabet("a").build();
    }

    @Test
    public void testInferredStates() {
        Map<String, Map<String, String>> trans = new HashMap<>();
        trans.put("p", Collections.singletonMap("a", "q"));
        DeterministicAutomaton dfa =
            new DeterministicAutomaton(Arrays.asList("a"), null, trans, "p",
                                       Arrays.asList("r"));
        assertEquals(3, dfa.states().size());
        assertTrue(dfa.states().containsAll(Arrays.asList("p", "q", "r")));
    }
}
