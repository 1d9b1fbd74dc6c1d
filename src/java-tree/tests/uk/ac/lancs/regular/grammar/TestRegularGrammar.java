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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import uk.ac.lancs.regular.fsa.NondeterministicAutomaton;

public class TestRegularGrammar {
    /**
     * Generates <samp>0*1</samp> with <samp>S &rarr; 0S | 1</samp>.
     */
    static RegularGrammar zerosThenOne() {
        return new RegularGrammar(Arrays.asList("S"), Arrays.asList("0", "1"),
                                  Arrays.asList(Production
                                      .rightLinear("S", "0", "S"),
                                                Production
                                                    .terminal("S", "1",
                                                              GrammarType.RIGHT_LINEAR)),
                                  "S", GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testZerosThenOne() {
        NondeterministicAutomaton nfa = zerosThenOne().toAutomaton();
        assertTrue(nfa.accepts("1"));
        assertTrue(nfa.accepts("001"));
        assertFalse(nfa.accepts("10"));
        assertFalse(nfa.accepts(""));
        assertTrue(nfa.states().contains(RegularGrammar.SYNTHETIC_FINAL));
        assertEquals(Collections.singleton(RegularGrammar.SYNTHETIC_FINAL),
                     nfa.finalStates());
    }

    @Test
    public void testEpsilonOnly() {
        RegularGrammar grammar =
            new RegularGrammar(Arrays.asList("S"), Arrays.asList("a", "b"),
                               Arrays.asList(Production
                                   .epsilon("S", GrammarType.RIGHT_LINEAR)),
                               "S", GrammarType.RIGHT_LINEAR);
        NondeterministicAutomaton nfa = grammar.toAutomaton();
        assertTrue(nfa.accepts(""));
        assertFalse(nfa.accepts("a"));
        assertFalse(nfa.accepts("ab"));
        assertFalse(nfa.states().contains(RegularGrammar.SYNTHETIC_FINAL));
        assertTrue(grammar.derivesEpsilon());
    }

    @Test
    public void testRegexOfGrammar() {
        assertEquals("0*1", zerosThenOne().toAutomaton().toRegex().toString());
    }

    @Test
    public void testSyntheticFinalAvoidsVariable() {
        RegularGrammar grammar =
            new RegularGrammar(Arrays.asList("S", "[Final]"),
                               Arrays.asList("a"),
                               Arrays.asList(Production
                                   .terminal("S", "a", GrammarType.RIGHT_LINEAR)),
                               "S", GrammarType.RIGHT_LINEAR);
        NondeterministicAutomaton nfa = grammar.toAutomaton();
        assertTrue(nfa.finalStates().contains("[Final]'"));
        assertFalse(nfa.finalStates().contains("[Final]"));
        assertTrue(nfa.accepts("a"));
    }

    @Test
    public void testLeftLinearEdgesReversed() {
        RegularGrammar grammar =
            new RegularGrammar(Arrays.asList("S", "A"), Arrays.asList("a",
                                                                      "b"),
                               Arrays.asList(Production
                                   .leftLinear("S", "b", "A"),
                                             Production
                                                 .terminal("A", "a",
                                                           GrammarType.LEFT_LINEAR)),
                               "S", GrammarType.LEFT_LINEAR);
        NondeterministicAutomaton nfa = grammar.toAutomaton();
        assertEquals(Collections.singleton("S"),
                     nfa.transitions().get("A").get("b"));
        assertEquals(Collections.singleton(RegularGrammar.SYNTHETIC_FINAL),
                     nfa.transitions().get("A").get("a"));
    }

    @Test
    public void testNullable() {
        RegularGrammar grammar =
            new RegularGrammar(Arrays.asList("S", "A"), Arrays.asList("a"),
                               Arrays.asList(Production
                                   .rightLinear("S", "a", "A"),
                                             Production
                                                 .epsilon("A",
                                                          GrammarType.RIGHT_LINEAR)),
                               "S", GrammarType.RIGHT_LINEAR);
        assertEquals(Collections.singleton("A"), grammar.nullableVariables());
        assertFalse(grammar.derivesEpsilon());
        assertTrue(grammar.toAutomaton().accepts("a"));
    }

    @Test
    public void testProductionsFor() {
        RegularGrammar grammar = zerosThenOne();
        assertEquals(2, grammar.productionsFor("S").size());
        assertTrue(grammar.productionsFor("T").isEmpty());
    }

    private static void assertInvalid(List<String> variables,
                                      List<String> terminals,
                                      List<Production> productions,
                                      String start, GrammarType type) {
        try {
            new RegularGrammar(variables, terminals, productions, start,
                               type);
            fail("accepted invalid grammar");
        } catch (InvalidGrammarException ex) {
            assertTrue(ex.getMessage().contains(ex.getReason()));
        }
    }

    @Test
    public void testStartNotDeclared() {
        assertInvalid(Arrays.asList("S"), Arrays.asList("a"),
                      Collections.emptyList(), "T",
                      GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testNotDisjoint() {
        assertInvalid(Arrays.asList("S", "a"), Arrays.asList("a"),
                      Collections.emptyList(), "S",
                      GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testUndeclaredLeftSide() {
        assertInvalid(Arrays.asList("S"), Arrays.asList("a"),
                      Arrays.asList(Production.epsilon("T",
                                                       GrammarType.RIGHT_LINEAR)),
                      "S", GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testOrientationMismatch() {
        assertInvalid(Arrays.asList("S"), Arrays.asList("a"),
                      Arrays.asList(Production.leftLinear("S", "a", "S")),
                      "S", GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testUndeclaredTerminal() {
        assertInvalid(Arrays.asList("S"), Arrays.asList("a"),
                      Arrays.asList(Production.rightLinear("S", "b", "S")),
                      "S", GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testUndeclaredVariable() {
        assertInvalid(Arrays.asList("S"), Arrays.asList("a"),
                      Arrays.asList(Production.rightLinear("S", "a", "T")),
                      "S", GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testLongTerminal() {
        assertInvalid(Arrays.asList("S"), Arrays.asList("ab"),
                      Collections.emptyList(), "S",
                      GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testToString() {
        assertEquals("Regular Grammar right-linear\n" + "Variables: S\n"
            + "Terminals: 0,1\n" + "Start Variable: S\n" + "Productions:\n"
            + " S -> 0S\n" + " S -> 1", zerosThenOne().toString());
    }
}
