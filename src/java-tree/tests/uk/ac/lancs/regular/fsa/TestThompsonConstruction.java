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
import static uk.ac.lancs.regular.expr.RegularExpression.EMPTY_SET;
import static uk.ac.lancs.regular.expr.RegularExpression.EMPTY_STRING;
import static uk.ac.lancs.regular.expr.RegularExpression.symbol;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

import uk.ac.lancs.regular.expr.RegularExpression;

public class TestThompsonConstruction {
    private static final RegularExpression a = symbol('a');
    private static final RegularExpression b = symbol('b');

    @Test
    public void testSymbol() {
        NondeterministicAutomaton nfa = ThompsonConstruction.toAutomaton(a);
        assertTrue(nfa.accepts("a"));
        assertFalse(nfa.accepts(""));
        assertFalse(nfa.accepts("aa"));
    }

    @Test
    public void testEmptyString() {
        NondeterministicAutomaton nfa =
            ThompsonConstruction.toAutomaton(EMPTY_STRING, Arrays.asList("a"));
        assertTrue(nfa.accepts(""));
        assertFalse(nfa.accepts("a"));
    }

    @Test
    public void testEmptySet() {
        NondeterministicAutomaton nfa =
            ThompsonConstruction.toAutomaton(EMPTY_SET, Arrays.asList("a"));
        assertFalse(nfa.accepts(""));
        assertFalse(nfa.accepts("a"));
    }

    @Test
    public void testStarOfUnionThenSymbol() {
        NondeterministicAutomaton nfa =
            ThompsonConstruction.toAutomaton(a.or(b).star().then(a));
        assertTrue(nfa.accepts("a"));
        assertTrue(nfa.accepts("bba"));
        assertTrue(nfa.accepts("abaa"));
        assertFalse(nfa.accepts(""));
        assertFalse(nfa.accepts("ab"));
    }

    @Test
    public void testAlphabetWidened() {
        NondeterministicAutomaton nfa =
            ThompsonConstruction.toAutomaton(a, Arrays.asList("b", "c"));
        assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")),
                     nfa.alphabet());
        assertFalse(nfa.accepts("c"));
    }

    @Test
    public void testSingleStartAndFinal() {
        NondeterministicAutomaton nfa =
            ThompsonConstruction.toAutomaton(a.then(b).star().or(b));
        assertEquals(1, nfa.finalStates().size());
        assertTrue(nfa.states().contains(nfa.start()));
    }
}
