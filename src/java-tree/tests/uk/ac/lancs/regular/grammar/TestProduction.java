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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestProduction {
    @Test
    public void testToString() {
        assertEquals("A -> aB", Production.rightLinear("A", "a", "B").toString());
        assertEquals("A -> Ba", Production.leftLinear("A", "a", "B").toString());
        assertEquals("A -> a",
                     Production.terminal("A", "a", GrammarType.LEFT_LINEAR)
                         .toString());
        assertEquals("A -> epsilon",
                     Production.epsilon("A", GrammarType.RIGHT_LINEAR)
                         .toString());
    }

    @Test
    public void testKinds() {
        Production eps = Production.epsilon("A", GrammarType.RIGHT_LINEAR);
        assertTrue(eps.isEpsilon());
        assertFalse(eps.isTerminal());
        assertFalse(eps.hasVariable());
        Production lin = Production.rightLinear("A", "a", "B");
        assertFalse(lin.isEpsilon());
        assertTrue(lin.isTerminal());
        assertTrue(lin.hasVariable());
    }

    @Test
    public void testParseRightLinear() {
        Production prod = Production.parse("S -> 0Rest", GrammarType.RIGHT_LINEAR);
        assertEquals(Production.rightLinear("S", "0", "Rest"), prod);
    }

    @Test
    public void testParseLeftLinear() {
        Production prod = Production.parse("S->Rest0", GrammarType.LEFT_LINEAR);
        assertEquals(Production.leftLinear("S", "0", "Rest"), prod);
    }

    @Test
    public void testParseTerminalAndEpsilon() {
        assertEquals(Production.terminal("S", "1", GrammarType.RIGHT_LINEAR),
                     Production.parse("S -> 1", GrammarType.RIGHT_LINEAR));
        Production eps = Production.parse("S -> epsilon", GrammarType.LEFT_LINEAR);
        assertTrue(eps.isEpsilon());
        assertNull(eps.terminal());
        assertEquals(GrammarType.LEFT_LINEAR, eps.type());
        assertTrue(Production.parse("S -> ε", GrammarType.RIGHT_LINEAR)
            .isEpsilon());
    }

    @Test
    public void testParseRoundTrip() {
        Production prod = Production.leftLinear("X", "z", "Y");
        assertEquals(prod, Production.parse(prod.toString(),
                                            GrammarType.LEFT_LINEAR));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseNoArrow() {
        Production.parse("S 0S", GrammarType.RIGHT_LINEAR);
    }

    @Test
    public void testGrammarTypeLabels() {
        assertEquals(GrammarType.LEFT_LINEAR, GrammarType.forLabel("left-linear"));
        assertEquals("right-linear", GrammarType.RIGHT_LINEAR.label());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownGrammarType() {
        GrammarType.forLabel("sideways");
    }
}
