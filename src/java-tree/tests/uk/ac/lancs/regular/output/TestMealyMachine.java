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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import uk.ac.lancs.regular.fsa.InvalidInputSymbolException;
import uk.ac.lancs.regular.fsa.NotAnAcceptorException;
import uk.ac.lancs.regular.fsa.SymbolNotInAlphabetException;

public class TestMealyMachine {
    static MealyMachine twoStates() {
        return MealyMachine.builder().alphabet("0", "1").start("q0")
            .transition("q0", "0", "q1", "x").transition("q0", "1", "q0", "y")
            .transition("q1", "0", "q1", "v").transition("q1", "1", "q0", "w")
            .build();
    }

    @Test
    public void testProcess() {
        assertEquals(Arrays.asList("x", "w"), twoStates().process("01"));
    }

    @Test
    public void testProcessEmpty() {
        assertTrue(twoStates().process("").isEmpty());
    }

    @Test
    public void testProcessLength() {
        assertEquals(5, twoStates().process("01101").size());
    }

    @Test
    public void testStep() {
        assertEquals(new MealyMachine.Step("q0", "w"),
                     twoStates().step("q1", "1"));
    }

    @Test
    public void testUnsetOutput() {
        MealyMachine mealy = MealyMachine.builder().alphabet("a").start("p")
            .transition("p", "a", "p").build();
        assertEquals("", mealy.output("p", "a"));
        assertEquals(Arrays.asList("", ""), mealy.process("aa"));
    }

    @Test(expected = NotAnAcceptorException.class)
    public void testNotAnAcceptor() {
        twoStates().accepts("01");
    }

    @Test(expected = SymbolNotInAlphabetException.class)
    public void testStepSymbolNotInAlphabet() {
        twoStates().step("q0", "2");
    }

    @Test(expected = InvalidInputSymbolException.class)
    public void testInvalidInput() {
        twoStates().process("012");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutputSymbolOutsideAlphabet() {
        new MealyMachine(Arrays.asList("a"), null,
                         Collections.singletonMap("p", Collections
                             .singletonMap("a", "p")),
                         "p", Collections.singletonMap("p", Collections
                             .singletonMap("b", "x")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConflictingTransition() {
        MealyMachine.builder().alphabet("a").start("p")
            .transition("p", "a", "q").transition("p", "a", "r");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConflictingOutput() {
        MealyMachine.builder().alphabet("a").start("p")
            .transition("p", "a", "q", "x").transition("p", "a", "q", "y");
    }

    @Test(expected = NullPointerException.class)
    public void testNullOutputValue() {
        MealyMachine.builder().alphabet("a").start("p")
            .transition("p", "a", "p", null);
    }

    @Test(expected = NullPointerException.class)
    public void testNullOutputInMap() {
        Map<String, String> edges = new HashMap<>();
        edges.put("a", null);
        new MealyMachine(Arrays.asList("a"), null,
                         Collections.singletonMap("p", Collections
                             .singletonMap("a", "p")),
                         "p", Collections.singletonMap("p", edges));
    }
}
