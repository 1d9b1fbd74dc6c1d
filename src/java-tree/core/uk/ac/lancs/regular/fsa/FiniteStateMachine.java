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

import java.util.Map;
import java.util.Set;

/**
 * Exposes the parts common to all finite-state machines. States and
 * symbols are strings, and every symbol is a single character. All
 * collections returned are unmodifiable, so a machine can be simulated
 * or converted by several threads at once.
 * 
 * @author simpsons
 */
public interface FiniteStateMachine {
    /**
     * The label of an edge that consumes no input, namely {@value}
     */
    String EPSILON = "";

    /**
     * Get the input alphabet. The alphabet never contains
     * {@link #EPSILON}.
     * 
     * @return the set of input symbols
     */
    Set<String> alphabet();

    /**
     * Get the states.
     * 
     * @return the set of states, including the start state and any
     * final states
     */
    Set<String> states();

    /**
     * Get the start state.
     * 
     * @return the start state
     */
    String start();

    /**
     * Get the transition relation in canonical form. Each state with
     * outgoing edges maps each label to the set of target states. A
     * deterministic machine yields singleton sets, and only a
     * non-deterministic one uses {@link #EPSILON} as a label.
     * 
     * @return a mapping from source state to label to target states
     */
    Map<String, Map<String, Set<String>>> transitions();

    /**
     * Determine whether the machine accepts an input string.
     * 
     * @param input the input string
     * 
     * @return {@code true} if the input is accepted
     * 
     * @throws InvalidInputSymbolException if the input contains a
     * character outside the alphabet
     * 
     * @throws NotAnAcceptorException if this machine produces output
     * instead of accepting or rejecting input
     */
    boolean accepts(CharSequence input);
}
