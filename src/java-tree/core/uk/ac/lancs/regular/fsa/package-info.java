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

/**
 * Models finite automata and converts them into regular expressions.
 * 
 * <p>
 * {@link uk.ac.lancs.regular.fsa.DeterministicAutomaton} tracks one
 * state at a time, while
 * {@link uk.ac.lancs.regular.fsa.NondeterministicAutomaton} tracks a
 * set closed under epsilon edges. Both are
 * {@linkplain uk.ac.lancs.regular.fsa.Acceptor acceptors}, and
 * {@link uk.ac.lancs.regular.fsa.Acceptor#toRegex()} yields an
 * equivalent {@link uk.ac.lancs.regular.expr.RegularExpression} by
 * state elimination. {@link uk.ac.lancs.regular.fsa.ThompsonConstruction}
 * goes the other way.
 * 
 * <p>
 * Misuse is reported with subclasses of
 * {@link uk.ac.lancs.regular.fsa.AutomatonException}. Malformed
 * construction data is rejected with
 * {@link java.lang.IllegalArgumentException}.
 * 
 * @resume Finite automata and their conversion to regular expressions
 * 
 * @author simpsons
 */
package uk.ac.lancs.regular.fsa;
