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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import uk.ac.lancs.regular.expr.Concatenation;
import uk.ac.lancs.regular.expr.EmptySet;
import uk.ac.lancs.regular.expr.EmptyString;
import uk.ac.lancs.regular.expr.KleeneStar;
import uk.ac.lancs.regular.expr.RegularExpression;
import uk.ac.lancs.regular.expr.Symbol;
import uk.ac.lancs.regular.expr.Union;

/**
 * Builds a non-deterministic automaton from a regular expression by
 * Thompson's construction. Each node yields a fragment with a single
 * entry state and a single exit state, and fragments are joined with
 * epsilon edges. States are named <samp>t0</samp>, <samp>t1</samp>,
 * and so on.
 * 
 * @author simpsons
 */
public final class ThompsonConstruction {
    private ThompsonConstruction() {}

    /**
     * Build an automaton accepting the language of an expression, over
     * the symbols the expression uses.
     * 
     * @param expr the expression
     * 
     * @return an equivalent automaton
     */
    public static NondeterministicAutomaton
        toAutomaton(RegularExpression expr) {
        return toAutomaton(expr, expr.symbols());
    }

    /**
     * Build an automaton accepting the language of an expression, over
     * a given alphabet. Symbols used by the expression are added to the
     * alphabet if missing.
     * 
     * @param expr the expression
     * 
     * @param alphabet the alphabet of the automaton
     * 
     * @return an equivalent automaton
     */
    public static NondeterministicAutomaton
        toAutomaton(RegularExpression expr, Collection<String> alphabet) {
        Set<String> symbols = new LinkedHashSet<>(alphabet);
        symbols.addAll(expr.symbols());
        NondeterministicAutomaton.Builder builder =
            NondeterministicAutomaton.builder().alphabet(symbols);
        Fragment whole = expr.accept(new Fragmenter(builder));
        return builder.start(whole.entry).finalState(whole.exit).build();
    }

    private static final class Fragment {
        final String entry, exit;

        Fragment(String entry, String exit) {
            this.entry = entry;
            this.exit = exit;
        }
    }

    private static final class Fragmenter
        implements RegularExpression.Visitor<Fragment> {
        private final NondeterministicAutomaton.Builder builder;
        private int next = 0;

        Fragmenter(NondeterministicAutomaton.Builder builder) {
            this.builder = builder;
        }

        private Fragment fresh() {
            String entry = "t" + next++;
            String exit = "t" + next++;
            builder.state(entry, exit);
            return new Fragment(entry, exit);
        }

        @Override
        public Fragment visit(Symbol expr) {
            Fragment result = fresh();
            builder.transition(result.entry, expr.symbol(), result.exit);
            return result;
        }

        @Override
        public Fragment visit(EmptyString expr) {
            Fragment result = fresh();
            builder.epsilon(result.entry, result.exit);
            return result;
        }

        @Override
        public Fragment visit(EmptySet expr) {
            return fresh();
        }

        @Override
        public Fragment visit(Union expr) {
            Fragment result = fresh();
            Fragment left = expr.left().accept(this);
            Fragment right = expr.right().accept(this);
            builder.epsilon(result.entry, left.entry, right.entry);
            builder.epsilon(left.exit, result.exit);
            builder.epsilon(right.exit, result.exit);
            return result;
        }

        @Override
        public Fragment visit(Concatenation expr) {
            Fragment left = expr.left().accept(this);
            Fragment right = expr.right().accept(this);
            builder.epsilon(left.exit, right.entry);
            return new Fragment(left.entry, right.exit);
        }

        @Override
        public Fragment visit(KleeneStar expr) {
            Fragment result = fresh();
            Fragment inner = expr.inner().accept(this);
            builder.epsilon(result.entry, inner.entry, result.exit);
            builder.epsilon(inner.exit, inner.entry, result.exit);
            return result;
        }
    }
}
