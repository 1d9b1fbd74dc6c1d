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

package uk.ac.lancs.regular.expr;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Represents a regular expression structurally. Expressions are built
 * from {@link #symbol(String)}, {@link #EMPTY_STRING} and
 * {@link #EMPTY_SET}, and combined with {@link #union(RegularExpression, RegularExpression)},
 * {@link #concat(RegularExpression, RegularExpression)} and
 * {@link #kleeneStar(RegularExpression)}, or with the equivalent
 * instance methods {@link #or(RegularExpression)},
 * {@link #then(RegularExpression)} and {@link #star()}. These are the
 * only ways to obtain compound nodes, and each applies algebraic
 * simplification, so a union with the empty set, for example, never
 * exists as a node.
 * 
 * <p>
 * The set of node kinds is closed. Consumers that must handle every
 * kind should implement {@link Visitor} and call
 * {@link #accept(Visitor)}.
 * 
 * <p>
 * Nodes are immutable, and equality is structural.
 * 
 * @author simpsons
 */
public abstract class RegularExpression {
    RegularExpression() {}

    /**
     * Handles each kind of expression node.
     * 
     * @param <R> the result type
     */
    public interface Visitor<R> {
        /**
         * Handle a single-symbol expression.
         * 
         * @param expr the expression
         * 
         * @return the result of handling the expression
         */
        R visit(Symbol expr);

        /**
         * Handle the expression matching only the empty string.
         * 
         * @param expr the expression
         * 
         * @return the result of handling the expression
         */
        R visit(EmptyString expr);

        /**
         * Handle the expression matching nothing.
         * 
         * @param expr the expression
         * 
         * @return the result of handling the expression
         */
        R visit(EmptySet expr);

        /**
         * Handle a choice between two expressions.
         * 
         * @param expr the expression
         * 
         * @return the result of handling the expression
         */
        R visit(Union expr);

        /**
         * Handle a sequence of two expressions.
         * 
         * @param expr the expression
         * 
         * @return the result of handling the expression
         */
        R visit(Concatenation expr);

        /**
         * Handle a repetition of an expression.
         * 
         * @param expr the expression
         * 
         * @return the result of handling the expression
         */
        R visit(KleeneStar expr);
    }

    /**
     * Pass this expression to the handler for its kind.
     * 
     * @param visitor the handler
     * 
     * @param <R> the result type
     * 
     * @return the handler's result
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * An expression matching only the empty string, rendered as
     * <samp>&#x03b5;</samp>
     */
    public static final RegularExpression EMPTY_STRING = EmptyString.INSTANCE;

    /**
     * An expression matching nothing, rendered as
     * <samp>&#x2205;</samp>
     */
    public static final RegularExpression EMPTY_SET = EmptySet.INSTANCE;

    /**
     * Create an expression matching a single symbol.
     * 
     * @param symbol the symbol, a single character
     * 
     * @return an expression matching exactly the symbol
     * 
     * @throws IllegalArgumentException if the symbol is not exactly
     * one character
     */
    public static RegularExpression symbol(String symbol) {
        return new Symbol(symbol);
    }

    /**
     * Create an expression matching a single character.
     * 
     * @param symbol the character
     * 
     * @return an expression matching exactly the character
     */
    public static RegularExpression symbol(char symbol) {
        return new Symbol(String.valueOf(symbol));
    }

    /**
     * Create an expression matching either of two expressions. The
     * empty set is the identity, and a union of an expression with
     * itself is the expression.
     * 
     * @param left the first option
     * 
     * @param right the second option
     * 
     * @return an expression matching either option
     */
    public static RegularExpression union(RegularExpression left,
                                          RegularExpression right) {
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");
        if (left == EMPTY_SET) return right;
        if (right == EMPTY_SET) return left;
        if (left.equals(right)) return left;
        return new Union(left, right);
    }

    /**
     * Create an expression matching one expression followed by
     * another. The empty string is the identity, and the empty set
     * absorbs.
     * 
     * @param left the leading expression
     * 
     * @param right the trailing expression
     * 
     * @return an expression matching the leading expression followed
     * by the trailing one
     */
    public static RegularExpression concat(RegularExpression left,
                                           RegularExpression right) {
        if (left == null) throw new NullPointerException("left");
        if (right == null) throw new NullPointerException("right");
        if (left == EMPTY_STRING) return right;
        if (right == EMPTY_STRING) return left;
        if (left == EMPTY_SET || right == EMPTY_SET) return EMPTY_SET;
        return new Concatenation(left, right);
    }

    /**
     * Create an expression matching any number of repetitions of
     * another, including none.
     * 
     * @param inner the repeated expression
     * 
     * @return an expression matching zero or more repetitions of the
     * inner expression
     */
    public static RegularExpression kleeneStar(RegularExpression inner) {
        if (inner == null) throw new NullPointerException("inner");
        if (inner == EMPTY_STRING || inner == EMPTY_SET) return EMPTY_STRING;
        if (inner instanceof Union) {
            /* (ε|B)* = B* and (A|ε)* = A* */
            Union choice = (Union) inner;
            if (choice.left() == EMPTY_STRING)
                return kleeneStar(choice.right());
            if (choice.right() == EMPTY_STRING)
                return kleeneStar(choice.left());
        }
        if (inner instanceof KleeneStar) return inner;
        return new KleeneStar(inner);
    }

    /**
     * Create an expression matching this one or another.
     * 
     * @param other the other option
     * 
     * @return an expression matching either this expression or the
     * other
     */
    public final RegularExpression or(RegularExpression other) {
        return union(this, other);
    }

    /**
     * Append an expression to this one.
     * 
     * @param next the following expression
     * 
     * @return an expression equivalent to this one followed by the next
     * one
     */
    public final RegularExpression then(RegularExpression next) {
        return concat(this, next);
    }

    /**
     * Create an expression matching any number of repetitions of this
     * one.
     * 
     * @return the Kleene star of this expression
     */
    public final RegularExpression star() {
        return kleeneStar(this);
    }

    /**
     * Get the symbols used by this expression.
     * 
     * @return an unmodifiable set of the symbols appearing in this
     * expression, in order of first appearance from the left
     */
    public final Set<String> symbols() {
        Set<String> result = new LinkedHashSet<>();
        collectSymbols(result);
        return Collections.unmodifiableSet(result);
    }

    abstract void collectSymbols(Set<String> result);

    abstract void render(StringBuilder buf);

    /**
     * Render this expression as text. A union is always enclosed in
     * parentheses, with nested unions flattened into it, and the
     * operand of a star is enclosed in parentheses if it is a
     * concatenation.
     * 
     * @return this expression as text
     */
    @Override
    public final String toString() {
        StringBuilder result = new StringBuilder();
        render(result);
        return result.toString();
    }
}
