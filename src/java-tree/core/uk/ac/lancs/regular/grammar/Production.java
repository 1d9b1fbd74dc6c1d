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

import java.util.Objects;

/**
 * Represents a production of a regular grammar. A production has a
 * variable on its left side, and on its right side either nothing
 * (<samp>A &rarr; &epsilon;</samp>), a terminal
 * (<samp>A &rarr; a</samp>), or a terminal and a variable placed
 * according to the grammar's orientation.
 * 
 * @author simpsons
 */
public final class Production {
    private final String left;
    private final String terminal;
    private final String variable;
    private final GrammarType type;

    private Production(String left, String terminal, String variable,
                       GrammarType type) {
        if (left == null) throw new NullPointerException("left side");
        if (type == null) throw new NullPointerException("type");
        this.left = left;
        this.terminal = terminal;
        this.variable = variable;
        this.type = type;
    }

    /**
     * Create an epsilon production <samp>A &rarr; &epsilon;</samp>.
     * 
     * @param left the variable on the left side
     * 
     * @param type the orientation of the containing grammar
     * 
     * @return the new production
     */
    public static Production epsilon(String left, GrammarType type) {
        return new Production(left, null, null, type);
    }

    /**
     * Create a terminal production <samp>A &rarr; a</samp>.
     * 
     * @param left the variable on the left side
     * 
     * @param terminal the terminal on the right side
     * 
     * @param type the orientation of the containing grammar
     * 
     * @return the new production
     */
    public static Production terminal(String left, String terminal,
                                      GrammarType type) {
        if (terminal == null) throw new NullPointerException("terminal");
        return new Production(left, terminal, null, type);
    }

    /**
     * Create a right-linear production <samp>A &rarr; aB</samp>.
     * 
     * @param left the variable on the left side
     * 
     * @param terminal the leading terminal
     * 
     * @param variable the trailing variable
     * 
     * @return the new production
     */
    public static Production rightLinear(String left, String terminal,
                                         String variable) {
        if (terminal == null) throw new NullPointerException("terminal");
        if (variable == null) throw new NullPointerException("variable");
        return new Production(left, terminal, variable,
                              GrammarType.RIGHT_LINEAR);
    }

    /**
     * Create a left-linear production <samp>A &rarr; Ba</samp>.
     * 
     * @param left the variable on the left side
     * 
     * @param terminal the trailing terminal
     * 
     * @param variable the leading variable
     * 
     * @return the new production
     */
    public static Production leftLinear(String left, String terminal,
                                        String variable) {
        if (terminal == null) throw new NullPointerException("terminal");
        if (variable == null) throw new NullPointerException("variable");
        return new Production(left, terminal, variable,
                              GrammarType.LEFT_LINEAR);
    }

    /**
     * Parse a production in the form produced by {@link #toString()}.
     * The right side <samp>epsilon</samp> (or <samp>&epsilon;</samp>)
     * denotes an epsilon production, and a single character denotes a
     * terminal production. Otherwise, the terminal is the first
     * character of a right-linear production, or the last of a
     * left-linear one, and the remainder names the variable.
     * 
     * @param text the text to parse, e.g., <samp>S -&gt; 0S</samp>
     * 
     * @param type the orientation of the containing grammar
     * 
     * @return the parsed production
     * 
     * @throws IllegalArgumentException if the text has no arrow, or
     * either side is empty
     */
    public static Production parse(String text, GrammarType type) {
        int arrow = text.indexOf("->");
        if (arrow < 0)
            throw new IllegalArgumentException("no arrow in production: "
                + text);
        String left = text.substring(0, arrow).trim();
        String right = text.substring(arrow + 2).trim();
        if (left.isEmpty() || right.isEmpty())
            throw new IllegalArgumentException("incomplete production: "
                + text);
        if (right.equals("epsilon") || right.equals("ε"))
            return epsilon(left, type);
        if (right.codePointCount(0, right.length()) == 1)
            return terminal(left, right, type);
        switch (type) {
        case RIGHT_LINEAR: {
            int split = right.offsetByCodePoints(0, 1);
            return rightLinear(left, right.substring(0, split),
                               right.substring(split));
        }

        case LEFT_LINEAR: {
            int split = right.offsetByCodePoints(right.length(), -1);
            return leftLinear(left, right.substring(split),
                              right.substring(0, split));
        }

        default:
            throw new AssertionError("unreachable");
        }
    }

    /**
     * Get the variable on the left side.
     * 
     * @return the left-side variable
     */
    public String left() {
        return left;
    }

    /**
     * Get the terminal on the right side.
     * 
     * @return the terminal, or {@code null} for an epsilon production
     */
    public String terminal() {
        return terminal;
    }

    /**
     * Get the variable on the right side.
     * 
     * @return the right-side variable, or {@code null} if there is none
     */
    public String variable() {
        return variable;
    }

    /**
     * Get the orientation of this production.
     * 
     * @return the orientation
     */
    public GrammarType type() {
        return type;
    }

    /**
     * Determine whether this is an epsilon production.
     * 
     * @return {@code true} if the right side is empty
     */
    public boolean isEpsilon() {
        return terminal == null && variable == null;
    }

    /**
     * Determine whether this production yields a terminal.
     * 
     * @return {@code true} if the right side has a terminal
     */
    public boolean isTerminal() {
        return terminal != null;
    }

    /**
     * Determine whether this production refers to another variable.
     * 
     * @return {@code true} if the right side has a variable
     */
    public boolean hasVariable() {
        return variable != null;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 29 * hash + left.hashCode();
        hash = 29 * hash + Objects.hashCode(terminal);
        hash = 29 * hash + Objects.hashCode(variable);
        hash = 29 * hash + type.hashCode();
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (getClass() != obj.getClass()) return false;
        final Production other = (Production) obj;
        return left.equals(other.left)
            && Objects.equals(terminal, other.terminal)
            && Objects.equals(variable, other.variable)
            && type == other.type;
    }

    @Override
    public String toString() {
        if (isEpsilon()) return left + " -> epsilon";
        if (!hasVariable()) return left + " -> " + terminal;
        if (type == GrammarType.RIGHT_LINEAR)
            return left + " -> " + terminal + variable;
        return left + " -> " + variable + terminal;
    }
}
