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

import java.util.Set;

/**
 * Matches one expression followed by another. Obtain instances with
 * {@link RegularExpression#concat(RegularExpression, RegularExpression)}.
 * 
 * @author simpsons
 */
public final class Concatenation extends RegularExpression {
    private final RegularExpression left, right;
    private final int hash;

    Concatenation(RegularExpression left, RegularExpression right) {
        this.left = left;
        this.right = right;
        this.hash = (37 + left.hashCode()) * 37 + right.hashCode();
    }

    /**
     * Get the leading expression.
     * 
     * @return the leading expression
     */
    public RegularExpression left() {
        return left;
    }

    /**
     * Get the trailing expression.
     * 
     * @return the trailing expression
     */
    public RegularExpression right() {
        return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    void collectSymbols(Set<String> result) {
        left.collectSymbols(result);
        right.collectSymbols(result);
    }

    /* A union operand already carries its own parentheses. */
    @Override
    void render(StringBuilder buf) {
        left.render(buf);
        right.render(buf);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (getClass() != obj.getClass()) return false;
        Concatenation other = (Concatenation) obj;
        return hash == other.hash && left.equals(other.left)
            && right.equals(other.right);
    }
}
