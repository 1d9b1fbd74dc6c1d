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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static uk.ac.lancs.regular.expr.RegularExpression.EMPTY_SET;
import static uk.ac.lancs.regular.expr.RegularExpression.EMPTY_STRING;
import static uk.ac.lancs.regular.expr.RegularExpression.concat;
import static uk.ac.lancs.regular.expr.RegularExpression.kleeneStar;
import static uk.ac.lancs.regular.expr.RegularExpression.symbol;
import static uk.ac.lancs.regular.expr.RegularExpression.union;

import java.util.Arrays;
import java.util.LinkedHashSet;

import org.junit.Test;

public class TestRegularExpression {
    private static final RegularExpression a = symbol('a');
    private static final RegularExpression b = symbol('b');
    private static final RegularExpression c = symbol('c');

    private static final RegularExpression[] samples =
        { a, EMPTY_STRING, EMPTY_SET, union(a, b), concat(a, b),
          kleeneStar(a), concat(kleeneStar(union(a, b)), c) };

    @Test
    public void testUnionIdentity() {
        for (RegularExpression x : samples) {
            assertEquals(x, union(EMPTY_SET, x));
            assertEquals(x, union(x, EMPTY_SET));
            assertEquals(x, union(x, x));
        }
    }

    @Test
    public void testConcatIdentity() {
        for (RegularExpression x : samples) {
            assertEquals(x, concat(EMPTY_STRING, x));
            assertEquals(x, concat(x, EMPTY_STRING));
        }
    }

    @Test
    public void testConcatAbsorption() {
        for (RegularExpression x : samples) {
            assertSame(EMPTY_SET, concat(EMPTY_SET, x));
            assertSame(EMPTY_SET, concat(x, EMPTY_SET));
        }
    }

    @Test
    public void testStarOfEmpty() {
        assertSame(EMPTY_STRING, kleeneStar(EMPTY_STRING));
        assertSame(EMPTY_STRING, kleeneStar(EMPTY_SET));
    }

    @Test
    public void testStarDropsEpsilonOption() {
        assertEquals(kleeneStar(a), kleeneStar(union(EMPTY_STRING, a)));
        assertEquals(kleeneStar(a), kleeneStar(union(a, EMPTY_STRING)));
        assertEquals("(ab)*",
                     kleeneStar(union(EMPTY_STRING, concat(a, b))).toString());
    }

    @Test
    public void testStarIdempotent() {
        RegularExpression once = kleeneStar(union(a, b));
        RegularExpression twice = kleeneStar(once);
        assertEquals(once, twice);
        assertEquals("(a|b)*", twice.toString());
        assertEquals("a*", kleeneStar(kleeneStar(a)).toString());
    }

    @Test
    public void testNoIdentityNodes() {
        assertTrue(union(EMPTY_SET, a) instanceof Symbol);
        assertTrue(concat(EMPTY_STRING, a) instanceof Symbol);
    }

    @Test
    public void testRenderSymbols() {
        assertEquals("a", a.toString());
        assertEquals("ε", EMPTY_STRING.toString());
        assertEquals("∅", EMPTY_SET.toString());
    }

    @Test
    public void testRenderPrecedence() {
        assertEquals("(a|b)c", concat(union(a, b), c).toString());
        assertEquals("(a|b)*", kleeneStar(union(a, b)).toString());
        assertEquals("(ab)*", kleeneStar(concat(a, b)).toString());
        assertEquals("ab*", concat(a, kleeneStar(b)).toString());
        assertEquals("(ab|c)", union(concat(a, b), c).toString());
        assertEquals("c(a|b)", concat(c, union(a, b)).toString());
    }

    @Test
    public void testNestedUnionFlattened() {
        assertEquals("(a|b|c)", union(union(a, b), c).toString());
        assertEquals("(a|b|c)", union(a, union(b, c)).toString());
        assertEquals("((a|b)*|c)", union(kleeneStar(union(a, b)), c).toString());
    }

    @Test
    public void testFluent() {
        assertEquals("a(a|b)*", a.then(a.or(b).star()).toString());
        assertEquals(concat(a, b), a.then(b));
    }

    @Test
    public void testStructuralEquality() {
        assertEquals(concat(a, union(b, c)), concat(symbol("a"),
                                                    union(symbol("b"), c)));
        assertEquals(concat(a, union(b, c)).hashCode(),
                     concat(symbol("a"), union(symbol("b"), c)).hashCode());
        assertNotEquals(union(a, b), union(b, a));
        assertNotEquals(concat(a, b), concat(b, a));
        assertNotEquals(union(a, b), concat(a, b));
    }

    @Test
    public void testSymbols() {
        RegularExpression expr = concat(kleeneStar(union(c, a)), concat(a, b));
        assertEquals(new LinkedHashSet<>(Arrays.asList("c", "a", "b")),
                     expr.symbols());
        assertTrue(EMPTY_SET.symbols().isEmpty());
    }

    @Test
    public void testSurrogatePairSymbol() {
        RegularExpression clef = symbol("𝄞");
        assertEquals("𝄞", clef.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMultiCharacterSymbol() {
        symbol("ab");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySymbol() {
        symbol("");
    }

    @Test
    public void testVisitor() {
        RegularExpression expr = concat(kleeneStar(union(a, b)), c);
        int depth = expr.accept(new RegularExpression.Visitor<Integer>() {
            @Override
            public Integer visit(Symbol expr) {
                return 1;
            }

            @Override
            public Integer visit(EmptyString expr) {
                return 1;
            }

            @Override
            public Integer visit(EmptySet expr) {
                return 1;
            }

            @Override
            public Integer visit(Union expr) {
                return 1 + Math.max(expr.left().accept(this),
                                    expr.right().accept(this));
            }

            @Override
            public Integer visit(Concatenation expr) {
                return 1 + Math.max(expr.left().accept(this),
                                    expr.right().accept(this));
            }

            @Override
            public Integer visit(KleeneStar expr) {
                return 1 + expr.inner().accept(this);
            }
        });
        assertEquals(4, depth);
    }
}
