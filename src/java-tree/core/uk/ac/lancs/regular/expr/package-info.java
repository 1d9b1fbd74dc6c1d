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
 * Represents regular expressions as immutable trees of
 * {@link uk.ac.lancs.regular.expr.Symbol},
 * {@link uk.ac.lancs.regular.expr.EmptyString},
 * {@link uk.ac.lancs.regular.expr.EmptySet},
 * {@link uk.ac.lancs.regular.expr.Union},
 * {@link uk.ac.lancs.regular.expr.Concatenation} and
 * {@link uk.ac.lancs.regular.expr.KleeneStar} nodes. For example:
 * 
 * <pre>
 * RegularExpression a = RegularExpression.symbol('a');
 * RegularExpression b = RegularExpression.symbol('b');
 * RegularExpression expr = a.then(a.or(b).star());
 * System.out.println(expr); // a(a|b)*
 * </pre>
 * 
 * <p>
 * Nodes can only be created through the static methods of
 * {@link uk.ac.lancs.regular.expr.RegularExpression}, which simplify
 * as they build.
 * 
 * @resume Structural representation of regular expressions
 * 
 * @author simpsons
 */
package uk.ac.lancs.regular.expr;
