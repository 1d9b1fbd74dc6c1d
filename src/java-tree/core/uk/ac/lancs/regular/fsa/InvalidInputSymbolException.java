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
import java.util.TreeSet;

/**
 * Indicates that an input string contains a character outside a
 * machine's alphabet. The check is made before any transition is
 * attempted for the character.
 * 
 * @author simpsons
 */
public class InvalidInputSymbolException
    extends SymbolNotInAlphabetException {
    private static final long serialVersionUID = 1L;

    private final int position;

    /**
     * Get the position of the offending character in the input.
     * 
     * @return the zero-based position, counted in symbols
     */
    public int getPosition() {
        return position;
    }

    /**
     * Create an exception.
     * 
     * @param position the zero-based position of the offending symbol
     * 
     * @param symbol the offending symbol
     * 
     * @param alphabet the alphabet that does not contain the symbol
     */
    public InvalidInputSymbolException(int position, String symbol,
                                       Collection<String> alphabet) {
        super("invalid input symbol at pos " + position + ": '" + symbol
            + "' not in alphabet " + new TreeSet<>(alphabet), symbol);
        this.position = position;
    }
}
