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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Holds static methods for validating alphabets and splitting input
 * into symbols.
 * 
 * @author simpsons
 */
public final class Alphabets {
    private Alphabets() {}

    /**
     * Determine whether a string is usable as a symbol. A symbol is a
     * single character, which may be a surrogate pair.
     * 
     * @param text the candidate symbol
     * 
     * @return {@code true} if the string is exactly one character
     */
    public static boolean isSymbol(String text) {
        return text != null && !text.isEmpty()
            && text.codePointCount(0, text.length()) == 1;
    }

    /**
     * Create a validated alphabet.
     * 
     * @param symbols the symbols of the alphabet
     * 
     * @return an unmodifiable set of the symbols, in their original
     * order
     * 
     * @throws IllegalArgumentException if a symbol is
     * {@link FiniteStateMachine#EPSILON} or is longer than one
     * character
     */
    public static Set<String> of(Collection<String> symbols) {
        if (symbols == null) throw new NullPointerException("alphabet");
        Set<String> result = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (!isSymbol(symbol))
                throw new IllegalArgumentException("bad alphabet symbol: \""
                    + symbol + "\"");
            result.add(symbol);
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Split input into symbols.
     * 
     * @param input the input string
     * 
     * @return the symbols of the input in order, one per character
     */
    public static List<String> split(CharSequence input) {
        if (input == null) throw new NullPointerException("input");
        List<String> result = new ArrayList<>(input.length());
        input.codePoints()
            .forEach(cp -> result.add(new String(Character.toChars(cp))));
        return result;
    }

    /**
     * Split input into symbols, ensuring that each is in an alphabet.
     * 
     * @param input the input string
     * 
     * @param alphabet the permitted symbols
     * 
     * @return the symbols of the input in order
     * 
     * @throws InvalidInputSymbolException if a symbol is outside the
     * alphabet
     */
    public static List<String> check(CharSequence input,
                                     Set<String> alphabet) {
        List<String> symbols = split(input);
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            if (!alphabet.contains(symbol))
                throw new InvalidInputSymbolException(i, symbol, alphabet);
        }
        return symbols;
    }

    /**
     * Collect or validate the state set of a machine. If no states are
     * declared, the result consists of every state mentioned.
     * Otherwise, every mentioned state must be declared.
     * 
     * @param declared the declared states, or {@code null} if they are
     * to be inferred
     * 
     * @param mentioned states mentioned by the transitions, the start
     * state and any other parts of the machine
     * 
     * @return an unmodifiable set of states
     * 
     * @throws IllegalArgumentException if a mentioned state is not
     * declared
     */
    static Set<String> states(Collection<String> declared,
                              Collection<String> mentioned) {
        if (declared == null)
            return Collections
                .unmodifiableSet(new LinkedHashSet<>(mentioned));
        Set<String> result = new LinkedHashSet<>(declared);
        if (result.contains(null))
            throw new NullPointerException("null state");
        for (String state : mentioned)
            if (!result.contains(state))
                throw new IllegalArgumentException("undeclared state: "
                    + state);
        return Collections.unmodifiableSet(result);
    }
}
