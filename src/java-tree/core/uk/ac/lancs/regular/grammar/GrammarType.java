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

/**
 * Identifies the orientation of a regular grammar, i.e., which end of
 * a linear production's right-hand side holds the variable.
 * 
 * @author simpsons
 */
public enum GrammarType {
    /**
     * Linear productions have the form <samp>A &rarr; aB</samp>.
     */
    RIGHT_LINEAR("right-linear"),

    /**
     * Linear productions have the form <samp>A &rarr; Ba</samp>.
     */
    LEFT_LINEAR("left-linear");

    private final String label;

    GrammarType(String label) {
        this.label = label;
    }

    /**
     * Get the external name of this orientation.
     * 
     * @return the label, as used in descriptions
     */
    public String label() {
        return label;
    }

    /**
     * Find the orientation with a given label.
     * 
     * @param label the label, as returned by {@link #label()}
     * 
     * @return the matching orientation
     * 
     * @throws IllegalArgumentException if no orientation has the label
     */
    public static GrammarType forLabel(String label) {
        for (GrammarType type : values())
            if (type.label.equals(label)) return type;
        throw new IllegalArgumentException("unknown grammar orientation: "
            + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
