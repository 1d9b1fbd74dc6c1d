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

import static uk.ac.lancs.regular.expr.RegularExpression.EMPTY_SET;
import static uk.ac.lancs.regular.expr.RegularExpression.EMPTY_STRING;
import static uk.ac.lancs.regular.expr.RegularExpression.concat;
import static uk.ac.lancs.regular.expr.RegularExpression.kleeneStar;
import static uk.ac.lancs.regular.expr.RegularExpression.union;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import uk.ac.lancs.regular.expr.RegularExpression;

/**
 * Converts an acceptor into a regular expression by state elimination.
 * A matrix holds, for each ordered pair of states, an expression for
 * the paths between them through states already eliminated. Every
 * state other than the start and the single final state is removed in
 * turn, and the expression is read from what remains.
 * 
 * @author simpsons
 */
final class StateEliminator {
    private StateEliminator() {}

    /**
     * The name given to a synthesized final state, primed until it is
     * distinct from all existing states
     */
    static final String SYNTHETIC_FINAL = "F_new";

    static RegularExpression toRegex(Acceptor automaton) {
        Set<String> finalStates = automaton.finalStates();
        if (finalStates.isEmpty()) throw new NoFinalStateException();
        logger.fine(() -> String
            .format("eliminating states of %d-state automaton from %s",
                    automaton.states().size(), automaton.start()));

        /* Start with no paths between any pair. */
        List<String> states = new ArrayList<>(automaton.states());
        Map<String, Map<String, RegularExpression>> matrix =
            new LinkedHashMap<>();
        for (String from : states) {
            Map<String, RegularExpression> row = new LinkedHashMap<>();
            for (String to : states)
                row.put(to, EMPTY_SET);
            matrix.put(from, row);
        }

        /* Merge parallel edges into a single union per pair. */
        for (Map.Entry<String, Map<String, Set<String>>> entry : automaton
            .transitions().entrySet()) {
            Map<String, RegularExpression> row = matrix.get(entry.getKey());
            for (Map.Entry<String, Set<String>> edge : entry.getValue()
                .entrySet()) {
                String label = edge.getKey();
                RegularExpression expr =
                    FiniteStateMachine.EPSILON.equals(label) ? EMPTY_STRING :
                        RegularExpression.symbol(label);
                for (String to : edge.getValue())
                    row.put(to, union(row.get(to), expr));
            }
        }

        /* Ensure there is exactly one final state. */
        final String start = automaton.start();
        final String last;
        if (finalStates.size() > 1) {
            String fresh = SYNTHETIC_FINAL;
            while (matrix.containsKey(fresh))
                fresh += "'";
            last = fresh;
            for (Map<String, RegularExpression> row : matrix.values())
                row.put(last, EMPTY_SET);
            states.add(last);
            Map<String, RegularExpression> row = new LinkedHashMap<>();
            for (String to : states)
                row.put(to, EMPTY_SET);
            matrix.put(last, row);
            for (String state : finalStates)
                matrix.get(state).put(last, EMPTY_STRING);
            logger.fine(() -> String.format("synthesized final state %s for %s",
                                            last, finalStates));
        } else {
            last = finalStates.iterator().next();
        }

        for (String victim : states) {
            if (victim.equals(start) || victim.equals(last)) continue;
            eliminate(matrix, victim);
        }

        RegularExpression result = finish(matrix, start, last);
        logger.fine(() -> String.format("state elimination yielded %s",
                                        result));
        return result;
    }

    /**
     * Remove a state from the matrix, routing paths through it
     * directly. The removed state's row, column and loop are captured
     * before any entry is updated.
     */
    private static void eliminate(Map<String, Map<String, RegularExpression>> matrix,
                                  String victim) {
        Map<String, RegularExpression> outgoing = matrix.remove(victim);
        RegularExpression loop = kleeneStar(outgoing.remove(victim));
        Map<String, RegularExpression> incoming = new HashMap<>();
        for (Map.Entry<String, Map<String, RegularExpression>> entry : matrix
            .entrySet())
            incoming.put(entry.getKey(), entry.getValue().remove(victim));

        for (Map.Entry<String, Map<String, RegularExpression>> entry : matrix
            .entrySet()) {
            RegularExpression in = incoming.get(entry.getKey());
            if (in == EMPTY_SET) continue;
            RegularExpression prefix = concat(in, loop);
            Map<String, RegularExpression> row = entry.getValue();
            for (Map.Entry<String, RegularExpression> cell : row.entrySet()) {
                RegularExpression via =
                    concat(prefix, outgoing.get(cell.getKey()));
                cell.setValue(union(cell.getValue(), via));
            }
        }
        logger.finer(() -> String.format("eliminated %s, %d states remain",
                                         victim, matrix.size()));
    }

    /**
     * Read the expression from the two remaining states. Paths may
     * leave the final state and return to the start, so the general
     * form is
     * <samp>(R<sub>ss</sub>|R<sub>sf</sub>R<sub>ff</sub>*R<sub>fs</sub>)*R<sub>sf</sub>R<sub>ff</sub>*</samp>.
     */
    private static RegularExpression
        finish(Map<String, Map<String, RegularExpression>> matrix,
               String start, String last) {
        RegularExpression startLoop = matrix.get(start).get(start);
        if (start.equals(last)) return kleeneStar(startLoop);

        RegularExpression direct = matrix.get(start).get(last);
        RegularExpression finalLoop = kleeneStar(matrix.get(last).get(last));
        RegularExpression back = matrix.get(last).get(start);
        RegularExpression loop =
            union(startLoop, concat(concat(direct, finalLoop), back));
        RegularExpression path = concat(direct, finalLoop);
        if (loop == EMPTY_SET) return path;
        return concat(kleeneStar(loop), path);
    }

    private static final Logger logger =
        Logger.getLogger(StateEliminator.class.getName());
}
