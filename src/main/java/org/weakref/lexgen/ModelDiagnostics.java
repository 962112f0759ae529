/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.weakref.lexgen;

import com.google.common.collect.ImmutableList;
import org.weakref.lexgen.Condition.Else;
import org.weakref.lexgen.Condition.Neither;
import org.weakref.lexgen.Condition.Not;
import org.weakref.lexgen.Condition.Or;
import org.weakref.lexgen.Condition.Range;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import static java.lang.String.format;
import static org.weakref.lexgen.Diagnostic.Type.EMPTY_RANGE;
import static org.weakref.lexgen.Diagnostic.Type.NO_TRANSITIONS;
import static org.weakref.lexgen.Diagnostic.Type.SHADOWED_TRANSITION;
import static org.weakref.lexgen.Diagnostic.Type.UNREACHABLE_STATE;

/**
 * Finds likely authoring mistakes. Nothing reported here makes a model invalid:
 * overlapping rules are resolved by declaration order.
 */
public final class ModelDiagnostics
{
    private ModelDiagnostics() {}

    public static List<Diagnostic> analyze(LexerModel model)
    {
        ImmutableList.Builder<Diagnostic> result = ImmutableList.builder();

        BitSet reachable = reachableStates(model);
        for (int state = 0; state < model.numStates(); state++) {
            List<Transition> transitions = model.transitions(state);

            if (!reachable.get(state)) {
                result.add(new Diagnostic(UNREACHABLE_STATE, state, -1, "not reachable from state 0"));
            }
            else if (transitions.isEmpty()) {
                result.add(new Diagnostic(NO_TRANSITIONS, state, -1, "any input in this state fails the scan"));
            }

            int catchAll = -1;
            for (int i = 0; i < transitions.size(); i++) {
                Transition transition = transitions.get(i);
                if (catchAll >= 0) {
                    result.add(new Diagnostic(SHADOWED_TRANSITION, state, i, format("never fires: transition %s matches everything", catchAll)));
                }
                else if (transition.condition() instanceof Else) {
                    catchAll = i;
                }

                if (hasEmptyRange(transition.condition())) {
                    result.add(new Diagnostic(EMPTY_RANGE, state, i, format("%s contains a range that matches nothing", transition.condition())));
                }
            }
        }

        return result.build();
    }

    private static BitSet reachableStates(LexerModel model)
    {
        BitSet visited = new BitSet(model.numStates());
        Deque<Integer> queue = new ArrayDeque<>();
        visited.set(0);
        queue.add(0);
        while (!queue.isEmpty()) {
            int state = queue.poll();
            for (Transition transition : model.transitions(state)) {
                if (!visited.get(transition.target())) {
                    visited.set(transition.target());
                    queue.add(transition.target());
                }
            }
        }
        return visited;
    }

    private static boolean hasEmptyRange(Condition condition)
    {
        if (condition instanceof Range range) {
            return range.isEmpty();
        }
        else if (condition instanceof Not not) {
            return hasEmptyRange(not.condition());
        }
        else if (condition instanceof Or or) {
            return or.conditions().stream().anyMatch(ModelDiagnostics::hasEmptyRange);
        }
        else if (condition instanceof Neither neither) {
            return neither.conditions().stream().anyMatch(ModelDiagnostics::hasEmptyRange);
        }
        return false;
    }
}
