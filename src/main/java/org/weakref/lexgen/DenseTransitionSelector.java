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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Precomputed selection for code points below {@code limit}: {@code table[state * limit + character]}
 * holds the index of the winning transition, or -1. Other characters, and the end of input,
 * fall back to ordered evaluation.
 */
final class DenseTransitionSelector
        implements TransitionSelector
{
    private final LexerModel model;
    private final int limit;
    private final int[] table;

    public DenseTransitionSelector(LexerModel model, int limit)
    {
        checkArgument(limit >= 0, "limit is negative: %s", limit);
        this.model = model;
        this.limit = limit;
        this.table = new int[Math.multiplyExact(model.numStates(), limit)];

        for (int state = 0; state < model.numStates(); state++) {
            List<Transition> transitions = model.transitions(state);
            for (int character = 0; character < limit; character++) {
                table[state * limit + character] = OrderedTransitionSelector.indexOf(transitions, character);
            }
        }
    }

    @Override
    public Transition select(int state, int character)
    {
        List<Transition> transitions = model.transitions(state);

        int index;
        if (character >= 0 && character < limit) {
            index = table[state * limit + character];
        }
        else {
            index = OrderedTransitionSelector.indexOf(transitions, character);
        }

        return index < 0 ? null : transitions.get(index);
    }
}
