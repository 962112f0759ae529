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

import static java.util.Objects.requireNonNull;

/**
 * Evaluates each condition of the state in turn.
 */
final class OrderedTransitionSelector
        implements TransitionSelector
{
    private final LexerModel model;

    public OrderedTransitionSelector(LexerModel model)
    {
        this.model = requireNonNull(model, "model is null");
    }

    @Override
    public Transition select(int state, int character)
    {
        int index = indexOf(model.transitions(state), character);
        return index < 0 ? null : model.transitions(state).get(index);
    }

    static int indexOf(List<Transition> transitions, int character)
    {
        for (int i = 0; i < transitions.size(); i++) {
            if (Condition.matches(transitions.get(i).condition(), character)) {
                return i;
            }
        }
        return -1;
    }
}
