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
import io.airlift.log.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * The declared states of a lexer and, for each state, its transitions in declaration order.
 * Instances are immutable; use {@link #builder(int)} to declare one.
 */
public record LexerModel(int numStates, List<List<Transition>> transitions)
{
    private static final Logger log = Logger.get(LexerModel.class);

    public LexerModel
    {
        checkArgument(numStates > 0, "numStates must be positive: %s", numStates);
        requireNonNull(transitions, "transitions is null");
        checkArgument(transitions.size() == numStates, "expected transitions for %s states, got %s", numStates, transitions.size());
        transitions = transitions.stream()
                .<List<Transition>>map(ImmutableList::copyOf)
                .collect(ImmutableList.toImmutableList());

        for (List<Transition> stateTransitions : transitions) {
            for (Transition transition : stateTransitions) {
                if (transition.target() >= numStates) {
                    throw new InvalidStateException("to", transition.target(), numStates - 1);
                }
            }
        }
    }

    public static Builder builder(int numStates)
    {
        return new Builder(numStates);
    }

    public List<Transition> transitions(int state)
    {
        checkElementIndex(state, numStates, "state");
        return transitions.get(state);
    }

    public static class Builder
    {
        private final int numStates;
        private final List<List<Transition>> transitions = new ArrayList<>();

        private Builder(int numStates)
        {
            checkArgument(numStates > 0, "numStates must be positive: %s", numStates);
            this.numStates = numStates;
            for (int i = 0; i < numStates; i++) {
                transitions.add(new ArrayList<>());
            }
        }

        public int numStates()
        {
            return numStates;
        }

        public Builder addTransition(int from, int to, String condition, String... actions)
        {
            return addTransition(from, to, (Object) condition, Arrays.asList(actions));
        }

        /**
         * Fires on any of the listed characters, ranges or negations.
         */
        public Builder addTransition(int from, int to, List<String> condition, String... actions)
        {
            return addTransition(from, to, (Object) condition, Arrays.asList(actions));
        }

        /**
         * Fires on a character that is none of the given characters or ranges.
         */
        public Builder addTransition(int from, int to, Set<String> condition, String... actions)
        {
            return addTransition(from, to, (Object) condition, Arrays.asList(actions));
        }

        /**
         * Declares a transition, evaluated after every transition previously declared for {@code from}.
         * The builder is left untouched when validation fails.
         *
         * @throws InvalidStateException if either state is outside {@code [0, numStates)}
         * @throws InvalidActionException if an action token is not recognized
         * @throws InvalidConditionException if the condition is not recognized
         */
        public Builder addTransition(int from, int to, Object condition, List<String> actions)
        {
            requireNonNull(actions, "actions is null");

            checkState("from", from);
            checkState("to", to);

            ImmutableList.Builder<Action> parsed = ImmutableList.builder();
            for (String action : actions) {
                parsed.add(Action.parse(action));
            }

            Transition transition = new Transition(ConditionParser.parse(condition), parsed.build(), to);
            transitions.get(from).add(transition);
            return this;
        }

        private void checkState(String bound, int state)
        {
            if (state < 0 || state >= numStates) {
                throw new InvalidStateException(bound, state, numStates - 1);
            }
        }

        public LexerModel build()
        {
            LexerModel model = new LexerModel(numStates, transitions);
            for (Diagnostic diagnostic : ModelDiagnostics.analyze(model)) {
                log.warn("%s", diagnostic);
            }
            return model;
        }
    }
}
