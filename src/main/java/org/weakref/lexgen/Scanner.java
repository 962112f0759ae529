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
import org.weakref.lexgen.Action.Append;
import org.weakref.lexgen.Action.Begin;
import org.weakref.lexgen.Action.Emit;
import org.weakref.lexgen.Action.Feed;
import org.weakref.lexgen.Action.Raise;

import java.util.BitSet;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.weakref.lexgen.Condition.END_OF_INPUT;

/**
 * A single pass over one input. Not thread safe; create one per input.
 * <p>
 * Each step reads the character at the cursor (or the end of input), fires the first matching
 * transition of the current state, runs its actions in order and moves to the target state.
 * The cursor advances unless the transition feeds the character to the target state.
 * The end of input is offered like a character: a fed end of input is offered to the target
 * state, any other transition on it, or the lack of one, ends the scan. Tokens still being
 * built at that point are dropped.
 */
final class Scanner
{
    private final TransitionSelector selector;
    private final boolean detectFeedLoops;
    private final CharSequence input;

    private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    private int state;
    private int position;

    private final StringBuilder buffer = new StringBuilder();
    private boolean bufferOpen;
    private int tokenStart;
    private int tokenEnd;

    // (state, buffer open) pairs entered by feeding at feedPosition
    private final BitSet fedStates = new BitSet();
    private int feedPosition = -1;

    public Scanner(TransitionSelector selector, boolean detectFeedLoops, CharSequence input)
    {
        this.selector = requireNonNull(selector, "selector is null");
        this.detectFeedLoops = detectFeedLoops;
        this.input = requireNonNull(input, "input is null");
    }

    public List<Token> run()
    {
        try {
            return scan();
        }
        catch (ScanException e) {
            e.setTokens(tokens.build());
            throw e;
        }
    }

    private List<Token> scan()
    {
        while (true) {
            int character = position < input.length() ? Character.codePointAt(input, position) : END_OF_INPUT;

            Transition transition = selector.select(state, character);
            if (transition == null) {
                if (character == END_OF_INPUT) {
                    break;
                }
                throw new NoMatchingTransitionException(state, character, position);
            }

            boolean bufferOpenBefore = bufferOpen;
            execute(transition.actions(), character);

            int previous = feedKey(state, bufferOpenBefore);
            state = transition.target();
            if (transition.feeds()) {
                checkFeedLoop(previous);
            }
            else if (character == END_OF_INPUT) {
                break;
            }
            else {
                position += Character.charCount(character);
            }
        }

        return tokens.build();
    }

    private void execute(List<Action> actions, int character)
    {
        for (Action action : actions) {
            if (action instanceof Begin) {
                buffer.setLength(0);
                bufferOpen = true;
                tokenStart = position;
                tokenEnd = position;
            }
            else if (action instanceof Append) {
                checkBufferOpen(action);
                if (character != END_OF_INPUT) {
                    buffer.appendCodePoint(character);
                    tokenEnd = position + Character.charCount(character);
                }
            }
            else if (action instanceof Emit emit) {
                checkBufferOpen(action);
                tokens.add(new Token(emit.kind(), buffer.toString(), tokenStart, tokenEnd));
                bufferOpen = false;
            }
            else if (action instanceof Raise raise) {
                throw new LexicalErrorException(raise.kind(), state, position);
            }
            else if (!(action instanceof Feed)) {
                throw new IllegalArgumentException("Unsupported action: " + action);
            }
        }
    }

    private void checkBufferOpen(Action action)
    {
        if (!bufferOpen) {
            throw new BufferNotOpenException(action, state, position);
        }
    }

    private void checkFeedLoop(int origin)
    {
        if (!detectFeedLoops) {
            return;
        }

        if (feedPosition != position) {
            feedPosition = position;
            fedStates.clear();
            fedStates.set(origin);
        }
        int key = feedKey(state, bufferOpen);
        if (fedStates.get(key)) {
            throw new FeedLoopException(state, position);
        }
        fedStates.set(key);
    }

    // only the state and whether the buffer is open decide what a re-fed character does next
    private static int feedKey(int state, boolean bufferOpen)
    {
        return state * 2 + (bufferOpen ? 1 : 0);
    }
}
