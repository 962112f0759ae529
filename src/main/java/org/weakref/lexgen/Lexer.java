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

import io.airlift.log.Logger;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Runs a {@link LexerModel} over inputs. A lexer is immutable and can be shared by any number
 * of threads; every call to {@link #tokenize(CharSequence)} scans with private state.
 */
public class Lexer
{
    private static final Logger log = Logger.get(Lexer.class);

    private final LexerModel model;
    private final Options options;
    private final TransitionSelector selector;

    private Lexer(LexerModel model, Options options, TransitionSelector selector)
    {
        this.model = model;
        this.options = options;
        this.selector = selector;
    }

    public LexerModel getModel()
    {
        return model;
    }

    public Options getOptions()
    {
        return options;
    }

    /**
     * Creates a lexer that evaluates the conditions of the current state on every character.
     */
    public static Lexer interpret(LexerModel model)
    {
        requireNonNull(model, "model is null");
        return new Lexer(model, Options.DEFAULT.withDenseLimit(0), new OrderedTransitionSelector(model));
    }

    public static Lexer compile(LexerModel model)
    {
        return compile(model, Options.DEFAULT);
    }

    /**
     * Creates a lexer that dispatches characters below {@link Options#denseLimit()} through
     * precomputed per-state tables.
     */
    public static Lexer compile(LexerModel model, Options options)
    {
        requireNonNull(model, "model is null");
        requireNonNull(options, "options is null");

        TransitionSelector selector = new DenseTransitionSelector(model, options.denseLimit());
        log.debug("Compiled lexer with %s states and dense limit %s", model.numStates(), options.denseLimit());
        return new Lexer(model, options, selector);
    }

    /**
     * @throws NoMatchingTransitionException if no transition accepts a character
     * @throws LexicalErrorException if a transition raises an error
     * @throws BufferNotOpenException if the model appends or emits without beginning a token
     * @throws FeedLoopException if feeding transitions cycle on one character
     */
    public List<Token> tokenize(CharSequence input)
    {
        return new Scanner(selector, options.detectFeedLoops(), input).run();
    }

    /**
     * @param denseLimit code points below this value are dispatched through lookup tables of
     * {@code numStates * denseLimit} entries
     * @param detectFeedLoops fail with {@link FeedLoopException} instead of spinning forever
     * when feeding transitions cycle
     */
    public record Options(int denseLimit, boolean detectFeedLoops)
    {
        public static final Options DEFAULT = new Options(256, true);

        public Options
        {
            checkArgument(denseLimit >= 0, "denseLimit is negative: %s", denseLimit);
        }

        public Options withDenseLimit(int denseLimit)
        {
            return new Options(denseLimit, detectFeedLoops);
        }

        public Options withFeedLoopDetection(boolean detectFeedLoops)
        {
            return new Options(denseLimit, detectFeedLoops);
        }
    }
}
