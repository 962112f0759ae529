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

import static java.util.Objects.requireNonNull;

/**
 * An operation on the token buffer, run when a transition fires.
 */
public sealed interface Action
        permits Action.Begin, Action.Append, Action.Emit, Action.Feed, Action.Raise
{
    /**
     * Parses an action token: {@code B}, {@code A}, {@code F}, {@code E:<kind>} or {@code R:<kind>}.
     */
    static Action parse(String token)
    {
        if (token == null) {
            throw new InvalidActionException(null);
        }

        switch (token) {
            case "B":
                return new Begin();
            case "A":
                return new Append();
            case "F":
                return new Feed();
            default:
                break;
        }

        if (token.startsWith("E:")) {
            return new Emit(token.substring(2));
        }
        if (token.startsWith("R:")) {
            return new Raise(token.substring(2));
        }

        throw new InvalidActionException(token);
    }

    /**
     * Opens a new, empty token buffer, discarding any unemitted one.
     */
    record Begin()
            implements Action
    {
        @Override
        public String toString()
        {
            return "begin";
        }
    }

    /**
     * Appends the current character to the open buffer.
     */
    record Append()
            implements Action
    {
        @Override
        public String toString()
        {
            return "append";
        }
    }

    /**
     * Produces a token of the given kind from the buffer and closes it.
     */
    record Emit(String kind)
            implements Action
    {
        public Emit
        {
            requireNonNull(kind, "kind is null");
        }

        @Override
        public String toString()
        {
            return "emit " + kind;
        }
    }

    /**
     * Keeps the current character so the destination state sees it again.
     */
    record Feed()
            implements Action
    {
        @Override
        public String toString()
        {
            return "feed";
        }
    }

    /**
     * Stops the scan with a lexical error of the given kind.
     */
    record Raise(String kind)
            implements Action
    {
        public Raise
        {
            requireNonNull(kind, "kind is null");
        }

        @Override
        public String toString()
        {
            return "raise " + kind;
        }
    }
}
