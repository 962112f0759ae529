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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A suspicious but legal property of a {@link LexerModel}.
 *
 * @param transition index of the transition within {@code state}, or -1 when the finding is about the whole state
 */
public record Diagnostic(Type type, int state, int transition, String message)
{
    public enum Type
    {
        UNREACHABLE_STATE,
        NO_TRANSITIONS,
        SHADOWED_TRANSITION,
        EMPTY_RANGE,
    }

    public Diagnostic
    {
        requireNonNull(type, "type is null");
        requireNonNull(message, "message is null");
    }

    @Override
    public String toString()
    {
        if (transition < 0) {
            return format("%s: state %s: %s", type, state, message);
        }
        return format("%s: state %s, transition %s: %s", type, state, transition, message);
    }
}
