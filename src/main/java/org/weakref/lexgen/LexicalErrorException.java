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
 * Raised by an {@link Action.Raise} declared in the model: the input was rejected.
 */
public class LexicalErrorException
        extends ScanException
{
    private final String kind;

    public LexicalErrorException(String kind, int state, int position)
    {
        super(format("%s at position %s (state %s)", kind, position, state), state, position);
        this.kind = requireNonNull(kind, "kind is null");
    }

    public String getKind()
    {
        return kind;
    }
}
