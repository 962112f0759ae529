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

public class InvalidStateException
        extends InvalidLexerDefinitionException
{
    private final String bound;
    private final int state;

    public InvalidStateException(String bound, int state, int maxState)
    {
        super(format("The \"%s\" state %s is not a possible state as it is either less than 0 or greater than %s", bound, state, maxState));
        this.bound = bound;
        this.state = state;
    }

    /**
     * Either {@code "from"} or {@code "to"}.
     */
    public String getBound()
    {
        return bound;
    }

    public int getState()
    {
        return state;
    }
}
