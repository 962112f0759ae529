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

/**
 * No transition of the current state accepts the current character.
 * The model is incomplete for this input; an {@code else} rule closes the gap.
 */
public class NoMatchingTransitionException
        extends ScanException
{
    private final int character;

    public NoMatchingTransitionException(int state, int character, int position)
    {
        super(format("No transition from state %s matches %s at position %s", state, describeCharacter(character), position), state, position);
        this.character = character;
    }

    public int getCharacter()
    {
        return character;
    }
}
