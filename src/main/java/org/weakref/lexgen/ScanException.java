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

import java.util.List;

/**
 * Terminates a scan. Scanning is deterministic, so the same model and input always fail the same way.
 */
public abstract class ScanException
        extends RuntimeException
{
    private final int state;
    private final int position;
    private List<Token> tokens = ImmutableList.of();

    protected ScanException(String message, int state, int position)
    {
        super(message);
        this.state = state;
        this.position = position;
    }

    /**
     * State the scanner was in when the scan stopped.
     */
    public int getState()
    {
        return state;
    }

    /**
     * Index into the input (in chars) of the character being processed.
     */
    public int getPosition()
    {
        return position;
    }

    /**
     * Tokens emitted before the scan stopped.
     */
    public List<Token> getTokens()
    {
        return tokens;
    }

    void setTokens(List<Token> tokens)
    {
        this.tokens = ImmutableList.copyOf(tokens);
    }

    static String describeCharacter(int character)
    {
        if (character == Condition.END_OF_INPUT) {
            return "<end of input>";
        }
        return "'" + Character.toString(character) + "'";
    }
}
