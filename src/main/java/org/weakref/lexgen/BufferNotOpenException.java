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
 * An append or emit ran without a preceding begin. This is a bug in the model, not in the input.
 */
public class BufferNotOpenException
        extends ScanException
{
    private final Action action;

    public BufferNotOpenException(Action action, int state, int position)
    {
        super(format("Cannot %s in state %s at position %s: no token has been begun", action, state, position), state, position);
        this.action = action;
    }

    public Action getAction()
    {
        return action;
    }
}
