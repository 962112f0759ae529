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
 * A chain of feeding transitions came back to a state it had already visited for the same
 * character, so the scan could never advance.
 */
public class FeedLoopException
        extends ScanException
{
    public FeedLoopException(int state, int position)
    {
        super(format("Feed loop through state %s at position %s", state, position), state, position);
    }
}
