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

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

public record Transition(Condition condition, List<Action> actions, int target)
{
    public Transition
    {
        requireNonNull(condition, "condition is null");
        actions = ImmutableList.copyOf(actions);
        checkArgument(target >= 0, "target is negative: %s", target);
    }

    /**
     * Whether firing this transition leaves the current character unconsumed.
     */
    public boolean feeds()
    {
        for (Action action : actions) {
            if (action instanceof Action.Feed) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString()
    {
        return format("-[%s]%s-> %s", condition, actions, target);
    }
}
