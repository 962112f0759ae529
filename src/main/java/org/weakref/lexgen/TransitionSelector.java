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

/**
 * Picks the transition that fires for a character. Implementations must return the first
 * transition of {@code state}, in declaration order, whose condition matches.
 */
interface TransitionSelector
{
    /**
     * @param character a code point or {@link Condition#END_OF_INPUT}
     * @return the selected transition, or {@code null} if none matches
     */
    Transition select(int state, int character);
}
