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

/**
 * A predicate over a single input character. Characters are Unicode code points;
 * {@link #END_OF_INPUT} stands for the position just past the last character.
 */
public sealed interface Condition
        permits Condition.Char, Condition.Range, Condition.Not, Condition.Or, Condition.Neither, Condition.Else, Condition.EndOfInput
{
    int END_OF_INPUT = -1;

    /**
     * Evaluates {@code condition} against a code point or {@link #END_OF_INPUT}.
     * The end of input is matched by {@link Else} and {@link EndOfInput} only.
     */
    static boolean matches(Condition condition, int character)
    {
        if (condition instanceof Else) {
            return true;
        }
        if (condition instanceof EndOfInput) {
            return character == END_OF_INPUT;
        }
        if (character == END_OF_INPUT) {
            return false;
        }

        if (condition instanceof Char value) {
            return value.codePoint() == character;
        }
        else if (condition instanceof Range range) {
            return range.low() <= character && character <= range.high();
        }
        else if (condition instanceof Not not) {
            return !matches(not.condition(), character);
        }
        else if (condition instanceof Or or) {
            return anyMatches(or.conditions(), character);
        }
        else if (condition instanceof Neither neither) {
            return !anyMatches(neither.conditions(), character);
        }

        throw new IllegalArgumentException("Unsupported condition: " + condition);
    }

    private static boolean anyMatches(List<Condition> conditions, int character)
    {
        for (Condition condition : conditions) {
            if (matches(condition, character)) {
                return true;
            }
        }
        return false;
    }

    record Char(int codePoint)
            implements Condition
    {
        @Override
        public String toString()
        {
            return format("'%s'", Character.toString(codePoint));
        }
    }

    /**
     * Inclusive code point range. A range whose low end is above its high end is legal and matches nothing.
     */
    record Range(int low, int high)
            implements Condition
    {
        public boolean isEmpty()
        {
            return low > high;
        }

        @Override
        public String toString()
        {
            return format("'%s'-'%s'", Character.toString(low), Character.toString(high));
        }
    }

    record Not(Condition condition)
            implements Condition
    {
        public Not
        {
            requireNonNull(condition, "condition is null");
        }

        @Override
        public String toString()
        {
            return "!" + condition;
        }
    }

    record Or(List<Condition> conditions)
            implements Condition
    {
        public Or
        {
            conditions = ImmutableList.copyOf(conditions);
            checkArgument(!conditions.isEmpty(), "conditions is empty");
        }

        @Override
        public String toString()
        {
            return format("any%s", conditions);
        }
    }

    /**
     * Matches when none of the conditions match, i.e. {@code Not(Or(conditions))}.
     */
    record Neither(List<Condition> conditions)
            implements Condition
    {
        public Neither
        {
            conditions = ImmutableList.copyOf(conditions);
            checkArgument(!conditions.isEmpty(), "conditions is empty");
        }

        @Override
        public String toString()
        {
            return format("none%s", conditions);
        }
    }

    record Else()
            implements Condition
    {
        @Override
        public String toString()
        {
            return "else";
        }
    }

    record EndOfInput()
            implements Condition
    {
        @Override
        public String toString()
        {
            return "eof";
        }
    }
}
