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
import org.weakref.lexgen.Condition.Char;
import org.weakref.lexgen.Condition.Else;
import org.weakref.lexgen.Condition.EndOfInput;
import org.weakref.lexgen.Condition.Neither;
import org.weakref.lexgen.Condition.Not;
import org.weakref.lexgen.Condition.Or;
import org.weakref.lexgen.Condition.Range;

import java.util.List;
import java.util.Set;

import static java.lang.String.format;

/**
 * Translates the condition notation used when declaring transitions:
 * <ul>
 *     <li>{@code "else"}: matches anything, including the end of input</li>
 *     <li>{@code "eof"}: matches only the end of input</li>
 *     <li>{@code "c"}: the single character {@code c}</li>
 *     <li>{@code "a-z"}: an inclusive range</li>
 *     <li>{@code "!c"}, {@code "!a-z"}: the negation of a character or range</li>
 *     <li>a {@link List} of two or more of the above (except {@code else}): any of them</li>
 *     <li>a {@link Set} of two or more characters or ranges: none of them</li>
 * </ul>
 */
public final class ConditionParser
{
    private static final String ELSE = "else";
    private static final String EOF = "eof";
    private static final char NEGATION = '!';
    private static final int RANGE_SEPARATOR = '-';

    private ConditionParser() {}

    public static Condition parse(Object syntax)
    {
        if (syntax instanceof String text) {
            return parse(text);
        }
        if (syntax instanceof List<?> values) {
            return parseAnyOf(values);
        }
        if (syntax instanceof Set<?> values) {
            return parseNoneOf(values);
        }
        throw new InvalidConditionException(syntax);
    }

    public static Condition parse(String syntax)
    {
        if (ELSE.equals(syntax)) {
            return new Else();
        }
        if (EOF.equals(syntax)) {
            return new EndOfInput();
        }
        if (isCharacter(syntax)) {
            return character(syntax);
        }
        if (isRange(syntax)) {
            return range(syntax);
        }
        if (isNegation(syntax)) {
            return negation(syntax);
        }
        throw new InvalidConditionException(syntax);
    }

    public static Or parseAnyOf(List<?> syntax)
    {
        if (syntax == null || syntax.size() < 2) {
            throw new InvalidConditionException(syntax);
        }

        ImmutableList.Builder<Condition> conditions = ImmutableList.builder();
        for (Object value : syntax) {
            String text = element(syntax, value, "or");
            if (isCharacter(text)) {
                conditions.add(character(text));
            }
            else if (isRange(text)) {
                conditions.add(range(text));
            }
            else if (isNegation(text)) {
                conditions.add(negation(text));
            }
            else {
                throw invalidElement(syntax, value, "or");
            }
        }
        return new Or(conditions.build());
    }

    public static Neither parseNoneOf(Set<?> syntax)
    {
        if (syntax == null || syntax.size() < 2) {
            throw new InvalidConditionException(syntax);
        }

        ImmutableList.Builder<Condition> conditions = ImmutableList.builder();
        for (Object value : syntax) {
            String text = element(syntax, value, "neither");
            if (isCharacter(text)) {
                conditions.add(character(text));
            }
            else if (isRange(text)) {
                conditions.add(range(text));
            }
            else {
                throw invalidElement(syntax, value, "neither");
            }
        }
        return new Neither(conditions.build());
    }

    private static String element(Object syntax, Object value, String context)
    {
        if (value instanceof String text) {
            return text;
        }
        throw invalidElement(syntax, value, context);
    }

    private static InvalidConditionException invalidElement(Object syntax, Object value, String context)
    {
        return new InvalidConditionException(
                syntax,
                format("The condition %s is invalid in the context of %s condition %s", InvalidConditionException.describe(value), context, syntax));
    }

    private static boolean isCharacter(String syntax)
    {
        return syntax != null && !syntax.isEmpty() && syntax.codePointCount(0, syntax.length()) == 1;
    }

    private static boolean isRange(String syntax)
    {
        if (syntax == null) {
            return false;
        }
        int[] codePoints = syntax.codePoints().toArray();
        return codePoints.length == 3 && codePoints[1] == RANGE_SEPARATOR;
    }

    private static boolean isNegation(String syntax)
    {
        if (syntax == null || syntax.length() < 2 || syntax.charAt(0) != NEGATION) {
            return false;
        }
        String negated = syntax.substring(1);
        return isCharacter(negated) || isRange(negated);
    }

    private static Char character(String syntax)
    {
        return new Char(syntax.codePointAt(0));
    }

    private static Range range(String syntax)
    {
        int[] codePoints = syntax.codePoints().toArray();
        return new Range(codePoints[0], codePoints[2]);
    }

    private static Not negation(String syntax)
    {
        String negated = syntax.substring(1);
        return new Not(isCharacter(negated) ? character(negated) : range(negated));
    }
}
