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

import org.junit.jupiter.api.Test;
import org.weakref.lexgen.Condition.Char;
import org.weakref.lexgen.Condition.Else;
import org.weakref.lexgen.Condition.EndOfInput;
import org.weakref.lexgen.Condition.Neither;
import org.weakref.lexgen.Condition.Not;
import org.weakref.lexgen.Condition.Or;
import org.weakref.lexgen.Condition.Range;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestConditionParser
{
    @Test
    public void testElse()
    {
        assertThat(ConditionParser.parse("else")).isEqualTo(new Else());
    }

    @Test
    public void testEndOfInput()
    {
        assertThat(ConditionParser.parse("eof")).isEqualTo(new EndOfInput());
        assertThatThrownBy(() -> ConditionParser.parse(List.of("a", "eof")))
                .isInstanceOf(InvalidConditionException.class);
    }

    @Test
    public void testCharacter()
    {
        assertThat(ConditionParser.parse("x")).isEqualTo(new Char('x'));
        assertThat(ConditionParser.parse("-")).isEqualTo(new Char('-'));
        assertThat(ConditionParser.parse("!")).isEqualTo(new Char('!'));
        assertThat(ConditionParser.parse("\t")).isEqualTo(new Char('\t'));
        assertThat(ConditionParser.parse("😀")).isEqualTo(new Char(0x1F600));
    }

    @Test
    public void testRange()
    {
        assertThat(ConditionParser.parse("0-9")).isEqualTo(new Range('0', '9'));
        assertThat(ConditionParser.parse("a-z")).isEqualTo(new Range('a', 'z'));
        assertThat(ConditionParser.parse("---")).isEqualTo(new Range('-', '-'));

        // a leading '!' is part of the range when the string has the range shape
        assertThat(ConditionParser.parse("!-z")).isEqualTo(new Range('!', 'z'));

        // backwards ranges are accepted as written
        assertThat(ConditionParser.parse("z-a")).isEqualTo(new Range('z', 'a'));
    }

    @Test
    public void testNegation()
    {
        assertThat(ConditionParser.parse("!x")).isEqualTo(new Not(new Char('x')));
        assertThat(ConditionParser.parse("!!")).isEqualTo(new Not(new Char('!')));
        assertThat(ConditionParser.parse("!0-9")).isEqualTo(new Not(new Range('0', '9')));
    }

    @Test
    public void testAnyOf()
    {
        assertThat(ConditionParser.parse(List.of(" ", "\t")))
                .isEqualTo(new Or(List.of(new Char(' '), new Char('\t'))));
        assertThat(ConditionParser.parse(List.of("a", "0-9", "!x")))
                .isEqualTo(new Or(List.of(new Char('a'), new Range('0', '9'), new Not(new Char('x')))));
    }

    @Test
    public void testNoneOf()
    {
        assertThat(ConditionParser.parse(new LinkedHashSet<>(List.of("\"", "a-f"))))
                .isEqualTo(new Neither(List.of(new Char('"'), new Range('a', 'f'))));
    }

    @Test
    public void testInvalidStrings()
    {
        for (String syntax : Arrays.asList("", "ab", "abcd", "a_z", "!ab", "!else", "else ", "ELSE", null)) {
            assertThatThrownBy(() -> ConditionParser.parse(syntax))
                    .isInstanceOf(InvalidConditionException.class)
                    .satisfies(e -> assertThat(((InvalidConditionException) e).getCondition()).isEqualTo(syntax));
        }
    }

    @Test
    public void testInvalidAnyOf()
    {
        assertThatThrownBy(() -> ConditionParser.parse(List.of("a")))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> ConditionParser.parse(List.of()))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> ConditionParser.parse(List.of("a", "else")))
                .isInstanceOf(InvalidConditionException.class)
                .hasMessageContaining("'else' is invalid in the context of or condition");
        assertThatThrownBy(() -> ConditionParser.parse(List.of("a", List.of("b", "c"))))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> ConditionParser.parse(List.of("a", "bc")))
                .isInstanceOf(InvalidConditionException.class)
                .satisfies(e -> assertThat(((InvalidConditionException) e).getCondition()).isEqualTo(List.of("a", "bc")));
    }

    @Test
    public void testInvalidNoneOf()
    {
        assertThatThrownBy(() -> ConditionParser.parse(Set.of("a")))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> ConditionParser.parse(Set.of("a", "!b")))
                .isInstanceOf(InvalidConditionException.class)
                .hasMessageContaining("in the context of neither condition");
    }

    @Test
    public void testUnsupportedValue()
    {
        assertThatThrownBy(() -> ConditionParser.parse((Object) 'x'))
                .isInstanceOf(InvalidConditionException.class)
                .hasMessage("The condition x is invalid");
        assertThatThrownBy(() -> ConditionParser.parse((Object) null))
                .isInstanceOf(InvalidConditionException.class);
    }
}
