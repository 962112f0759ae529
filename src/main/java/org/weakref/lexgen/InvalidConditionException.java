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

public class InvalidConditionException
        extends InvalidLexerDefinitionException
{
    private final Object condition;

    public InvalidConditionException(Object condition)
    {
        this(condition, format("The condition %s is invalid", describe(condition)));
    }

    public InvalidConditionException(Object condition, String message)
    {
        super(message);
        this.condition = condition;
    }

    public Object getCondition()
    {
        return condition;
    }

    static String describe(Object condition)
    {
        if (condition instanceof String) {
            return "'" + condition + "'";
        }
        return String.valueOf(condition);
    }
}
