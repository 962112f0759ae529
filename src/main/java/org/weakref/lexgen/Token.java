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
import static java.util.Objects.requireNonNull;

/**
 * A token produced by a scan.
 *
 * @param start index (in chars) of the character that began the token
 * @param end index just past the last character appended to it
 */
public record Token(String kind, String text, int start, int end)
{
    public Token
    {
        requireNonNull(kind, "kind is null");
        requireNonNull(text, "text is null");
    }

    @Override
    public String toString()
    {
        return format("%s(\"%s\")@%s..%s", kind, text, start, end);
    }
}
