/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.arrays.identifier;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/// Text forms of a UUID, named after their single-letter format specifiers.
///
/// | Format | Specifier | Example |
/// |--------|-----------|---------|
/// | [#DIGITS] | `N` | `00000000000000000000000000000000` |
/// | [#HYPHENATED] | `D` | `00000000-0000-0000-0000-000000000000` |
/// | [#BRACES] | `B` | `{00000000-0000-0000-0000-000000000000}` |
/// | [#PARENTHESES] | `P` | `(00000000-0000-0000-0000-000000000000)` |
public enum UuidFormat {
    DIGITS('N'),
    HYPHENATED('D'),
    BRACES('B'),
    PARENTHESES('P');

    private final char specifier;

    UuidFormat(char specifier) {
        this.specifier = specifier;
    }

    public char specifier() {
        return specifier;
    }

    /// Renders `uuid` in this format, lower case unless `upperCase` is set.
    public String format(UUID uuid, boolean upperCase) {
        Objects.requireNonNull(uuid, "uuid cannot be null");
        String hyphenated = uuid.toString();
        String text;
        switch (this) {
            case DIGITS:
                text = hyphenated.replace("-", "");
                break;
            case BRACES:
                text = "{" + hyphenated + "}";
                break;
            case PARENTHESES:
                text = "(" + hyphenated + ")";
                break;
            default:
                text = hyphenated;
        }
        return upperCase ? text.toUpperCase(Locale.ROOT) : text;
    }

    /// @param specifier one of `N`, `D`, `B` or `P`, either case
    /// @throws IllegalArgumentException for any other specifier
    public static UuidFormat fromSpecifier(String specifier) {
        Objects.requireNonNull(specifier, "specifier cannot be null");
        if (specifier.length() == 1) {
            char c = Character.toUpperCase(specifier.charAt(0));
            for (UuidFormat format : values()) {
                if (format.specifier == c) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Unknown UUID format specifier: '" + specifier + "'");
    }
}
