package io.statvec.encoding;

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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/// The semantic data types a feature's statistics can describe.
///
/// Only the vectorizable types produce vectors. {@link #DATETIME} and {@link #UNKNOWN} are
/// carried through a dataset untouched.
public enum DataType {
    /// two-valued features, statistics `{numOfNotNull, numOfTrue}`
    BOOLEAN(true),
    /// continuous features, statistics `{numOfNotNull, min, max, avg, q1, q2, q3}`
    NUMERIC(true),
    /// unordered categories, statistics `{numOfNotNull, valueSet, cardinalityPerItem}`
    NOMINAL(true),
    /// ordered categories, same statistics as {@link #NOMINAL}
    ORDINAL(true),
    /// features for which only a non-null count is known
    DATETIME(false),
    /// anything not recognized
    UNKNOWN(false);

    private final boolean vectorizable;

    DataType(boolean vectorizable) {
        this.vectorizable = vectorizable;
    }

    /// @return true if features of this type are turned into vectors
    public boolean isVectorizable() {
        return vectorizable;
    }

    /// Look up a data type by name, ignoring case and surrounding whitespace.
    /// @param name
    ///     the declared type name, may be null
    /// @return the matching type, or empty when the name is blank or not one of the known names
    public static Optional<DataType> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        for (DataType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /// @param name a declared type name
    /// @return the trimmed, upper-cased form used on the wire
    public static String normalize(String name) {
        return name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
    }

    /// @return the types that have a dedicated vectorizer, in declaration order
    public static Set<DataType> vectorizable() {
        EnumSet<DataType> types = EnumSet.noneOf(DataType.class);
        for (DataType type : values()) {
            if (type.vectorizable) {
                types.add(type);
            }
        }
        return types;
    }
}
