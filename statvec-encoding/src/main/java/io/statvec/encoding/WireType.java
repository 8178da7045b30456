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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/// The numeric kind tag carried by every encoder object, so a receiver can interpret
/// the raw values without consulting the schema.
public enum WireType {
    INT,
    FLOAT,
    MIXED;

    /// @return the lower-case tag used in JSON payloads
    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// @param dataType a declared or inferred data type name
    /// @return the wire type for values of that data type; unrecognized types map to {@link #INT}
    public static WireType forDataType(String dataType) {
        return DataType.lookup(dataType).map(WireType::forDataType).orElse(INT);
    }

    /// @param dataType a data type
    /// @return {@link #FLOAT} for numeric statistics, {@link #INT} for everything else
    public static WireType forDataType(DataType dataType) {
        return dataType == DataType.NUMERIC ? FLOAT : INT;
    }

    @JsonCreator
    public static WireType fromTag(String tag) {
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
