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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// An ordered, fixed-length sequence of numbers produced from one statistics record.
///
/// Integral values are held as {@link Long}, real values as {@link Double}, so a vector
/// serializes back to JSON with the same numeric kinds it was built from.
/// @param values
///     the vector elements, copied and made immutable
public record FeatureVector(List<Number> values) {

    /// the zero-length vector
    public static final FeatureVector EMPTY = new FeatureVector(List.of());

    public FeatureVector {
        List<Number> normalized = new ArrayList<>(values.size());
        for (Number value : values) {
            normalized.add(canonical(value));
        }
        values = List.copyOf(normalized);
    }

    /// @param values the vector elements
    /// @return a vector holding the given values in order
    public static FeatureVector of(Number... values) {
        return new FeatureVector(Arrays.asList(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static FeatureVector fromJson(List<Number> values) {
        return new FeatureVector(values);
    }

    /// @return the elements, as serialized into JSON
    @JsonValue
    @Override
    public List<Number> values() {
        return values;
    }

    /// @return the number of elements
    public int length() {
        return values.size();
    }

    /// @param index element position
    /// @return the element at that position
    public Number get(int index) {
        return values.get(index);
    }

    /// @return true if every element is integral
    public boolean isIntegral() {
        return values.stream().allMatch(v -> v instanceof Long);
    }

    /// @return the elements widened to doubles
    public double[] toDoubleArray() {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i).doubleValue();
        }
        return result;
    }

    /// @param from start offset, inclusive
    /// @param length number of elements
    /// @return the elements in {@code [from, from+length)} as a new vector
    public FeatureVector slice(int from, int length) {
        return new FeatureVector(values.subList(from, from + length));
    }

    /// Concatenate vectors in the given order.
    /// @param vectors the parts
    /// @return one vector holding every element of every part
    public static FeatureVector concat(List<FeatureVector> vectors) {
        List<Number> flattened = new ArrayList<>();
        for (FeatureVector vector : vectors) {
            flattened.addAll(vector.values);
        }
        return new FeatureVector(flattened);
    }

    private static Number canonical(Number value) {
        if (value == null) {
            throw new NullPointerException("vector elements may not be null");
        }
        if (value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        return value.doubleValue();
    }
}
