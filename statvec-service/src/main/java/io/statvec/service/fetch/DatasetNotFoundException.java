package io.statvec.service.fetch;

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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// A local dataset path did not resolve to an existing file.
public class DatasetNotFoundException extends IOException {

    private final String location;
    private final List<Path> candidates;

    /// @param location the path as requested
    /// @param candidates every path that was tried, in order
    public DatasetNotFoundException(String location, List<Path> candidates) {
        super(message(location, candidates));
        this.location = location;
        this.candidates = List.copyOf(candidates);
    }

    /// @return the path as requested
    public String getLocation() {
        return location;
    }

    /// @return every path that was tried
    public List<Path> getCandidates() {
        return candidates;
    }

    private static String message(String location, List<Path> candidates) {
        if (candidates.size() > 1) {
            return "Local file not found in any of: " + candidates;
        }
        return "Local file not found: " + (candidates.isEmpty() ? location : candidates.get(0));
    }
}
