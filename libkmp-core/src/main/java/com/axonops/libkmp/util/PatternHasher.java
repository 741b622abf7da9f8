/*
 * Copyright 2025 AxonOps
 *
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

package com.axonops.libkmp.util;

import java.util.Arrays;

/**
 * Utility for hashing pattern bytes for logging purposes.
 *
 * <p>Patterns may contain sensitive data (search terms, tokens), so they are never logged
 * verbatim. The same pattern always gets the same hash, which keeps logs greppable.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a pattern for logging.
     *
     * @param pattern the pattern bytes
     * @return hex string (e.g., "7a3f2b1c"), or "null"
     */
    public static String hash(byte[] pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(Arrays.hashCode(pattern));
    }
}
