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

package com.axonops.libkmp.api;

/**
 * Receives occurrences found while a block is fed to a {@link StreamMatcher}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MatchListener {

    /**
     * Called once per occurrence, in stream order.
     *
     * @param startOffset absolute position of the first symbol of the occurrence
     * @param endPosition absolute position of the last symbol of the occurrence
     */
    void onMatch(long startOffset, long endPosition);
}
