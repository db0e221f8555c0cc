/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.blockship.block;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of how a shipped block was produced, recorded in its uploaded manifest.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public enum SourceType {

    /**
     * Shipped by an agent running next to the ingesting process.
     */
    SIDECAR("sidecar"),

    /**
     * Produced by a compactor merging other blocks.
     */
    COMPACTOR("compactor"),

    /**
     * Produced by a rule evaluator writing its own blocks.
     */
    RULER("ruler"),

    /**
     * Produced by a receiving endpoint that ingests remote writes.
     */
    RECEIVE("receive");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a source type from its wire value, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static SourceType fromValue(String value) {
        for (SourceType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
