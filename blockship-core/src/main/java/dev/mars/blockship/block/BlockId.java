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

import java.util.Optional;

/**
 * Identifier of a block: a ULID in its canonical 26-character Crockford base32 form.
 *
 * <p>The first ten characters encode the creation time in milliseconds, so the natural
 * ordering of block IDs is chronological. Only upper-case canonical strings are accepted,
 * which keeps the ID identical to the block's directory name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class BlockId implements Comparable<BlockId> {

    public static final int LENGTH = 26;

    private static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    private final String value;

    private BlockId(String value) {
        this.value = value;
    }

    /**
     * Parses a block ID.
     *
     * @throws IllegalArgumentException if the value is not a canonical ULID
     */
    @JsonCreator
    public static BlockId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Block ID must not be null");
        }
        if (value.length() != LENGTH) {
            throw new IllegalArgumentException("Block ID must be " + LENGTH + " characters: " + value);
        }
        for (int i = 0; i < LENGTH; i++) {
            if (ALPHABET.indexOf(value.charAt(i)) < 0) {
                throw new IllegalArgumentException(
                        "Invalid character '" + value.charAt(i) + "' in block ID: " + value);
            }
        }
        // 26 base32 digits carry 130 bits; the top two must be zero
        if (value.charAt(0) > '7') {
            throw new IllegalArgumentException("Block ID overflows 128 bits: " + value);
        }
        return new BlockId(value);
    }

    /**
     * Parses a directory name, returning empty for anything that is not a block ID.
     */
    public static Optional<BlockId> fromDirectoryName(String name) {
        try {
            return Optional.of(parse(name));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Creation time embedded in the ID, in milliseconds since the epoch.
     */
    public long timestampMillis() {
        long ts = 0;
        for (int i = 0; i < 10; i++) {
            ts = (ts << 5) | ALPHABET.indexOf(value.charAt(i));
        }
        return ts;
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }

    @Override
    public int compareTo(BlockId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockId)) return false;
        return value.equals(((BlockId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
