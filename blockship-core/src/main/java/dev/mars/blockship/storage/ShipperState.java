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

package dev.mars.blockship.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.blockship.block.BlockId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bookkeeping record listing the blocks already confirmed as shipped.
 *
 * <pre>
 * {
 *     "version": 1,
 *     "uploaded": ["01H...", "01J..."]
 * }
 * </pre>
 *
 * <p>Immutable. Every listed ID refers to a block whose manifest was fully uploaded (or
 * deliberately skipped) at some point.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
@JsonPropertyOrder({"version", "uploaded"})
public final class ShipperState {

    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final List<BlockId> uploaded;

    @JsonCreator
    public ShipperState(@JsonProperty("version") int version,
                        @JsonProperty("uploaded") List<BlockId> uploaded) {
        this.version = version;
        // an absent or null list means nothing uploaded
        this.uploaded = uploaded == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(uploaded));
    }

    public static ShipperState empty() {
        return new ShipperState(CURRENT_VERSION, List.of());
    }

    public static ShipperState of(List<BlockId> uploaded) {
        return new ShipperState(CURRENT_VERSION, uploaded);
    }

    @JsonProperty("version")
    public int getVersion() {
        return version;
    }

    @JsonProperty("uploaded")
    public List<BlockId> getUploaded() {
        return uploaded;
    }

    public Set<BlockId> uploadedSet() {
        return new LinkedHashSet<>(uploaded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShipperState)) return false;
        ShipperState that = (ShipperState) o;
        return version == that.version && uploaded.equals(that.uploaded);
    }

    @Override
    public int hashCode() {
        return 31 * version + uploaded.hashCode();
    }

    @Override
    public String toString() {
        return "ShipperState{version=" + version + ", uploaded=" + uploaded.size() + " blocks}";
    }
}
