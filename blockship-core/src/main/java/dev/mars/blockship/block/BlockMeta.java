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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Contents of a block's {@code meta.json} manifest.
 *
 * <p>Only the fields the shipper needs are modelled. Every other field is kept in
 * {@link #getOtherFields()} and written back unchanged, so rewriting the staged manifest
 * never drops information produced by the block writer.</p>
 *
 * <p>The {@code blockship} section is added by the shipper when staging an upload and is
 * never written into the original block directory.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
@JsonPropertyOrder({"ulid", "minTime", "maxTime", "version", "compaction", "blockship"})
public class BlockMeta {

    /** The only manifest format version this shipper understands. */
    public static final int SUPPORTED_VERSION = 1;

    @JsonProperty("ulid")
    private BlockId ulid;

    @JsonProperty("minTime")
    private long minTime;

    @JsonProperty("maxTime")
    private long maxTime;

    @JsonProperty("version")
    private int version = SUPPORTED_VERSION;

    @JsonProperty("compaction")
    private Compaction compaction = new Compaction();

    @JsonProperty("blockship")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ShippingInfo shipping;

    private final Map<String, Object> otherFields = new LinkedHashMap<>();

    /**
     * Default constructor for JSON deserialization.
     */
    public BlockMeta() {
    }

    public BlockMeta(BlockId ulid, long minTime, long maxTime, int compactionLevel) {
        this.ulid = Objects.requireNonNull(ulid, "ulid cannot be null");
        this.minTime = minTime;
        this.maxTime = maxTime;
        this.compaction = new Compaction(compactionLevel, List.of(ulid));
    }

    public BlockId getUlid() {
        return ulid;
    }

    public void setUlid(BlockId ulid) {
        this.ulid = ulid;
    }

    public long getMinTime() {
        return minTime;
    }

    public void setMinTime(long minTime) {
        this.minTime = minTime;
    }

    public long getMaxTime() {
        return maxTime;
    }

    public void setMaxTime(long maxTime) {
        this.maxTime = maxTime;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public Compaction getCompaction() {
        return compaction;
    }

    public void setCompaction(Compaction compaction) {
        this.compaction = compaction;
    }

    public ShippingInfo getShipping() {
        return shipping;
    }

    public void setShipping(ShippingInfo shipping) {
        this.shipping = shipping;
    }

    /**
     * Returns the shipping section, creating it if the manifest has none yet.
     */
    public ShippingInfo shipping() {
        if (shipping == null) {
            shipping = new ShippingInfo();
        }
        return shipping;
    }

    @JsonAnyGetter
    public Map<String, Object> getOtherFields() {
        return otherFields;
    }

    @JsonAnySetter
    public void setOtherField(String name, Object value) {
        otherFields.put(name, value);
    }

    @Override
    public String toString() {
        return "BlockMeta{" +
                "ulid=" + ulid +
                ", minTime=" + minTime +
                ", maxTime=" + maxTime +
                ", level=" + (compaction != null ? compaction.getLevel() : 0) +
                '}';
    }

    /**
     * Compaction history of a block. Level 1 marks a block written directly by ingestion.
     */
    @JsonPropertyOrder({"level", "sources"})
    public static class Compaction {

        @JsonProperty("level")
        private int level;

        @JsonProperty("sources")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private List<BlockId> sources;

        private final Map<String, Object> otherFields = new LinkedHashMap<>();

        public Compaction() {
        }

        public Compaction(int level, List<BlockId> sources) {
            this.level = level;
            this.sources = new ArrayList<>(sources);
        }

        public int getLevel() {
            return level;
        }

        public void setLevel(int level) {
            this.level = level;
        }

        /**
         * @return the source block IDs, or null when the manifest lists none
         */
        public List<BlockId> getSources() {
            return sources;
        }

        public void setSources(List<BlockId> sources) {
            this.sources = sources;
        }

        @JsonAnyGetter
        public Map<String, Object> getOtherFields() {
            return otherFields;
        }

        @JsonAnySetter
        public void setOtherField(String name, Object value) {
            otherFields.put(name, value);
        }
    }

    /**
     * Fields attached by the shipper to the uploaded copy of the manifest.
     */
    @JsonPropertyOrder({"labels", "source"})
    public static class ShippingInfo {

        @JsonProperty("labels")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private Map<String, String> labels = new LinkedHashMap<>();

        @JsonProperty("source")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private SourceType source;

        private final Map<String, Object> otherFields = new LinkedHashMap<>();

        public Map<String, String> getLabels() {
            return labels;
        }

        public void setLabels(Map<String, String> labels) {
            this.labels = labels != null ? new LinkedHashMap<>(labels) : new LinkedHashMap<>();
        }

        public SourceType getSource() {
            return source;
        }

        public void setSource(SourceType source) {
            this.source = source;
        }

        @JsonAnyGetter
        public Map<String, Object> getOtherFields() {
            return otherFields;
        }

        @JsonAnySetter
        public void setOtherField(String name, Object value) {
            otherFields.put(name, value);
        }
    }
}
