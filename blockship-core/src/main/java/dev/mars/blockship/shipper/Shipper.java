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

package dev.mars.blockship.shipper;

import dev.mars.blockship.block.BlockId;
import dev.mars.blockship.block.BlockScanner;
import dev.mars.blockship.block.SourceType;
import dev.mars.blockship.exceptions.BlockUploadException;
import dev.mars.blockship.exceptions.BlockshipException;
import dev.mars.blockship.exceptions.StateFileException;
import dev.mars.blockship.exceptions.StateFileNotFoundException;
import dev.mars.blockship.objstore.ObjectStore;
import dev.mars.blockship.observability.MetricsSink;
import dev.mars.blockship.storage.AtomicFileWriter;
import dev.mars.blockship.storage.FileManager;
import dev.mars.blockship.storage.ShipperState;
import dev.mars.blockship.storage.ShipperStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Watches a data directory for blocks and ships each of them to an object store once.
 *
 * <p>Each {@link #sync(ShipContext)} pass rebuilds the bookkeeping record from scratch:</p>
 * <ul>
 *   <li>blocks listed in the previous record are kept without contacting the store</li>
 *   <li>any other block is handed to {@link BlockShipment} and recorded only on success</li>
 *   <li>blocks that disappeared locally are dropped from the record</li>
 * </ul>
 *
 * <p>A failing block is logged and retried on the next pass; it never stops the others.
 * Listed blocks are trusted: a block deleted from the store after being recorded is not
 * uploaded again while it stays listed.</p>
 *
 * <p><b>Thread Safety:</b> not safe for concurrent use. Callers must never run two passes,
 * or a pass and {@link #timestamps()}, at the same time.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Shipper shipper = Shipper.builder()
 *     .dataDir(Paths.get("/var/lib/tsdb"))
 *     .objectStore(store)
 *     .labels(() -> Map.of("cluster", "eu-1"))
 *     .source(SourceType.SIDECAR)
 *     .build();
 * SyncResult result = shipper.sync(ShipContext.create());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class Shipper {

    private static final Logger logger = LoggerFactory.getLogger(Shipper.class);

    /** Reserved directory under the data directory; never a valid block ID. */
    public static final String RESERVED_DIRNAME = "blockship";
    public static final String UPLOAD_DIRNAME = "upload";

    private final Path dataDir;
    private final Path stagingRoot;
    private final BlockScanner scanner;
    private final ShipperStateStore stateStore;
    private final BlockShipment shipment;
    private final MetricsSink metrics;

    private Shipper(Builder builder) {
        this.dataDir = builder.dataDir;
        this.stagingRoot = builder.stagingRoot != null
                ? builder.stagingRoot
                : builder.dataDir.resolve(RESERVED_DIRNAME).resolve(UPLOAD_DIRNAME);
        this.scanner = new BlockScanner(dataDir);
        this.stateStore = new ShipperStateStore(dataDir, builder.writer);
        this.shipment = new BlockShipment(builder.objectStore, stagingRoot, builder.writer,
                builder.labels, builder.source);
        this.metrics = builder.metrics;
        logger.info("Shipper created for {} -> {} (source: {})",
                dataDir, builder.objectStore.getName(), builder.source.getValue());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Performs one synchronization pass, ensuring every local block has been shipped once.
     * Never throws: failures are logged, counted and reflected in the result.
     */
    public SyncResult sync(ShipContext context) {
        metrics.incrementCounter(MetricsSink.DIR_SYNCS);

        ShipperState previous;
        try {
            previous = stateStore.read();
        } catch (StateFileNotFoundException e) {
            logger.debug("No state file yet, starting with an empty record");
            previous = ShipperState.empty();
        } catch (StateFileException e) {
            // The record only deduplicates uploads; existence checks cover for its loss
            logger.warn("Reading state file failed, rebuilding it: {}", e.getMessage());
            previous = ShipperState.empty();
        }
        Set<BlockId> hasUploaded = previous.uploadedSet();

        List<BlockId> uploaded = new ArrayList<>();
        Set<BlockId> recorded = new HashSet<>();
        Tally tally = new Tally();

        try {
            scanner.scan(block -> {
                BlockId id = block.getId();
                if (!recorded.add(id)) {
                    logger.warn("Block {} found in more than one directory, ignoring {}", id, block.getDirectory());
                    return;
                }
                if (hasUploaded.contains(id)) {
                    tally.retained++;
                    uploaded.add(id);
                    return;
                }
                if (context.isCancelled()) {
                    logger.debug("Sync pass cancelled, leaving block {} for the next pass", id);
                    return;
                }
                try {
                    BlockShipment.Outcome outcome = shipment.ship(context, block);
                    tally.count(outcome);
                    if (outcome == BlockShipment.Outcome.UPLOADED) {
                        metrics.incrementCounter(MetricsSink.UPLOADS);
                    }
                    uploaded.add(id);
                } catch (BlockUploadException e) {
                    // Other blocks still get shipped; this one is retried on the next pass
                    logger.error("Shipping failed for block {}", id, e);
                    metrics.incrementCounter(MetricsSink.UPLOADS);
                    metrics.incrementCounter(MetricsSink.UPLOAD_FAILURES);
                    tally.failed++;
                } catch (RuntimeException e) {
                    logger.error("Shipping failed unexpectedly for block {}", id, e);
                    metrics.incrementCounter(MetricsSink.UPLOADS);
                    metrics.incrementCounter(MetricsSink.UPLOAD_FAILURES);
                    tally.failed++;
                }
            });
        } catch (BlockshipException e) {
            logger.error("Iterating block metas failed in {}", dataDir, e);
            metrics.incrementCounter(MetricsSink.DIR_SYNC_FAILURES);
            return SyncResult.aborted();
        }

        boolean persisted = true;
        try {
            stateStore.write(ShipperState.of(uploaded));
        } catch (IOException e) {
            logger.warn("Updating state file {} failed", stateStore.getStateFile(), e);
            metrics.incrementCounter(MetricsSink.DIR_SYNC_FAILURES);
            persisted = false;
        }

        SyncResult result = tally.toResult(persisted);
        if (result.getUploaded() > 0 || result.getFailed() > 0) {
            logger.info("Sync pass finished for {}: {}", dataDir, result);
        } else {
            logger.debug("Sync pass finished for {}: {}", dataDir, result);
        }
        return result;
    }

    /**
     * Returns the earliest start time over all local blocks and the latest end time over the
     * local blocks recorded as shipped.
     *
     * @throws BlockshipException if the data directory cannot be scanned or the bookkeeping
     *                            file exists but cannot be read
     */
    public Timestamps timestamps() throws BlockshipException {
        ShipperState state;
        try {
            state = stateStore.read();
        } catch (StateFileNotFoundException e) {
            state = ShipperState.empty();
        }
        Set<BlockId> hasUploaded = state.uploadedSet();

        long[] bounds = {Long.MAX_VALUE, Timestamps.NONE};
        scanner.scan(block -> {
            if (block.getMinTime() < bounds[0]) {
                bounds[0] = block.getMinTime();
            }
            if (hasUploaded.contains(block.getId()) && block.getMaxTime() > bounds[1]) {
                bounds[1] = block.getMaxTime();
            }
        });

        // No block found: no minimum can be assumed, report 0
        long minTime = bounds[0] == Long.MAX_VALUE ? 0 : bounds[0];
        return new Timestamps(minTime, bounds[1]);
    }

    /**
     * Creates the staging root and checks that it shares a file store with the data
     * directory, which hard-link staging requires.
     *
     * @throws IllegalStateException if the two are on different file stores
     * @throws IOException           if the staging root cannot be created or inspected
     */
    public void verifyStagingFilesystem() throws IOException {
        FileManager.ensureDirectoryExists(stagingRoot);
        if (!FileManager.isSameFileStore(dataDir, stagingRoot)) {
            throw new IllegalStateException("Staging directory " + stagingRoot
                    + " is not on the same filesystem as data directory " + dataDir);
        }
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getStagingRoot() {
        return stagingRoot;
    }

    public Path getStateFile() {
        return stateStore.getStateFile();
    }

    private static final class Tally {
        int uploaded;
        int alreadyPresent;
        int filtered;
        int failed;
        int retained;

        void count(BlockShipment.Outcome outcome) {
            switch (outcome) {
                case UPLOADED:
                    uploaded++;
                    break;
                case ALREADY_PRESENT:
                    alreadyPresent++;
                    break;
                case FILTERED:
                    filtered++;
                    break;
                default:
                    throw new IllegalStateException("Unknown outcome: " + outcome);
            }
        }

        SyncResult toResult(boolean completed) {
            return new SyncResult(uploaded, alreadyPresent, filtered, failed, retained, completed);
        }
    }

    /**
     * Builder for {@link Shipper}. Data directory and object store are required.
     */
    public static class Builder {
        private Path dataDir;
        private Path stagingRoot;
        private ObjectStore objectStore;
        private Supplier<Map<String, String>> labels = () -> null;
        private SourceType source = SourceType.SIDECAR;
        private MetricsSink metrics = MetricsSink.noop();
        private AtomicFileWriter writer = new AtomicFileWriter();

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /**
         * Overrides the staging root, {@code <dataDir>/blockship/upload} by default.
         * Must be on the same filesystem as the data directory.
         */
        public Builder stagingRoot(Path stagingRoot) {
            this.stagingRoot = stagingRoot;
            return this;
        }

        public Builder objectStore(ObjectStore objectStore) {
            this.objectStore = objectStore;
            return this;
        }

        /**
         * Supplier of the external labels attached to each shipped manifest, called once per
         * upload. Returning null leaves the manifest's labels untouched.
         */
        public Builder labels(Supplier<Map<String, String>> labels) {
            this.labels = labels != null ? labels : () -> null;
            return this;
        }

        public Builder source(SourceType source) {
            this.source = source;
            return this;
        }

        public Builder metrics(MetricsSink metrics) {
            this.metrics = metrics != null ? metrics : MetricsSink.noop();
            return this;
        }

        public Builder fileWriter(AtomicFileWriter writer) {
            this.writer = writer;
            return this;
        }

        public Shipper build() {
            Objects.requireNonNull(dataDir, "dataDir is required");
            Objects.requireNonNull(objectStore, "objectStore is required");
            Objects.requireNonNull(source, "source is required");
            Objects.requireNonNull(writer, "fileWriter is required");
            return new Shipper(this);
        }
    }
}
