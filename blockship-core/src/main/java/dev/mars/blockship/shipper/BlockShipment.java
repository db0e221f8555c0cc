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

import dev.mars.blockship.block.Block;
import dev.mars.blockship.block.BlockFiles;
import dev.mars.blockship.block.BlockId;
import dev.mars.blockship.block.BlockMeta;
import dev.mars.blockship.block.SourceType;
import dev.mars.blockship.exceptions.BlockUploadException;
import dev.mars.blockship.objstore.ObjectStore;
import dev.mars.blockship.storage.AtomicFileWriter;
import dev.mars.blockship.storage.FileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ships a single block to the object store.
 *
 * <p><b>Procedure:</b></p>
 * <ol>
 *   <li>Blocks above compaction level 1 are skipped; only first-generation blocks are shipped</li>
 *   <li>If the block's manifest already exists remotely, nothing is uploaded</li>
 *   <li>A fresh staging directory {@code <stagingRoot>/<blockId>} replaces any crash leftover</li>
 *   <li>Chunk files, index and manifest are hard-linked into it, so the upload reads a stable
 *       snapshot even if the block is compacted away meanwhile</li>
 *   <li>The staged manifest (never the original) is rewritten with the external labels and
 *       the source type</li>
 *   <li>Chunks, then index, then manifest are uploaded: a remote manifest implies all data
 *       files are present</li>
 *   <li>The staging directory is removed, whatever the outcome</li>
 * </ol>
 *
 * <p>Hard links cannot cross file stores; the staging root must live on the same
 * filesystem as the data directory.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class BlockShipment {

    private static final Logger logger = LoggerFactory.getLogger(BlockShipment.class);

    /**
     * What happened to a block that did not fail.
     */
    public enum Outcome {
        /** All files were uploaded during this call. */
        UPLOADED,
        /** The manifest already existed remotely. */
        ALREADY_PRESENT,
        /** Skipped because of its compaction level. */
        FILTERED
    }

    private final ObjectStore objectStore;
    private final Path stagingRoot;
    private final AtomicFileWriter writer;
    private final Supplier<Map<String, String>> labels;
    private final SourceType source;

    public BlockShipment(ObjectStore objectStore, Path stagingRoot, AtomicFileWriter writer,
                         Supplier<Map<String, String>> labels, SourceType source) {
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore cannot be null");
        this.stagingRoot = Objects.requireNonNull(stagingRoot, "stagingRoot cannot be null");
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
        this.labels = labels != null ? labels : () -> null;
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    /**
     * Ships the block unless it is filtered or already present remotely.
     *
     * @throws BlockUploadException if any step fails or the context is cancelled; the block
     *                              must then be treated as not shipped
     */
    public Outcome ship(ShipContext context, Block block) throws BlockUploadException {
        BlockId id = block.getId();

        // TODO: ship compacted blocks once the compactor can tell which sources they replace
        if (block.getCompactionLevel() > 1) {
            logger.debug("Skipping block {} at compaction level {}", id, block.getCompactionLevel());
            return Outcome.FILTERED;
        }

        checkCancelled(context, id);
        boolean exists;
        try {
            exists = objectStore.exists(BlockFiles.objectName(id, BlockFiles.META_FILENAME));
        } catch (IOException | RuntimeException e) {
            throw new BlockUploadException(id.toString(), "check exists", e);
        }
        if (exists) {
            logger.debug("Block {} already present in {}", id, objectStore.getName());
            return Outcome.ALREADY_PRESENT;
        }

        logger.info("Upload new block {}", id);

        Path stagingDir = stagingRoot.resolve(id.toString());
        try {
            FileManager.deleteRecursively(stagingDir);
        } catch (IOException e) {
            throw new BlockUploadException(id.toString(), "clean upload directory", e);
        }
        try {
            try {
                Files.createDirectories(stagingDir);
            } catch (IOException e) {
                throw new BlockUploadException(id.toString(), "create upload dir", e);
            }
            List<String> files = hardLinkBlock(id, block.getDirectory(), stagingDir);
            augmentManifest(id, stagingDir);
            upload(context, id, stagingDir, files);
        } finally {
            try {
                FileManager.deleteRecursively(stagingDir);
            } catch (IOException e) {
                logger.error("Failed to clean upload directory {}", stagingDir, e);
            }
        }
        return Outcome.UPLOADED;
    }

    /**
     * Hard-links the block's files into the staging directory.
     *
     * @return the linked files relative to the block directory, in upload order
     */
    private List<String> hardLinkBlock(BlockId id, Path src, Path dst) throws BlockUploadException {
        List<String> files = new ArrayList<>();
        try {
            Files.createDirectories(dst.resolve(BlockFiles.CHUNKS_DIRNAME));
            for (String name : FileManager.listNames(src.resolve(BlockFiles.CHUNKS_DIRNAME))) {
                files.add(BlockFiles.CHUNKS_DIRNAME + "/" + name);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new BlockUploadException(id.toString(), "read chunk dir", e);
        }
        files.add(BlockFiles.INDEX_FILENAME);
        files.add(BlockFiles.META_FILENAME);

        for (String file : files) {
            try {
                FileManager.hardLink(src.resolve(file), dst.resolve(file));
            } catch (IOException e) {
                throw new BlockUploadException(id.toString(), "hard link file " + file, e);
            }
        }
        logger.debug("Staged {} files for block {} in {}", files.size(), id, dst);
        return files;
    }

    private void augmentManifest(BlockId id, Path stagingDir) throws BlockUploadException {
        try {
            BlockMeta meta = BlockFiles.readMeta(stagingDir);
            Map<String, String> current;
            try {
                current = labels.get();
            } catch (RuntimeException e) {
                throw new BlockUploadException(id.toString(), "get external labels", e);
            }
            if (current != null) {
                meta.shipping().setLabels(current);
            }
            meta.shipping().setSource(source);
            BlockFiles.writeMeta(writer, stagingDir, meta);
        } catch (IOException e) {
            throw new BlockUploadException(id.toString(), "write meta file", e);
        }
    }

    private void upload(ShipContext context, BlockId id, Path stagingDir, List<String> files)
            throws BlockUploadException {
        for (String file : files) {
            checkCancelled(context, id);
            String objectName = BlockFiles.objectName(id, file);
            try {
                objectStore.upload(objectName, stagingDir.resolve(file));
            } catch (IOException | RuntimeException e) {
                throw new BlockUploadException(id.toString(), "upload " + objectName, e);
            }
        }
        logger.info("Uploaded block {} ({} files) to {}", id, files.size(), objectStore.getName());
    }

    private static void checkCancelled(ShipContext context, BlockId id) throws BlockUploadException {
        if (context.isCancelled()) {
            throw new BlockUploadException(id.toString(), "cancelled");
        }
    }

    public Path getStagingRoot() {
        return stagingRoot;
    }
}
