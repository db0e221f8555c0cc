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

import dev.mars.blockship.exceptions.BlockScanException;
import dev.mars.blockship.exceptions.BlockshipException;
import dev.mars.blockship.storage.FileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Enumerates the blocks stored directly under a root directory.
 *
 * <p>Each pass works on one snapshot of the root's entry names, visited in sorted (and
 * therefore chronological) order. Entries whose name is not a block ID, that are not
 * directories, or whose manifest cannot be read are skipped with a warning: a compactor
 * may delete a block mid-scan and a writer may not have finished its manifest yet.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class BlockScanner {

    private static final Logger logger = LoggerFactory.getLogger(BlockScanner.class);

    private final Path root;

    public BlockScanner(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
    }

    /**
     * Visits every readable block under the root.
     *
     * @param visitor called once per block; an exception it throws ends the scan and is rethrown
     * @throws BlockScanException if the root directory cannot be listed
     * @throws BlockshipException whatever the visitor threw
     */
    public void scan(BlockVisitor visitor) throws BlockshipException {
        List<String> names;
        try {
            names = FileManager.listNames(root);
        } catch (IOException e) {
            throw new BlockScanException("Failed to read block directory " + root, e);
        }

        for (String name : names) {
            Optional<Block> block = load(name);
            if (block.isPresent()) {
                visitor.visit(block.get());
            }
        }
    }

    /**
     * Collects every readable block under the root.
     */
    public List<Block> listBlocks() throws BlockshipException {
        List<Block> blocks = new ArrayList<>();
        scan(blocks::add);
        return blocks;
    }

    public Path getRoot() {
        return root;
    }

    private Optional<Block> load(String name) {
        if (BlockId.fromDirectoryName(name).isEmpty()) {
            if (BlockId.fromDirectoryName(name.toUpperCase(Locale.ROOT)).isPresent()) {
                logger.debug("Skipping {}: block IDs must be upper-case", name);
            } else {
                logger.debug("Skipping {}: not a block directory", name);
            }
            return Optional.empty();
        }
        Path dir = root.resolve(name);

        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(dir, BasicFileAttributes.class);
        } catch (IOException e) {
            logger.warn("Open file failed for {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
        if (!attrs.isDirectory()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new Block(BlockFiles.readMeta(dir), dir));
        } catch (IOException e) {
            logger.warn("Reading meta file failed for {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }
}
