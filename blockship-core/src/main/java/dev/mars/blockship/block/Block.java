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

import java.nio.file.Path;
import java.util.Objects;

/**
 * A block found on local storage: its parsed manifest together with the directory it was
 * read from. Blocks are immutable once their manifest exists, but the directory may be
 * deleted by a compactor at any time.
 */
public final class Block {

    private final BlockMeta meta;
    private final Path directory;

    public Block(BlockMeta meta, Path directory) {
        this.meta = Objects.requireNonNull(meta, "meta cannot be null");
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
    }

    public BlockId getId() {
        return meta.getUlid();
    }

    public long getMinTime() {
        return meta.getMinTime();
    }

    public long getMaxTime() {
        return meta.getMaxTime();
    }

    public int getCompactionLevel() {
        return meta.getCompaction() != null ? meta.getCompaction().getLevel() : 0;
    }

    public BlockMeta getMeta() {
        return meta;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public String toString() {
        return "Block{id=" + getId() + ", level=" + getCompactionLevel() + ", dir=" + directory + "}";
    }
}
