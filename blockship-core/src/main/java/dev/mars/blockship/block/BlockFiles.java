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

import dev.mars.blockship.storage.AtomicFileWriter;
import dev.mars.blockship.storage.JsonCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout of a block directory and access to its manifest.
 *
 * <pre>
 * {blockDir}/
 *   ├── meta.json     // manifest
 *   ├── index         // index file
 *   └── chunks/       // data segment files
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public final class BlockFiles {

    public static final String META_FILENAME = "meta.json";
    public static final String INDEX_FILENAME = "index";
    public static final String CHUNKS_DIRNAME = "chunks";

    private BlockFiles() {
    }

    /**
     * Reads and validates {@code <blockDir>/meta.json}.
     *
     * @throws IOException if the file is missing, is not valid JSON, has no ULID or
     *                     carries an unsupported version
     */
    public static BlockMeta readMeta(Path blockDir) throws IOException {
        Path metaPath = blockDir.resolve(META_FILENAME);
        BlockMeta meta = JsonCodec.decode(Files.readAllBytes(metaPath), BlockMeta.class);
        if (meta.getUlid() == null) {
            throw new IOException("Manifest has no ulid: " + metaPath);
        }
        if (meta.getVersion() != BlockMeta.SUPPORTED_VERSION) {
            throw new IOException("Unexpected manifest version " + meta.getVersion() + ": " + metaPath);
        }
        return meta;
    }

    /**
     * Atomically writes {@code meta} to {@code <blockDir>/meta.json}.
     */
    public static void writeMeta(AtomicFileWriter writer, Path blockDir, BlockMeta meta) throws IOException {
        writer.write(blockDir.resolve(META_FILENAME), JsonCodec.encode(meta));
    }

    /**
     * Remote object name of a file inside a block, e.g. {@code <id>/chunks/000001}.
     */
    public static String objectName(BlockId id, String relativePath) {
        return id + "/" + relativePath;
    }
}
