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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Replaces files so that a crash leaves either the old or the new content, never a partial file.
 *
 * <p><b>Write sequence:</b></p>
 * <ol>
 *   <li>Write content to the sibling {@code <name>.tmp} and force it to disk</li>
 *   <li>Remove a directory occupying the target path, if any</li>
 *   <li>Atomically move the temp file onto the target</li>
 *   <li>Force the parent directory so the rename itself survives a crash</li>
 * </ol>
 *
 * <p>A failed write may leave the {@code .tmp} file behind; the next write truncates it.
 * The move replaces the target's directory entry, so a target that is a hard link to
 * another file never has that other file's content modified.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class AtomicFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

    static final String TEMP_SUFFIX = ".tmp";

    private final boolean fsyncEnabled;

    public AtomicFileWriter() {
        this(true);
    }

    /**
     * @param fsyncEnabled whether to force file content and parent directory (false only for tests)
     */
    public AtomicFileWriter(boolean fsyncEnabled) {
        this.fsyncEnabled = fsyncEnabled;
    }

    /**
     * Atomically replaces {@code target} with {@code content}.
     *
     * @throws IOException if any step fails; the previous target content is then left intact
     */
    public void write(Path target, byte[] content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);

        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(content);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (fsyncEnabled) {
                ch.force(true);
            }
        }

        commit(tmp, target);
        logger.debug("Atomically wrote {} bytes to {}", content.length, target);
    }

    /**
     * Atomically replaces {@code target} with a copy of {@code source}, streaming the content
     * rather than holding it in memory.
     *
     * @throws IOException if any step fails; the previous target content is then left intact
     */
    public void copy(Path source, Path target) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);

        try (FileChannel in = FileChannel.open(source, StandardOpenOption.READ);
             FileChannel out = FileChannel.open(tmp,
                     StandardOpenOption.CREATE,
                     StandardOpenOption.TRUNCATE_EXISTING,
                     StandardOpenOption.WRITE)) {
            long size = in.size();
            long position = 0;
            while (position < size) {
                position += in.transferTo(position, size - position, out);
            }
            if (fsyncEnabled) {
                out.force(true);
            }
        }

        commit(tmp, target);
        logger.debug("Atomically copied {} to {}", source, target);
    }

    private void commit(Path tmp, Path target) throws IOException {
        // A move cannot replace a non-empty directory
        if (Files.isDirectory(target)) {
            FileManager.deleteRecursively(target);
        }

        Files.move(tmp, target,
                StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);

        // Fsync the directory (critical on Linux ext4/xfs)
        if (fsyncEnabled) {
            FileManager.syncDirectory(target.toAbsolutePath().getParent());
        }
    }

    public boolean isFsyncEnabled() {
        return fsyncEnabled;
    }
}
