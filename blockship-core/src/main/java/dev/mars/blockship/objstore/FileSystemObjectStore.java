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

package dev.mars.blockship.objstore;

import dev.mars.blockship.storage.AtomicFileWriter;
import dev.mars.blockship.storage.FileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link ObjectStore} backed by a directory, mapping each object name to a file path below
 * the bucket root. Objects are written through the {@link AtomicFileWriter}, so a reader never
 * observes a partially written object.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path bucketRoot;
    private final AtomicFileWriter writer;

    public FileSystemObjectStore(Path bucketRoot, AtomicFileWriter writer) {
        this.bucketRoot = Objects.requireNonNull(bucketRoot, "bucketRoot cannot be null").toAbsolutePath().normalize();
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
    }

    @Override
    public String getName() {
        return "filesystem:" + bucketRoot;
    }

    @Override
    public boolean exists(String objectName) throws IOException {
        return Files.isRegularFile(resolve(objectName));
    }

    @Override
    public void upload(String objectName, Path source) throws IOException {
        Path target = resolve(objectName);
        FileManager.ensureDirectoryExists(target.getParent());
        writer.copy(source, target);
        logger.debug("Uploaded {} to {}", source, target);
    }

    public Path getBucketRoot() {
        return bucketRoot;
    }

    private Path resolve(String objectName) throws IOException {
        if (objectName == null || objectName.isEmpty()) {
            throw new IOException("Object name must not be empty");
        }
        Path resolved = bucketRoot.resolve(objectName).normalize();
        // Check for path traversal attempts
        if (!resolved.startsWith(bucketRoot) || resolved.equals(bucketRoot)) {
            throw new IOException("Object name escapes bucket root: " + objectName);
        }
        return resolved;
    }
}
