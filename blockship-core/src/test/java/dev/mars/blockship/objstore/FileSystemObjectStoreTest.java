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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemObjectStoreTest {

    @TempDir
    Path tempDir;

    private Path bucket;
    private FileSystemObjectStore store;

    @BeforeEach
    void setUp() {
        bucket = tempDir.resolve("bucket");
        store = new FileSystemObjectStore(bucket, new AtomicFileWriter(false));
    }

    @Test
    void testUploadCreatesNestedObject() throws IOException {
        Path source = Files.writeString(tempDir.resolve("000001"), "chunk data");

        store.upload("01HGW1K5XQ8Z2Y3M4N5P6Q0001/chunks/000001", source);

        Path object = bucket.resolve("01HGW1K5XQ8Z2Y3M4N5P6Q0001").resolve("chunks").resolve("000001");
        assertEquals("chunk data", Files.readString(object));
        assertTrue(store.exists("01HGW1K5XQ8Z2Y3M4N5P6Q0001/chunks/000001"));
    }

    @Test
    void testExistsForMissingObject() throws IOException {
        assertFalse(store.exists("01HGW1K5XQ8Z2Y3M4N5P6Q0001/meta.json"));
    }

    @Test
    void testDirectoryIsNotAnObject() throws IOException {
        Files.createDirectories(bucket.resolve("prefix"));

        assertFalse(store.exists("prefix"));
    }

    @Test
    void testUploadOverwrites() throws IOException {
        Path first = Files.writeString(tempDir.resolve("first"), "one");
        Path second = Files.writeString(tempDir.resolve("second"), "two");

        store.upload("obj", first);
        store.upload("obj", second);

        assertEquals("two", Files.readString(bucket.resolve("obj")));
    }

    @Test
    void testUploadMissingSource() {
        assertThrows(IOException.class, () -> store.upload("obj", tempDir.resolve("absent")));
        assertFalse(Files.exists(bucket.resolve("obj")));
    }

    @Test
    void testRejectsNamesEscapingBucket() throws IOException {
        Path source = Files.writeString(tempDir.resolve("source"), "x");

        assertThrows(IOException.class, () -> store.upload("../escaped", source));
        assertThrows(IOException.class, () -> store.exists("a/../../escaped"));
        assertFalse(Files.exists(tempDir.resolve("escaped")));
    }

    @Test
    void testName() {
        assertEquals("filesystem:" + bucket.toAbsolutePath().normalize(), store.getName());
        assertEquals(bucket.toAbsolutePath().normalize(), store.getBucketRoot());
    }
}
