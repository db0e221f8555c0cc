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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.blockship.storage.AtomicFileWriter;
import dev.mars.blockship.storage.JsonCodec;
import dev.mars.blockship.testing.TestBlocks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockFilesTest {

    @TempDir
    Path tempDir;

    private final AtomicFileWriter writer = new AtomicFileWriter(false);

    @Test
    void testReadMeta() throws IOException {
        BlockId id = TestBlocks.id(1);
        Path dir = TestBlocks.create(tempDir, id, 100, 200, 1);

        BlockMeta meta = BlockFiles.readMeta(dir);

        assertEquals(id, meta.getUlid());
        assertEquals(100, meta.getMinTime());
        assertEquals(200, meta.getMaxTime());
        assertEquals(1, meta.getVersion());
        assertEquals(1, meta.getCompaction().getLevel());
        assertEquals(List.of(id), meta.getCompaction().getSources());
        assertNull(meta.getShipping());
    }

    @Test
    void testReadMetaRejectsUnsupportedVersion() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("block"));
        Files.write(dir.resolve(BlockFiles.META_FILENAME), ("{\"ulid\":\"" + TestBlocks.id(1)
                + "\",\"minTime\":0,\"maxTime\":1,\"version\":2}").getBytes(StandardCharsets.UTF_8));

        IOException e = assertThrows(IOException.class, () -> BlockFiles.readMeta(dir));
        assertTrue(e.getMessage().contains("version 2"));
    }

    @Test
    void testReadMetaRejectsMissingUlid() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("block"));
        Files.write(dir.resolve(BlockFiles.META_FILENAME),
                "{\"minTime\":0,\"maxTime\":1,\"version\":1}".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> BlockFiles.readMeta(dir));
    }

    @Test
    void testReadMetaRejectsMalformedJson() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("block"));
        Files.write(dir.resolve(BlockFiles.META_FILENAME), "{\"ulid\":".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> BlockFiles.readMeta(dir));
    }

    @Test
    void testReadMetaMissingFile() {
        assertThrows(IOException.class, () -> BlockFiles.readMeta(tempDir.resolve("absent")));
    }

    @Test
    @DisplayName("Fields the shipper does not model survive a read/write cycle")
    void testUnknownFieldsArePreserved() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("block"));
        String json = "{\"ulid\":\"" + TestBlocks.id(1) + "\",\"minTime\":5,\"maxTime\":9,\"version\":1,"
                + "\"stats\":{\"numSamples\":42},"
                + "\"compaction\":{\"level\":1,\"sources\":[\"" + TestBlocks.id(1) + "\"],\"parents\":[]},"
                + "\"extensions\":{\"downsample\":{\"resolution\":0}}}";
        Files.write(dir.resolve(BlockFiles.META_FILENAME), json.getBytes(StandardCharsets.UTF_8));

        BlockMeta meta = BlockFiles.readMeta(dir);
        meta.shipping().setSource(SourceType.COMPACTOR);
        BlockFiles.writeMeta(writer, dir, meta);

        JsonNode written = JsonCodec.mapper().readTree(dir.resolve(BlockFiles.META_FILENAME).toFile());
        assertEquals(42, written.path("stats").path("numSamples").asInt());
        assertEquals(0, written.path("extensions").path("downsample").path("resolution").asInt());
        assertTrue(written.path("compaction").has("parents"));
        assertEquals("compactor", written.path("blockship").path("source").asText());
    }

    @Test
    void testExistingShippingSectionAndEmptySourcesArePreserved() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("block"));
        String json = "{\"ulid\":\"" + TestBlocks.id(1) + "\",\"minTime\":5,\"maxTime\":9,\"version\":1,"
                + "\"compaction\":{\"level\":1,\"sources\":[]},"
                + "\"blockship\":{\"source\":\"receive\",\"resolution\":300}}";
        Files.write(dir.resolve(BlockFiles.META_FILENAME), json.getBytes(StandardCharsets.UTF_8));

        BlockMeta meta = BlockFiles.readMeta(dir);
        meta.shipping().setSource(SourceType.SIDECAR);
        BlockFiles.writeMeta(writer, dir, meta);

        JsonNode written = JsonCodec.mapper().readTree(dir.resolve(BlockFiles.META_FILENAME).toFile());
        assertTrue(written.path("compaction").path("sources").isArray());
        assertEquals(0, written.path("compaction").path("sources").size());
        assertEquals(300, written.path("blockship").path("resolution").asInt());
        assertEquals("sidecar", written.path("blockship").path("source").asText());
    }

    @Test
    void testAbsentSourcesStayAbsent() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("block"));
        String json = "{\"ulid\":\"" + TestBlocks.id(1) + "\",\"minTime\":5,\"maxTime\":9,\"version\":1,"
                + "\"compaction\":{\"level\":1}}";
        Files.write(dir.resolve(BlockFiles.META_FILENAME), json.getBytes(StandardCharsets.UTF_8));

        BlockFiles.writeMeta(writer, dir, BlockFiles.readMeta(dir));

        JsonNode written = JsonCodec.mapper().readTree(dir.resolve(BlockFiles.META_FILENAME).toFile());
        assertFalse(written.path("compaction").has("sources"));
    }

    @Test
    void testWriteMetaWithLabels() throws IOException {
        BlockId id = TestBlocks.id(3);
        Path dir = TestBlocks.create(tempDir, id, 1, 2, 1);

        BlockMeta meta = BlockFiles.readMeta(dir);
        meta.shipping().setLabels(Map.of("cluster", "eu-1"));
        meta.shipping().setSource(SourceType.SIDECAR);
        BlockFiles.writeMeta(writer, dir, meta);

        BlockMeta reread = BlockFiles.readMeta(dir);
        assertEquals(Map.of("cluster", "eu-1"), reread.getShipping().getLabels());
        assertEquals(SourceType.SIDECAR, reread.getShipping().getSource());
        assertEquals(Map.of("numSamples", 1000, "numSeries", 10), reread.getOtherFields().get("stats"));
    }

    @Test
    void testObjectName() {
        BlockId id = TestBlocks.id(7);
        assertEquals(id + "/meta.json", BlockFiles.objectName(id, BlockFiles.META_FILENAME));
        assertEquals(id + "/chunks/000001", BlockFiles.objectName(id, "chunks/000001"));
    }
}
