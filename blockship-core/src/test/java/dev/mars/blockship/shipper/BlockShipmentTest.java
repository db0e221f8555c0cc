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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.blockship.block.Block;
import dev.mars.blockship.block.BlockFiles;
import dev.mars.blockship.block.BlockId;
import dev.mars.blockship.block.SourceType;
import dev.mars.blockship.exceptions.BlockUploadException;
import dev.mars.blockship.storage.AtomicFileWriter;
import dev.mars.blockship.storage.JsonCodec;
import dev.mars.blockship.testing.InMemoryObjectStore;
import dev.mars.blockship.testing.TestBlocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class BlockShipmentTest {

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path stagingRoot;
    private InMemoryObjectStore store;

    @BeforeEach
    void setUp() throws IOException {
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        stagingRoot = dataDir.resolve("blockship").resolve("upload");
        store = new InMemoryObjectStore();
    }

    private BlockShipment shipment(Supplier<Map<String, String>> labels, SourceType source) {
        return new BlockShipment(store, stagingRoot, new AtomicFileWriter(false), labels, source);
    }

    private Block block(BlockId id, int level) throws IOException {
        Path dir = TestBlocks.create(dataDir, id, 100, 200, level, 3);
        return new Block(BlockFiles.readMeta(dir), dir);
    }

    @Test
    void testUploadsAllFilesWithManifestLast() throws Exception {
        BlockId id = TestBlocks.id(1);
        Block block = block(id, 1);

        BlockShipment.Outcome outcome = shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block);

        assertEquals(BlockShipment.Outcome.UPLOADED, outcome);
        assertEquals(List.of(
                id + "/chunks/000001",
                id + "/chunks/000002",
                id + "/chunks/000003",
                id + "/index",
                id + "/meta.json"), store.getUploadLog());
        assertTrue(store.getVisibilityViolations().isEmpty());
        assertArrayEquals(Files.readAllBytes(block.getDirectory().resolve("index")), store.get(id + "/index"));
    }

    @Test
    @DisplayName("Uploaded manifest carries labels and source, the local one stays untouched")
    void testManifestAugmentation() throws Exception {
        BlockId id = TestBlocks.id(1);
        Block block = block(id, 1);
        byte[] localBefore = Files.readAllBytes(block.getDirectory().resolve(BlockFiles.META_FILENAME));

        shipment(() -> Map.of("cluster", "eu-1", "replica", "a"), SourceType.RECEIVE)
                .ship(ShipContext.create(), block);

        JsonNode uploaded = JsonCodec.mapper().readTree(store.get(id + "/meta.json"));
        assertEquals("eu-1", uploaded.path("blockship").path("labels").path("cluster").asText());
        assertEquals("a", uploaded.path("blockship").path("labels").path("replica").asText());
        assertEquals("receive", uploaded.path("blockship").path("source").asText());
        assertEquals(1000, uploaded.path("stats").path("numSamples").asInt());
        assertEquals(id.toString(), uploaded.path("ulid").asText());

        assertArrayEquals(localBefore, Files.readAllBytes(block.getDirectory().resolve(BlockFiles.META_FILENAME)));
    }

    @Test
    void testNullLabelsLeaveManifestLabelsAbsent() throws Exception {
        BlockId id = TestBlocks.id(1);

        shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block(id, 1));

        JsonNode uploaded = JsonCodec.mapper().readTree(store.get(id + "/meta.json"));
        assertFalse(uploaded.path("blockship").has("labels"));
        assertEquals("sidecar", uploaded.path("blockship").path("source").asText());
    }

    @Test
    void testLabelsSuppliedOncePerUpload() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        BlockShipment shipment = shipment(() -> {
            calls.incrementAndGet();
            return Map.of("cluster", "eu-1");
        }, SourceType.SIDECAR);

        shipment.ship(ShipContext.create(), block(TestBlocks.id(1), 1));
        shipment.ship(ShipContext.create(), block(TestBlocks.id(2), 1));

        assertEquals(2, calls.get());
    }

    @Test
    void testCompactedBlockIsFiltered() throws Exception {
        BlockShipment.Outcome outcome = shipment(() -> null, SourceType.SIDECAR)
                .ship(ShipContext.create(), block(TestBlocks.id(1), 2));

        assertEquals(BlockShipment.Outcome.FILTERED, outcome);
        assertEquals(0, store.getExistsCalls());
        assertTrue(store.getUploadLog().isEmpty());
    }

    @Test
    void testAlreadyPresentBlockIsNotUploaded() throws Exception {
        BlockId id = TestBlocks.id(1);
        store.put(id + "/meta.json", new byte[]{'{', '}'});

        BlockShipment.Outcome outcome = shipment(() -> null, SourceType.SIDECAR)
                .ship(ShipContext.create(), block(id, 1));

        assertEquals(BlockShipment.Outcome.ALREADY_PRESENT, outcome);
        assertTrue(store.getUploadLog().isEmpty());
        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
    }

    @Test
    void testStagingDirectoryRemovedAfterUpload() throws Exception {
        BlockId id = TestBlocks.id(1);

        shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block(id, 1));

        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
        assertTrue(Files.exists(dataDir.resolve(id.toString()).resolve("chunks").resolve("000001")));
    }

    @Test
    void testStaleStagingDirectoryIsReplaced() throws Exception {
        BlockId id = TestBlocks.id(1);
        Path stale = Files.createDirectories(stagingRoot.resolve(id.toString()).resolve("chunks"));
        Files.writeString(stale.resolve("999999"), "left over from an interrupted upload");

        shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block(id, 1));

        assertFalse(store.contains(id + "/chunks/999999"));
        assertEquals(5, store.getUploadLog().size());
        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
    }

    @Test
    void testFailedChunkUploadKeepsManifestUnpublished() throws Exception {
        BlockId id = TestBlocks.id(1);
        store.failUploadsMatching(name -> name.endsWith("/chunks/000002"));

        BlockUploadException e = assertThrows(BlockUploadException.class,
                () -> shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block(id, 1)));

        assertEquals(id.toString(), e.getBlockId());
        assertTrue(e.getMessage().contains(id.toString()));
        assertFalse(store.contains(id + "/meta.json"));
        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
    }

    @Test
    void testExistsFailureAbortsBlock() throws Exception {
        store.failExistsMatching(name -> true);

        assertThrows(BlockUploadException.class,
                () -> shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block(TestBlocks.id(1), 1)));
        assertTrue(store.getUploadLog().isEmpty());
    }

    @Test
    void testUncheckedExistsFailureBecomesUploadException() throws Exception {
        InMemoryObjectStore failing = new InMemoryObjectStore() {
            @Override
            public synchronized boolean exists(String objectName) {
                throw new IllegalStateException("credentials expired");
            }
        };
        BlockShipment shipment = new BlockShipment(failing, stagingRoot, new AtomicFileWriter(false),
                () -> null, SourceType.SIDECAR);

        BlockUploadException e = assertThrows(BlockUploadException.class,
                () -> shipment.ship(ShipContext.create(), block(TestBlocks.id(1), 1)));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void testLabelSupplierFailureBecomesUploadException() throws Exception {
        BlockId id = TestBlocks.id(1);
        BlockShipment shipment = shipment(() -> {
            throw new IllegalStateException("labels unavailable");
        }, SourceType.SIDECAR);

        assertThrows(BlockUploadException.class, () -> shipment.ship(ShipContext.create(), block(id, 1)));
        assertTrue(store.getUploadLog().isEmpty());
        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
    }

    @Test
    void testMissingIndexFailsBeforeUpload() throws Exception {
        BlockId id = TestBlocks.id(1);
        Block block = block(id, 1);
        Files.delete(block.getDirectory().resolve(BlockFiles.INDEX_FILENAME));

        assertThrows(BlockUploadException.class,
                () -> shipment(() -> null, SourceType.SIDECAR).ship(ShipContext.create(), block));
        assertTrue(store.getUploadLog().isEmpty());
        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
    }

    @Test
    void testCancelledBeforeStart() throws Exception {
        ShipContext context = ShipContext.create();
        context.cancel();

        assertThrows(BlockUploadException.class,
                () -> shipment(() -> null, SourceType.SIDECAR).ship(context, block(TestBlocks.id(1), 1)));
        assertEquals(0, store.getExistsCalls());
    }

    @Test
    void testCancelledMidUpload() throws Exception {
        BlockId id = TestBlocks.id(1);
        Block block = block(id, 1);
        ShipContext context = ShipContext.create();
        store.beforeEachUpload(context::cancel);

        assertThrows(BlockUploadException.class,
                () -> shipment(() -> null, SourceType.SIDECAR).ship(context, block));

        assertEquals(List.of(id + "/chunks/000001"), store.getUploadLog());
        assertFalse(store.contains(id + "/meta.json"));
        assertFalse(Files.exists(stagingRoot.resolve(id.toString())));
    }
}
