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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.blockship.exceptions.StateFileException;
import dev.mars.blockship.exceptions.StateFileNotFoundException;
import dev.mars.blockship.exceptions.StateFileVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes the shipper bookkeeping file {@code <dataDir>/blockship.shipper.json}.
 *
 * <p>The file only saves redundant existence checks: the shipper re-checks the object store
 * before uploading any block not listed here, so a lost or corrupt file never causes data loss.
 * Not safe for concurrent writers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class ShipperStateStore {

    private static final Logger logger = LoggerFactory.getLogger(ShipperStateStore.class);

    public static final String STATE_FILENAME = "blockship.shipper.json";

    private final Path dataDir;
    private final AtomicFileWriter writer;

    public ShipperStateStore(Path dataDir, AtomicFileWriter writer) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir cannot be null");
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
    }

    /**
     * Loads the bookkeeping record.
     *
     * @throws StateFileNotFoundException if the file does not exist
     * @throws StateFileVersionException  if the version is not {@link ShipperState#CURRENT_VERSION}
     * @throws StateFileException         if the file cannot be read or decoded
     */
    public ShipperState read() throws StateFileException {
        Path path = getStateFile();
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new StateFileNotFoundException(path);
        } catch (IOException e) {
            throw new StateFileException(path, "Failed to read state file " + path, e);
        }

        ShipperState state;
        try {
            state = JsonCodec.decode(data, ShipperState.class);
        } catch (JsonProcessingException e) {
            throw new StateFileException(path, "Corrupt state file " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StateFileException(path, "Failed to decode state file " + path, e);
        }
        if (state == null) {
            throw new StateFileException(path, "Empty state file " + path);
        }
        if (state.getVersion() != ShipperState.CURRENT_VERSION) {
            throw new StateFileVersionException(path, state.getVersion(), ShipperState.CURRENT_VERSION);
        }
        return state;
    }

    /**
     * Atomically replaces the bookkeeping record.
     */
    public void write(ShipperState state) throws IOException {
        writer.write(getStateFile(), JsonCodec.encode(state));
        logger.debug("Wrote {} to {}", state, getStateFile());
    }

    public Path getStateFile() {
        return dataDir.resolve(STATE_FILENAME);
    }
}
