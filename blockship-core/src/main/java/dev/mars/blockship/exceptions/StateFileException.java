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

package dev.mars.blockship.exceptions;

import java.nio.file.Path;

/**
 * Thrown when the shipper bookkeeping file cannot be read or decoded.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class StateFileException extends BlockshipException {

    private final Path stateFile;

    public StateFileException(Path stateFile, String message) {
        super(message);
        this.stateFile = stateFile;
    }

    public StateFileException(Path stateFile, String message, Throwable cause) {
        super(message, cause);
        this.stateFile = stateFile;
    }

    public Path getStateFile() {
        return stateFile;
    }
}
