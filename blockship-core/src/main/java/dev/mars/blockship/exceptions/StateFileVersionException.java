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
 * The bookkeeping file carries a version this shipper does not understand.
 * No forward or backward compatibility is attempted.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public class StateFileVersionException extends StateFileException {

    private final int foundVersion;
    private final int expectedVersion;

    public StateFileVersionException(Path stateFile, int foundVersion, int expectedVersion) {
        super(stateFile, String.format("Unexpected state file version %d (expected %d): %s",
                foundVersion, expectedVersion, stateFile));
        this.foundVersion = foundVersion;
        this.expectedVersion = expectedVersion;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getExpectedVersion() {
        return expectedVersion;
    }
}
