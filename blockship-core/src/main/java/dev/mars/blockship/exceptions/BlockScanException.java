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

/**
 * Thrown when a block directory scan cannot proceed, either because the root directory
 * could not be listed or because a visitor aborted the scan.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public class BlockScanException extends BlockshipException {

    public BlockScanException(String message) {
        super(message);
    }

    public BlockScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
