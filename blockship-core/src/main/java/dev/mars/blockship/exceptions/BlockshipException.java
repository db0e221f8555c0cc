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
 * Base exception class for all Blockship-related exceptions.
 * Provides a common hierarchy for error handling throughout the shipper.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class BlockshipException extends Exception {

    public BlockshipException(String message) {
        super(message);
    }

    public BlockshipException(String message, Throwable cause) {
        super(message, cause);
    }

    public BlockshipException(Throwable cause) {
        super(cause);
    }
}
