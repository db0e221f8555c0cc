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
 * Exception thrown when shipping a single block fails.
 * This covers the remote existence check, staging I/O and the upload itself.
 * The block stays unconfirmed and is retried on the next sync pass.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public class BlockUploadException extends BlockshipException {

    private final String blockId;

    public BlockUploadException(String blockId, String message) {
        super(message);
        this.blockId = blockId;
    }

    public BlockUploadException(String blockId, String message, Throwable cause) {
        super(message, cause);
        this.blockId = blockId;
    }

    public String getBlockId() {
        return blockId;
    }

    @Override
    public String getMessage() {
        return String.format("Shipping block %s failed: %s", blockId, super.getMessage());
    }
}
