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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Remote object store the shipper uploads blocks into.
 * Implementations handle transport and authentication; object names are
 * slash-separated, e.g. {@code <blockId>/chunks/000001}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public interface ObjectStore {

    /**
     * Get the store name for logging.
     */
    String getName();

    /**
     * Check whether an object with the given name exists.
     *
     * @throws IOException if the store cannot be queried
     */
    boolean exists(String objectName) throws IOException;

    /**
     * Upload the content of a local file under the given object name, replacing any
     * existing object. The object must be either fully visible or absent after the call.
     *
     * @throws IOException if the upload fails
     */
    void upload(String objectName, Path source) throws IOException;
}
