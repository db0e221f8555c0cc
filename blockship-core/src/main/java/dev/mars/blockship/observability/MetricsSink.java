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

package dev.mars.blockship.observability;

/**
 * Counter sink the shipper reports into. One sink is handed to each shipper at
 * construction, so counters are never process-global state of the shipper itself.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
@FunctionalInterface
public interface MetricsSink {

    /** Total sync pass attempts. */
    String DIR_SYNCS = "blockship.shipper.dir.syncs";

    /** Sync passes that could not scan the data directory or persist bookkeeping. */
    String DIR_SYNC_FAILURES = "blockship.shipper.dir.sync.failures";

    /** Block upload attempts. */
    String UPLOADS = "blockship.shipper.uploads";

    /** Block upload attempts that failed. */
    String UPLOAD_FAILURES = "blockship.shipper.upload.failures";

    void incrementCounter(String name);

    /**
     * A sink that discards everything.
     */
    static MetricsSink noop() {
        return name -> { };
    }
}
