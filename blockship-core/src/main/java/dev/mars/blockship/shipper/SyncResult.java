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

/**
 * Outcome of one sync pass.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 */
public final class SyncResult {

    private final int uploaded;
    private final int alreadyPresent;
    private final int filtered;
    private final int failed;
    private final int retained;
    private final boolean completed;

    public SyncResult(int uploaded, int alreadyPresent, int filtered, int failed, int retained, boolean completed) {
        this.uploaded = uploaded;
        this.alreadyPresent = alreadyPresent;
        this.filtered = filtered;
        this.failed = failed;
        this.retained = retained;
        this.completed = completed;
    }

    static SyncResult aborted() {
        return new SyncResult(0, 0, 0, 0, 0, false);
    }

    /** Blocks uploaded during this pass. */
    public int getUploaded() {
        return uploaded;
    }

    /** Unrecorded blocks found to exist remotely already. */
    public int getAlreadyPresent() {
        return alreadyPresent;
    }

    /** Unrecorded blocks skipped because of their compaction level. */
    public int getFiltered() {
        return filtered;
    }

    /** Blocks whose upload failed; retried on the next pass. */
    public int getFailed() {
        return failed;
    }

    /** Blocks carried over unchanged from the previous bookkeeping record. */
    public int getRetained() {
        return retained;
    }

    /** False when the pass could not scan the data directory or persist bookkeeping. */
    public boolean isCompleted() {
        return completed;
    }

    @Override
    public String toString() {
        return "SyncResult{" +
                "uploaded=" + uploaded +
                ", alreadyPresent=" + alreadyPresent +
                ", filtered=" + filtered +
                ", failed=" + failed +
                ", retained=" + retained +
                ", completed=" + completed +
                '}';
    }
}
