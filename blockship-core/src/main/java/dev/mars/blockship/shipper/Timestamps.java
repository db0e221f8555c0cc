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
 * Data watermarks reported by {@link Shipper#timestamps()}.
 *
 * <p>{@code minTime} is the earliest start time of any local block, or 0 when there are no
 * blocks. {@code maxSyncedTime} is the latest end time of any block confirmed as shipped, or
 * {@link #NONE} when nothing has been confirmed.</p>
 */
public final class Timestamps {

    /** Sentinel for "no block confirmed yet". */
    public static final long NONE = Long.MIN_VALUE;

    private final long minTime;
    private final long maxSyncedTime;

    public Timestamps(long minTime, long maxSyncedTime) {
        this.minTime = minTime;
        this.maxSyncedTime = maxSyncedTime;
    }

    public long getMinTime() {
        return minTime;
    }

    public long getMaxSyncedTime() {
        return maxSyncedTime;
    }

    public boolean hasSyncedData() {
        return maxSyncedTime != NONE;
    }

    @Override
    public String toString() {
        return "Timestamps{minTime=" + minTime +
                ", maxSyncedTime=" + (hasSyncedData() ? String.valueOf(maxSyncedTime) : "none") + '}';
    }
}
