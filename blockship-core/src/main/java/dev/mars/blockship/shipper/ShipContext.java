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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation handle for a sync pass. Checked between the steps of each block upload and
 * between the individual file uploads; a cancelled pass leaves the current block
 * unconfirmed so it is retried on the next pass.
 */
public class ShipContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static ShipContext create() {
        return new ShipContext();
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void cancel() {
        cancelled.set(true);
    }
}
