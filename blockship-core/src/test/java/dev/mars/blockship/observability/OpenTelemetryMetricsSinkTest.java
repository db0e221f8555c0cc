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

import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenTelemetryMetricsSinkTest {

    @Test
    void testIncrementAllCounters() {
        MetricsSink sink = new OpenTelemetryMetricsSink(OpenTelemetry.noop().getMeter("blockship"), "/data");

        assertDoesNotThrow(() -> {
            sink.incrementCounter(MetricsSink.DIR_SYNCS);
            sink.incrementCounter(MetricsSink.DIR_SYNC_FAILURES);
            sink.incrementCounter(MetricsSink.UPLOADS);
            sink.incrementCounter(MetricsSink.UPLOAD_FAILURES);
            sink.incrementCounter(MetricsSink.UPLOADS);
        });
    }

    @Test
    void testGlobalMeterWithoutSdk() {
        // Without an installed SDK the global meter is a no-op
        MetricsSink sink = new OpenTelemetryMetricsSink("/data");

        assertDoesNotThrow(() -> sink.incrementCounter(MetricsSink.UPLOADS));
    }
}
