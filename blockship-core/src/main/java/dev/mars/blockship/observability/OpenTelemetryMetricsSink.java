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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OpenTelemetry-backed {@link MetricsSink}.
 *
 * Provides the shipper counters:
 * - blockship.shipper.dir.syncs (counter) - Sync pass attempts
 * - blockship.shipper.dir.sync.failures (counter) - Failed sync passes
 * - blockship.shipper.uploads (counter) - Block upload attempts
 * - blockship.shipper.upload.failures (counter) - Failed block uploads
 *
 * Counters are created lazily on first use and tagged with the data directory so several
 * shippers in one process stay distinguishable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0 (OpenTelemetry)
 */
public class OpenTelemetryMetricsSink implements MetricsSink {

    private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryMetricsSink.class);
    private static final String METER_NAME = "blockship";

    private static final AttributeKey<String> DATA_DIR_KEY = AttributeKey.stringKey("data.dir");

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            DIR_SYNCS, "Total number of sync pass attempts",
            DIR_SYNC_FAILURES, "Number of failed sync passes",
            UPLOADS, "Total number of block upload attempts",
            UPLOAD_FAILURES, "Number of failed block uploads");

    private final Meter meter;
    private final Attributes attributes;
    private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();

    public OpenTelemetryMetricsSink(String dataDir) {
        this(GlobalOpenTelemetry.getMeter(METER_NAME), dataDir);
    }

    public OpenTelemetryMetricsSink(Meter meter, String dataDir) {
        this.meter = meter;
        this.attributes = Attributes.of(DATA_DIR_KEY, dataDir);
        logger.info("OpenTelemetryMetricsSink initialized for {}", dataDir);
    }

    @Override
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, this::createCounter).add(1, attributes);
    }

    private LongCounter createCounter(String name) {
        return meter.counterBuilder(name)
                .setDescription(DESCRIPTIONS.getOrDefault(name, name))
                .setUnit("1")
                .build();
    }
}
