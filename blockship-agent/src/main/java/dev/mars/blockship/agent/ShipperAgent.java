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

package dev.mars.blockship.agent;

import dev.mars.blockship.config.ShipperConfiguration;
import dev.mars.blockship.objstore.FileSystemObjectStore;
import dev.mars.blockship.observability.MetricsSink;
import dev.mars.blockship.observability.OpenTelemetryMetricsSink;
import dev.mars.blockship.shipper.ShipContext;
import dev.mars.blockship.shipper.Shipper;
import dev.mars.blockship.shipper.SyncResult;
import dev.mars.blockship.storage.AtomicFileWriter;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Main class for the Blockship agent.
 * Runs {@link Shipper#sync(ShipContext)} on a Vert.x periodic timer.
 *
 * <p>Each pass runs on an ordered worker via {@code executeBlocking}, keeping filesystem and
 * object store I/O off the event loop. A tick that fires while the previous pass is still
 * running is skipped, so passes never overlap.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class ShipperAgent {

    private static final Logger logger = LoggerFactory.getLogger(ShipperAgent.class);

    private final Vertx vertx;
    private final Shipper shipper;
    private final long initialDelayMs;
    private final long intervalMs;

    // Vert.x timer ID for proper cleanup
    private volatile long syncTimerId = 0;

    private final AtomicBoolean passInFlight = new AtomicBoolean(false);
    private final AtomicLong completedPasses = new AtomicLong(0);
    private volatile ShipContext currentContext;
    private volatile SyncResult lastResult;

    // Shutdown coordination
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Creates a ShipperAgent.
     *
     * @param vertx          the Vert.x instance (must not be null)
     * @param shipper        the shipper to drive (must not be null)
     * @param initialDelayMs delay before the first pass
     * @param intervalMs     delay between passes, must be positive
     */
    public ShipperAgent(Vertx vertx, Shipper shipper, long initialDelayMs, long intervalMs) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.shipper = Objects.requireNonNull(shipper, "Shipper cannot be null");
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Sync interval must be positive, got: " + intervalMs);
        }
        this.initialDelayMs = Math.max(1, initialDelayMs);
        this.intervalMs = intervalMs;
    }

    /**
     * Wires a shipper from configuration: filesystem object store at the bucket directory,
     * configured labels and source, OpenTelemetry counters when metrics are enabled.
     */
    public static ShipperAgent fromConfiguration(Vertx vertx, ShipperConfiguration config) {
        config.validate();

        AtomicFileWriter writer = new AtomicFileWriter(config.isFsyncEnabled());
        MetricsSink metrics = config.isMetricsEnabled()
                ? new OpenTelemetryMetricsSink(config.getDataDir().toString())
                : MetricsSink.noop();
        Map<String, String> labels = config.getLabels();

        Shipper shipper = Shipper.builder()
                .dataDir(config.getDataDir())
                .objectStore(new FileSystemObjectStore(config.getBucketDir(), writer))
                .labels(() -> labels)
                .source(config.getSource())
                .metrics(metrics)
                .fileWriter(writer)
                .build();

        return new ShipperAgent(vertx, shipper, config.getSyncInitialDelayMs(), config.getSyncIntervalMs());
    }

    public static void main(String[] args) {
        logger.info("Starting Blockship Agent...");

        Vertx vertx = Vertx.vertx();

        try {
            ShipperConfiguration config = new ShipperConfiguration();
            config.logConfiguration();

            ShipperAgent agent = ShipperAgent.fromConfiguration(vertx, config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                agent.shutdown();

                vertx.close().onComplete(ar -> {
                    if (ar.succeeded()) {
                        logger.info("Vert.x instance closed successfully");
                    } else {
                        logger.error("Error closing Vert.x instance", ar.cause());
                    }
                });
            }));

            agent.start();
            agent.awaitShutdown();

        } catch (Exception e) {
            logger.error("Failed to start Blockship Agent", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("Blockship Agent stopped");
    }

    /**
     * Checks the staging precondition and starts the periodic sync timer.
     *
     * @throws IOException           if the staging directory cannot be prepared
     * @throws IllegalStateException if the agent is closed or staging is on another filesystem
     */
    public void start() throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Agent is closed, cannot start");
        }

        shipper.verifyStagingFilesystem();
        running = true;

        syncTimerId = vertx.setPeriodic(initialDelayMs, intervalMs, id -> {
            if (!closed.get() && running) {
                triggerSync().onFailure(err -> logger.debug("Sync tick skipped: {}", err.getMessage()));
            }
        });
        logger.info("Sync timer started for {} (initial delay: {}ms, interval: {}ms) [Vert.x timer ID: {}]",
                shipper.getDataDir(), initialDelayMs, intervalMs, syncTimerId);
    }

    /**
     * Runs a pass now unless one is already running.
     *
     * @return the pass result, or a failed future if a pass is in flight or the agent is closed
     */
    public Future<SyncResult> triggerSync() {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Agent is closed"));
        }
        if (!passInFlight.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException("Sync pass already in progress"));
        }

        ShipContext context = ShipContext.create();
        currentContext = context;
        return vertx.executeBlocking(() -> shipper.sync(context), true)
                .onComplete(ar -> {
                    currentContext = null;
                    if (ar.succeeded()) {
                        lastResult = ar.result();
                        completedPasses.incrementAndGet();
                    } else {
                        logger.error("Sync pass failed unexpectedly", ar.cause());
                    }
                    passInFlight.set(false);
                });
    }

    public void shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Agent already closed, skipping shutdown");
            return;
        }

        logger.info("Shutting down Blockship Agent...");
        running = false;

        try {
            if (syncTimerId != 0) {
                boolean cancelled = vertx.cancelTimer(syncTimerId);
                logger.info("Sync timer cancelled: {} [ID: {}]", cancelled, syncTimerId);
                syncTimerId = 0;
            }

            ShipContext context = currentContext;
            if (context != null) {
                logger.info("Cancelling in-flight sync pass");
                context.cancel();
            }
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPassInFlight() {
        return passInFlight.get();
    }

    public long getCompletedPasses() {
        return completedPasses.get();
    }

    /**
     * @return the result of the most recent completed pass, or null before the first one
     */
    public SyncResult getLastResult() {
        return lastResult;
    }

    public Shipper getShipper() {
        return shipper;
    }
}
