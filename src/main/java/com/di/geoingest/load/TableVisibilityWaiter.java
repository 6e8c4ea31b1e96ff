package com.di.geoingest.load;

import com.di.geoingest.config.GeoIngestProperties;
import com.di.geoingest.warehouse.TableRef;
import com.di.geoingest.warehouse.WarehouseClient;
import com.di.geoingest.warehouse.WarehouseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Polls until a newly created table is visible to metadata reads, backing off exponentially
 * (first interval, then multiplied on every miss, capped at a maximum interval) and giving up with
 * {@link TableVisibilityTimeoutException} once the total wait reaches the timeout.
 */
@Slf4j
@Component
public class TableVisibilityWaiter {

    /**
     * Blocks for a number of milliseconds. Replaced in tests so no real time passes.
     */
    @FunctionalInterface
    public interface Waiter {
        void waitForMillis(long millis) throws InterruptedException;
    }

    private final WarehouseClient warehouse;
    private final long initialIntervalMillis;
    private final double multiplier;
    private final long maxIntervalMillis;
    private final long timeoutMillis;
    private final Waiter waiter;

    @Autowired
    public TableVisibilityWaiter(WarehouseClient warehouse, GeoIngestProperties properties) {
        this(warehouse,
                properties.getTableVisibility().getInitialInterval(),
                properties.getTableVisibility().getMultiplier(),
                properties.getTableVisibility().getMaxInterval(),
                properties.getTableVisibility().getTimeout(),
                Thread::sleep);
    }

    public TableVisibilityWaiter(WarehouseClient warehouse, Duration initialInterval, double multiplier,
                                 Duration maxInterval, Duration timeout, Waiter waiter) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1, got: " + multiplier);
        }
        this.warehouse = warehouse;
        this.initialIntervalMillis = Math.max(1L, initialInterval.toMillis());
        this.multiplier = multiplier;
        this.maxIntervalMillis = Math.max(initialIntervalMillis, maxInterval.toMillis());
        this.timeoutMillis = timeout.toMillis();
        this.waiter = waiter;
    }

    /**
     * @return the number of existence checks made
     * @throws TableVisibilityTimeoutException if the table is still invisible when the timeout is reached
     */
    public int awaitVisible(TableRef table) {
        long waited = 0;
        long interval = initialIntervalMillis;
        int attempts = 0;
        while (true) {
            attempts++;
            if (warehouse.tableExists(table)) {
                log.debug("[TABLES] {} visible after {} check(s), {} ms", table, attempts, waited);
                return attempts;
            }
            if (waited >= timeoutMillis) {
                throw new TableVisibilityTimeoutException(table, attempts, waited);
            }
            long sleep = Math.min(interval, timeoutMillis - waited);
            log.info("[TABLES] Waiting {} ms for {} to become visible (attempt {})", sleep, table, attempts);
            try {
                waiter.waitForMillis(sleep);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WarehouseException("Interrupted waiting for " + table + " to become visible", e);
            }
            waited += sleep;
            interval = Math.min((long) (interval * multiplier), maxIntervalMillis);
        }
    }
}
