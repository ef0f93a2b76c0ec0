package com.cred.freestyle.stockcount.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for stock count operations, published through Micrometer.
 *
 * Key Metrics:
 * - Stock counts started and rejected starts
 * - RFID tags recorded per location
 * - Lookups that found nothing
 * - Stock take latency (p50, p95, p99)
 *
 * @author Stock Count Team
 */
@Service
public class StockCountMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(StockCountMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "stockcount.";
    private static final String COUNT_PREFIX = METRIC_PREFIX + "count.";
    private static final String TAKE_PREFIX = METRIC_PREFIX + "take.";

    public StockCountMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a started stock count.
     *
     * @param locationId Location ID
     * @param categoryCode Product category code
     */
    public void recordStockCountStarted(Integer locationId, String categoryCode) {
        Counter.builder(COUNT_PREFIX + "started")
                .tag("location_id", String.valueOf(locationId))
                .tag("category_code", categoryCode)
                .description("Stock counts started")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded stock count start for location: {}, category: {}", locationId, categoryCode);
    }

    /**
     * Record a start rejected because of unknown reference data.
     */
    public void recordStartRejected() {
        Counter.builder(COUNT_PREFIX + "start.rejected")
                .description("Stock count starts rejected for unknown location or category")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record RFID tags appended to a stock count.
     *
     * @param locationId Location ID reported with the stock take
     * @param tagCount Number of tags recorded
     */
    public void recordTagsRecorded(Integer locationId, int tagCount) {
        Counter.builder(TAKE_PREFIX + "tags")
                .tag("location_id", String.valueOf(locationId))
                .description("RFID tag reads recorded against stock counts")
                .register(meterRegistry)
                .increment(tagCount);
        logger.debug("Recorded {} tags for location: {}", tagCount, locationId);
    }

    /**
     * Record a lookup or stock take that found no stock count.
     *
     * @param operation Operation name (e.g., "getStockCount", "reportStockTake")
     */
    public void recordNotFound(String operation) {
        Counter.builder(METRIC_PREFIX + "not_found")
                .tag("operation", operation)
                .description("Stock count lookups that found nothing")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record stock take latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordStockTakeLatency(long durationMs) {
        Timer.builder(TAKE_PREFIX + "latency")
                .description("Stock take latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
