package com.cred.freestyle.stockcount.service;

import com.cred.freestyle.stockcount.domain.model.Location;
import com.cred.freestyle.stockcount.domain.model.ProductCategory;
import com.cred.freestyle.stockcount.domain.model.ProductIdentifier;
import com.cred.freestyle.stockcount.domain.model.RfidEvent;
import com.cred.freestyle.stockcount.domain.model.StockCount;
import com.cred.freestyle.stockcount.domain.model.StockTake;
import com.cred.freestyle.stockcount.exception.InvalidReferenceDataException;
import com.cred.freestyle.stockcount.exception.ResourceNotFoundException;
import com.cred.freestyle.stockcount.infrastructure.metrics.StockCountMetricsService;
import com.cred.freestyle.stockcount.repository.ReferenceDataRepository;
import com.cred.freestyle.stockcount.repository.StockCountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Service for in-progress stock counts.
 * Handles lookup, filtering, starting new counts and recording RFID stock takes.
 *
 * @author Stock Count Team
 */
@Service
public class StockCountService {

    private static final Logger logger = LoggerFactory.getLogger(StockCountService.class);

    /**
     * Body returned for every accepted stock take. It is not a stock count id.
     */
    public static final int STOCK_TAKE_ACCEPTED = 0;

    private final StockCountRepository stockCountRepository;
    private final ReferenceDataRepository referenceDataRepository;
    private final StockCountMetricsService metricsService;

    public StockCountService(
            StockCountRepository stockCountRepository,
            ReferenceDataRepository referenceDataRepository,
            StockCountMetricsService metricsService
    ) {
        this.stockCountRepository = stockCountRepository;
        this.referenceDataRepository = referenceDataRepository;
        this.metricsService = metricsService;
    }

    /**
     * Get stock count by ID.
     *
     * @param stockCountId Stock count ID (may be null, which never matches)
     * @return Stock count
     * @throws ResourceNotFoundException if no count has this ID
     */
    public StockCount getStockCount(Integer stockCountId) {
        logger.debug("Getting stock count: {}", stockCountId);

        return stockCountRepository.findById(stockCountId)
                .orElseThrow(() -> {
                    metricsService.recordNotFound("getStockCount");
                    return ResourceNotFoundException.stockCount(stockCountId);
                });
    }

    /**
     * Find in-progress stock counts, optionally filtered by location and category code.
     * Filters combine with AND; a null filter places no restriction.
     *
     * @param locationId Location ID, or null
     * @param categoryCode Category code, or null/empty
     * @return Matching counts in collection order
     */
    public List<StockCount> findStockCounts(Integer locationId, String categoryCode) {
        logger.debug("Finding stock counts - location: {}, category: {}", locationId, categoryCode);

        Predicate<StockCount> filter = stockCount -> true;
        if (locationId != null) {
            filter = filter.and(stockCount -> stockCount.isAtLocation(locationId));
        }
        if (categoryCode != null && !categoryCode.isEmpty()) {
            filter = filter.and(stockCount -> stockCount.hasCategoryCode(categoryCode));
        }

        List<StockCount> matching = stockCountRepository.findAll(filter);
        logger.debug("Found {} stock counts", matching.size());
        return matching;
    }

    /**
     * Start a new stock count for a location and product category.
     *
     * @param locationId Location ID
     * @param productCategoryCode Product category code
     * @return ID of the new stock count
     * @throws InvalidReferenceDataException if the location or category is unknown
     */
    public Integer startStockCount(Integer locationId, String productCategoryCode) {
        Optional<Location> location = referenceDataRepository.findLocationById(locationId);
        Optional<ProductCategory> category = referenceDataRepository.findCategoryByCode(productCategoryCode);

        if (location.isEmpty() || category.isEmpty()) {
            logger.warn("Rejected stock count start - location: {} (known: {}), category: {} (known: {})",
                    locationId, location.isPresent(), productCategoryCode, category.isPresent());
            metricsService.recordStartRejected();
            throw new InvalidReferenceDataException(locationId, productCategoryCode);
        }

        String description = StockCount.describe(location.get(), category.get());
        StockCount created = stockCountRepository.create(
                id -> new StockCount(id, description, location.get(), category.get())
        );

        metricsService.recordStockCountStarted(locationId, productCategoryCode);
        logger.info("Started stock count: {} ({}), {} in progress",
                created.getStockCountId(), description, stockCountRepository.count());
        return created.getStockCountId();
    }

    /**
     * Record the RFID reads of a stock take.
     *
     * The reads go to the first in-progress count at the stock take's location, or to
     * the first in-progress count when no location is given. One event is appended per
     * product identifier, in submission order.
     *
     * @param stockTake Stock take
     * @return {@link #STOCK_TAKE_ACCEPTED}
     * @throws ResourceNotFoundException if no in-progress count matches
     */
    public int reportStockTake(StockTake stockTake) {
        long startTime = System.currentTimeMillis();
        Integer locationId = stockTake.getLocationId();

        List<RfidEvent> events = stockTake.getProductIdentifiers().stream()
                .map(ProductIdentifier::getTagIdHex)
                .map(tagIdHex -> RfidEvent.builder()
                        .locationId(locationId)
                        .workArea(stockTake.getWorkArea())
                        .tagIdHex(tagIdHex)
                        .build())
                .collect(Collectors.toList());

        Predicate<StockCount> filter = locationId == null
                ? stockCount -> true
                : stockCount -> stockCount.isAtLocation(locationId);

        StockCount updated = stockCountRepository.updateFirst(filter, stockCount -> stockCount.recordEvents(events))
                .orElseThrow(() -> {
                    logger.warn("No stock count in progress for stock take at location: {}", locationId);
                    metricsService.recordNotFound("reportStockTake");
                    return ResourceNotFoundException.stockCountAtLocation(locationId);
                });

        metricsService.recordTagsRecorded(locationId, events.size());
        metricsService.recordStockTakeLatency(System.currentTimeMillis() - startTime);
        logger.info("Recorded {} tags against stock count: {} (work area: {}), log now holds {} events",
                events.size(), updated.getStockCountId(), stockTake.getWorkArea(), updated.getRfidEventLog().size());

        return STOCK_TAKE_ACCEPTED;
    }
}
