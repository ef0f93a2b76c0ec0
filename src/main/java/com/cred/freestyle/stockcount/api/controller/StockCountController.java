package com.cred.freestyle.stockcount.api.controller;

import com.cred.freestyle.stockcount.api.dto.StockCountResponse;
import com.cred.freestyle.stockcount.domain.model.StockCount;
import com.cred.freestyle.stockcount.domain.model.StockTake;
import com.cred.freestyle.stockcount.service.StockCountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for stock count operations.
 * Handles lookup and search of in-progress counts, starting counts and RFID stock takes.
 *
 * @author Stock Count Team
 */
@RestController
@RequestMapping("/stockcount")
@Tag(name = "Stock Count Service", description = "In-progress stock counts and RFID stock takes")
public class StockCountController {

    private static final Logger logger = LoggerFactory.getLogger(StockCountController.class);

    private final StockCountService stockCountService;

    public StockCountController(StockCountService stockCountService) {
        this.stockCountService = stockCountService;
    }

    /**
     * Get a stock count by ID.
     *
     * @param stockCountId Stock count ID
     * @return Stock count with its RFID event log
     */
    @GetMapping("/{StockCountId}")
    @Operation(summary = "Get a stock count by ID", description = "Returns 404 when no stock count has the ID")
    public ResponseEntity<StockCountResponse> getStockCount(
            @Parameter(description = "The ID of the stock count")
            @PathVariable("StockCountId") Integer stockCountId
    ) {
        StockCount stockCount = stockCountService.getStockCount(stockCountId);
        return ResponseEntity.ok(StockCountResponse.fromEntity(stockCount));
    }

    /**
     * Find stock counts matching optional location and category filters.
     *
     * @param locationId Location ID filter
     * @param categoryCode Category code filter
     * @return Matching stock counts, possibly empty
     */
    @GetMapping
    @Operation(summary = "Find matching stock counts", description = "Will find stock counts that match the criteria")
    public ResponseEntity<List<StockCountResponse>> findStockCounts(
            @Parameter(description = "A location id for getting stock counts")
            @RequestParam(value = "LocationId", required = false) Integer locationId,
            @Parameter(description = "A category code for getting stock counts")
            @RequestParam(value = "CategoryCode", required = false) String categoryCode
    ) {
        List<StockCountResponse> responses = stockCountService.findStockCounts(locationId, categoryCode)
                .stream()
                .map(StockCountResponse::fromEntity)
                .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    /**
     * Start a stock count for a location and product category.
     *
     * @param locationId Location ID
     * @param productCategoryCode Product category code
     * @return 202 ACCEPTED with the new stock count ID
     */
    @PostMapping("/start")
    @Operation(summary = "Start a stock count with specified data",
            description = "Returns 406 when the location or product category is unknown")
    public ResponseEntity<Integer> startStockCount(
            @Parameter(description = "Location for this stock count", required = true)
            @RequestParam("LocationId") Integer locationId,
            @Parameter(description = "Product Category for this stock count", required = true)
            @RequestParam("ProductCategoryCode") String productCategoryCode
    ) {
        logger.info("Starting stock count - location: {}, category: {}", locationId, productCategoryCode);

        Integer stockCountId = stockCountService.startStockCount(locationId, productCategoryCode);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(stockCountId);
    }

    /**
     * Report the RFID tag reads of a stock take.
     *
     * @param stockTake Location, work area and tag reads
     * @return 202 ACCEPTED with a body of 0
     */
    @PostMapping("/take")
    @Operation(summary = "Report the RFID tag reads for the stock count",
            description = "Send RFID reads for stock counting. The response body is always 0")
    public ResponseEntity<Integer> reportStockTake(
            @Valid @RequestBody StockTake stockTake
    ) {
        logger.info("Stock take received - location: {}, work area: {}, tags: {}",
                stockTake.getLocationId(), stockTake.getWorkArea(), stockTake.getProductIdentifiers().size());

        int result = stockCountService.reportStockTake(stockTake);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }
}
