package com.cred.freestyle.stockcount.domain.model;

import lombok.Getter;

import java.util.List;

/**
 * An in-progress stock count: one counting session for a location and a product category.
 *
 * Location and category are held by value, copied from the reference data when
 * the count is started. The only mutation after creation is appending RFID events.
 *
 * @author Stock Count Team
 */
@Getter
public class StockCount {

    private final Integer stockCountId;
    private final String description;
    private final Location location;
    private final ProductCategory productCategory;
    private final RfidEventLog rfidEventLog;

    public StockCount(Integer stockCountId, String description, Location location, ProductCategory productCategory) {
        this(stockCountId, description, location, productCategory, new RfidEventLog());
    }

    private StockCount(
            Integer stockCountId,
            String description,
            Location location,
            ProductCategory productCategory,
            RfidEventLog rfidEventLog
    ) {
        this.stockCountId = stockCountId;
        this.description = description;
        this.location = location;
        this.productCategory = productCategory;
        this.rfidEventLog = rfidEventLog;
    }

    /**
     * Build the description used for a newly started count, e.g. "Baldock - Womens".
     *
     * @param location Location being counted
     * @param category Category being counted
     * @return Description
     */
    public static String describe(Location location, ProductCategory category) {
        return String.format("%s - %s", location.getName(), category.getCategoryName());
    }

    public boolean isAtLocation(Integer locationId) {
        return location.getLocationId().equals(locationId);
    }

    public boolean hasCategoryCode(String categoryCode) {
        return productCategory.getCategoryCode().equals(categoryCode);
    }

    /**
     * Append events to the log in the given order.
     *
     * @param events Events to record
     */
    public void recordEvents(List<RfidEvent> events) {
        events.forEach(rfidEventLog::append);
    }

    /**
     * Copy with its own event log, safe to hand out while the original keeps changing.
     *
     * @return Detached copy
     */
    public StockCount snapshot() {
        return new StockCount(stockCountId, description, location, productCategory, rfidEventLog.copy());
    }
}
