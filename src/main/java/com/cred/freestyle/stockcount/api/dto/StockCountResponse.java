package com.cred.freestyle.stockcount.api.dto;

import com.cred.freestyle.stockcount.domain.model.Location;
import com.cred.freestyle.stockcount.domain.model.ProductCategory;
import com.cred.freestyle.stockcount.domain.model.RfidEvent;
import com.cred.freestyle.stockcount.domain.model.StockCount;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for stock count operations.
 *
 * @author Stock Count Team
 */
public class StockCountResponse {

    private Integer stockCountId;
    private String description;
    private Location location;
    private ProductCategory productCategory;
    private RfidEventLogResponse rfidEventLog;

    public StockCountResponse() {
    }

    /**
     * Create response from StockCount.
     *
     * @param stockCount Stock count snapshot
     * @return StockCountResponse
     */
    public static StockCountResponse fromEntity(StockCount stockCount) {
        StockCountResponse response = new StockCountResponse();
        response.setStockCountId(stockCount.getStockCountId());
        response.setDescription(stockCount.getDescription());
        response.setLocation(stockCount.getLocation());
        response.setProductCategory(stockCount.getProductCategory());
        response.setRfidEventLog(new RfidEventLogResponse(stockCount.getRfidEventLog().getRfidEvents()));
        return response;
    }

    // Getters and setters
    public Integer getStockCountId() {
        return stockCountId;
    }

    public void setStockCountId(Integer stockCountId) {
        this.stockCountId = stockCountId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public ProductCategory getProductCategory() {
        return productCategory;
    }

    public void setProductCategory(ProductCategory productCategory) {
        this.productCategory = productCategory;
    }

    public RfidEventLogResponse getRfidEventLog() {
        return rfidEventLog;
    }

    public void setRfidEventLog(RfidEventLogResponse rfidEventLog) {
        this.rfidEventLog = rfidEventLog;
    }

    /**
     * RFID events recorded against the stock count, in reporting order.
     */
    public static class RfidEventLogResponse {

        private List<RfidEvent> rfidEvents = new ArrayList<>();

        public RfidEventLogResponse() {
        }

        public RfidEventLogResponse(List<RfidEvent> rfidEvents) {
            this.rfidEvents = new ArrayList<>(rfidEvents);
        }

        public List<RfidEvent> getRfidEvents() {
            return rfidEvents;
        }

        public void setRfidEvents(List<RfidEvent> rfidEvents) {
            this.rfidEvents = rfidEvents;
        }
    }
}
