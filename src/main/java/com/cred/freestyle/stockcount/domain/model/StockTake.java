package com.cred.freestyle.stockcount.domain.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A batch of RFID reads from one work area, reported against a stock count.
 *
 * @author Stock Count Team
 */
public class StockTake {

    /**
     * Selects the stock count to update. When absent the first in-progress count is used.
     */
    private Integer locationId;

    private String workArea;

    @NotNull(message = "Product identifiers are required")
    private List<@NotNull(message = "Product identifier must not be null") @Valid ProductIdentifier> productIdentifiers =
            new ArrayList<>();

    public StockTake() {
    }

    public StockTake(Integer locationId, String workArea, List<ProductIdentifier> productIdentifiers) {
        this.locationId = locationId;
        this.workArea = workArea;
        this.productIdentifiers = productIdentifiers;
    }

    // Getters and setters
    public Integer getLocationId() {
        return locationId;
    }

    public void setLocationId(Integer locationId) {
        this.locationId = locationId;
    }

    public String getWorkArea() {
        return workArea;
    }

    public void setWorkArea(String workArea) {
        this.workArea = workArea;
    }

    public List<ProductIdentifier> getProductIdentifiers() {
        return productIdentifiers;
    }

    public void setProductIdentifiers(List<ProductIdentifier> productIdentifiers) {
        this.productIdentifiers = productIdentifiers;
    }
}
