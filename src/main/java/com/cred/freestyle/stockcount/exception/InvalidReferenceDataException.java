package com.cred.freestyle.stockcount.exception;

/**
 * Exception thrown when a stock count is started for an unknown location or product category.
 * The message does not say which of the two was rejected.
 *
 * @author Stock Count Team
 */
public class InvalidReferenceDataException extends RuntimeException {

    private final Integer locationId;
    private final String productCategoryCode;

    public InvalidReferenceDataException(Integer locationId, String productCategoryCode) {
        super("Unacceptable location or product code");
        this.locationId = locationId;
        this.productCategoryCode = productCategoryCode;
    }

    public Integer getLocationId() {
        return locationId;
    }

    public String getProductCategoryCode() {
        return productCategoryCode;
    }
}
