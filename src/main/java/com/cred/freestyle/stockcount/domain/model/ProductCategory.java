package com.cred.freestyle.stockcount.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Product category a stock count is scoped to.
 * Reference data, created once at startup and never changed.
 *
 * @author Stock Count Team
 */
@Value
@Builder
public class ProductCategory {

    Integer categoryId;

    /**
     * Short merchandise code (e.g., "H71"). Clients address categories by this code.
     */
    String categoryCode;

    /**
     * Display name (e.g., "Womens"). Used to build stock count descriptions.
     */
    String categoryName;
}
