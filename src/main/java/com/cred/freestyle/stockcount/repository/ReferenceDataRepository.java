package com.cred.freestyle.stockcount.repository;

import com.cred.freestyle.stockcount.domain.model.Location;
import com.cred.freestyle.stockcount.domain.model.ProductCategory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookups over the locations and product categories a stock count can be started for.
 * Contents are fixed at construction.
 *
 * @author Stock Count Team
 */
public class ReferenceDataRepository {

    private final List<Location> locations;
    private final List<ProductCategory> productCategories;

    public ReferenceDataRepository(List<Location> locations, List<ProductCategory> productCategories) {
        this.locations = List.copyOf(locations);
        this.productCategories = List.copyOf(productCategories);
    }

    /**
     * Find location by ID.
     *
     * @param locationId Location ID
     * @return Optional containing the location if found
     */
    public Optional<Location> findLocationById(Integer locationId) {
        return locations.stream()
                .filter(location -> Objects.equals(location.getLocationId(), locationId))
                .findFirst();
    }

    /**
     * Find product category by its code (e.g., "H71").
     *
     * @param categoryCode Category code
     * @return Optional containing the category if found
     */
    public Optional<ProductCategory> findCategoryByCode(String categoryCode) {
        return productCategories.stream()
                .filter(category -> Objects.equals(category.getCategoryCode(), categoryCode))
                .findFirst();
    }

    public List<Location> findAllLocations() {
        return locations;
    }

    public List<ProductCategory> findAllCategories() {
        return productCategories;
    }
}
