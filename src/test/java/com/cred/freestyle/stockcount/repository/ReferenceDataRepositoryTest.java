package com.cred.freestyle.stockcount.repository;

import com.cred.freestyle.stockcount.config.StockCountSeedData;
import com.cred.freestyle.stockcount.domain.model.Location;
import com.cred.freestyle.stockcount.domain.model.ProductCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ReferenceDataRepository over the seeded locations and categories.
 */
@DisplayName("ReferenceDataRepository Tests")
class ReferenceDataRepositoryTest {

    private final ReferenceDataRepository repository = new ReferenceDataRepository(
            StockCountSeedData.locations(),
            StockCountSeedData.productCategories()
    );

    @Test
    @DisplayName("Should find seeded locations by id")
    void findLocationById() {
        assertThat(repository.findLocationById(1)).map(Location::getName).contains("Baldock");
        assertThat(repository.findLocationById(2)).map(Location::getName).contains("Stevenage");
        assertThat(repository.findLocationById(99)).isEmpty();
        assertThat(repository.findLocationById(null)).isEmpty();
    }

    @Test
    @DisplayName("Should find categories by exact code")
    void findCategoryByCode() {
        assertThat(repository.findCategoryByCode("H71")).map(ProductCategory::getCategoryName).contains("Womens");
        assertThat(repository.findCategoryByCode("H7")).map(ProductCategory::getCategoryName).contains("Clothing");
        assertThat(repository.findCategoryByCode("h71")).isEmpty();
        assertThat(repository.findCategoryByCode(null)).isEmpty();
    }

    @Test
    @DisplayName("Should expose all ten categories in seed order")
    void findAllCategories() {
        assertThat(repository.findAllCategories())
                .extracting(ProductCategory::getCategoryCode)
                .containsExactly("H7", "H71", "H72", "H73", "H74", "H75", "H76", "H77", "H78", "H79");
        assertThat(repository.findAllLocations()).hasSize(2);
    }
}
