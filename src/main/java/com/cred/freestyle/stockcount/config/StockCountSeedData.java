package com.cred.freestyle.stockcount.config;

import com.cred.freestyle.stockcount.domain.model.Location;
import com.cred.freestyle.stockcount.domain.model.ProductCategory;
import com.cred.freestyle.stockcount.domain.model.StockCount;
import com.cred.freestyle.stockcount.repository.InMemoryStockCountRepository;
import com.cred.freestyle.stockcount.repository.ReferenceDataRepository;
import com.cred.freestyle.stockcount.repository.StockCountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.List;

/**
 * Seed data for the stock count store.
 * Builds the reference data and the initial in-progress counts once per application context.
 *
 * @author Stock Count Team
 */
@Configuration
public class StockCountSeedData {

    private static final Logger logger = LoggerFactory.getLogger(StockCountSeedData.class);

    public static final Location BALDOCK = location(1, "Baldock");
    public static final Location STEVENAGE = location(2, "Stevenage");

    public static final ProductCategory CLOTHING = category(0, "H7", "Clothing");
    public static final ProductCategory WOMENS = category(1, "H71", "Womens");
    public static final ProductCategory TODDLERS = category(2, "H72", "Toddlers");
    public static final ProductCategory BABY = category(3, "H73", "Baby");
    public static final ProductCategory GIRLS = category(4, "H74", "Girls");
    public static final ProductCategory BOYS = category(5, "H75", "Boys");
    public static final ProductCategory MENS = category(6, "H76", "Mens");
    public static final ProductCategory SCHOOLWEAR = category(7, "H77", "Schoolwear");
    public static final ProductCategory FOOTWEAR = category(8, "H78", "Footwear");
    public static final ProductCategory UNDERWEAR = category(9, "H79", "Underwear");

    @Value("${stockcount.seed.in-progress:true}")
    private boolean seedInProgress;

    @Bean
    public ReferenceDataRepository referenceDataRepository() {
        ReferenceDataRepository repository = new ReferenceDataRepository(locations(), productCategories());
        logger.info("Loaded reference data: {} locations, {} product categories",
                repository.findAllLocations().size(), repository.findAllCategories().size());
        return repository;
    }

    @Bean
    public StockCountRepository stockCountRepository() {
        if (!seedInProgress) {
            logger.info("In-progress stock count seeding disabled");
            return new InMemoryStockCountRepository(Collections.emptyList());
        }
        return new InMemoryStockCountRepository(inProgressStockCounts());
    }

    public static List<Location> locations() {
        return List.of(BALDOCK, STEVENAGE);
    }

    public static List<ProductCategory> productCategories() {
        return List.of(CLOTHING, WOMENS, TODDLERS, BABY, GIRLS, BOYS, MENS, SCHOOLWEAR, FOOTWEAR, UNDERWEAR);
    }

    /**
     * Counts already running at startup. Descriptions are kept as the stores entered them.
     *
     * @return Fresh list of new StockCount instances
     */
    public static List<StockCount> inProgressStockCounts() {
        return List.of(
                new StockCount(1, "Baldock - Clothing", BALDOCK, CLOTHING),
                new StockCount(2, "Baldock - Menswear", BALDOCK, MENS),
                new StockCount(3, "Stevanage - Clothing", STEVENAGE, CLOTHING),
                new StockCount(4, "Stevanage - Boys", STEVENAGE, BOYS)
        );
    }

    private static Location location(int locationId, String name) {
        return Location.builder().locationId(locationId).name(name).build();
    }

    private static ProductCategory category(int categoryId, String code, String name) {
        return ProductCategory.builder().categoryId(categoryId).categoryCode(code).categoryName(name).build();
    }
}
