package com.cred.freestyle.stockcount.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StockCount domain model.
 */
@DisplayName("StockCount Domain Model Tests")
class StockCountTest {

    private final Location baldock = Location.builder().locationId(1).name("Baldock").build();
    private final ProductCategory womens = ProductCategory.builder()
            .categoryId(1).categoryCode("H71").categoryName("Womens").build();

    @Test
    @DisplayName("Should describe a count as '{location} - {category}'")
    void shouldBuildDescription() {
        assertThat(StockCount.describe(baldock, womens)).isEqualTo("Baldock - Womens");
    }

    @Test
    @DisplayName("Should append recorded events in the given order")
    void shouldAppendEventsInOrder() {
        // Given
        StockCount stockCount = new StockCount(5, "Baldock - Womens", baldock, womens);
        RfidEvent first = RfidEvent.builder().locationId(1).workArea("Stock Room").tagIdHex("AA01").build();
        RfidEvent second = RfidEvent.builder().locationId(1).workArea("Stock Room").tagIdHex("AA02").build();

        // When
        stockCount.recordEvents(List.of(first, second));
        stockCount.recordEvents(List.of(RfidEvent.builder().tagIdHex("AA03").build()));

        // Then
        assertThat(stockCount.getRfidEventLog().getRfidEvents())
                .extracting(RfidEvent::getTagIdHex)
                .containsExactly("AA01", "AA02", "AA03");
    }

    @Test
    @DisplayName("Should detach snapshot from later appends")
    void snapshotShouldNotSeeLaterEvents() {
        // Given
        StockCount stockCount = new StockCount(5, "Baldock - Womens", baldock, womens);
        stockCount.recordEvents(List.of(RfidEvent.builder().tagIdHex("AA01").build()));

        // When
        StockCount snapshot = stockCount.snapshot();
        stockCount.recordEvents(List.of(RfidEvent.builder().tagIdHex("AA02").build()));

        // Then
        assertThat(snapshot.getRfidEventLog().size()).isEqualTo(1);
        assertThat(stockCount.getRfidEventLog().size()).isEqualTo(2);
        assertThat(snapshot.getLocation()).isEqualTo(baldock);
        assertThat(snapshot.getProductCategory()).isEqualTo(womens);
    }

    @Test
    @DisplayName("Should not allow changing the event log through its view")
    void eventLogViewShouldBeReadOnly() {
        StockCount stockCount = new StockCount(5, "Baldock - Womens", baldock, womens);

        assertThatThrownBy(() -> stockCount.getRfidEventLog().getRfidEvents()
                .add(RfidEvent.builder().tagIdHex("AA01").build()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should match location and category code by equality")
    void shouldMatchLocationAndCategory() {
        StockCount stockCount = new StockCount(5, "Baldock - Womens", baldock, womens);

        assertThat(stockCount.isAtLocation(1)).isTrue();
        assertThat(stockCount.isAtLocation(2)).isFalse();
        assertThat(stockCount.hasCategoryCode("H71")).isTrue();
        assertThat(stockCount.hasCategoryCode("H7")).isFalse();
    }
}
