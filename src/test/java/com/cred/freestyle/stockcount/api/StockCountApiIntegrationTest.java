package com.cred.freestyle.stockcount.api;

import com.cred.freestyle.stockcount.repository.StockCountRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests for the stock count endpoints.
 * Each test gets a freshly seeded store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@DisplayName("Stock Count API Integration Tests")
class StockCountApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StockCountRepository stockCountRepository;

    @ParameterizedTest
    @ValueSource(ints = {0, 5, 6, 100})
    @DisplayName("GET /stockcount/{id} - Ids outside the seed return 404")
    void getUnknownStockCount_Returns404(int stockCountId) throws Exception {
        mockMvc.perform(get("/stockcount/{id}", stockCountId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No stock count found with id " + stockCountId));
    }

    @Test
    @DisplayName("GET /stockcount/{id} - Seeded count is returned")
    void getSeededStockCount_Returns200() throws Exception {
        mockMvc.perform(get("/stockcount/{id}", 2))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("Baldock - Menswear"))
                .andExpect(jsonPath("$.productCategory.categoryCode").value("H76"))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents", hasSize(0)));
    }

    @Test
    @DisplayName("GET /stockcount - Filters by location, then by location and category")
    void findStockCounts_Filters() throws Exception {
        mockMvc.perform(get("/stockcount").param("LocationId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].stockCountId", contains(1, 2)));

        mockMvc.perform(get("/stockcount").param("LocationId", "2").param("CategoryCode", "H75"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].stockCountId", contains(4)));

        mockMvc.perform(get("/stockcount").param("CategoryCode", "H79"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("POST /stockcount/start - Creates count 5 retrievable afterwards")
    void startStockCount_ThenGet() throws Exception {
        mockMvc.perform(post("/stockcount/start")
                        .param("LocationId", "1")
                        .param("ProductCategoryCode", "H71"))
                .andExpect(status().isAccepted())
                .andExpect(content().string("5"));

        mockMvc.perform(get("/stockcount/{id}", 5))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("Baldock - Womens"))
                .andExpect(jsonPath("$.location.locationId").value(1))
                .andExpect(jsonPath("$.productCategory.categoryCode").value("H71"));

        mockMvc.perform(get("/stockcount").param("LocationId", "1"))
                .andExpect(jsonPath("$[*].stockCountId", contains(1, 2, 5)));
    }

    @Test
    @DisplayName("POST /stockcount/start - Unknown location returns 406 and leaves store unchanged")
    void startStockCount_UnknownLocation_Returns406() throws Exception {
        mockMvc.perform(post("/stockcount/start")
                        .param("LocationId", "99")
                        .param("ProductCategoryCode", "H71"))
                .andExpect(status().isNotAcceptable())
                .andExpect(jsonPath("$.message").value("Unacceptable location or product code"));

        assertThat(stockCountRepository.count()).isEqualTo(4);
        mockMvc.perform(get("/stockcount/{id}", 5))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /stockcount/take - Appends two events in order to the first count at location 2")
    void reportStockTake_AppendsEvents() throws Exception {
        String body = "{\"locationId\":2,\"workArea\":\"Shop Floor\","
                + "\"productIdentifiers\":[{\"tagIdHex\":\"3034257BF7194E4000000001\"},"
                + "{\"tagIdHex\":\"3034257BF7194E4000000002\"}]}";

        mockMvc.perform(post("/stockcount/take")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(content().string("0"));

        mockMvc.perform(get("/stockcount/{id}", 3))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents", hasSize(2)))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents[0].tagIdHex").value("3034257BF7194E4000000001"))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents[1].tagIdHex").value("3034257BF7194E4000000002"))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents[0].locationId").value(2))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents[0].workArea").value("Shop Floor"));

        mockMvc.perform(get("/stockcount/{id}", 4))
                .andExpect(jsonPath("$.rfidEventLog.rfidEvents", hasSize(0)));
    }

    @Test
    @DisplayName("POST /stockcount/take - Answers 0 even when a newly started count is updated")
    void reportStockTake_AlwaysReturnsZero() throws Exception {
        mockMvc.perform(post("/stockcount/take")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"locationId\":1,\"productIdentifiers\":[{\"tagIdHex\":\"AA\"}]}"))
                .andExpect(status().isAccepted())
                .andExpect(content().string("0"));
    }

    @Test
    @DisplayName("POST /stockcount/take - No count at location returns 404")
    void reportStockTake_NoMatch_Returns404() throws Exception {
        mockMvc.perform(post("/stockcount/take")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"locationId\":99,\"productIdentifiers\":[{\"tagIdHex\":\"AA\"}]}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET unknown route - Returns 404 rather than a server error")
    void unknownRoute_Returns404() throws Exception {
        mockMvc.perform(get("/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }
}
