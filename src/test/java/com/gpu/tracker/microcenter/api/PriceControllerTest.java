package com.gpu.tracker.microcenter.api;

import com.gpu.tracker.microcenter.model.PriceHistoryPointDTO;
import com.gpu.tracker.microcenter.model.ProductSnapshotDTO;
import com.gpu.tracker.microcenter.service.PriceQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PriceController.class)
class PriceControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PriceQueryService priceQueryService;

    @Test
    void latestSnapshotIsNeverCached() throws Exception {
        when(priceQueryService.listLatest()).thenReturn(List.of(new ProductSnapshotDTO(
                5L, "MSI", "GeForce RTX 5070 Ti", "NVIDIA", "MSI NVIDIA GeForce RTX 5070 Ti Ventus",
                1L, "Denver", "Denver", "CO", "123456",
                "https://www.microcenter.com/product/123456", "N/A",
                new BigDecimal("749.99"), "12 NEW IN STOCK", LocalDateTime.of(2025, 3, 1, 12, 0))));

        mockMvc.perform(get("/api/gpus"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"))
                .andExpect(header().string("Pragma", "no-cache"))
                .andExpect(header().string("Expires", "0"))
                .andExpect(jsonPath("$[0].product_id").value(5))
                .andExpect(jsonPath("$[0].model_name").value("GeForce RTX 5070 Ti"))
                .andExpect(jsonPath("$[0].store_name").value("Denver"))
                .andExpect(jsonPath("$[0].price_usd").value(749.99))
                .andExpect(jsonPath("$[0].stock_status").value("12 NEW IN STOCK"))
                .andExpect(jsonPath("$[0].last_seen_image_url").value("N/A"));
    }

    @Test
    void emptyDatabaseReturnsEmptyArray() throws Exception {
        when(priceQueryService.listLatest()).thenReturn(List.of());

        mockMvc.perform(get("/api/gpus"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void historyIsReturnedAsPoints() throws Exception {
        when(priceQueryService.history(5L)).thenReturn(List.of(
                new PriceHistoryPointDTO(10L, new BigDecimal("799.99"), "5 IN STOCK", LocalDateTime.of(2025, 3, 1, 6, 0)),
                new PriceHistoryPointDTO(11L, new BigDecimal("749.99"), "3 IN STOCK", LocalDateTime.of(2025, 3, 1, 12, 0))));

        mockMvc.perform(get("/api/history/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].history_id").value(10))
                .andExpect(jsonPath("$[1].price_usd").value(749.99))
                .andExpect(jsonPath("$[1].scraped_at").value("2025-03-01T12:00:00"));
    }

    @Test
    void nonNumericProductIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/history/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request"));
    }

    @Test
    void databaseOutageIsServiceUnavailable() throws Exception {
        when(priceQueryService.listLatest()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/gpus"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Database connection failed"));
    }
}
