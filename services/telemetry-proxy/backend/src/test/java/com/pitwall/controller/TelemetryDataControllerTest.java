package com.pitwall.controller;

import com.pitwall.client.UpstreamException;
import com.pitwall.config.filter.FilterOrderConfig;
import com.pitwall.domain.DataCategory;
import com.pitwall.domain.DriverRecord;
import com.pitwall.domain.FetchParams;
import com.pitwall.service.ResilientFetchProxy;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TelemetryDataController.class)
@Import(FilterOrderConfig.class)
class TelemetryDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResilientFetchProxy fetchProxy;

    @Test
    void returnsRecordsForCategory() throws Exception {
        DriverRecord driver = new DriverRecord(1219, 9158, 1, "Max VERSTAPPEN", "VER", "Red Bull Racing", "3671C6", "NED", null);
        doReturn(List.of(driver)).when(fetchProxy).fetch(eq(DataCategory.DRIVERS), any());

        mockMvc.perform(get("/api/v1/data/drivers").param("session_key", "9158").param("driver_number", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].name_acronym").value("VER"));

        verify(fetchProxy).fetch(DataCategory.DRIVERS,
                FetchParams.builder().sessionKey(9158).driverNumber(1).build());
    }

    @Test
    void acceptsDashedCategoryNames() throws Exception {
        doReturn(List.of()).when(fetchProxy).fetch(eq(DataCategory.CAR_DATA), any());

        mockMvc.perform(get("/api/v1/data/car-data").param("session_key", "9158"))
                .andExpect(status().isOk());
    }

    @Test
    void unknownCategoryIs404() throws Exception {
        mockMvc.perform(get("/api/v1/data/weather"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("UNKNOWN_CATEGORY"));

        verifyNoInteractions(fetchProxy);
    }

    @Test
    void nonNumericSessionKeyIs400() throws Exception {
        mockMvc.perform(get("/api/v1/data/laps").param("session_key", "latest-ish"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_PARAM"));
    }

    @Test
    void upstreamFailureIs503() throws Exception {
        doThrow(new UpstreamException(DataCategory.LAPS, 502, "bad gateway"))
                .when(fetchProxy).fetch(eq(DataCategory.LAPS), any());

        mockMvc.perform(get("/api/v1/data/laps").param("session_key", "9158"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("UPSTREAM_UNAVAILABLE"));
    }

    @Test
    void openBreakerIs503() throws Exception {
        doThrow(CallNotPermittedException.createCallNotPermittedException(CircuitBreaker.ofDefaults("openf1")))
                .when(fetchProxy).fetch(eq(DataCategory.LAPS), any());

        mockMvc.perform(get("/api/v1/data/laps").param("session_key", "9158"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("CIRCUIT_OPEN"));
    }

    @Test
    void echoesTraceIdHeader() throws Exception {
        doReturn(List.of()).when(fetchProxy).fetch(eq(DataCategory.STINTS), any());

        mockMvc.perform(get("/api/v1/data/stints").header("X-Trace-Id", "abc123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "abc123"));
    }
}
