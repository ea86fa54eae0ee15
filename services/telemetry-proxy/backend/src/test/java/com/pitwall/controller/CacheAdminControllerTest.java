package com.pitwall.controller;

import com.pitwall.service.ResilientFetchProxy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CacheAdminController.class)
class CacheAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResilientFetchProxy fetchProxy;

    @Test
    void flushReturnsDeletedKeyCountWithoutSession() throws Exception {
        when(fetchProxy.invalidateAll()).thenReturn(12L);

        mockMvc.perform(delete("/api/v1/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deletedKeys").value(12));

        verify(fetchProxy).invalidateAll();
    }
}
