package com.chambua.schoolsports.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ApiFallbackController.class, HealthController.class})
@ActiveProfiles("test")
class ApiFallbackControllerTest {

    @Autowired private MockMvc mockMvc;

    @Test
    void healthReportsOk() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.message").value("Server is running"));
    }

    @Test
    void unknownApiRouteIsJson404() throws Exception {
        mockMvc.perform(post("/api/does-not-exist?x=1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Route not found: POST /api/does-not-exist?x=1"));
    }
}
