package com.isweep.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.isweep.core.engine.DecisionEngine;
import com.isweep.core.model.Action;
import com.isweep.core.model.Category;
import com.isweep.core.model.Decision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EventController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DecisionEngine decisionEngine;

    @Test
    @DisplayName("POST /event returns the structured decision")
    void structuredDecision() throws Exception {
        when(decisionEngine.decide(any(JsonNode.class))).thenReturn(new Decision(Action.FAST_FORWARD, 5,
                Category.VIOLENCE, "violence content detected; sensitivity=low; severity=2"));

        mockMvc.perform(post("/event")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": 1, \"text\": \"he shot her twice\", \"confidence\": 0.9}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("fast_forward"))
                .andExpect(jsonPath("$.duration_seconds").value(5))
                .andExpect(jsonPath("$.matched_category").value("violence"))
                .andExpect(jsonPath("$.reason").value("violence content detected; sensitivity=low; severity=2"))
                .andExpect(jsonPath("$.*", hasSize(4)));

        verify(decisionEngine).decide(argThat((JsonNode body) ->
                body.get("text").asText().equals("he shot her twice")));
    }

    @Test
    @DisplayName("POST /event renders matched_category as null when nothing matched")
    void nullCategory() throws Exception {
        when(decisionEngine.decide(any(JsonNode.class))).thenReturn(Decision.none("Unknown user"));

        mockMvc.perform(post("/event")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"9999999\", \"text\": \"damn\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("none"))
                .andExpect(jsonPath("$.duration_seconds").value(0))
                .andExpect(jsonPath("$.matched_category").value(nullValue()))
                .andExpect(jsonPath("$.reason").value("Unknown user"));
    }

    @Test
    @DisplayName("POST /event with malformed JSON still answers 200")
    void malformedJson() throws Exception {
        when(decisionEngine.decide((JsonNode) isNull()))
                .thenReturn(Decision.none("Invalid payload: body must be a JSON object"));

        mockMvc.perform(post("/event")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{broken"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("none"))
                .andExpect(jsonPath("$.reason", startsWith("Invalid payload")));
    }

    @Test
    @DisplayName("POST /event without a body still answers 200")
    void emptyBody() throws Exception {
        when(decisionEngine.decide((JsonNode) isNull()))
                .thenReturn(Decision.none("Invalid payload: body must be a JSON object"));

        mockMvc.perform(post("/event").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("none"));
    }
}
