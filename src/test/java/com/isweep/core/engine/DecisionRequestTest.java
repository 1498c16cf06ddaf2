package com.isweep.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionRequestTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private DecisionRequest parse(String json) throws Exception {
        return DecisionRequest.parse(objectMapper.readTree(json));
    }

    private String rejection(String json) throws Exception {
        JsonNode body = objectMapper.readTree(json);
        return assertThrows(InvalidPayloadException.class, () -> DecisionRequest.parse(body)).getMessage();
    }

    @Test
    @DisplayName("accepts an integer user_id, text and confidence")
    void fullRequest() throws Exception {
        DecisionRequest request = parse("{\"user_id\": 7, \"text\": \"hello\", \"confidence\": 0.9}");
        assertEquals(7L, request.userId());
        assertEquals("hello", request.text());
        assertEquals(0.9, request.confidence());
    }

    @Test
    @DisplayName("accepts user_id as a string of digits")
    void stringUserId() throws Exception {
        assertEquals(9999999L, parse("{\"user_id\": \"9999999\", \"text\": \"\"}").userId());
    }

    @Test
    @DisplayName("confidence is optional")
    void noConfidence() throws Exception {
        assertNull(parse("{\"user_id\": 1, \"text\": \"x\"}").confidence());
    }

    @Test
    @DisplayName("rejects a body that is not an object")
    void notAnObject() throws Exception {
        assertEquals("body must be a JSON object", rejection("[1, 2]"));
        assertThrows(InvalidPayloadException.class, () -> DecisionRequest.parse(null));
    }

    @Test
    @DisplayName("rejects missing or malformed user_id")
    void badUserId() throws Exception {
        assertEquals("user_id is required", rejection("{\"text\": \"x\"}"));
        assertEquals("user_id must be an integer", rejection("{\"user_id\": 1.5, \"text\": \"x\"}"));
        assertEquals("user_id must be an integer", rejection("{\"user_id\": \"abc\", \"text\": \"x\"}"));
        assertEquals("user_id must be an integer", rejection("{\"user_id\": \"-3\", \"text\": \"x\"}"));
        assertEquals("user_id is out of range",
                rejection("{\"user_id\": \"99999999999999999999\", \"text\": \"x\"}"));
    }

    @Test
    @DisplayName("rejects missing or non-string text")
    void badText() throws Exception {
        assertEquals("text is required", rejection("{\"user_id\": 1}"));
        assertEquals("text must be a string", rejection("{\"user_id\": 1, \"text\": 42}"));
    }

    @Test
    @DisplayName("drops a confidence outside [0, 1] or not a number")
    void badConfidence() throws Exception {
        DecisionRequest word = parse("{\"user_id\": 1, \"text\": \"x\", \"confidence\": \"high\"}");
        assertNull(word.confidence());
        assertEquals("x", word.text());
        assertNull(parse("{\"user_id\": 1, \"text\": \"x\", \"confidence\": 1.5}").confidence());
        assertNull(parse("{\"user_id\": 1, \"text\": \"x\", \"confidence\": -0.1}").confidence());
    }
}
