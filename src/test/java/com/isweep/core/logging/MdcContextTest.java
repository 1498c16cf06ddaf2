package com.isweep.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setUser puts userId in MDC")
    void setUser() {
        MdcContext.setUser(42L);
        assertEquals("42", MDC.get("userId"));
    }

    @Test
    @DisplayName("setRequest puts userId and decisionMode in MDC")
    void setRequest() {
        MdcContext.setRequest(7L, "structured");
        assertEquals("7", MDC.get("userId"));
        assertEquals("structured", MDC.get("decisionMode"));
    }

    @Test
    @DisplayName("clear removes all isweep MDC keys and leaves others alone")
    void clear() {
        MDC.put("traceId", "abc");
        MdcContext.setRequest(7L, "simple");
        MdcContext.clear();
        assertNull(MDC.get("userId"));
        assertNull(MDC.get("decisionMode"));
        assertEquals("abc", MDC.get("traceId"));
        MDC.remove("traceId");
    }
}
