package com.bountyscope.core.logging;

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
    @DisplayName("setRun puts runId and target in MDC")
    void setRun() {
        MdcContext.setRun("1700000000000_example_com", "example.com");
        assertEquals("1700000000000_example_com", MDC.get("runId"));
        assertEquals("example.com", MDC.get("target"));
    }

    @Test
    @DisplayName("clearHost removes only the host key")
    void clearHost() {
        MdcContext.setStage("SCAN");
        MdcContext.setHost("https://a.example.com");
        MdcContext.clearHost();
        assertNull(MDC.get("host"));
        assertEquals("SCAN", MDC.get("stage"));
    }

    @Test
    @DisplayName("clear removes all bountyscope MDC keys")
    void clear() {
        MdcContext.setRun("r1", "example.com");
        MdcContext.setStage("RECON");
        MdcContext.setHost("a.example.com");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("target"));
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("host"));
    }
}
