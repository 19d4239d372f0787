package com.agentry.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setExecution and clearExecution manage the execution keys only")
    void executionKeys() {
        MdcContext.setRecipe("nightly");
        MdcContext.setExecution("exec-1", "reviewer");

        assertEquals("exec-1", MDC.get("executionId"));
        assertEquals("reviewer", MDC.get("agentName"));

        MdcContext.clearExecution();

        assertNull(MDC.get("executionId"));
        assertNull(MDC.get("agentName"));
        assertEquals("nightly", MDC.get("recipeName"));
    }

    @Test
    @DisplayName("setBatch records the recipe and batch number")
    void batchKeys() {
        MdcContext.setBatch("nightly", 3);

        assertEquals("nightly", MDC.get("recipeName"));
        assertEquals("3", MDC.get("batchNumber"));
    }

    @Test
    @DisplayName("clear removes every Agentry key")
    void clearAll() {
        MdcContext.setExecution("exec-1", "reviewer");
        MdcContext.setBatch("nightly", 1);

        MdcContext.clear();

        assertNull(MDC.get("executionId"));
        assertNull(MDC.get("agentName"));
        assertNull(MDC.get("recipeName"));
        assertNull(MDC.get("batchNumber"));
    }
}
