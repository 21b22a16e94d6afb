package com.flagship.accounting.sequence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentSequenceFormatTest {

    @Test
    @DisplayName("Counter is zero padded to the configured width")
    void testFormat_Padded() {
        assertEquals("JV-20240405-0007", DocumentSequenceService.format("JV", LocalDate.of(2024, 4, 5), 7, 4));
    }

    @Test
    @DisplayName("Counter wider than the configured width is kept whole")
    void testFormat_Overflow() {
        assertEquals("PAY-20241231-12345",
            DocumentSequenceService.format("PAY", LocalDate.of(2024, 12, 31), 12345, 4));
    }
}
