package dk.lawoffice.intranet.frontend.format;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DisplayFormatTest {

    @Test
    void currency() {
        assertEquals("$1,234.50", DisplayFormat.currency(new BigDecimal("1234.5")));
        assertEquals("$0.00", DisplayFormat.currency(BigDecimal.ZERO));
        assertEquals("", DisplayFormat.currency(null));
    }

    @Test
    void dates() {
        assertEquals("Jan 5, 2025", DisplayFormat.date(LocalDate.of(2025, 1, 5)));
        assertEquals("Jan 5, 2025 2:30 PM", DisplayFormat.dateTime(LocalDateTime.of(2025, 1, 5, 14, 30)));
        assertEquals("", DisplayFormat.date((LocalDate) null));
    }

    @Test
    void timeRange() {
        LocalDateTime start = LocalDateTime.of(2025, 1, 5, 9, 0);
        assertEquals("Jan 5, 2025 9:00 AM - 10:15 AM", DisplayFormat.timeRange(start, start.plusMinutes(75)));
        assertEquals("Jan 5, 2025 9:00 AM - Jan 6, 2025 9:00 AM", DisplayFormat.timeRange(start, start.plusDays(1)));
        assertEquals("Jan 5, 2025 9:00 AM", DisplayFormat.timeRange(start, null));
    }

    @Test
    void statusLabel() {
        assertEquals("In Progress", DisplayFormat.statusLabel("in_progress"));
        assertEquals("Paid", DisplayFormat.statusLabel("PAID"));
        assertEquals("", DisplayFormat.statusLabel(null));
    }

    @Test
    void paletteFallsBackToPrimary() {
        StatusPalette palette = new StatusPalette(Map.of("primary", "#000000", "in-progress", "#5E35B1"));

        assertEquals("#5E35B1", palette.colorFor("in_progress"));
        assertEquals("#5E35B1", palette.colorFor("IN_PROGRESS"));
        assertEquals("#000000", palette.colorFor("archived"));
        assertEquals("#000000", palette.colorFor(null));
        assertEquals(StatusPalette.FALLBACK, new StatusPalette(Map.of()).colorFor("paid"));
    }
}
