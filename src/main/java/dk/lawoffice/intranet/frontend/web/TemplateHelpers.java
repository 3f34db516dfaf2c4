package dk.lawoffice.intranet.frontend.web;

import dk.lawoffice.intranet.frontend.format.DisplayFormat;
import dk.lawoffice.intranet.frontend.format.StatusPalette;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Instance facade over {@link DisplayFormat} and {@link StatusPalette} for use in templates.
 */
public class TemplateHelpers {

    private final StatusPalette palette;

    public TemplateHelpers(StatusPalette palette) {
        this.palette = palette;
    }

    public String currency(BigDecimal amount) {
        return DisplayFormat.currency(amount);
    }

    public String date(LocalDate date) {
        return DisplayFormat.date(date);
    }

    public String dateTime(LocalDateTime dateTime) {
        return DisplayFormat.dateTime(dateTime);
    }

    public String timeRange(LocalDateTime start, LocalDateTime end) {
        return DisplayFormat.timeRange(start, end);
    }

    public String color(Object status) {
        return palette.colorFor(status != null ? status.toString() : null);
    }
}
