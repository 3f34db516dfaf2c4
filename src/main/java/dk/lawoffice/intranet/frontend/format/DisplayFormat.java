package dk.lawoffice.intranet.frontend.format;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formatting of values for display in both renderers. Null values render as an empty string.
 */
public final class DisplayFormat {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private DisplayFormat() {
    }

    /** {@code 1234.5} becomes {@code $1,234.50}. */
    public static String currency(BigDecimal amount) {
        if (amount == null) return "";
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.US);
        return format.format(amount);
    }

    /** {@code 2025-01-05} becomes {@code Jan 5, 2025}. */
    public static String date(LocalDate date) {
        return date != null ? DATE.format(date) : "";
    }

    public static String date(LocalDateTime dateTime) {
        return dateTime != null ? DATE.format(dateTime) : "";
    }

    public static String dateTime(LocalDateTime dateTime) {
        return dateTime != null ? DATE.format(dateTime) + " " + TIME.format(dateTime) : "";
    }

    /**
     * {@code Jan 5, 2025 9:00 AM - 10:00 AM} for a range within one day, both full date-times otherwise.
     */
    public static String timeRange(LocalDateTime start, LocalDateTime end) {
        if (start == null) return "";
        if (end == null) return dateTime(start);
        if (start.toLocalDate().equals(end.toLocalDate())) {
            return dateTime(start) + " - " + TIME.format(end);
        }
        return dateTime(start) + " - " + dateTime(end);
    }

    /** {@code in_progress} becomes {@code In Progress}. */
    public static String statusLabel(String value) {
        if (value == null || value.isBlank()) return "";
        StringBuilder label = new StringBuilder();
        for (String word : value.trim().toLowerCase(Locale.ROOT).split("[_\\s-]+")) {
            if (word.isEmpty()) continue;
            if (label.length() > 0) label.append(' ');
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }
}
