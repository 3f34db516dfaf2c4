package dk.lawoffice.intranet.frontend.format;

import java.util.Locale;
import java.util.Map;

/**
 * Maps status values ({@code in_progress}, {@code paid}, ...) to the colours configured under
 * {@code lawoffice.frontend.theme}. Unknown statuses get the primary colour.
 */
public class StatusPalette {

    static final String PRIMARY = "primary";
    static final String FALLBACK = "#1565C0";

    private final Map<String, String> theme;

    public StatusPalette(Map<String, String> theme) {
        this.theme = Map.copyOf(theme);
    }

    public String colorFor(String status) {
        String primary = theme.getOrDefault(PRIMARY, FALLBACK);
        if (status == null) return primary;
        return theme.getOrDefault(status.toLowerCase(Locale.ROOT).replace('_', '-'), primary);
    }
}
