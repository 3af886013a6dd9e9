package warden.core.util;

import java.util.Locale;

/**
 * Lenient parser for duration strings such as {@code 5m}, {@code 1h} or {@code 30}.
 *
 * <p>Parsing never fails:
 * <ul>
 *   <li>{@code null} or empty input yields 0</li>
 *   <li>every non-digit character is ignored when reading the magnitude</li>
 *   <li>input without any digit has a magnitude of 1</li>
 *   <li>the unit is days if the text contains {@code d}, otherwise hours for
 *       {@code h}, minutes for {@code m}, and seconds for anything else</li>
 * </ul>
 *
 * <p>Existing configurations rely on this leniency, e.g. {@code "1 day"} is a day
 * and {@code "h"} is an hour.
 */
public final class DurationParser {

    private static final long SECONDS_PER_DAY = 86_400;
    private static final long SECONDS_PER_HOUR = 3_600;
    private static final long SECONDS_PER_MINUTE = 60;

    private DurationParser() {}

    /**
     * Parse a duration string into whole seconds.
     *
     * @param text the duration text (may be null)
     * @return the duration in seconds
     */
    public static long parseSeconds(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        final var normalized = text.trim().toLowerCase(Locale.ROOT);

        final var digits = new StringBuilder();
        for (var i = 0; i < normalized.length(); i++) {
            final var c = normalized.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        final var magnitude = digits.length() == 0 ? 1L : Long.parseLong(digits.toString());

        return magnitude * unitSeconds(normalized);
    }

    private static long unitSeconds(String normalized) {
        if (normalized.indexOf('d') >= 0) {
            return SECONDS_PER_DAY;
        }
        if (normalized.indexOf('h') >= 0) {
            return SECONDS_PER_HOUR;
        }
        if (normalized.indexOf('m') >= 0) {
            return SECONDS_PER_MINUTE;
        }
        return 1;
    }
}
