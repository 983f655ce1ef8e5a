package io.pricedock.quality;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient numeric parsing for spreadsheet cells: picks the first number in the text,
 * ignores digit-group spaces and accepts a decimal comma ({@code "1 234,50"} is 1234.5).
 */
public final class NumberCoercion {
    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(?:[ \\d])*(?:[.,]\\d+)?");

    private NumberCoercion() {
    }

    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        Matcher m = NUMBER.matcher(value.toString().replace('\u00A0', ' '));
        if (!m.find()) {
            return null;
        }
        String normalized = m.group().replace(" ", "").replace(',', '.');
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Rounds half to even.
     */
    public static Long toLong(Object value) {
        Double d = toDouble(value);
        return d == null ? null : (long) Math.rint(d);
    }
}
