package io.pricedock.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One normalized price-list row. Field names are the normalized column names produced by
 * the reader ({@code code}, {@code price_list}, {@code stock_total}, ...); values are kept
 * exactly as read. Absent columns are absent keys, empty cells are {@code null} or blank.
 */
public record PriceRow(int lineNumber, Map<String, Object> fields) {
    public static final String CODE = "code";
    public static final String TITLE = "title";
    public static final String PRODUCER = "producer";
    public static final String COUNTRY = "country";
    public static final String REGION = "region";
    public static final String PRICE_LIST = "price_list";
    public static final String PRICE_DISCOUNT = "price_discount";
    public static final String STOCK_TOTAL = "stock_total";
    public static final String RESERVED = "reserved";
    public static final String STOCK_FREE = "stock_free";
    public static final String ABV = "abv";
    public static final String VOLUME = "volume";

    public PriceRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static PriceRow of(int lineNumber, Map<String, ?> fields) {
        return new PriceRow(lineNumber, new LinkedHashMap<>(fields));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Trimmed text of a field, or {@code null} when missing or blank.
     */
    public String text(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
