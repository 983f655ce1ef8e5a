package io.pricedock.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Row-level checks run before anything reaches the catalog. Classification only; persisting
 * rejected rows is {@link QuarantineStore}'s job.
 */
public final class QualityGate {
    public static final String MISSING_CODE = "missing_code";
    public static final String INVALID_CODE_FORMAT = "invalid_code_format";
    public static final String MISSING_PRICE = "missing_price";
    public static final String NEGATIVE_PRICE_LIST = "negative_price_list";
    public static final String NEGATIVE_PRICE_DISCOUNT = "negative_price_discount";
    public static final String NEGATIVE_STOCK_TOTAL = "negative_stock_total";
    public static final String NEGATIVE_RESERVED = "negative_reserved";
    public static final String NEGATIVE_STOCK_FREE = "negative_stock_free";
    public static final String INVALID_ABV_RANGE = "invalid_abv_range";
    public static final String INVALID_VOLUME = "invalid_volume";

    static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{2,}$");

    private QualityGate() {
    }

    public static QualityGateResult apply(List<PriceRow> rows) {
        List<PriceRow> accepted = new ArrayList<>();
        List<RejectedRow> rejected = new ArrayList<>();
        for (PriceRow row : rows) {
            List<String> errors = validate(row);
            if (errors.isEmpty()) {
                accepted.add(row);
            } else {
                rejected.add(new RejectedRow(row, errors));
            }
        }
        return new QualityGateResult(accepted, rejected);
    }

    /**
     * Every rule the row violates, in rule order. Rules for a column only apply when the
     * reader produced that column.
     */
    public static List<String> validate(PriceRow row) {
        List<String> errors = new ArrayList<>();

        String code = row.text(PriceRow.CODE);
        if (code == null) {
            errors.add(MISSING_CODE);
        } else if (!CODE_PATTERN.matcher(code).matches()) {
            errors.add(INVALID_CODE_FORMAT);
        }

        Double priceList = row.has(PriceRow.PRICE_LIST) ? NumberCoercion.toDouble(row.get(PriceRow.PRICE_LIST)) : null;
        Double priceDiscount = row.has(PriceRow.PRICE_DISCOUNT)
                ? NumberCoercion.toDouble(row.get(PriceRow.PRICE_DISCOUNT))
                : null;
        if (priceList == null && priceDiscount == null) {
            if (row.has(PriceRow.PRICE_LIST) || row.has(PriceRow.PRICE_DISCOUNT)) {
                errors.add(MISSING_PRICE);
            }
        } else {
            if (priceList != null && priceList < 0) {
                errors.add(NEGATIVE_PRICE_LIST);
            }
            if (priceDiscount != null && priceDiscount < 0) {
                errors.add(NEGATIVE_PRICE_DISCOUNT);
            }
        }

        checkNonNegative(row, PriceRow.STOCK_TOTAL, NEGATIVE_STOCK_TOTAL, errors);
        checkNonNegative(row, PriceRow.RESERVED, NEGATIVE_RESERVED, errors);
        checkNonNegative(row, PriceRow.STOCK_FREE, NEGATIVE_STOCK_FREE, errors);

        if (row.has(PriceRow.ABV)) {
            Double abv = NumberCoercion.toDouble(row.get(PriceRow.ABV));
            if (abv != null && (abv < 0.0d || abv > 100.0d)) {
                errors.add(INVALID_ABV_RANGE);
            }
        }
        if (row.has(PriceRow.VOLUME)) {
            Double volume = NumberCoercion.toDouble(row.get(PriceRow.VOLUME));
            if (volume != null && volume <= 0.0d) {
                errors.add(INVALID_VOLUME);
            }
        }
        return errors;
    }

    private static void checkNonNegative(PriceRow row, String field, String code, List<String> errors) {
        if (!row.has(field)) {
            return;
        }
        Long value = NumberCoercion.toLong(row.get(field));
        if (value != null && value < 0) {
            errors.add(code);
        }
    }
}
