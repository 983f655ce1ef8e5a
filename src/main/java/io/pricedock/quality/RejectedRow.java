package io.pricedock.quality;

import java.util.List;

public record RejectedRow(PriceRow row, List<String> violatedRules) {
    public RejectedRow {
        violatedRules = List.copyOf(violatedRules);
    }

    public String code() {
        return row.text(PriceRow.CODE);
    }
}
