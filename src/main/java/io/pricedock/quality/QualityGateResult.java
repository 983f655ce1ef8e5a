package io.pricedock.quality;

import java.util.List;

public record QualityGateResult(List<PriceRow> accepted, List<RejectedRow> rejected) {
    public QualityGateResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public int total() {
        return accepted.size() + rejected.size();
    }
}
