package io.pricedock.driver;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

final class EffectiveDatesTest {

    @Test
    void parsesSeparatedAndCompactDates() {
        LocalDate expected = LocalDate.of(2026, 3, 1);
        Assertions.assertEquals(Optional.of(expected), EffectiveDates.fromFileName("prices_2026_03_01.csv"));
        Assertions.assertEquals(Optional.of(expected), EffectiveDates.fromFileName("prices-2026-03-01.csv"));
        Assertions.assertEquals(Optional.of(expected), EffectiveDates.fromFileName("prices 2026.03.01 final.csv"));
        Assertions.assertEquals(Optional.of(expected), EffectiveDates.fromFileName("prices20260301.csv"));
    }

    @Test
    void rejectsImpossibleAndEmbeddedDates() {
        Assertions.assertTrue(EffectiveDates.fromFileName("prices_2026-02-30.csv").isEmpty());
        Assertions.assertTrue(EffectiveDates.fromFileName("order_120260301.csv").isEmpty());
        Assertions.assertTrue(EffectiveDates.fromFileName("prices.csv").isEmpty());
        Assertions.assertTrue(EffectiveDates.fromFileName(null).isEmpty());
    }

    @Test
    void fallsBackWhenNameHasNoDate() {
        LocalDate today = LocalDate.of(2026, 10, 18);
        Assertions.assertEquals(today, EffectiveDates.fromFileNameOr("prices.csv", today));
    }
}
