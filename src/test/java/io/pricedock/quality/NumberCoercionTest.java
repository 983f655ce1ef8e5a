package io.pricedock.quality;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class NumberCoercionTest {

    @Test
    void parsesSpreadsheetStyleNumbers() {
        Assertions.assertEquals(1234.5d, NumberCoercion.toDouble("1 234,50"));
        Assertions.assertEquals(1234.5d, NumberCoercion.toDouble("1\u00A0234.50 RUB"));
        Assertions.assertEquals(-7d, NumberCoercion.toDouble("-7"));
        Assertions.assertEquals(3d, NumberCoercion.toDouble(3));
        Assertions.assertNull(NumberCoercion.toDouble("n/a"));
        Assertions.assertNull(NumberCoercion.toDouble(null));
        Assertions.assertNull(NumberCoercion.toDouble(Double.NaN));
    }

    @Test
    void longsRoundHalfToEven() {
        Assertions.assertEquals(2L, NumberCoercion.toLong("2,5"));
        Assertions.assertEquals(4L, NumberCoercion.toLong("3.5"));
        Assertions.assertNull(NumberCoercion.toLong(""));
    }
}
