package io.pricedock.catalog;

import io.pricedock.quality.PriceRow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class CsvPriceListReaderTest {

    @Test
    void readsSemicolonFileWithAliasedHeaders() throws Exception {
        Path file = Files.createTempFile("pricedock-test-reader-", ".csv");
        try {
            Files.writeString(file, "\uFEFFSKU;Name;Price RUB;Free Stock\nA100;Wine;\"1 234,50\";7\n;;;\nB200;Other;10;1\n",
                    StandardCharsets.UTF_8);
            List<PriceRow> rows = new CsvPriceListReader().read(file);
            Assertions.assertEquals(2, rows.size());
            PriceRow first = rows.get(0);
            Assertions.assertEquals("A100", first.text(PriceRow.CODE));
            Assertions.assertEquals("Wine", first.text(PriceRow.TITLE));
            Assertions.assertEquals("1 234,50", first.text(PriceRow.PRICE_LIST));
            Assertions.assertEquals("7", first.text(PriceRow.STOCK_FREE));
            Assertions.assertEquals(4, rows.get(1).lineNumber());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void readsCommaFileAndShortRows() throws Exception {
        Path file = Files.createTempFile("pricedock-test-reader-", ".csv");
        try {
            Files.writeString(file, "code,price_list,abv\nA100,5\n", StandardCharsets.UTF_8);
            List<PriceRow> rows = new CsvPriceListReader().read(file);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals("5", rows.get(0).text(PriceRow.PRICE_LIST));
            Assertions.assertTrue(rows.get(0).has(PriceRow.ABV));
            Assertions.assertNull(rows.get(0).get(PriceRow.ABV));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void normalizesHeaders() {
        Assertions.assertEquals(PriceRow.CODE, CsvPriceListReader.normalizeHeader(" Article "));
        Assertions.assertEquals("stock_total", CsvPriceListReader.normalizeHeader("Stock Total"));
        Assertions.assertEquals("", CsvPriceListReader.normalizeHeader(null));
    }
}
