package io.pricedock.catalog;

import io.pricedock.quality.PriceRow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns a supplier file into normalized rows.
 */
public interface PriceListReader {
    List<PriceRow> read(Path file) throws IOException;
}
