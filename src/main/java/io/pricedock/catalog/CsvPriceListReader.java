package io.pricedock.catalog;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import io.pricedock.quality.PriceRow;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header-driven CSV reader. Headers are lower-cased with spaces turned into underscores, a few
 * common aliases are folded onto the normalized names, and cells are kept as read. The
 * separator is {@code ;} when the header line contains one, {@code ,} otherwise.
 */
public final class CsvPriceListReader implements PriceListReader {
    private static final Map<String, String> ALIASES = Map.of(
            "sku", PriceRow.CODE,
            "article", PriceRow.CODE,
            "price", PriceRow.PRICE_LIST,
            "price_rub", PriceRow.PRICE_LIST,
            "discount_price", PriceRow.PRICE_DISCOUNT,
            "stock", PriceRow.STOCK_TOTAL,
            "free_stock", PriceRow.STOCK_FREE,
            "name", PriceRow.TITLE
    );

    @Override
    public List<PriceRow> read(Path file) throws IOException {
        char separator = detectSeparator(file);
        List<PriceRow> rows = new ArrayList<>();
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(in)
                     .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
                     .build()) {
            String[] header = csv.readNext();
            if (header == null) {
                return rows;
            }
            List<String> columns = new ArrayList<>(header.length);
            for (String h : header) {
                columns.add(normalizeHeader(h));
            }
            String[] line;
            while ((line = csv.readNext()) != null) {
                if (isBlank(line)) {
                    continue;
                }
                Map<String, Object> fields = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    String column = columns.get(i);
                    if (column.isEmpty() || fields.containsKey(column)) {
                        continue;
                    }
                    fields.put(column, i < line.length ? line[i] : null);
                }
                rows.add(PriceRow.of((int) csv.getLinesRead(), fields));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + file.getFileName() + ": " + e.getMessage(), e);
        }
        return rows;
    }

    static String normalizeHeader(String raw) {
        if (raw == null) {
            return "";
        }
        String h = raw.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
        return ALIASES.getOrDefault(h, h);
    }

    private static char detectSeparator(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String first = in.readLine();
            return first != null && first.indexOf(';') >= 0 ? ';' : ',';
        }
    }

    private static boolean isBlank(String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
