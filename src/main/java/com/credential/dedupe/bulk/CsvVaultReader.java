package com.credential.dedupe.bulk;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a provider CSV export into a {@link CsvTable}.
 *
 * <p>The first record is the header. A UTF-8 byte-order mark on the first header cell is
 * removed; header names are otherwise kept verbatim. Quoted cells may span lines.
 * Short rows are padded with empty strings; cells beyond the header are kept under
 * {@code column<N>} so nothing is lost.</p>
 */
public class CsvVaultReader {
    private static final Logger log = LoggerFactory.getLogger(CsvVaultReader.class);

    private static final String BOM = "\uFEFF";
    private static final String OVERFLOW_PREFIX = "column";

    private final CSVFormat format;

    public CsvVaultReader() {
        this.format = CSVFormat.DEFAULT.builder()
                .setIgnoreEmptyLines(true)
                .get();
    }

    public CsvTable read(Reader reader) throws IOException {
        List<String> header = new ArrayList<>();
        List<Map<String, String>> rows = new ArrayList<>();

        try (CSVParser parser = CSVParser.parse(reader, format)) {
            boolean first = true;
            for (CSVRecord record : parser) {
                if (first) {
                    first = false;
                    for (int i = 0; i < record.size(); i++) {
                        String name = record.get(i);
                        header.add(i == 0 && name.startsWith(BOM) ? name.substring(BOM.length()) : name);
                    }
                    continue;
                }
                rows.add(toRow(header, record));
            }
        }
        log.debug("csv.read columns={} rows={}", header.size(), rows.size());
        return new CsvTable(header, rows);
    }

    private static Map<String, String> toRow(List<String> header, CSVRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            row.putIfAbsent(header.get(i), i < record.size() ? record.get(i) : "");
        }
        for (int i = header.size(); i < record.size(); i++) {
            row.put(OVERFLOW_PREFIX + (i + 1), record.get(i));
        }
        return row;
    }
}
