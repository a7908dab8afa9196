package com.credential.dedupe.bulk;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes exported rows as CSV: a header line in the given column order, then one line per
 * row. Cells are quoted only when they contain a delimiter, quote or line break.
 */
public class CsvVaultWriter {

    private final CSVFormat format;

    public CsvVaultWriter() {
        this.format = CSVFormat.DEFAULT.builder()
                .setQuoteMode(QuoteMode.MINIMAL)
                .setRecordSeparator("\n")
                .get();
    }

    public void write(Writer writer, List<String> columns, List<Map<String, String>> rows) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, format);
        printer.printRecord(columns);
        for (Map<String, String> row : rows) {
            List<String> values = new ArrayList<>(columns.size());
            for (String column : columns) {
                String value = row.get(column);
                values.add(value != null ? value : "");
            }
            printer.printRecord(values);
        }
        printer.flush();
    }
}
