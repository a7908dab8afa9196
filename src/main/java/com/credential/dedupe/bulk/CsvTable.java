package com.credential.dedupe.bulk;

import java.util.List;
import java.util.Map;

/**
 * A parsed CSV file: the header row and every data row keyed by header name.
 */
public record CsvTable(List<String> header, List<Map<String, String>> rows) {

    public CsvTable {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }
}
