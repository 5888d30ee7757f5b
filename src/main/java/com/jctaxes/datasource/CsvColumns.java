package com.jctaxes.datasource;

import com.csvreader.CsvReader;

import java.io.File;
import java.io.IOException;

/**
 * Maps the header row of a CSV file onto column indexes. Header names are matched without regard to case, since the
 * exports we consume are inconsistent about it.
 */
class CsvColumns {

    private final CsvReader reader;

    private final File file;

    CsvColumns (CsvReader reader, File file) throws IOException {
        this.reader = reader;
        this.file = file;
        reader.readHeaders();
    }

    /** @return the index of the named column, or -1 if the file has no such column. */
    int optional (String name) throws IOException {
        for (int c = 0; c < reader.getHeaderCount(); c++) {
            if (reader.getHeader(c).trim().equalsIgnoreCase(name)) {
                return c;
            }
        }
        return -1;
    }

    int required (String name) throws IOException {
        int column = optional(name);
        if (column < 0) {
            throw new DataSourceException(String.format("CSV file %s has no column named '%s'.", file, name));
        }
        return column;
    }

    /** @return the trimmed value in the given column of the current record, or null for a missing column. */
    String get (int column) throws IOException {
        if (column < 0) {
            return null;
        }
        return reader.get(column).trim();
    }

}
