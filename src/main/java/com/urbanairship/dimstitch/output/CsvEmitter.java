/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.dimstitch.output;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.urbanairship.dimstitch.CombinedRow;
import com.urbanairship.dimstitch.StitchResult;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a stitched table as delimited text: a header row of translated dimension names, then one line
 * per row with the values in header order. Fields a row has no value for are written as the invalid
 * value. An empty table is just the header.
 * <p>
 * Fields are only quoted when they contain the delimiter, a quote or a line break.
 */
public class CsvEmitter {
    public static final char DEFAULT_DELIMITER = ',';

    private final HeaderTranslator headerTranslator;
    private final char delimiter;
    private final boolean skipHeader;
    private final String invalidValue;

    public CsvEmitter(HeaderTranslator headerTranslator, char delimiter, boolean skipHeader, String invalidValue) {
        this.headerTranslator = headerTranslator;
        this.delimiter = delimiter;
        this.skipHeader = skipHeader;
        this.invalidValue = invalidValue;
    }

    /**
     * Write the table and flush, leaving the writer open.
     *
     * @return the number of rows written, not counting the header
     */
    public int emit(StitchResult result, Writer out) throws IOException {
        ICSVWriter csvWriter = new CSVWriterBuilder(out)
                .withSeparator(delimiter)
                .withLineEnd(ICSVWriter.DEFAULT_LINE_END)
                .build();

        List<String> columns = result.getColumns();
        if (!skipHeader) {
            csvWriter.writeNext(headerTranslator.translate(columns).toArray(new String[0]), false);
        }

        String[] line = new String[columns.size()];
        for (CombinedRow row : result.getRows()) {
            for (int i = 0; i < line.length; i++) {
                String value = row.get(columns.get(i));
                line[i] = value == null ? invalidValue : value;
            }
            csvWriter.writeNext(line, false);
        }

        // Not closing, that would close the caller's writer
        csvWriter.flush();
        if (csvWriter.checkError()) {
            throw new IOException("Failed writing output", csvWriter.getException());
        }
        return result.getRows().size();
    }
}
