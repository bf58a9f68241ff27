package com.driverlens.core.store;

import com.driverlens.core.model.DataTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CSV serialization of {@link DataTable}s.
 *
 * <p>
 * The first record is the header. On read a column becomes numeric when every
 * non-blank cell parses as a {@code double}; otherwise it stays text. Blank
 * cells are read as missing values in both cases, and missing values are
 * written as empty cells. A blank header cell, as left by an exported row
 * index, is named {@code "Unnamed: <position>"}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TableCsvCodec {

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .build();

    /** Prefix of the name given to a column whose header cell is blank. */
    static final String UNNAMED_PREFIX = "Unnamed: ";

    private TableCsvCodec() {
        // utility class — not instantiable
    }

    /**
     * Write a table as CSV with a header row.
     *
     * @param table  the table; must have at least one column
     * @param writer destination, left open
     * @throws IOException if writing fails
     */
    public static void write(DataTable table, Writer writer) throws IOException {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(writer, "writer must not be null");
        List<String> names = table.getColumnNames();
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Cannot write a table without columns");
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(names.toArray(new String[0]))
                .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        List<String> row = new ArrayList<>(names.size());
        for (int i = 0; i < table.getRowCount(); i++) {
            row.clear();
            for (String name : names) {
                row.add(table.cellAsText(name, i));
            }
            printer.printRecord(row);
        }
        printer.flush();
    }

    /**
     * Parse a CSV document into a table.
     *
     * @param reader source, left open
     * @return the parsed table
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if the content is not a well-formed
     *                                  table (no header, ragged rows, bad
     *                                  quoting, duplicate column names)
     */
    public static DataTable read(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        List<String> headers;
        List<String[]> cells = new ArrayList<>();
        try {
            CSVParser parser = READ_FORMAT.parse(reader);
            headers = nameColumns(parser.getHeaderNames());
            if (headers.isEmpty()) {
                throw new IllegalArgumentException("CSV content has no header row");
            }
            for (CSVRecord record : parser) {
                if (record.size() != headers.size()) {
                    throw new IllegalArgumentException("Record " + record.getRecordNumber()
                            + " has " + record.size() + " fields, expected " + headers.size());
                }
                String[] values = new String[headers.size()];
                for (int c = 0; c < values.length; c++) {
                    values[c] = record.get(c);
                }
                cells.add(values);
            }
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new IllegalArgumentException("Malformed CSV content: " + e.getMessage(), e);
        }

        DataTable.Builder builder = DataTable.builder();
        for (int c = 0; c < headers.size(); c++) {
            addColumn(builder, headers.get(c), c, cells);
        }
        return builder.build();
    }

    private static List<String> nameColumns(List<String> headerNames) {
        List<String> names = new ArrayList<>(headerNames.size());
        for (int c = 0; c < headerNames.size(); c++) {
            String header = headerNames.get(c);
            names.add(header == null || header.isBlank() ? UNNAMED_PREFIX + c : header);
        }
        return names;
    }

    private static void addColumn(DataTable.Builder builder, String name, int index, List<String[]> cells) {
        int rows = cells.size();
        double[] numbers = new double[rows];
        boolean numeric = true;
        for (int r = 0; r < rows && numeric; r++) {
            String cell = cells.get(r)[index];
            if (cell == null || cell.isBlank()) {
                numbers[r] = Double.NaN;
                continue;
            }
            try {
                numbers[r] = Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                numeric = false;
            }
        }
        if (numeric) {
            builder.numericColumn(name, numbers);
            return;
        }
        String[] texts = new String[rows];
        for (int r = 0; r < rows; r++) {
            String cell = cells.get(r)[index];
            texts[r] = cell == null || cell.isBlank() ? null : cell;
        }
        builder.textColumn(name, texts);
    }
}
