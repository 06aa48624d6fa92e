package com.libragraph.evidence.formats.csv;

import com.libragraph.evidence.formats.api.CsvTable;
import com.libragraph.evidence.formats.api.CsvTableReader;
import com.libragraph.evidence.formats.api.MalformedSourceException;
import org.jboss.logging.Logger;
import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.prefs.CsvPreference;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link CsvTableReader} backed by Super CSV.
 *
 * <p>The first record is the header. A leading byte order mark is skipped. Short rows are
 * padded with empty cells, rows wider than the header are rejected.
 */
public class SuperCsvTableReader implements CsvTableReader {

    private static final Logger log = Logger.getLogger(SuperCsvTableReader.class);

    private static final int BOM = 0xFEFF;

    private final Charset charset;
    private final CsvPreference preference;

    public SuperCsvTableReader() {
        this(StandardCharsets.UTF_8, CsvPreference.STANDARD_PREFERENCE);
    }

    public SuperCsvTableReader(Charset charset, CsvPreference preference) {
        this.charset = charset;
        this.preference = preference;
    }

    @Override
    public CsvTable read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
            skipByteOrderMark(reader);

            try (CsvListReader csv = new CsvListReader(reader, preference)) {
                String[] header = csv.getHeader(true);
                if (header == null || header.length == 0) {
                    throw new MalformedSourceException(file, "no header row");
                }
                List<String> columns = normalizeHeader(file, header);

                List<List<String>> rows = new ArrayList<>();
                List<String> row;
                while ((row = csv.read()) != null) {
                    rows.add(fit(file, csv.getLineNumber(), columns.size(), row));
                }

                log.debugf("Read %d rows (%d columns) from %s", rows.size(), columns.size(), file);
                return new CsvTable(columns, rows);
            }
        } catch (SuperCsvException e) {
            throw new MalformedSourceException(file, e.getMessage(), e);
        }
    }

    private static void skipByteOrderMark(Reader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != BOM) {
            reader.reset();
        }
    }

    private static List<String> normalizeHeader(Path file, String[] header) {
        List<String> columns = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].strip();
            if (name.isEmpty()) {
                throw new MalformedSourceException(file, "empty column name at position " + i);
            }
            if (columns.contains(name)) {
                throw new MalformedSourceException(file, "duplicate column name: " + name);
            }
            columns.add(name);
        }
        return columns;
    }

    private static List<String> fit(Path file, int line, int width, List<String> row) {
        if (row.size() > width) {
            throw new MalformedSourceException(file,
                    "line " + line + " has " + row.size() + " cells, header has " + width);
        }
        String[] cells = new String[width];
        Arrays.fill(cells, "");
        for (int i = 0; i < row.size(); i++) {
            cells[i] = row.get(i) == null ? "" : row.get(i);
        }
        return Arrays.asList(cells);
    }
}
