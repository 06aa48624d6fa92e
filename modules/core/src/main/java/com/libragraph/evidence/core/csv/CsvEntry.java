package com.libragraph.evidence.core.csv;

import com.libragraph.evidence.core.build.EvidenceBuilder;
import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.entry.Entry;
import com.libragraph.evidence.core.entry.FileEntry;
import com.libragraph.evidence.formats.api.CsvTable;
import com.libragraph.evidence.formats.api.CsvTableReader;
import com.libragraph.evidence.formats.csv.SuperCsvTableReader;
import org.jboss.logging.Logger;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A CSV file whose rows become child entries.
 *
 * <p>Adding it to a builder registers the file first, then one entry per row made by
 * the {@link RowGenerator} (one {@link CsvRowEntry} per row by default).
 */
public class CsvEntry extends FileEntry {

    private static final Logger log = Logger.getLogger(CsvEntry.class);

    public static final String MIME_TYPE = "text/csv";

    private final RowGenerator rowGenerator;
    private final CsvTableReader reader;
    private CsvTable table;

    public CsvEntry(Path filePath) {
        this(filePath, null);
    }

    public CsvEntry(Path filePath, String parentId) {
        this(filePath, parentId, CsvRowEntry::new);
    }

    public CsvEntry(Path filePath, String parentId, RowGenerator rowGenerator) {
        this(filePath, MIME_TYPE, parentId, rowGenerator, null);
    }

    /**
     * @param reader table reader, or {@code null} for Super CSV in the configured encoding
     */
    public CsvEntry(Path filePath, String mimeType, String parentId, RowGenerator rowGenerator,
                    CsvTableReader reader) {
        super(filePath, mimeType, parentId);
        this.rowGenerator = Objects.requireNonNull(rowGenerator, "rowGenerator cannot be null");
        this.reader = reader;
    }

    @Override
    public String addToBuilder(EvidenceBuilder builder) {
        // parsed up front so a malformed file registers nothing
        CsvTable rows = load(builder.config());
        String id = builder.register(this);
        for (int i = 0; i < rows.size(); i++) {
            Entry row = rowGenerator.create(this, i);
            row.addToBuilder(builder);
        }
        log.debugf("Registered %d rows of %s", rows.size(), filePath());
        return id;
    }

    @Override
    public String addAsParentPath(String existingPath) {
        return name() + "/" + existingPath;
    }

    public List<String> header() {
        return table().header();
    }

    public int rowCount() {
        return table().size();
    }

    /**
     * Row {@code rowIndex} as column name to cell, in column order.
     */
    public Map<String, String> row(int rowIndex) {
        CsvTable t = table();
        List<String> cells = t.rows().get(rowIndex);
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < t.header().size(); i++) {
            row.put(t.header().get(i), cells.get(i));
        }
        return row;
    }

    public String value(int rowIndex, String column) {
        int columnIndex = header().indexOf(column);
        if (columnIndex < 0) {
            throw new IllegalArgumentException("No column '" + column + "' in " + filePath());
        }
        return table().rows().get(rowIndex).get(columnIndex);
    }

    /**
     * Parsed table, read on first use.
     *
     * @throws com.libragraph.evidence.formats.api.MalformedSourceException if the file is not valid CSV
     */
    public CsvTable table() {
        return load(config());
    }

    private CsvTable load(EvidenceConfig settings) {
        if (table == null) {
            CsvTableReader effective = reader != null
                    ? reader
                    : new SuperCsvTableReader(settings.csvEncoding(), CsvPreference.STANDARD_PREFERENCE);
            try {
                table = effective.read(filePath());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read CSV " + filePath(), e);
            }
        }
        return table;
    }
}
