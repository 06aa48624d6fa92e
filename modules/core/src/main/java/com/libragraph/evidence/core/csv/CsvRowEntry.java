package com.libragraph.evidence.core.csv;

import com.libragraph.evidence.core.entry.MappingEntry;
import com.libragraph.evidence.core.field.FieldFactory;
import com.libragraph.evidence.types.FieldType;

import java.util.Map;

/**
 * One CSV row: a text field per column, parented to its CSV file by default.
 */
public class CsvRowEntry extends MappingEntry {

    private final CsvEntry csv;
    private final int rowIndex;

    public CsvRowEntry(CsvEntry csv, int rowIndex) {
        this(csv, rowIndex, csv.id());
    }

    public CsvRowEntry(CsvEntry csv, int rowIndex, String parentId) {
        super(DEFAULT_MIME_TYPE, parentId);
        this.csv = csv;
        this.rowIndex = rowIndex;
        for (Map.Entry<String, String> cell : csv.row(rowIndex).entrySet()) {
            addField(FieldFactory.generate(cell.getKey(), FieldType.TEXT, cell.getValue()));
        }
    }

    public CsvEntry csv() {
        return csv;
    }

    public int rowIndex() {
        return rowIndex;
    }

    public String value(String column) {
        return csv.value(rowIndex, column);
    }

    /**
     * The row-name column if present, else the row index.
     */
    @Override
    public String getName() {
        String name = nameFromFields(config().defaultRowNameField());
        return name != null ? name : String.valueOf(rowIndex);
    }
}
