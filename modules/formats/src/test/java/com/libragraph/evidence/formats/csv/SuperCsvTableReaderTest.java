package com.libragraph.evidence.formats.csv;

import com.libragraph.evidence.formats.api.CsvTable;
import com.libragraph.evidence.formats.api.MalformedSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SuperCsvTableReaderTest {

    private final SuperCsvTableReader reader = new SuperCsvTableReader();

    @TempDir
    Path tempDir;

    @Test
    void shouldReadHeaderAndRows() throws Exception {
        Path csv = write("simple.csv", "a,b\n1,2\n3,4\n");

        CsvTable table = reader.read(csv);

        assertThat(table.header()).containsExactly("a", "b");
        assertThat(table.rows()).containsExactly(List.of("1", "2"), List.of("3", "4"));
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void shouldSkipByteOrderMark() throws Exception {
        Path csv = write("bom.csv", "\uFEFFPID,Name\n4,System\n");

        CsvTable table = reader.read(csv);

        assertThat(table.header()).containsExactly("PID", "Name");
    }

    @Test
    void shouldKeepQuotedCommasAndNewlines() throws Exception {
        Path csv = write("quoted.csv", "From,Message\nalice,\"hi, there\nbob\"\n");

        CsvTable table = reader.read(csv);

        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0).get(1)).isEqualTo("hi, there\nbob");
    }

    @Test
    void shouldPadShortRows() throws Exception {
        Path csv = write("short.csv", "a,b,c\n1\n");

        CsvTable table = reader.read(csv);

        assertThat(table.rows().get(0)).containsExactly("1", "", "");
    }

    @Test
    void shouldRejectWideRows() throws Exception {
        Path csv = write("wide.csv", "a,b\n1,2,3\n");

        assertThatThrownBy(() -> reader.read(csv))
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("3 cells");
    }

    @Test
    void shouldRejectEmptyFile() throws Exception {
        Path csv = write("empty.csv", "");

        assertThatThrownBy(() -> reader.read(csv))
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("no header");
    }

    @Test
    void shouldRejectDuplicateColumns() throws Exception {
        Path csv = write("dup.csv", "a,a\n1,2\n");

        assertThatThrownBy(() -> reader.read(csv))
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("duplicate column");
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
