package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.build.EvidenceBuilder;
import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.core.field.FieldFactory;
import com.libragraph.evidence.core.field.StandardFields;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.types.FieldType;
import com.libragraph.evidence.util.ContentHash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileEntryTest {

    @TempDir
    Path tempDir;

    private final EvidenceBuilder builder = new EvidenceBuilder(EvidenceConfig.defaults());

    @Test
    void shouldPopulateStandardFieldsAtRegistration() throws Exception {
        Path file = tempDir.resolve("report.txt");
        Files.writeString(file, "quarterly numbers");
        FileEntry entry = new FileEntry(file, "text/plain");

        assertThat(entry.fields()).isEmpty();
        builder.register(entry);

        assertThat(entry.entryType()).isEqualTo(EntryType.FILE);
        assertThat(entry.field(StandardFields.NAME).orElseThrow().value()).isEqualTo("report.txt");
        assertThat(entry.field(StandardFields.MIME_TYPE).orElseThrow().value()).isEqualTo("text/plain");
        assertThat(entry.field(StandardFields.SHA1).orElseThrow().value())
                .isEqualTo(ContentHash.ofText("quarterly numbers").toHex());
        assertThat(entry.field(StandardFields.FILE_SIZE).orElseThrow().value()).isEqualTo(17L);
        assertThat(entry.field(StandardFields.PATH_NAME).orElseThrow().value())
                .isEqualTo(file.toAbsolutePath().normalize().toString());
        assertThat(entry.field(StandardFields.FILE_MODIFIED).orElseThrow().type()).isEqualTo(FieldType.DATE_TIME);
        assertThat(entry.field(StandardFields.FILE_OWNER).orElseThrow().render()).isNotEmpty();
        assertThat(entry.itemDate()).isPresent();
        assertThat(entry.nativePath()).contains(file.toAbsolutePath().normalize());
    }

    @Test
    void shouldFailRegistrationWhenFileIsMissing() {
        FileEntry entry = new FileEntry(tempDir.resolve("gone.bin"), "application/octet-stream");

        assertThatThrownBy(() -> builder.register(entry))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("gone.bin");
        assertThat(builder.size()).isZero();
    }

    @Test
    void shouldRejectSecondRegistration() throws Exception {
        Path file = tempDir.resolve("a.txt");
        Files.writeString(file, "a");
        FileEntry entry = new FileEntry(file, "text/plain");
        builder.register(entry);

        assertThatThrownBy(() -> builder.register(entry)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new EvidenceBuilder(EvidenceConfig.defaults()).register(entry))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldNotOverwriteExistingFieldThroughAddField() throws Exception {
        Path file = tempDir.resolve("a.txt");
        Files.writeString(file, "a");
        FileEntry entry = new FileEntry(file, "text/plain");
        builder.register(entry);

        assertThatThrownBy(() -> entry.addField(FieldFactory.generate(StandardFields.NAME, FieldType.TEXT, "other")))
                .isInstanceOf(IllegalStateException.class);

        entry.replaceField(FieldFactory.generate(StandardFields.NAME, FieldType.TEXT, "other"));
        assertThat(entry.field(StandardFields.NAME).orElseThrow().value()).isEqualTo("other");

        entry.setFieldValue(StandardFields.FILE_SIZE, "99");
        assertThat(entry.field(StandardFields.FILE_SIZE).orElseThrow().value()).isEqualTo(99L);
        assertThatThrownBy(() -> entry.setFieldValue("Nope", 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepFieldValuesIndependentAcrossEntries() throws Exception {
        Path a = Files.write(tempDir.resolve("a.txt"), "a".getBytes(StandardCharsets.UTF_8));
        Path b = Files.write(tempDir.resolve("b.txt"), "b".getBytes(StandardCharsets.UTF_8));
        FileEntry first = new FileEntry(a, "text/plain");
        FileEntry second = new FileEntry(b, "text/plain");
        EntryField shared = FieldFactory.generate("Reviewer", FieldType.TEXT, "Alice");

        first.addField(shared);
        second.addField(shared);
        shared.setValue("Bob");
        first.setFieldValue("Reviewer", "Carol");

        assertThat(second.field("Reviewer").orElseThrow().value()).isEqualTo("Alice");
        assertThat(first.field("Reviewer").orElseThrow().value()).isEqualTo("Carol");
    }

    @Test
    void shouldNotExposeStoredFields() throws Exception {
        Path a = Files.write(tempDir.resolve("a.txt"), new byte[]{1});
        FileEntry entry = new FileEntry(a, "application/octet-stream");
        entry.addField(FieldFactory.generate("Tag", FieldType.TEXT, "x"));

        entry.fields().get(0).setValue("changed");
        entry.field("Tag").orElseThrow().setValue("changed");

        assertThat(entry.field("Tag").orElseThrow().value()).isEqualTo("x");
    }

    @Test
    void shouldFixParentAtRegistration() throws Exception {
        Path a = Files.write(tempDir.resolve("a.txt"), new byte[]{1});
        FileEntry entry = new FileEntry(a, "application/octet-stream");
        String dir = builder.addDirectory("Evidence");

        entry.setParentId(dir);
        builder.register(entry);

        assertThat(entry.parentId()).isEqualTo(dir);
        assertThatThrownBy(() -> entry.setParentId(null)).isInstanceOf(IllegalStateException.class);
    }
}
