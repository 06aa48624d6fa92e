package com.libragraph.evidence.core.entry;

import com.libragraph.evidence.core.build.EvidenceBuilder;
import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.field.StandardFields;
import com.libragraph.evidence.formats.tika.MimeTypeDetector;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.util.ContentHash;
import com.libragraph.evidence.util.FileDigests;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DirectoryEntryTest {

    @TempDir
    Path tempDir;

    private final EvidenceBuilder builder = new EvidenceBuilder(EvidenceConfig.defaults());

    @Test
    void shouldUseLabelWhenNotOnDisk() {
        DirectoryEntry entry = new DirectoryEntry("Custodian A");
        builder.register(entry);

        assertThat(entry.entryType()).isEqualTo(EntryType.DIRECTORY);
        assertThat(entry.name()).isEqualTo("Custodian A");
        assertThat(entry.mimeType()).isEqualTo(MimeTypeDetector.DIRECTORY);
        assertThat(entry.sourceDirectory()).isEmpty();
        assertThat(entry.digest()).isEqualTo(ContentHash.ofText("Custodian A"));
        assertThat(entry.addAsParentPath("mail.eml")).isEqualTo("Custodian A/mail.eml");
    }

    @Test
    void shouldHashExistingDirectoryTree() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("exports"));
        Files.writeString(dir.resolve("one.txt"), "1");
        DirectoryEntry entry = new DirectoryEntry(dir.toString() + "/");
        builder.register(entry);

        assertThat(entry.name()).isEqualTo("exports");
        assertThat(entry.sourceDirectory()).contains(dir.toAbsolutePath().normalize());
        assertThat(entry.digest()).isEqualTo(FileDigests.sha1Tree(dir, FileDigests.DEFAULT_BUFFER_SIZE));
        assertThat(entry.itemDate()).isPresent();
    }

    @Test
    void shouldBuildFromFieldMap() {
        DirectoryEntry entry = new DirectoryEntry(Map.of("Name", "Mailbox"), null);
        builder.register(entry);

        assertThat(entry.name()).isEqualTo("Mailbox");
        assertThat(entry.field(StandardFields.NAME).orElseThrow().value()).isEqualTo("Mailbox");
    }
}
