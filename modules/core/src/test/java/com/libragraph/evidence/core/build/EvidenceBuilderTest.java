package com.libragraph.evidence.core.build;

import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.entry.Entry;
import com.libragraph.evidence.core.entry.MappingEntry;
import com.libragraph.evidence.core.manifest.ManifestMode;
import com.libragraph.evidence.formats.tika.MimeTypeDetector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class EvidenceBuilderTest {

    @TempDir
    Path tempDir;

    private final EvidenceBuilder builder = new EvidenceBuilder(EvidenceConfig.defaults());

    @Test
    void shouldAssignDistinctIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            // identical names and parents on purpose
            ids.add(builder.addMapping(Map.of("Name", "same"), MappingEntry.DEFAULT_MIME_TYPE));
        }
        String dir = builder.addDirectory("d");
        for (int i = 0; i < 50; i++) {
            ids.add(builder.addMapping(Map.of("Name", "same"), MappingEntry.DEFAULT_MIME_TYPE, dir));
        }

        assertThat(ids).hasSize(250);
        assertThat(ids).allSatisfy(id -> assertThat(id).matches("[0-9a-f]{40}"));
    }

    @Test
    void shouldKeepRegistrationOrderAsSiblingOrder() {
        String root = builder.addDirectory("root");
        String b = builder.addMapping(Map.of("Name", "b"), "x/y", root);
        String a = builder.addMapping(Map.of("Name", "a"), "x/y", root);

        EntryTree tree = builder.tree();

        assertThat(tree.roots()).extracting(Entry::id).containsExactly(root);
        assertThat(tree.children(tree.roots().get(0))).extracting(Entry::id).containsExactly(b, a);
        assertThat(tree.depthFirst()).extracting(Entry::id).containsExactly(root, b, a);
    }

    @Test
    void shouldFailSaveOnDanglingParent() {
        builder.addMapping(Map.of("Name", "orphan"), "x/y", "no-such-parent");
        Path destination = tempDir.resolve("out.zip");

        assertThatThrownBy(() -> builder.save(destination))
                .isInstanceOfSatisfying(DanglingParentReferenceException.class,
                        e -> assertThat(e.parentReference()).isEqualTo("no-such-parent"));
        assertThat(destination).doesNotExist();
    }

    @Test
    void shouldResolveForwardNaturalKeyReference() {
        String child = builder.addEntry(new ProcessEntry(Map.of("PID", "88", "PPID", "4", "Name", "smss.exe")));
        String parent = builder.addEntry(new ProcessEntry(Map.of("PID", "4", "Name", "System")));

        EntryTree tree = builder.tree();

        Entry childEntry = builder.entry(child).orElseThrow();
        assertThat(tree.parent(childEntry)).map(Entry::id).contains(parent);
        assertThat(builder.entry("4")).map(Entry::id).contains(parent);
    }

    @Test
    void shouldRejectCycles() {
        builder.addEntry(new ProcessEntry(Map.of("PID", "1", "PPID", "2")));
        builder.addEntry(new ProcessEntry(Map.of("PID", "2", "PPID", "1")));

        assertThatThrownBy(builder::tree)
                .isInstanceOfSatisfying(CyclicParentReferenceException.class,
                        e -> assertThat(e.cycle()).hasSize(3));
    }

    @Test
    void shouldRejectSelfReferenceAtRegistration() {
        assertThatThrownBy(() -> builder.addEntry(new ProcessEntry(Map.of("PID", "7", "PPID", "7"))))
                .isInstanceOf(CyclicParentReferenceException.class);
        assertThat(builder.size()).isZero();
    }

    @Test
    void shouldFreezeAfterManifestIsBuilt() {
        builder.addDirectory("root");
        builder.buildManifest(ManifestMode.STANDALONE);

        assertThatThrownBy(() -> builder.addDirectory("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDetectMimeTypeWithTika() throws Exception {
        Path pdf = Files.write(tempDir.resolve("scan.pdf"), "%PDF-1.4\n%âãÏÓ\n".getBytes());
        Path dir = Files.createDirectories(tempDir.resolve("folder"));

        String id = builder.addFile(pdf);

        assertThat(builder.entry(id).orElseThrow().mimeType()).isEqualTo("application/pdf");
        assertThat(builder.detectMimeType(dir)).isEqualTo(MimeTypeDetector.DIRECTORY);
    }

    @Test
    void shouldReturnEntriesInRegistrationOrder() {
        String first = builder.addDirectory("one");
        String second = builder.addDirectory("two");

        List<Entry> entries = builder.entries();

        assertThat(entries).extracting(Entry::id).containsExactly(first, second);
        assertThatThrownBy(() -> entries.clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    private static class ProcessEntry extends MappingEntry {

        ProcessEntry(Map<String, String> process) {
            super(process, "application/x-process", process.get("PPID"));
        }

        @Override
        public Optional<String> identifierField() {
            return Optional.of("PID");
        }
    }
}
