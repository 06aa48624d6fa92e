package com.libragraph.evidence.core.manifest;

import com.libragraph.evidence.core.build.EntryTree;
import com.libragraph.evidence.core.build.EvidenceBuilder;
import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.csv.CsvEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class NativeLayoutTest {

    @TempDir
    Path tempDir;

    private final EvidenceBuilder builder = new EvidenceBuilder(EvidenceConfig.defaults());

    @Test
    void shouldNestPathsUnderContributingParents() throws Exception {
        Path csv = Files.writeString(tempDir.resolve("people.csv"), "Name\nAlice\n");
        String dir = builder.addDirectory("Evidence");
        builder.addEntry(new CsvEntry(csv, dir));

        EntryTree tree = builder.tree();
        NativeLayout layout = NativeLayout.plan(tree);

        assertThat(tree.depthFirst()).extracting(e -> layout.pathOf(e).orElseThrow())
                .containsExactly("Evidence", "Evidence/people.csv", "Evidence/people.csv/Alice");
    }

    @Test
    void shouldDisambiguateCollidingNames() throws Exception {
        Path a = Files.createDirectories(tempDir.resolve("a"));
        Path b = Files.createDirectories(tempDir.resolve("b"));
        String first = builder.addFile(Files.writeString(a.resolve("report.txt"), "1"), "text/plain");
        String second = builder.addFile(Files.writeString(b.resolve("report.txt"), "2"), "text/plain");
        String third = builder.addMapping(Map.of("Name", "report.txt"), "x/y");

        EntryTree tree = builder.tree();
        NativeLayout layout = NativeLayout.plan(tree);

        assertThat(layout.pathOf(builder.entry(first).orElseThrow())).contains("report.txt");
        assertThat(layout.pathOf(builder.entry(second).orElseThrow())).contains("report (1).txt");
        assertThat(layout.pathOf(builder.entry(third).orElseThrow())).contains("report (2).txt");
    }

    @Test
    void shouldSuffixNamesWithoutExtension() {
        Set<String> taken = new HashSet<>(Set.of("notes", "dir.d/notes"));

        assertThat(NativeLayout.claim("notes", taken)).isEqualTo("notes (1)");
        assertThat(NativeLayout.claim("dir.d/notes", taken)).isEqualTo("dir.d/notes (1)");
        assertThat(NativeLayout.claim(".hidden", new HashSet<>(Set.of(".hidden")))).isEqualTo(".hidden (1)");
    }
}
