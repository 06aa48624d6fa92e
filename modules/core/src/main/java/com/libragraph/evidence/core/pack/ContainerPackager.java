package com.libragraph.evidence.core.pack;

import com.libragraph.evidence.core.build.EntryTree;
import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.entry.Entry;
import com.libragraph.evidence.core.entry.FileEntry;
import com.libragraph.evidence.core.manifest.ManifestBuilder;
import com.libragraph.evidence.core.manifest.ManifestMode;
import com.libragraph.evidence.core.manifest.NativeLayout;
import com.libragraph.evidence.formats.archive.ContainerChild;
import com.libragraph.evidence.formats.archive.ContainerWriter;
import com.libragraph.evidence.formats.archive.ZipContainerWriter;
import com.libragraph.evidence.util.ContentHash;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes an entry tree into a single ZIP container: the manifest and image metadata under
 * {@code ._metadata/}, then every native at its {@link NativeLayout} path.
 *
 * <p>The archive is assembled in a temporary file beside the destination and moved into
 * place once complete, so a failed save never leaves a partial container behind.
 */
public class ContainerPackager {

    private static final Logger log = Logger.getLogger(ContainerPackager.class);

    public static final String METADATA_DIR = "._metadata";
    public static final String MANIFEST_PATH = METADATA_DIR + "/image_contents.xml";
    public static final String IMAGE_METADATA_PATH = METADATA_DIR + "/image_metadata.xml";
    public static final String MANIFEST_HASH_PATH = METADATA_DIR + "/image_contents.sha1_hash";

    private final EvidenceConfig config;
    private final ManifestBuilder manifestBuilder;
    private final ContainerWriter writer;
    private final Clock clock;

    public ContainerPackager(EvidenceConfig config) {
        this(config, new ManifestBuilder(config), new ZipContainerWriter(), Clock.systemUTC());
    }

    public ContainerPackager(EvidenceConfig config, ManifestBuilder manifestBuilder,
                             ContainerWriter writer, Clock clock) {
        this.config = config;
        this.manifestBuilder = manifestBuilder;
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * @throws PackagingException if a native cannot be read or the container cannot be written
     */
    public void save(EntryTree tree, Path destination) {
        Path target = destination.toAbsolutePath().normalize();
        Path temp = null;
        try {
            NativeLayout layout = NativeLayout.plan(tree);
            List<ContainerChild> children = children(tree, layout);

            Path dir = target.getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, "." + target.getFileName() + "-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                writer.write(children, out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.infof("Saved container %s with %d entries", target, tree.size());
        } catch (IOException | UncheckedIOException e) {
            IOException cause = e instanceof UncheckedIOException u ? u.getCause() : (IOException) e;
            PackagingException failure = new PackagingException("Failed to write container " + target, cause);
            discard(temp, failure);
            throw failure;
        } catch (RuntimeException e) {
            discard(temp, e);
            throw e;
        }
    }

    private List<ContainerChild> children(EntryTree tree, NativeLayout layout) {
        Document manifest = manifestBuilder.build(tree, layout, ManifestMode.CONTAINER);
        byte[] manifestBytes = manifestBuilder.toBytes(manifest);
        byte[] imageMetadata = manifestBuilder.toBytes(ImageMetadata.build(config.image(), clock.instant()));

        List<ContainerChild> children = new ArrayList<>();
        children.add(ContainerChild.directory(METADATA_DIR));
        children.add(ContainerChild.bytes(MANIFEST_PATH, manifestBytes));
        children.add(ContainerChild.bytes(IMAGE_METADATA_PATH, imageMetadata));
        children.add(ContainerChild.bytes(MANIFEST_HASH_PATH, ContentHash.of(manifestBytes).bytes()));

        Set<String> directories = new HashSet<>();
        for (Entry entry : tree.depthFirst()) {
            String path = layout.pathOf(entry).orElse(null);
            if (path == null) {
                continue;
            }
            switch (entry.entryType()) {
                case DIRECTORY -> {
                    // same-named sibling directories merge into one record
                    if (directories.add(path)) {
                        children.add(ContainerChild.directory(path));
                    }
                }
                case FILE -> children.add(ContainerChild.file(path, entry.nativePath().orElseThrow(), modified(entry)));
                case MAPPING -> children.add(ContainerChild.bytes(path, entry.text().getBytes(config.encoding())));
            }
        }
        return children;
    }

    private static Instant modified(Entry entry) {
        return entry instanceof FileEntry file ? file.stat().modified() : null;
    }

    private static void discard(Path temp, Exception failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
