package com.libragraph.evidence.core.build;

import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.entry.DirectoryEntry;
import com.libragraph.evidence.core.entry.Entry;
import com.libragraph.evidence.core.entry.FileEntry;
import com.libragraph.evidence.core.entry.MappingEntry;
import com.libragraph.evidence.core.entry.RegistrationContext;
import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.core.manifest.ManifestBuilder;
import com.libragraph.evidence.core.manifest.ManifestMode;
import com.libragraph.evidence.core.manifest.NativeLayout;
import com.libragraph.evidence.core.pack.ContainerPackager;
import com.libragraph.evidence.core.pack.PackagingException;
import com.libragraph.evidence.formats.tika.MimeTypeDetector;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects entries into a tree and writes it out as a container or a standalone load file.
 *
 * <p>Every entry is registered exactly once and receives an id unique within this builder.
 * Parent references are resolved when the tree is walked, so a child may name a parent
 * (by id or natural key) that is registered after it. Once a manifest has been built the
 * tree is frozen and further registration fails.
 *
 * <p>Not thread-safe; use one builder per thread.
 */
public class EvidenceBuilder {

    private static final Logger log = Logger.getLogger(EvidenceBuilder.class);

    private final EvidenceConfig config;
    private final IdentifierGenerator identifiers = new IdentifierGenerator();
    private final MimeTypeDetector mimeTypeDetector = new MimeTypeDetector();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, String> naturalKeys = new HashMap<>();
    private boolean frozen;

    public EvidenceBuilder() {
        this(EvidenceConfig.load());
    }

    public EvidenceBuilder(EvidenceConfig config) {
        this.config = config;
    }

    public EvidenceConfig config() {
        return config;
    }

    /**
     * Assigns an id to {@code entry} and adds it to the tree. Composite entries call this for
     * themselves and their derived entries from {@link Entry#addToBuilder(EvidenceBuilder)}.
     *
     * @return the assigned id
     * @throws IllegalStateException          if the entry is already registered or the tree is frozen
     * @throws CyclicParentReferenceException if the entry names itself as parent
     */
    public String register(Entry entry) {
        if (frozen) {
            throw new IllegalStateException("Manifest already built; no more entries can be added");
        }
        if (entry.id() != null) {
            throw new IllegalStateException("Entry " + entry.id() + " is already registered");
        }
        String naturalKey = naturalKeyOf(entry);
        String parentId = entry.parentId();
        if (parentId != null && parentId.equals(naturalKey)) {
            throw new CyclicParentReferenceException(List.of(naturalKey, naturalKey));
        }

        IdentifierGenerator.Identifier identifier = identifiers.next(entry.name(), parentId);
        while (entries.containsKey(identifier.id())) {
            identifier = identifiers.next(entry.name(), parentId);
        }
        entry.onRegister(new RegistrationContext(identifier.id(), identifier.sequence(), config));
        entries.put(identifier.id(), entry);

        if (naturalKey != null) {
            String existing = naturalKeys.putIfAbsent(naturalKey, identifier.id());
            if (existing != null) {
                log.warnf("Natural key '%s' of %s already belongs to %s; keeping the first", naturalKey,
                        identifier.id(), existing);
            }
        }
        log.debugf("Registered %s %s (%s) parent=%s", entry.entryType().label(), identifier.id(),
                entry.name(), parentId);
        return identifier.id();
    }

    public String addEntry(Entry entry) {
        return entry.addToBuilder(this);
    }

    public String addFile(Path path, String mimeType) {
        return addFile(path, mimeType, null);
    }

    public String addFile(Path path, String mimeType, String parentId) {
        return addEntry(new FileEntry(path, mimeType, parentId));
    }

    /**
     * Adds a file with its MIME type detected from name and content.
     */
    public String addFile(Path path) {
        return addFile(path, detectMimeType(path), null);
    }

    public String addDirectory(String name) {
        return addDirectory(name, null);
    }

    public String addDirectory(String name, String parentId) {
        return addEntry(new DirectoryEntry(name, parentId));
    }

    public String addDirectory(Map<String, ?> fields) {
        return addDirectory(fields, null);
    }

    public String addDirectory(Map<String, ?> fields, String parentId) {
        return addEntry(new DirectoryEntry(fields, parentId));
    }

    public String addMapping(Map<String, ?> fields, String mimeType) {
        return addMapping(fields, mimeType, null);
    }

    public String addMapping(Map<String, ?> fields, String mimeType, String parentId) {
        return addEntry(new MappingEntry(fields, mimeType, parentId));
    }

    public Optional<Entry> entry(String idOrNaturalKey) {
        Entry entry = entries.get(idOrNaturalKey);
        if (entry == null) {
            String id = naturalKeys.get(idOrNaturalKey);
            entry = id == null ? null : entries.get(id);
        }
        return Optional.ofNullable(entry);
    }

    /**
     * Registered entries in registration order.
     */
    public List<Entry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Resolves and freezes the tree.
     *
     * @throws DanglingParentReferenceException if a parent reference does not resolve
     * @throws CyclicParentReferenceException   if an entry is its own ancestor
     */
    public EntryTree tree() {
        EntryTree tree = EntryTree.resolve(entries.values(), naturalKeys);
        frozen = true;
        return tree;
    }

    public Document buildManifest(ManifestMode mode) {
        EntryTree tree = tree();
        return new ManifestBuilder(config).build(tree, NativeLayout.plan(tree), mode);
    }

    /**
     * Writes a standalone EDRM load file referencing natives at their original locations.
     *
     * @throws PackagingException if the file cannot be written or a native cannot be read
     */
    public void writeLoadFile(Path destination) {
        ManifestBuilder manifestBuilder = new ManifestBuilder(config);
        try {
            byte[] xml = manifestBuilder.toBytes(buildManifest(ManifestMode.STANDALONE));
            Path target = destination.toAbsolutePath();
            Files.createDirectories(target.getParent());
            Files.write(target, xml);
            log.infof("Wrote load file %s with %d entries", target, entries.size());
        } catch (IOException e) {
            throw new PackagingException("Failed to write load file " + destination, e);
        } catch (UncheckedIOException e) {
            throw new PackagingException("Failed to write load file " + destination, e.getCause());
        }
    }

    /**
     * Writes the container to {@code destination}.
     *
     * @throws DanglingParentReferenceException if a parent reference does not resolve
     * @throws CyclicParentReferenceException   if an entry is its own ancestor
     * @throws PackagingException               if a native cannot be read or the archive cannot be written
     */
    public void save(Path destination) {
        new ContainerPackager(config).save(tree(), destination);
    }

    /**
     * MIME type of {@code path} as detected by Apache Tika.
     */
    public String detectMimeType(Path path) {
        try {
            return mimeTypeDetector.detect(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot detect MIME type of " + path, e);
        }
    }

    private static String naturalKeyOf(Entry entry) {
        return entry.identifierField()
                .flatMap(entry::field)
                .map(EntryField::render)
                .filter(key -> !key.isEmpty())
                .orElse(null);
    }
}
