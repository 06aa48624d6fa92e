package com.libragraph.evidence.core.manifest;

import com.libragraph.evidence.core.build.EntryTree;
import com.libragraph.evidence.core.config.EvidenceConfig;
import com.libragraph.evidence.core.entry.DirectoryEntry;
import com.libragraph.evidence.core.entry.Entry;
import com.libragraph.evidence.core.field.EntryField;
import com.libragraph.evidence.types.EntryType;
import com.libragraph.evidence.types.FieldType;
import com.libragraph.evidence.util.FileDigests;
import com.libragraph.evidence.util.XmlText;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes an entry tree as an EDRM XML 1.2 load file.
 *
 * <p>Documents appear depth-first from the roots. Field keys ({@code field_0}, {@code field_1}, ...)
 * are assigned per manifest in order of first appearance.
 */
public class ManifestBuilder {

    private static final Logger log = Logger.getLogger(ManifestBuilder.class);

    static final String DESCRIPTION = "EDRM XML Load File";
    static final String CONTAINER_LOCATION = "Location within container file";
    static final String DISK_LOCATION = "Location on Disk";

    private final EvidenceConfig config;

    public ManifestBuilder(EvidenceConfig config) {
        this.config = config;
    }

    /**
     * @throws UncheckedIOException if a native cannot be read for hashing
     */
    public Document build(EntryTree tree, NativeLayout layout, ManifestMode mode) {
        Document doc = newDocument();
        Element root = doc.createElement("Root");
        root.setAttribute("MajorVersion", "1");
        root.setAttribute("MinorVersion", "2");
        root.setAttribute("Description", DESCRIPTION);
        root.setAttribute("Locale", "US");
        root.setAttribute("DataInterchangeType", "Update");
        doc.appendChild(root);

        Map<String, FieldKey> keys = assignKeys(tree);
        Element fields = append(root, "Fields");
        for (Map.Entry<String, FieldKey> def : keys.entrySet()) {
            Element field = append(fields, "Field");
            field.setAttribute("Name", XmlText.sanitize(def.getKey()));
            field.setAttribute("DataType", def.getValue().type().label());
            field.setAttribute("Key", def.getValue().key());
        }

        Element batch = append(root, "Batch");
        Element documents = append(batch, "Documents");
        Element relationships = append(batch, "Relationships");
        Element folders = append(batch, "Folders");
        Map<String, Element> folderById = new HashMap<>();

        for (Entry entry : tree.depthFirst()) {
            documents.appendChild(document(doc, entry, keys, layout, mode));

            Optional<Entry> parent = tree.parent(entry);
            if (parent.isPresent()) {
                Element relationship = append(relationships, "Relationship");
                relationship.setAttribute("Type", "Container");
                relationship.setAttribute("ParentDocId", parent.get().id());
                relationship.setAttribute("ChildDocId", entry.id());
            }

            if (tree.hasChildren(entry)) {
                Element container = parent.map(p -> folderById.get(p.id())).orElse(folders);
                Element folder = append(container, "Folder");
                folder.setAttribute("FolderName", entry.id());
                for (Entry child : tree.children(entry)) {
                    append(folder, "Document").setAttribute("DocId", child.id());
                }
                folderById.put(entry.id(), folder);
            }
        }

        log.debugf("Built %s manifest with %d documents and %d fields", mode, tree.size(), keys.size());
        return doc;
    }

    public byte[] toBytes(Document doc) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, config.encoding().name());
            transformer.transform(new DOMSource(doc), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IllegalStateException("Cannot serialize manifest", e);
        }
        return out.toByteArray();
    }

    private Element document(Document doc, Entry entry, Map<String, FieldKey> keys,
                             NativeLayout layout, ManifestMode mode) {
        Element document = doc.createElement("Document");
        document.setAttribute("DocID", entry.id());
        document.setAttribute("DocType", "File");
        document.setAttribute("MimeType", entry.mimeType());

        Element values = append(document, "FieldValues");
        for (EntryField field : entry.fields()) {
            append(values, keys.get(field.name()).key()).setTextContent(XmlText.sanitize(field.render()));
        }

        String text = entry.text();
        Element nativeFile = nativeFile(doc, entry, text, layout, mode);
        if (nativeFile != null || text != null) {
            Element files = append(document, "Files");
            if (nativeFile != null) {
                files.appendChild(nativeFile);
            }
            if (text != null) {
                Element textFile = append(files, "File");
                textFile.setAttribute("FileType", "Text");
                append(textFile, "InlineContent").setTextContent(XmlText.sanitize(text));
            }
        }

        Element location = append(append(document, "Locations"), "Location");
        append(location, "Custodian").setTextContent(XmlText.sanitize(config.custodian()));
        append(location, "Description").setTextContent(
                mode == ManifestMode.CONTAINER ? CONTAINER_LOCATION : DISK_LOCATION);
        locationUri(entry, layout, mode).ifPresent(uri -> append(location, "LocationURI").setTextContent(uri));
        return document;
    }

    private Element nativeFile(Document doc, Entry entry, String text, NativeLayout layout, ManifestMode mode) {
        String filePath;
        String fileName;
        String md5;
        if (entry.entryType() == EntryType.FILE && entry.nativePath().isPresent()) {
            Path source = entry.nativePath().get();
            md5 = md5(source);
            if (mode == ManifestMode.CONTAINER) {
                String path = layout.pathOf(entry).orElseThrow();
                filePath = parentOf(path);
                fileName = lastSegment(path);
            } else {
                filePath = source.getParent() == null ? "" : source.getParent().toString();
                fileName = source.getFileName().toString();
            }
        } else if (entry.entryType() == EntryType.MAPPING && text != null && mode == ManifestMode.CONTAINER) {
            String path = layout.pathOf(entry).orElseThrow();
            md5 = FileDigests.md5Hex(text.getBytes(config.encoding()));
            filePath = parentOf(path);
            fileName = lastSegment(path);
        } else {
            return null;
        }

        Element file = doc.createElement("File");
        file.setAttribute("FileType", "Native");
        Element external = append(file, "ExternalFile");
        external.setAttribute("FilePath", XmlText.sanitize(filePath));
        external.setAttribute("FileName", XmlText.sanitize(fileName));
        external.setAttribute("Hash", md5);
        external.setAttribute("HashType", "MD5");
        return file;
    }

    private Optional<String> locationUri(Entry entry, NativeLayout layout, ManifestMode mode) {
        if (mode == ManifestMode.CONTAINER) {
            return layout.pathOf(entry).map(path -> URLEncoder.encode(path, StandardCharsets.UTF_8));
        }
        if (entry.nativePath().isPresent()) {
            return Optional.of(entry.nativePath().get().toUri().toString());
        }
        if (entry instanceof DirectoryEntry directory) {
            return directory.sourceDirectory().map(dir -> dir.toUri().toString());
        }
        return Optional.empty();
    }

    private String md5(Path source) {
        try {
            return FileDigests.md5Hex(source, config.hashBufferSize());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot hash native " + source, e);
        }
    }

    /**
     * One key per field name. The first type seen for a name is the one declared; values of
     * other types are still written, rendered as text under that declaration.
     */
    private static Map<String, FieldKey> assignKeys(EntryTree tree) {
        Map<String, FieldKey> keys = new LinkedHashMap<>();
        Set<String> conflicting = new HashSet<>();
        for (Entry entry : tree.depthFirst()) {
            List<EntryField> fields = entry.fields();
            for (EntryField field : fields) {
                FieldKey declared = keys.get(field.name());
                if (declared == null) {
                    keys.put(field.name(), new FieldKey("field_" + keys.size(), field.type()));
                } else if (declared.type() != field.type() && conflicting.add(field.name())) {
                    log.warnf("Field '%s' is declared %s but %s (%s) holds %s; keeping %s", field.name(),
                            declared.type().label(), entry.id(), entry.name(), field.type().label(),
                            declared.type().label());
                }
            }
        }
        return keys;
    }

    private static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String lastSegment(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static Element append(Element parent, String name) {
        Element child = parent.getOwnerDocument().createElement(name);
        parent.appendChild(child);
        return child;
    }

    private static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("No XML document builder available", e);
        }
    }

    private record FieldKey(String key, FieldType type) {
    }
}
