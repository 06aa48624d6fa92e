package com.libragraph.evidence.formats.archive;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;

/**
 * {@link ContainerWriter} producing a deflated ZIP archive with UTF-8 entry names.
 */
public class ZipContainerWriter implements ContainerWriter {

    private static final Logger log = Logger.getLogger(ZipContainerWriter.class);

    private final int level;

    public ZipContainerWriter() {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    public ZipContainerWriter(int level) {
        this.level = level;
    }

    @Override
    public void write(List<ContainerChild> children, OutputStream output) throws IOException {
        Instant now = Instant.now();
        Set<String> written = new HashSet<>();

        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(new NonClosingOutputStream(output))) {
            zos.setEncoding("UTF-8");
            zos.setLevel(level);

            for (ContainerChild child : children) {
                if (!written.add(child.path())) {
                    throw new IOException("Duplicate archive path: " + child.path());
                }

                ZipArchiveEntry entry = new ZipArchiveEntry(child.path());
                entry.setLastModifiedTime(FileTime.from(child.mtime() != null ? child.mtime() : now));
                zos.putArchiveEntry(entry);

                if (!child.isDirectory()) {
                    if (child.sourceFile() != null) {
                        try (InputStream in = Files.newInputStream(child.sourceFile())) {
                            in.transferTo(zos);
                        }
                    } else if (child.content() != null) {
                        zos.write(child.content());
                    }
                }

                zos.closeArchiveEntry();
            }
            zos.finish();
        }

        log.debugf("Wrote %d archive records", children.size());
    }

    /**
     * Keeps {@link ZipArchiveOutputStream#close()} from closing the caller's stream.
     */
    private static final class NonClosingOutputStream extends FilterOutputStream {

        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
