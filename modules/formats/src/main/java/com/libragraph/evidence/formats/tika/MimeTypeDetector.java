package com.libragraph.evidence.formats.tika;

import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Detects the MIME type of a native file with Apache Tika.
 * Combines magic bytes with the file name; falls back to {@code application/octet-stream}.
 */
public class MimeTypeDetector {

    private static final Logger log = Logger.getLogger(MimeTypeDetector.class);

    public static final String DIRECTORY = "filesystem/directory";

    private static final Detector DETECTOR = new DefaultDetector();

    public String detect(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            return DIRECTORY;
        }

        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, path.getFileName().toString());

        try (TikaInputStream stream = TikaInputStream.get(path)) {
            MediaType mediaType = DETECTOR.detect(stream, metadata);
            log.debugf("Detected %s for %s", mediaType, path);
            return mediaType != null ? mediaType.getBaseType().toString() : MediaType.OCTET_STREAM.toString();
        }
    }
}
