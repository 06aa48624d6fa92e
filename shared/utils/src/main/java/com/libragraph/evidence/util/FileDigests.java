package com.libragraph.evidence.util;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Chunked digests over files and directory trees.
 *
 * <p>Files are read {@code bufferSize} bytes at a time so large natives never
 * have to fit in memory.
 */
public final class FileDigests {

    public static final int DEFAULT_BUFFER_SIZE = 65536;

    private FileDigests() {
    }

    public static ContentHash sha1(Path file, int bufferSize) throws IOException {
        MessageDigest digest = DigestUtils.getSha1Digest();
        update(digest, file, bufferSize);
        return new ContentHash(digest.digest());
    }

    public static String md5Hex(Path file, int bufferSize) throws IOException {
        MessageDigest digest = DigestUtils.getMd5Digest();
        update(digest, file, bufferSize);
        return Hex.encodeHexString(digest.digest());
    }

    public static String md5Hex(byte[] data) {
        return DigestUtils.md5Hex(data);
    }

    /**
     * Digests a directory tree: every regular file's name followed by its bytes,
     * visited in sorted path order so the result does not depend on the file system's
     * listing order.
     */
    public static ContentHash sha1Tree(Path directory, int bufferSize) throws IOException {
        MessageDigest digest = DigestUtils.getSha1Digest();
        updateTree(digest, directory, bufferSize);
        return new ContentHash(digest.digest());
    }

    private static void updateTree(MessageDigest digest, Path directory, int bufferSize) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            digest.update(file.getFileName().toString().getBytes(StandardCharsets.UTF_8));
            update(digest, file, bufferSize);
        }
    }

    private static void update(MessageDigest digest, Path file, int bufferSize) throws IOException {
        int size = bufferSize > 0 ? bufferSize : DEFAULT_BUFFER_SIZE;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file), size)) {
            DigestUtils.updateDigest(digest, in);
        }
    }
}
