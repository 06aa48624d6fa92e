package com.libragraph.evidence.core.manifest;

import com.libragraph.evidence.core.build.EntryTree;
import com.libragraph.evidence.core.entry.Entry;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Where each entry lands inside a container.
 *
 * <p>Files and mapping texts get unique paths; a path already taken gets a {@code " (n)"}
 * suffix before its extension. Directory entries share their path with same-named siblings.
 */
public final class NativeLayout {

    private final Map<String, String> pathById;

    private NativeLayout(Map<String, String> pathById) {
        this.pathById = Collections.unmodifiableMap(pathById);
    }

    public static NativeLayout plan(EntryTree tree) {
        Map<String, String> pathById = new HashMap<>();
        Set<String> taken = new HashSet<>();
        for (Entry entry : tree.depthFirst()) {
            String path = tree.relativePath(entry);
            switch (entry.entryType()) {
                case DIRECTORY -> {
                    taken.add(path);
                    pathById.put(entry.id(), path);
                }
                case FILE -> pathById.put(entry.id(), claim(path, taken));
                case MAPPING -> {
                    if (entry.text() != null) {
                        pathById.put(entry.id(), claim(path, taken));
                    }
                }
            }
        }
        return new NativeLayout(pathById);
    }

    /**
     * Container path of the entry's native or directory record, if it has one.
     */
    public Optional<String> pathOf(Entry entry) {
        return Optional.ofNullable(pathById.get(entry.id()));
    }

    static String claim(String path, Set<String> taken) {
        if (taken.add(path)) {
            return path;
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        boolean hasExtension = dot > slash + 1;
        String stem = hasExtension ? path.substring(0, dot) : path;
        String extension = hasExtension ? path.substring(dot) : "";
        for (int n = 1; ; n++) {
            String candidate = stem + " (" + n + ")" + extension;
            if (taken.add(candidate)) {
                return candidate;
            }
        }
    }
}
