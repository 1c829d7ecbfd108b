package com.example.strmmirror.domain.model;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local paths backed by a remote entry in the current run. Files outside this set are
 * candidates for deletion during reconciliation.
 */
public class ProcessedPathSet {

    private final Set<Path> paths = ConcurrentHashMap.newKeySet();

    public void add(Path path) {
        paths.add(normalize(path));
    }

    public void remove(Path path) {
        paths.remove(normalize(path));
    }

    public boolean contains(Path path) {
        return paths.contains(normalize(path));
    }

    public int size() {
        return paths.size();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
