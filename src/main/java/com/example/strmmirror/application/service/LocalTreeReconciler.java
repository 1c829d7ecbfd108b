package com.example.strmmirror.application.service;

import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.ProcessedPathSet;
import com.example.strmmirror.domain.model.ReconcileResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deletes local files that no remote entry of the current run accounts for, then prunes the
 * directories left empty.
 */
@Component
public class LocalTreeReconciler {

    private static final Logger log = LoggerFactory.getLogger(LocalTreeReconciler.class);

    public ReconcileResult reconcile(MirrorConfiguration config, ProcessedPathSet processed) {
        ReconcileResult result = new ReconcileResult();
        Path root = config.getTargetDir().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.info("RECONCILE_SKIPPED sourceId={} reason=target-missing targetDir={}", config.getId(), root);
            return result;
        }

        List<Path> localFiles;
        try {
            localFiles = listLocalFiles(root, config.isFlattenMode());
        } catch (IOException | UncheckedIOException e) {
            log.error("RECONCILE_FAILED sourceId={} cannot list {}", config.getId(), root, e);
            return result;
        }
        result.setScannedFiles(localFiles.size());

        Pattern ignore = config.getSyncIgnore();
        for (Path file : localFiles) {
            if (processed.contains(file)) {
                continue;
            }
            if (ignore != null && ignore.matcher(file.getFileName().toString()).find()) {
                result.setIgnoredFiles(result.getIgnoredFiles() + 1);
                log.debug("Keep {} : matches sync-ignore", file.getFileName());
                continue;
            }
            try {
                if (!deleteFile(file)) {
                    continue;
                }
            } catch (IOException e) {
                result.setFailedDeletions(result.getFailedDeletions() + 1);
                log.error("Delete orphan failed, file={}", file, e);
                continue;
            }
            result.setDeletedFiles(result.getDeletedFiles() + 1);
            log.info("ORPHAN_DELETED file={}", file);
            if (!config.isFlattenMode()) {
                result.setPrunedDirectories(result.getPrunedDirectories() + pruneEmptyParents(file.getParent(), root));
            }
        }

        log.info("RECONCILE_FINISH sourceId={} scanned={} deleted={} ignored={} prunedDirs={} failed={}",
                config.getId(), result.getScannedFiles(), result.getDeletedFiles(), result.getIgnoredFiles(),
                result.getPrunedDirectories(), result.getFailedDeletions());
        return result;
    }

    /**
     * Walks up from {@code dir} removing empty directories; stops at {@code root}, at the first
     * non-empty directory or at the first failure.
     */
    int pruneEmptyParents(Path dir, Path root) {
        int pruned = 0;
        Path current = dir;
        while (current != null && !current.equals(root) && current.startsWith(root)) {
            try {
                if (!Files.isDirectory(current) || !isEmpty(current)) {
                    break;
                }
                deleteDirectory(current);
            } catch (IOException e) {
                log.warn("Prune empty directory failed, dir={}, reason={}", current, e.getMessage());
                break;
            }
            pruned++;
            log.info("EMPTY_DIR_DELETED dir={}", current);
            current = current.getParent();
        }
        return pruned;
    }

    boolean deleteFile(Path file) throws IOException {
        return Files.deleteIfExists(file);
    }

    void deleteDirectory(Path dir) throws IOException {
        Files.delete(dir);
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
            return !children.iterator().hasNext();
        }
    }

    private static List<Path> listLocalFiles(Path root, boolean flatten) throws IOException {
        try (Stream<Path> stream = flatten ? Files.list(root) : Files.walk(root)) {
            List<Path> files = stream
                    .filter(Files::isRegularFile)
                    .map(path -> path.toAbsolutePath().normalize())
                    .collect(Collectors.toCollection(ArrayList::new));
            Collections.sort(files);
            return files;
        }
    }
}
