package com.example.strmmirror.application.service;

import com.example.strmmirror.domain.model.Classification;
import com.example.strmmirror.domain.model.Classification.Reason;
import com.example.strmmirror.domain.model.DiscImageIndex;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.ProcessedPathSet;
import com.example.strmmirror.domain.model.RemoteEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides per remote entry whether it has to be materialized in this run.
 */
@Component
public class PathClassifier {

    private static final Logger log = LoggerFactory.getLogger(PathClassifier.class);

    private final LocalPathMapper localPathMapper;

    public PathClassifier(LocalPathMapper localPathMapper) {
        this.localPathMapper = localPathMapper;
    }

    /**
     * Every candidate whose local path could be computed is recorded in {@code processed},
     * whether it is accepted or skipped as up to date.
     */
    public Classification classify(RemoteEntry entry,
                                   DiscImageIndex discImages,
                                   MirrorConfiguration config,
                                   ProcessedPathSet processed) {
        if (entry.isDirectory()) {
            return Classification.reject(null, Reason.DIRECTORY);
        }

        String path = entry.getPath();
        String suffix = entry.getSuffix();
        if (!discImages.isPrimary(path)) {
            if (discImages.isSuppressed(path) || discImages.isInsideGroup(path)) {
                log.debug("Skip disc-image member {}", path);
                return Classification.reject(null, Reason.DISC_IMAGE_SUPPRESSED);
            }
        }
        if (!config.processExtensions().contains(suffix)) {
            log.debug("Skip {} : extension not processed", entry.getName());
            return Classification.reject(null, Reason.EXTENSION_FILTERED);
        }

        Path localPath;
        try {
            localPath = localPathMapper.map(path, suffix, config);
        } catch (InvalidPathException e) {
            log.warn("LOCAL_PATH_INVALID remotePath={} reason={}", path, e.getMessage());
            return Classification.reject(null, Reason.INVALID_LOCAL_PATH);
        }
        processed.add(localPath);

        if (config.isOverwrite()) {
            return Classification.accept(localPath, Reason.ACCEPTED);
        }
        BasicFileAttributes attributes = readAttributes(localPath);
        if (attributes == null) {
            return Classification.accept(localPath, Reason.ACCEPTED);
        }
        if (!config.isVideo(suffix)) {
            double localModified = attributes.lastModifiedTime().toMillis() / 1000D;
            if (localModified < entry.getModifiedTimestamp()) {
                log.debug("Local {} is older than remote {}, refreshing", localPath.getFileName(), path);
                return Classification.accept(localPath, Reason.STALE);
            }
            if (attributes.size() < entry.getSize()) {
                log.debug("Local {} is smaller than remote {}, refreshing", localPath.getFileName(), path);
                return Classification.accept(localPath, Reason.STALE);
            }
        }
        // pointer files are not re-checked once present
        log.debug("Local {} exists, skip {}", localPath.getFileName(), path);
        return Classification.reject(localPath, Reason.UP_TO_DATE);
    }

    private BasicFileAttributes readAttributes(Path localPath) {
        if (!Files.exists(localPath, LinkOption.NOFOLLOW_LINKS)) {
            return null;
        }
        try {
            return Files.readAttributes(localPath, BasicFileAttributes.class);
        } catch (IOException e) {
            log.debug("Cannot stat {}, treating as missing", localPath, e);
            return null;
        }
    }
}
