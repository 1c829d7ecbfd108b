package com.example.strmmirror.application.service;

import com.example.strmmirror.domain.model.MediaExtensions;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Maps a remote path to its local counterpart. Pure: never touches the filesystem.
 */
@Component
public class LocalPathMapper {

    static final String DISC_MARKER = "BDMV";
    static final String STREAM_DIR = "STREAM";

    private static final int MAX_NAME_BYTES = 255;

    /**
     * @throws InvalidPathException when the remote path cannot be represented below the target
     *                              directory (over-long names, traversal segments, illegal characters)
     */
    public Path map(String remotePath, String suffix, MirrorConfiguration config) {
        Path targetDir = config.getTargetDir();
        boolean video = config.isVideo(suffix);

        List<String> segments;
        if (config.isFlattenMode()) {
            segments = new ArrayList<>();
            segments.add(video ? replaceSuffix(fileName(remotePath), suffix) : fileName(remotePath));
        } else {
            segments = split(relativize(remotePath, config.getSourceDir()));
            if (!collapseDiscImage(segments, suffix)) {
                int last = segments.size() - 1;
                if (video && last >= 0) {
                    segments.set(last, replaceSuffix(segments.get(last), suffix));
                }
            }
        }

        if (segments.isEmpty()) {
            throw new InvalidPathException(remotePath, "remote path has no file name");
        }
        for (String segment : segments) {
            checkSegment(remotePath, segment);
        }

        Path root = targetDir.normalize();
        Path local = root;
        for (String segment : segments) {
            local = local.resolve(segment);
        }
        local = local.normalize();
        if (!local.startsWith(root) || local.equals(root)) {
            throw new InvalidPathException(remotePath, "resolves outside of " + root);
        }
        return local;
    }

    /**
     * Rewrites {@code [item, ..., BDMV, STREAM, 00001.m2ts]} to {@code [item, item.strm]}. The first
     * relative segment names the media item, so discs nested deeper share that name.
     */
    private boolean collapseDiscImage(List<String> segments, String suffix) {
        int n = segments.size();
        if (!MediaExtensions.DISC_VIDEO.equals(suffix) || n < 4) {
            return false;
        }
        if (!STREAM_DIR.equalsIgnoreCase(segments.get(n - 2)) || !DISC_MARKER.equalsIgnoreCase(segments.get(n - 3))) {
            return false;
        }
        String displayName = segments.get(0);
        segments.clear();
        segments.add(displayName);
        segments.add(displayName + MediaExtensions.POINTER);
        return true;
    }

    static String relativize(String remotePath, String sourceDir) {
        String root = sourceDir == null ? "/" : sourceDir.trim();
        while (root.length() > 1 && root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        String relative = remotePath;
        if (!"/".equals(root) && (remotePath.equals(root) || remotePath.startsWith(root + "/"))) {
            relative = remotePath.substring(root.length());
        }
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return relative;
    }

    private static List<String> split(String relative) {
        List<String> segments = new ArrayList<>();
        for (String segment : relative.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static String fileName(String remotePath) {
        return remotePath.substring(remotePath.lastIndexOf('/') + 1);
    }

    private static String replaceSuffix(String name, String suffix) {
        if (!suffix.isEmpty() && name.length() > suffix.length()
                && name.regionMatches(true, name.length() - suffix.length(), suffix, 0, suffix.length())) {
            return name.substring(0, name.length() - suffix.length()) + MediaExtensions.POINTER;
        }
        return name + MediaExtensions.POINTER;
    }

    private static void checkSegment(String remotePath, String segment) {
        if (".".equals(segment) || "..".equals(segment)) {
            throw new InvalidPathException(remotePath, "relative segment '" + segment + "' not allowed");
        }
        if (segment.indexOf('\0') >= 0) {
            throw new InvalidPathException(remotePath, "NUL character in name");
        }
        if (segment.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw new InvalidPathException(remotePath, "name exceeds " + MAX_NAME_BYTES + " bytes");
        }
    }
}
