package com.example.strmmirror.domain.model;

import com.example.strmmirror.domain.enumtype.AddressingMode;
import com.example.strmmirror.domain.enumtype.SourceType;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;
import org.springframework.util.StringUtils;

/**
 * Immutable settings of one configured remote source. Built once and reused by every run of
 * that source.
 */
@Value
@Builder(toBuilder = true)
public class MirrorConfiguration {

    public static final String DEFAULT_URL = "http://localhost:5244";
    public static final String DEFAULT_SOURCE_DIR = "/";
    public static final int DEFAULT_MAX_WORKERS = 50;
    public static final int DEFAULT_MAX_DOWNLOADERS = 5;

    String id;

    @Builder.Default
    SourceType sourceType = SourceType.ALIST;

    @Builder.Default
    String url = DEFAULT_URL;

    @Builder.Default
    String username = "";

    @Builder.Default
    String password = "";

    @Builder.Default
    String token = "";

    @Builder.Default
    String sourceDir = DEFAULT_SOURCE_DIR;

    Path targetDir;

    @Builder.Default
    AddressingMode mode = AddressingMode.ALIST_URL;

    boolean flattenMode;

    boolean subtitle;

    boolean image;

    boolean nfo;

    /** Extra auxiliary extensions, comma separated. */
    @Builder.Default
    String otherExt = "";

    boolean overwrite;

    @Builder.Default
    int maxWorkers = DEFAULT_MAX_WORKERS;

    @Builder.Default
    int maxDownloaders = DEFAULT_MAX_DOWNLOADERS;

    @Builder.Default
    Duration waitTime = Duration.ZERO;

    boolean syncServer;

    /** File names matching this pattern survive reconciliation. */
    Pattern syncIgnore;

    /**
     * Auxiliary extensions downloaded next to the pointer files. Always empty in flatten mode.
     */
    public Set<String> downloadExtensions() {
        if (flattenMode) {
            return Collections.emptySet();
        }
        Set<String> extensions = new LinkedHashSet<>();
        if (subtitle) {
            extensions.addAll(MediaExtensions.SUBTITLE);
        }
        if (image) {
            extensions.addAll(MediaExtensions.IMAGE);
        }
        if (nfo) {
            extensions.addAll(MediaExtensions.NFO);
        }
        extensions.addAll(otherExtensions());
        return extensions;
    }

    public Set<String> processExtensions() {
        Set<String> extensions = new LinkedHashSet<>(MediaExtensions.VIDEO);
        extensions.addAll(downloadExtensions());
        return extensions;
    }

    public boolean isVideo(String suffix) {
        return MediaExtensions.VIDEO.contains(suffix);
    }

    /** Whether the listing client has to resolve direct URLs for every file. */
    public boolean requiresDetail() {
        return mode == AddressingMode.RAW_URL || !downloadExtensions().isEmpty();
    }

    /**
     * Checks option values that cannot be expressed by types alone.
     *
     * @throws IllegalArgumentException naming the offending option
     */
    public MirrorConfiguration validate() {
        if (!StringUtils.hasText(id)) {
            throw new IllegalArgumentException("mirror source id must not be blank");
        }
        if (targetDir == null) {
            throw new IllegalArgumentException("mirror source '" + id + "': target-dir is required");
        }
        if (!StringUtils.hasText(sourceDir) || !sourceDir.startsWith("/")) {
            throw new IllegalArgumentException("mirror source '" + id + "': source-dir must be an absolute remote path");
        }
        if (!StringUtils.hasText(url) && sourceType == SourceType.ALIST) {
            throw new IllegalArgumentException("mirror source '" + id + "': url is required");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("mirror source '" + id + "': max-workers must be >= 1");
        }
        if (maxDownloaders < 1 || maxDownloaders > maxWorkers) {
            throw new IllegalArgumentException("mirror source '" + id
                    + "': max-downloaders must be between 1 and max-workers (" + maxWorkers + ")");
        }
        if (waitTime == null || waitTime.isNegative()) {
            throw new IllegalArgumentException("mirror source '" + id + "': wait-time must not be negative");
        }
        if (sourceType == null || mode == null) {
            throw new IllegalArgumentException("mirror source '" + id + "': source-type and mode are required");
        }
        return this;
    }

    private Set<String> otherExtensions() {
        if (!StringUtils.hasText(otherExt)) {
            return Collections.emptySet();
        }
        return Arrays.stream(otherExt.split(","))
                .map(item -> item.trim().toLowerCase(Locale.ROOT))
                .filter(item -> !item.isEmpty())
                .map(item -> item.startsWith(".") ? item : "." + item)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
