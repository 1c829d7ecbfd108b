package com.example.strmmirror.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class MediaExtensions {

    /** Transport-stream files inside a BDMV/STREAM directory. */
    public static final String DISC_VIDEO = ".m2ts";

    public static final String POINTER = ".strm";

    public static final Set<String> VIDEO = of(
            ".mp4", ".mkv", ".flv", ".avi", ".wmv", ".ts", ".rmvb", ".webm", ".mpg", ".mpeg",
            ".mov", ".m4v", ".3gp", ".vob", ".iso", DISC_VIDEO);

    public static final Set<String> SUBTITLE = of(".ass", ".srt", ".ssa", ".sub", ".sup", ".vtt", ".idx");

    public static final Set<String> IMAGE = of(".png", ".jpg", ".jpeg", ".bmp", ".gif", ".webp", ".tiff");

    public static final Set<String> NFO = of(".nfo");

    private MediaExtensions() {
    }

    private static Set<String> of(String... extensions) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(extensions)));
    }
}
