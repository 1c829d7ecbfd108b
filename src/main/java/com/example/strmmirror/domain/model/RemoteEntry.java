package com.example.strmmirror.domain.model;

import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * One file or directory of the remote listing, as seen during a single mirror run.
 */
@Value
@Builder
public class RemoteEntry {

    /** Absolute slash-delimited remote path, unique within a run. */
    String path;

    String name;

    boolean directory;

    long size;

    /** Seconds since epoch. */
    double modifiedTimestamp;

    String primaryUrl;

    String rawUrl;

    /**
     * Lower-cased extension including the dot, or an empty string when the name has none.
     */
    public String getSuffix() {
        return suffixOf(name);
    }

    public String getParentPath() {
        int idx = path.lastIndexOf('/');
        if (idx <= 0) {
            return "/";
        }
        return path.substring(0, idx);
    }

    public static String suffixOf(String name) {
        if (name == null) {
            return "";
        }
        int idx = name.lastIndexOf('.');
        if (idx <= 0 || idx == name.length() - 1) {
            return "";
        }
        return name.substring(idx).toLowerCase(Locale.ROOT);
    }
}
