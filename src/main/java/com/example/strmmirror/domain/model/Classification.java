package com.example.strmmirror.domain.model;

import java.nio.file.Path;
import lombok.Value;

/**
 * Outcome of classifying one remote entry.
 */
@Value
public class Classification {

    public enum Reason {
        ACCEPTED,
        STALE,
        DIRECTORY,
        EXTENSION_FILTERED,
        DISC_IMAGE_SUPPRESSED,
        UP_TO_DATE,
        INVALID_LOCAL_PATH
    }

    boolean accepted;

    /** Null when the local path could not be computed or was never needed. */
    Path localPath;

    Reason reason;

    public static Classification accept(Path localPath, Reason reason) {
        return new Classification(true, localPath, reason);
    }

    public static Classification reject(Path localPath, Reason reason) {
        return new Classification(false, localPath, reason);
    }
}
