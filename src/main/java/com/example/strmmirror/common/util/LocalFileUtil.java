package com.example.strmmirror.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes that are either fully visible at the target path or not at all.
 */
public final class LocalFileUtil {

    private static final Logger log = LoggerFactory.getLogger(LocalFileUtil.class);

    /** Temp names do not grow with the target name. */
    private static final String TEMP_PREFIX = ".strm-";
    private static final String TEMP_SUFFIX = ".part";

    private LocalFileUtil() {
    }

    public static void writeStringAtomically(Path target, String content) throws IOException {
        Path temp = createSiblingTempFile(target);
        try {
            Files.write(temp, content.getBytes(StandardCharsets.UTF_8));
            moveIntoPlace(temp, target);
        } finally {
            deleteQuietly(temp);
        }
    }

    public static void copyAtomically(InputStream in, Path target) throws IOException {
        Path temp = createSiblingTempFile(target);
        try {
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(temp, target);
        } finally {
            deleteQuietly(temp);
        }
    }

    private static Path createSiblingTempFile(Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        return Files.createTempFile(dir, TEMP_PREFIX, TEMP_SUFFIX);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Temp file delete failed: {}", temp, e);
        }
    }
}
