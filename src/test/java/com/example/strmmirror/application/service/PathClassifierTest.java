package com.example.strmmirror.application.service;

import static com.example.strmmirror.application.service.DiscImageResolverTest.dir;
import static com.example.strmmirror.application.service.DiscImageResolverTest.file;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.strmmirror.domain.model.Classification;
import com.example.strmmirror.domain.model.Classification.Reason;
import com.example.strmmirror.domain.model.DiscImageIndex;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.ProcessedPathSet;
import com.example.strmmirror.domain.model.RemoteEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathClassifierTest {

    @TempDir
    Path tempDir;

    private PathClassifier classifier;
    private ProcessedPathSet processed;
    private MirrorConfiguration config;

    @BeforeEach
    void setUp() {
        classifier = new PathClassifier(new LocalPathMapper());
        processed = new ProcessedPathSet();
        config = MirrorConfiguration.builder()
                .id("test")
                .sourceDir("/src")
                .targetDir(tempDir)
                .subtitle(true)
                .build();
    }

    @Test
    void directoryShouldNeverBeAccepted() {
        Classification result = classify(dir("/src/Movies"), config);

        assertFalse(result.isAccepted());
        assertEquals(Reason.DIRECTORY, result.getReason());
        assertEquals(0, processed.size());
    }

    @Test
    void unknownExtensionShouldBeFiltered() {
        Classification result = classify(file("/src/readme.txt", 10), config);

        assertEquals(Reason.EXTENSION_FILTERED, result.getReason());
        assertEquals(0, processed.size());
    }

    @Test
    void otherExtShouldWidenProcessedExtensions() {
        MirrorConfiguration withTxt = config.toBuilder().otherExt("txt, .MKA").build();

        assertTrue(classify(file("/src/readme.txt", 10), withTxt).isAccepted());
        assertTrue(classify(file("/src/track.mka", 10), withTxt).isAccepted());
    }

    @Test
    void missingLocalFileShouldBeAcceptedAndRecorded() {
        Classification result = classify(file("/src/Movies/a.mkv", 100), config);

        assertTrue(result.isAccepted());
        assertEquals(tempDir.resolve("Movies/a.strm"), result.getLocalPath());
        assertTrue(processed.contains(tempDir.resolve("Movies/a.strm")));
    }

    @Test
    void existingPointerShouldBeSkippedButStillRecorded() throws IOException {
        Path local = writeLocal("Movies/a.strm", "http://old");
        Files.setLastModifiedTime(local, FileTime.fromMillis(1L));

        Classification result = classify(file("/src/Movies/a.mkv", 100), config);

        assertFalse(result.isAccepted());
        assertEquals(Reason.UP_TO_DATE, result.getReason());
        assertTrue(processed.contains(local));
    }

    @Test
    void overwriteShouldAcceptExistingFiles() throws IOException {
        writeLocal("Movies/a.strm", "http://old");

        Classification result = classify(file("/src/Movies/a.mkv", 100), config.toBuilder().overwrite(true).build());

        assertTrue(result.isAccepted());
    }

    @Test
    void olderAuxiliaryFileShouldBeStale() throws IOException {
        Path local = writeLocal("Movies/a.srt", "0123456789");
        Files.setLastModifiedTime(local, FileTime.fromMillis(500_000L));

        Classification result = classify(file("/src/Movies/a.srt", 5), config);

        assertTrue(result.isAccepted());
        assertEquals(Reason.STALE, result.getReason());
    }

    @Test
    void smallerAuxiliaryFileShouldBeStale() throws IOException {
        writeLocal("Movies/a.srt", "01");

        Classification result = classify(file("/src/Movies/a.srt", 5), config);

        assertEquals(Reason.STALE, result.getReason());
    }

    @Test
    void currentAuxiliaryFileShouldBeUpToDate() throws IOException {
        writeLocal("Movies/a.srt", "0123456789");

        Classification result = classify(file("/src/Movies/a.srt", 5), config);

        assertFalse(result.isAccepted());
        assertEquals(Reason.UP_TO_DATE, result.getReason());
    }

    @Test
    void auxiliaryCategoriesShouldBeIgnoredInFlattenMode() {
        MirrorConfiguration flatten = config.toBuilder().flattenMode(true).build();

        assertEquals(Reason.EXTENSION_FILTERED, classify(file("/src/Movies/a.srt", 5), flatten).getReason());
    }

    @Test
    void discImageMembersShouldFollowIndex() {
        RemoteEntry primary = file("/src/Heat/BDMV/STREAM/00002.m2ts", 999);
        RemoteEntry other = file("/src/Heat/BDMV/STREAM/00001.m2ts", 10);
        RemoteEntry nested = file("/src/Heat/BDMV/BACKUP/extra.mkv", 10);
        DiscImageIndex index = new DiscImageResolver().resolve(
                Arrays.asList(dir("/src/Heat/BDMV"), other, primary, nested));

        Classification primaryResult = classifier.classify(primary, index, config, processed);
        Classification otherResult = classifier.classify(other, index, config, processed);
        Classification nestedResult = classifier.classify(nested, index, config, processed);

        assertTrue(primaryResult.isAccepted());
        assertEquals(tempDir.resolve("Heat/Heat.strm"), primaryResult.getLocalPath());
        assertEquals(Reason.DISC_IMAGE_SUPPRESSED, otherResult.getReason());
        assertNull(otherResult.getLocalPath());
        assertEquals(Reason.DISC_IMAGE_SUPPRESSED, nestedResult.getReason());
        assertEquals(1, processed.size());
    }

    @Test
    void unmappablePathShouldBeRejected() {
        Classification result = classify(file("/src/../escape.mkv", 1), config);

        assertEquals(Reason.INVALID_LOCAL_PATH, result.getReason());
        assertEquals(0, processed.size());
    }

    private Classification classify(RemoteEntry entry, MirrorConfiguration configuration) {
        return classifier.classify(entry, DiscImageIndex.empty(), configuration, processed);
    }

    private Path writeLocal(String relative, String content) throws IOException {
        Path local = tempDir.resolve(relative);
        Files.createDirectories(local.getParent());
        Files.write(local, content.getBytes());
        return local;
    }
}
