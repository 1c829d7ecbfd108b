package com.example.strmmirror.domain.model;

import com.example.strmmirror.domain.enumtype.RunStatus;
import java.time.Instant;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class MirrorRunResult {

    private String sourceId;

    private RunStatus status;

    private Instant startedAt;

    private Instant finishedAt;

    /** Files and directories returned by the remote listing. */
    private int totalEntries;

    private int discImageGroups;

    private int acceptedEntries;

    private int skippedEntries;

    private int pathCollisions;

    private int pointerFilesWritten;

    private int assetsDownloaded;

    private int failedEntries;

    private int deletedFiles;

    private int prunedDirectories;

    private String errorMessage;

    public MirrorRunResult(String sourceId) {
        this.sourceId = sourceId;
        this.startedAt = Instant.now();
    }
}
