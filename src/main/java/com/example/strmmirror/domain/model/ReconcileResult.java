package com.example.strmmirror.domain.model;

import lombok.Data;

@Data
public class ReconcileResult {

    private int scannedFiles;

    private int deletedFiles;

    private int ignoredFiles;

    private int prunedDirectories;

    private int failedDeletions;
}
