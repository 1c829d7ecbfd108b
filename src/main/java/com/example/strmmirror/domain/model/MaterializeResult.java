package com.example.strmmirror.domain.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters filled concurrently by materialization tasks.
 */
public class MaterializeResult {

    private final AtomicInteger pointerFilesWritten = new AtomicInteger();
    private final AtomicInteger assetsDownloaded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private volatile boolean canceled;

    public void pointerWritten() {
        pointerFilesWritten.incrementAndGet();
    }

    public void assetDownloaded() {
        assetsDownloaded.incrementAndGet();
    }

    public void failed() {
        failed.incrementAndGet();
    }

    public void markCanceled() {
        this.canceled = true;
    }

    public int getPointerFilesWritten() {
        return pointerFilesWritten.get();
    }

    public int getAssetsDownloaded() {
        return assetsDownloaded.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public boolean isCanceled() {
        return canceled;
    }
}
