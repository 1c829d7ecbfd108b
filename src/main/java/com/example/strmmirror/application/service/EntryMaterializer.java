package com.example.strmmirror.application.service;

import com.example.strmmirror.common.util.LocalFileUtil;
import com.example.strmmirror.common.util.NamedThreadFactory;
import com.example.strmmirror.domain.model.MaterializeResult;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.ProcessedPathSet;
import com.example.strmmirror.domain.model.RemoteEntry;
import com.example.strmmirror.infrastructure.download.AssetDownloader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes pointer files and downloads auxiliary assets with two budgets: a worker pool sized
 * {@code max-workers} bounds entries in flight, a semaphore sized {@code max-downloaders} bounds
 * concurrent transfers inside those workers.
 */
@Component
public class EntryMaterializer {

    private static final Logger log = LoggerFactory.getLogger(EntryMaterializer.class);

    /**
     * Materialize every entry of {@code work} (local path to remote entry) and return once all
     * submitted tasks have finished, successfully or not.
     */
    public MaterializeResult materialize(Map<Path, RemoteEntry> work,
                                         MirrorConfiguration config,
                                         AssetDownloader downloader,
                                         ProcessedPathSet processed,
                                         BooleanSupplier cancelSignal) {
        MaterializeResult result = new MaterializeResult();
        if (work.isEmpty()) {
            return result;
        }
        int workers = Math.min(config.getMaxWorkers(), work.size());
        ExecutorService executor = Executors.newFixedThreadPool(
                workers, new NamedThreadFactory("mirror-" + config.getId() + "-"));
        Semaphore downloadPermits = new Semaphore(config.getMaxDownloaders());
        List<Future<?>> futures = new ArrayList<>(work.size());
        try {
            for (Map.Entry<Path, RemoteEntry> item : work.entrySet()) {
                if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                    result.markCanceled();
                    log.info("MATERIALIZE_CANCELED sourceId={} submitted={} total={}",
                            config.getId(), futures.size(), work.size());
                    break;
                }
                Path localPath = item.getKey();
                RemoteEntry entry = item.getValue();
                futures.add(executor.submit(() ->
                        materializeOne(localPath, entry, config, downloader, downloadPermits, processed, result)));
            }
            awaitAll(futures, result);
        } finally {
            executor.shutdown();
        }
        return result;
    }

    void materializeOne(Path localPath,
                        RemoteEntry entry,
                        MirrorConfiguration config,
                        AssetDownloader downloader,
                        Semaphore downloadPermits,
                        ProcessedPathSet processed,
                        MaterializeResult result) {
        try {
            Files.createDirectories(localPath.toAbsolutePath().getParent());
        } catch (IOException | RuntimeException e) {
            processed.remove(localPath);
            result.failed();
            log.error("Create parent directory failed, localPath={}", localPath, e);
            return;
        }

        if (config.isVideo(entry.getSuffix())) {
            String content = pointerContent(entry, config);
            if (content == null || content.isEmpty()) {
                result.failed();
                log.error("No {} address for {}, strm not written", config.getMode(), entry.getPath());
                return;
            }
            try {
                LocalFileUtil.writeStringAtomically(localPath, content);
                result.pointerWritten();
                log.info("STRM_WRITTEN localPath={} remotePath={}", localPath, entry.getPath());
            } catch (IOException | RuntimeException e) {
                result.failed();
                log.error("Write strm failed, localPath={}", localPath, e);
            }
            return;
        }

        boolean acquired = false;
        try {
            downloadPermits.acquire();
            acquired = true;
            downloader.download(entry.getRawUrl(), localPath);
            result.assetDownloaded();
            log.info("ASSET_DOWNLOADED localPath={} remotePath={}", localPath, entry.getPath());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.failed();
            log.warn("Download interrupted, localPath={}", localPath);
        } catch (IOException | RuntimeException e) {
            result.failed();
            log.error("Download failed, url={}, localPath={}", entry.getRawUrl(), localPath, e);
        } finally {
            if (acquired) {
                downloadPermits.release();
            }
        }
    }

    String pointerContent(RemoteEntry entry, MirrorConfiguration config) {
        switch (config.getMode()) {
            case RAW_URL:
                return entry.getRawUrl();
            case ALIST_PATH:
                return entry.getPath();
            case ALIST_URL:
            default:
                return entry.getPrimaryUrl();
        }
    }

    private void awaitAll(List<Future<?>> futures, MaterializeResult result) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.markCanceled();
                log.warn("Materialize join interrupted, remaining tasks left to finish on their own");
                return;
            } catch (ExecutionException e) {
                result.failed();
                log.error("Materialize task failed unexpectedly", e.getCause());
            }
        }
    }
}
