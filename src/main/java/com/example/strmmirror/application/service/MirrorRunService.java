package com.example.strmmirror.application.service;

import com.example.strmmirror.domain.enumtype.RunStatus;
import com.example.strmmirror.domain.model.Classification;
import com.example.strmmirror.domain.model.DiscImageIndex;
import com.example.strmmirror.domain.model.MaterializeResult;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.MirrorRunResult;
import com.example.strmmirror.domain.model.ProcessedPathSet;
import com.example.strmmirror.domain.model.ReconcileResult;
import com.example.strmmirror.domain.model.RemoteEntry;
import com.example.strmmirror.infrastructure.remote.RemoteSession;
import com.example.strmmirror.infrastructure.remote.RemoteSourceConnector;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * One mirror pass: enumerate, resolve disc images, classify, materialize, reconcile.
 */
@Service
public class MirrorRunService {

    private static final Logger log = LoggerFactory.getLogger(MirrorRunService.class);

    private final RemoteSourceConnector remoteSourceConnector;
    private final DiscImageResolver discImageResolver;
    private final PathClassifier pathClassifier;
    private final EntryMaterializer entryMaterializer;
    private final LocalTreeReconciler localTreeReconciler;
    private final MeterRegistry meterRegistry;

    public MirrorRunService(RemoteSourceConnector remoteSourceConnector,
                            DiscImageResolver discImageResolver,
                            PathClassifier pathClassifier,
                            EntryMaterializer entryMaterializer,
                            LocalTreeReconciler localTreeReconciler,
                            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.remoteSourceConnector = remoteSourceConnector;
        this.discImageResolver = discImageResolver;
        this.pathClassifier = pathClassifier;
        this.entryMaterializer = entryMaterializer;
        this.localTreeReconciler = localTreeReconciler;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Runs one pass for {@code config}. Only a failed remote enumeration aborts the run; every
     * per-entry failure is logged and counted.
     */
    public MirrorRunResult run(MirrorConfiguration config, BooleanSupplier cancelSignal) {
        long startNanos = System.nanoTime();
        MirrorRunResult result = new MirrorRunResult(config.getId());
        log.info("MIRROR_RUN_START sourceId={} sourceType={} sourceDir={} targetDir={} mode={} flatten={} syncServer={}",
                config.getId(), config.getSourceType(), config.getSourceDir(), config.getTargetDir(),
                config.getMode(), config.isFlattenMode(), config.isSyncServer());

        RemoteSession session;
        try {
            session = remoteSourceConnector.open(config);
        } catch (RuntimeException e) {
            return abort(result, config, e, startNanos);
        }
        try {
            List<RemoteEntry> entries;
            try {
                entries = enumerate(session, config, cancelSignal);
            } catch (RuntimeException e) {
                return abort(result, config, e, startNanos);
            }
            result.setTotalEntries(entries.size());
            if (isCanceled(cancelSignal)) {
                result.setStatus(RunStatus.CANCELED);
                log.info("MIRROR_RUN_CANCELED sourceId={} stage=enumerate entries={}", config.getId(), entries.size());
                return finish(result, startNanos);
            }
            log.info("MIRROR_RUN_DISCOVERED sourceId={} entries={}", config.getId(), entries.size());

            DiscImageIndex discImages = discImageResolver.resolve(entries);
            result.setDiscImageGroups(discImages.getGroups().size());

            ProcessedPathSet processed = new ProcessedPathSet();
            Map<Path, RemoteEntry> work = classify(entries, discImages, config, processed, result);
            log.info("MIRROR_RUN_CLASSIFIED sourceId={} accepted={} skipped={} discImages={} collisions={}",
                    config.getId(), work.size(), result.getSkippedEntries(), result.getDiscImageGroups(),
                    result.getPathCollisions());

            MaterializeResult materialized = entryMaterializer.materialize(
                    work, config, session.getDownloader(), processed, cancelSignal);
            result.setPointerFilesWritten(materialized.getPointerFilesWritten());
            result.setAssetsDownloaded(materialized.getAssetsDownloaded());
            result.setFailedEntries(materialized.getFailed());
            if (materialized.isCanceled() || isCanceled(cancelSignal)) {
                result.setStatus(RunStatus.CANCELED);
                log.info("MIRROR_RUN_CANCELED sourceId={} stage=materialize", config.getId());
                return finish(result, startNanos);
            }

            if (config.isSyncServer()) {
                ReconcileResult reconciled = localTreeReconciler.reconcile(config, processed);
                result.setDeletedFiles(reconciled.getDeletedFiles());
                result.setPrunedDirectories(reconciled.getPrunedDirectories());
            }
            result.setStatus(RunStatus.COMPLETED);
            return finish(result, startNanos);
        } finally {
            closeSession(session, config);
        }
    }

    private MirrorRunResult abort(MirrorRunResult result, MirrorConfiguration config, Exception e, long startNanos) {
        result.setStatus(RunStatus.ABORTED);
        result.setErrorMessage(e.getMessage());
        log.error("MIRROR_RUN_ABORTED sourceId={} sourceDir={} reason={}",
                config.getId(), config.getSourceDir(), e.getMessage(), e);
        return finish(result, startNanos);
    }

    private void closeSession(RemoteSession session, MirrorConfiguration config) {
        try {
            session.close();
        } catch (IOException e) {
            log.warn("Remote session close failed, sourceId={}", config.getId(), e);
        }
    }

    private List<RemoteEntry> enumerate(RemoteSession session, MirrorConfiguration config, BooleanSupplier cancelSignal) {
        List<RemoteEntry> entries = new ArrayList<>();
        for (RemoteEntry entry : session.getListingClient().listTree(
                config.getSourceDir(), config.getWaitTime(), config.requiresDetail())) {
            entries.add(entry);
            if (entries.size() % 1000 == 0) {
                log.info("MIRROR_RUN_PROGRESS sourceId={} discovered={}", config.getId(), entries.size());
                if (isCanceled(cancelSignal)) {
                    break;
                }
            }
        }
        return entries;
    }

    private Map<Path, RemoteEntry> classify(List<RemoteEntry> entries,
                                            DiscImageIndex discImages,
                                            MirrorConfiguration config,
                                            ProcessedPathSet processed,
                                            MirrorRunResult result) {
        Map<Path, RemoteEntry> work = new LinkedHashMap<>();
        for (RemoteEntry entry : entries) {
            Classification classification = pathClassifier.classify(entry, discImages, config, processed);
            if (!classification.isAccepted()) {
                if (!entry.isDirectory()) {
                    result.setSkippedEntries(result.getSkippedEntries() + 1);
                }
                continue;
            }
            Path localPath = classification.getLocalPath().toAbsolutePath().normalize();
            RemoteEntry previous = work.remove(localPath);
            if (previous != null) {
                result.setPathCollisions(result.getPathCollisions() + 1);
                log.warn("MIRROR_PATH_COLLISION sourceId={} localPath={} replaced={} by={}",
                        config.getId(), localPath, previous.getPath(), entry.getPath());
            }
            work.put(localPath, entry);
        }
        result.setAcceptedEntries(work.size());
        return work;
    }

    private MirrorRunResult finish(MirrorRunResult result, long startNanos) {
        result.setFinishedAt(Instant.now());
        String sourceId = result.getSourceId();
        log.info("MIRROR_RUN_FINISH sourceId={} status={} entries={} accepted={} skipped={} strm={} downloaded={} "
                        + "failed={} deleted={} prunedDirs={} costMs={}",
                sourceId, result.getStatus(), result.getTotalEntries(), result.getAcceptedEntries(),
                result.getSkippedEntries(), result.getPointerFilesWritten(), result.getAssetsDownloaded(),
                result.getFailedEntries(), result.getDeletedFiles(), result.getPrunedDirectories(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        incrementCounter("strm.mirror.entry.written", result.getPointerFilesWritten(), "source", sourceId);
        incrementCounter("strm.mirror.entry.downloaded", result.getAssetsDownloaded(), "source", sourceId);
        incrementCounter("strm.mirror.entry.failed", result.getFailedEntries(), "source", sourceId);
        incrementCounter("strm.mirror.file.deleted", result.getDeletedFiles(), "source", sourceId);
        recordDuration("strm.mirror.run.duration", System.nanoTime() - startNanos,
                "source", sourceId, "status", result.getStatus().name());
        return result;
    }

    private static boolean isCanceled(BooleanSupplier cancelSignal) {
        return cancelSignal != null && cancelSignal.getAsBoolean();
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }
}
