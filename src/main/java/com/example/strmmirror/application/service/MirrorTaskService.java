package com.example.strmmirror.application.service;

import com.example.strmmirror.common.config.AppMirrorProperties;
import com.example.strmmirror.common.exception.BusinessException;
import com.example.strmmirror.domain.enumtype.RunStatus;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.MirrorRunResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Starts, cancels and tracks mirror passes. At most one pass per source runs at a time.
 */
@Service
public class MirrorTaskService {

    private static final Logger log = LoggerFactory.getLogger(MirrorTaskService.class);

    private final MirrorRunService mirrorRunService;
    private final ExecutorService mirrorTaskExecutor;
    private final Map<String, SourceState> sources;

    public MirrorTaskService(AppMirrorProperties appMirrorProperties,
                             MirrorRunService mirrorRunService,
                             ExecutorService mirrorTaskExecutor) {
        this.mirrorRunService = mirrorRunService;
        this.mirrorTaskExecutor = mirrorTaskExecutor;
        Map<String, SourceState> states = new LinkedHashMap<>();
        for (AppMirrorProperties.Source source : appMirrorProperties.getSources()) {
            MirrorConfiguration config = source.toConfiguration();
            if (states.putIfAbsent(config.getId(), new SourceState(config)) != null) {
                throw new IllegalArgumentException("duplicate mirror source id: " + config.getId());
            }
            log.info("MIRROR_SOURCE_REGISTERED sourceId={} sourceType={} url={} sourceDir={} targetDir={}",
                    config.getId(), config.getSourceType(), config.getUrl(), config.getSourceDir(),
                    config.getTargetDir());
        }
        this.sources = Collections.unmodifiableMap(states);
    }

    /**
     * Queues a pass of {@code sourceId} on the task executor.
     *
     * @throws BusinessException 404 for an unknown source, 409 when a pass of the source is
     *                           already running, TASK_EXECUTOR_REJECTED when the executor is full
     */
    public void trigger(String sourceId) {
        SourceState state = acquire(sourceId);
        try {
            mirrorTaskExecutor.execute(() -> runPass(state));
        } catch (RejectedExecutionException e) {
            state.running.set(false);
            log.warn("MIRROR_TASK_REJECTED sourceId={} reason={}", sourceId, e.getMessage());
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "mirror executor is full, retry later");
        }
        log.info("MIRROR_TASK_SUBMITTED sourceId={}", sourceId);
    }

    /**
     * Runs a pass of {@code sourceId} on the calling thread.
     */
    public MirrorRunResult runNow(String sourceId) {
        return runPass(acquire(sourceId));
    }

    /**
     * Requests cooperative cancellation of the running pass.
     *
     * @return whether a pass was running
     */
    public boolean cancel(String sourceId) {
        SourceState state = require(sourceId);
        if (!state.running.get()) {
            log.info("MIRROR_TASK_CANCEL_IGNORED sourceId={} reason=not-running", sourceId);
            return false;
        }
        state.cancelRequested.set(true);
        log.info("MIRROR_TASK_CANCEL_REQUESTED sourceId={}", sourceId);
        return true;
    }

    public boolean isRunning(String sourceId) {
        return require(sourceId).running.get();
    }

    /**
     * Result of the most recent finished pass, or {@code null} when none has finished yet.
     */
    public MirrorRunResult lastResult(String sourceId) {
        return require(sourceId).lastResult;
    }

    public List<String> getSourceIds() {
        return new ArrayList<>(sources.keySet());
    }

    @PreDestroy
    public void cancelAll() {
        for (SourceState state : sources.values()) {
            if (state.running.get()) {
                state.cancelRequested.set(true);
                log.info("MIRROR_TASK_CANCEL_REQUESTED sourceId={} reason=shutdown", state.config.getId());
            }
        }
    }

    private SourceState require(String sourceId) {
        SourceState state = sourceId == null ? null : sources.get(sourceId);
        if (state == null) {
            throw new BusinessException("404", "mirror source not found: " + sourceId);
        }
        return state;
    }

    private SourceState acquire(String sourceId) {
        SourceState state = require(sourceId);
        if (!state.running.compareAndSet(false, true)) {
            throw new BusinessException("409", "mirror source is already running: " + sourceId);
        }
        state.cancelRequested.set(false);
        return state;
    }

    private MirrorRunResult runPass(SourceState state) {
        String sourceId = state.config.getId();
        try {
            MirrorRunResult result;
            try {
                result = mirrorRunService.run(state.config, state.cancelRequested::get);
            } catch (RuntimeException e) {
                log.error("Mirror pass failed unexpectedly, sourceId={}", sourceId, e);
                result = new MirrorRunResult(sourceId);
                result.setStatus(RunStatus.ABORTED);
                result.setFinishedAt(Instant.now());
                result.setErrorMessage(e.getMessage());
            }
            state.lastResult = result;
            return result;
        } finally {
            state.running.set(false);
        }
    }

    private static final class SourceState {

        private final MirrorConfiguration config;
        private final AtomicBoolean running = new AtomicBoolean(false);
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private volatile MirrorRunResult lastResult;

        private SourceState(MirrorConfiguration config) {
            this.config = config;
        }
    }
}
