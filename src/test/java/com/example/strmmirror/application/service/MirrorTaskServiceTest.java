package com.example.strmmirror.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.strmmirror.common.config.AppMirrorProperties;
import com.example.strmmirror.common.exception.BusinessException;
import com.example.strmmirror.domain.enumtype.RunStatus;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.MirrorRunResult;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MirrorTaskServiceTest {

    @TempDir
    Path tempDir;

    private MirrorRunService mirrorRunService;
    private ExecutorService executor;
    private AppMirrorProperties properties;

    @BeforeEach
    void setUp() {
        mirrorRunService = mock(MirrorRunService.class);
        executor = Executors.newSingleThreadExecutor();
        properties = new AppMirrorProperties();
        properties.setSources(Arrays.asList(source("movies"), source("shows")));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runNowShouldRecordLastResult() {
        MirrorRunResult completed = result("movies", RunStatus.COMPLETED);
        when(mirrorRunService.run(any(MirrorConfiguration.class), any(BooleanSupplier.class))).thenReturn(completed);
        MirrorTaskService service = new MirrorTaskService(properties, mirrorRunService, executor);

        assertNull(service.lastResult("movies"));
        assertSame(completed, service.runNow("movies"));
        assertSame(completed, service.lastResult("movies"));
        assertFalse(service.isRunning("movies"));
        assertEquals(Arrays.asList("movies", "shows"), service.getSourceIds());
    }

    @Test
    void unknownSourceShouldBeRejectedWith404() {
        MirrorTaskService service = new MirrorTaskService(properties, mirrorRunService, executor);

        BusinessException e = assertThrows(BusinessException.class, () -> service.trigger("music"));
        assertEquals("404", e.getCode());
    }

    @Test
    void secondTriggerWhileRunningShouldBeRejectedAndCancelShouldStopRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        when(mirrorRunService.run(any(MirrorConfiguration.class), any(BooleanSupplier.class))).thenAnswer(invocation -> {
            BooleanSupplier cancelSignal = invocation.getArgument(1);
            started.countDown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!cancelSignal.getAsBoolean() && System.nanoTime() < deadline) {
                Thread.sleep(5L);
            }
            finished.countDown();
            return result("movies", cancelSignal.getAsBoolean() ? RunStatus.CANCELED : RunStatus.COMPLETED);
        });
        MirrorTaskService service = new MirrorTaskService(properties, mirrorRunService, executor);

        service.trigger("movies");
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(service.isRunning("movies"));

        BusinessException e = assertThrows(BusinessException.class, () -> service.trigger("movies"));
        assertEquals("409", e.getCode());
        assertTrue(service.cancel("movies"));

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        awaitIdle(service, "movies");
        assertEquals(RunStatus.CANCELED, service.lastResult("movies").getStatus());
        assertFalse(service.cancel("movies"));
    }

    @Test
    void fullExecutorShouldReleaseRunningFlag() {
        ExecutorService rejecting = mock(ExecutorService.class);
        doThrow(new RejectedExecutionException("queue full")).when(rejecting).execute(any(Runnable.class));
        MirrorTaskService service = new MirrorTaskService(properties, mirrorRunService, rejecting);

        BusinessException e = assertThrows(BusinessException.class, () -> service.trigger("movies"));

        assertEquals("TASK_EXECUTOR_REJECTED", e.getCode());
        assertFalse(service.isRunning("movies"));
    }

    @Test
    void unexpectedFailureShouldBeRecordedAsAborted() {
        when(mirrorRunService.run(any(MirrorConfiguration.class), any(BooleanSupplier.class)))
                .thenThrow(new IllegalStateException("boom"));
        MirrorTaskService service = new MirrorTaskService(properties, mirrorRunService, executor);

        MirrorRunResult result = service.runNow("shows");

        assertEquals(RunStatus.ABORTED, result.getStatus());
        assertEquals("boom", result.getErrorMessage());
        assertFalse(service.isRunning("shows"));
    }

    @Test
    void duplicateSourceIdsShouldFailStartup() {
        properties.setSources(Arrays.asList(source("movies"), source("movies")));

        assertThrows(IllegalArgumentException.class,
                () -> new MirrorTaskService(properties, mirrorRunService, executor));
    }

    private AppMirrorProperties.Source source(String id) {
        AppMirrorProperties.Source source = new AppMirrorProperties.Source();
        source.setId(id);
        source.setSourceDir("/" + id);
        source.setTargetDir(tempDir.resolve(id).toString());
        return source;
    }

    private static MirrorRunResult result(String sourceId, RunStatus status) {
        MirrorRunResult result = new MirrorRunResult(sourceId);
        result.setStatus(status);
        return result;
    }

    private static void awaitIdle(MirrorTaskService service, String sourceId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (service.isRunning(sourceId) && System.nanoTime() < deadline) {
            Thread.sleep(5L);
        }
    }
}
