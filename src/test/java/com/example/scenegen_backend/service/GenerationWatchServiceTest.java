package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.dto.SceneStatusView;
import com.example.scenegen_backend.exception.SceneGenException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationWatchServiceTest {

    private static final Duration TICK = Duration.ofMillis(20);

    private final UUID sceneId = UUID.randomUUID();
    private final UUID ownerId = UUID.randomUUID();
    private SceneStatusService statusService;
    private ThreadPoolTaskScheduler scheduler;
    private GenerationWatchService watches;

    @BeforeEach
    void setup() {
        statusService = mock(SceneStatusService.class);
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        watches = new GenerationWatchService(statusService, scheduler, new SceneProperties());
    }

    @AfterEach
    void teardown() {
        scheduler.shutdown();
    }

    @Test
    void endsWhenSceneSettles() throws Exception {
        when(statusService.pollOnce(sceneId, ownerId)).thenReturn(view(false), view(false), view(true));
        Recorder recorder = new Recorder();

        watches.watch(sceneId, ownerId, recorder, TICK, 50);

        assertThat(recorder.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(recorder.reason.get()).isEqualTo(GenerationWatchService.EndReason.TERMINAL);
        assertThat(recorder.updates).hasSize(3);
        assertThat(recorder.updates.get(2).isTerminal()).isTrue();
        assertThat(watches.activeCount()).isZero();
    }

    @Test
    void stopsAfterMaxAttempts() throws Exception {
        when(statusService.pollOnce(sceneId, ownerId)).thenReturn(view(false));
        Recorder recorder = new Recorder();

        watches.watch(sceneId, ownerId, recorder, TICK, 3);

        assertThat(recorder.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(recorder.reason.get()).isEqualTo(GenerationWatchService.EndReason.MAX_ATTEMPTS);
        assertThat(recorder.updates).hasSize(3);
    }

    @Test
    void pollFailureEndsWatchWithError() throws Exception {
        when(statusService.pollOnce(any(UUID.class), any(UUID.class))).thenThrow(SceneGenException.notFound("Scene not found"));
        Recorder recorder = new Recorder();

        watches.watch(sceneId, ownerId, recorder, TICK, 10);

        assertThat(recorder.ended.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(recorder.reason.get()).isEqualTo(GenerationWatchService.EndReason.ERROR);
        assertThat(recorder.error.get()).isInstanceOf(SceneGenException.class);
    }

    @Test
    void cancelStopsFurtherPolling() throws Exception {
        when(statusService.pollOnce(sceneId, ownerId)).thenReturn(view(false));
        Recorder recorder = new Recorder();

        GenerationWatchService.Handle handle = watches.watch(sceneId, ownerId, recorder, Duration.ofSeconds(10), 10);
        handle.cancel();

        assertThat(recorder.ended.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(recorder.reason.get()).isEqualTo(GenerationWatchService.EndReason.CANCELLED);
        assertThat(handle.isActive()).isFalse();
        Thread.sleep(100);
        verify(statusService, atMost(1)).pollOnce(sceneId, ownerId);
    }

    private SceneStatusView view(boolean terminal) {
        return new SceneStatusView(sceneId, UUID.randomUUID(), 1, terminal ? "ready" : "processing",
                terminal ? "completed" : "processing", terminal ? "completed" : "processing", terminal ? 100 : 50,
                null, terminal, null, null);
    }

    private static final class Recorder implements GenerationWatchService.Listener {
        final List<SceneStatusView> updates = new CopyOnWriteArrayList<>();
        final CountDownLatch ended = new CountDownLatch(1);
        final AtomicReference<GenerationWatchService.EndReason> reason = new AtomicReference<>();
        final AtomicReference<Exception> error = new AtomicReference<>();

        @Override
        public void onUpdate(SceneStatusView view) {
            updates.add(view);
        }

        @Override
        public void onEnd(GenerationWatchService.EndReason r) {
            reason.set(r);
            ended.countDown();
        }

        @Override
        public void onError(Exception e) {
            error.set(e);
        }
    }
}
