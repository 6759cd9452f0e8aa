package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.dto.SceneStatusView;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Repeating poll bound to one subscriber. The watch ends on a terminal state, after the configured
 * number of ticks, on error, or when the subscriber cancels; the provider job is never cancelled.
 */
@Service
public class GenerationWatchService {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationWatchService.class);

    public enum EndReason { TERMINAL, MAX_ATTEMPTS, CANCELLED, ERROR }

    public interface Listener {
        void onUpdate(SceneStatusView view);

        default void onEnd(EndReason reason) {
        }

        default void onError(Exception error) {
        }
    }

    public interface Handle {
        UUID id();

        void cancel();

        boolean isActive();
    }

    private final SceneStatusService statusService;
    private final TaskScheduler scheduler;
    private final SceneProperties props;
    private final Map<UUID, Watch> active = new ConcurrentHashMap<>();

    public GenerationWatchService(SceneStatusService statusService,
                                  @Qualifier("watchTaskScheduler") TaskScheduler scheduler,
                                  SceneProperties props) {
        this.statusService = statusService;
        this.scheduler = scheduler;
        this.props = props;
    }

    public Handle watch(UUID sceneId, UUID ownerId, Listener listener) {
        return watch(sceneId, ownerId, listener, props.getPollInterval(), props.getPollMaxAttempts());
    }

    public Handle watch(UUID sceneId, UUID ownerId, Listener listener, Duration interval, int maxAttempts) {
        Watch watch = new Watch(UUID.randomUUID(), sceneId, ownerId, listener, maxAttempts);
        active.put(watch.id, watch);
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(watch::tick, Instant.now(), interval);
        watch.future.set(future);
        if (!watch.isActive()) {
            // settled on the first tick before the future was published
            future.cancel(false);
        }
        LOGGER.info("SceneWatch START watchId={} sceneId={} interval={}ms max={}", watch.id, sceneId, interval.toMillis(), maxAttempts);
        return watch;
    }

    public int activeCount() {
        return active.size();
    }

    @PreDestroy
    void shutdown() {
        active.values().forEach(Watch::cancel);
    }

    private final class Watch implements Handle {
        private final UUID id;
        private final UUID sceneId;
        private final UUID ownerId;
        private final Listener listener;
        private final int maxAttempts;
        private final AtomicInteger ticks = new AtomicInteger();
        private final AtomicBoolean done = new AtomicBoolean();
        private final AtomicReference<ScheduledFuture<?>> future = new AtomicReference<>();

        private Watch(UUID id, UUID sceneId, UUID ownerId, Listener listener, int maxAttempts) {
            this.id = id;
            this.sceneId = sceneId;
            this.ownerId = ownerId;
            this.listener = listener;
            this.maxAttempts = maxAttempts;
        }

        private void tick() {
            if (done.get()) return;
            try {
                SceneStatusView view = statusService.pollOnce(sceneId, ownerId);
                if (done.get()) return;
                listener.onUpdate(view);
                if (view.isTerminal()) {
                    finish(EndReason.TERMINAL);
                } else if (ticks.incrementAndGet() >= maxAttempts) {
                    finish(EndReason.MAX_ATTEMPTS);
                }
            } catch (Exception e) {
                LOGGER.warn("SceneWatch tick FAIL watchId={} sceneId={} error={}", id, sceneId, e.getMessage());
                listener.onError(e);
                finish(EndReason.ERROR);
            }
        }

        private void finish(EndReason reason) {
            if (!done.compareAndSet(false, true)) return;
            ScheduledFuture<?> f = future.get();
            if (f != null) f.cancel(false);
            active.remove(id);
            LOGGER.info("SceneWatch END watchId={} sceneId={} reason={} ticks={}", id, sceneId, reason, ticks.get());
            listener.onEnd(reason);
        }

        @Override
        public UUID id() {
            return id;
        }

        @Override
        public void cancel() {
            finish(EndReason.CANCELLED);
        }

        @Override
        public boolean isActive() {
            return !done.get();
        }
    }
}
