package dev.catananti.notifier.scheduler;

import dev.catananti.notifier.config.NotifierConfig;
import dev.catananti.notifier.metrics.NotificationMetrics;
import dev.catananti.notifier.service.NotificationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Periodic refresh of the notification store while the live transport is down.
 * The first tick runs immediately; ticks never overlap, a tick that is still running when the next
 * one is due causes that one to be skipped.
 */
@Component
@Slf4j
public class PollingFallbackLoop {

    private final NotificationStore notificationStore;
    private final NotificationMetrics metrics;
    private final Scheduler scheduler;
    private final Duration interval;
    private final int hoursWindow;

    private Disposable timer;

    public PollingFallbackLoop(NotificationStore notificationStore,
                               NotificationMetrics metrics,
                               NotifierConfig config,
                               @Qualifier("notifierScheduler") Scheduler scheduler) {
        this.notificationStore = notificationStore;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.interval = config.getPollingInterval();
        this.hoursWindow = config.getPollingHoursWindow();
    }

    /**
     * Start polling. Calling it while running restarts the timer.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.debug("Polling fallback already running, restarting timer");
            timer.dispose();
        }
        log.info("Starting polling fallback (every {}s, last {}h)", interval.toSeconds(), hoursWindow);
        timer = Flux.interval(Duration.ZERO, interval, scheduler)
                .onBackpressureDrop(tick -> log.debug("Skipping poll tick {}, previous one still running", tick))
                .concatMap(tick -> poll(), 1)
                .subscribe(
                        null,
                        error -> log.error("Polling fallback terminated unexpectedly: {}", error.getMessage(), error));
    }

    /**
     * @return false when the loop was not running
     */
    public synchronized boolean stop() {
        if (!isRunning()) {
            return false;
        }
        timer.dispose();
        timer = null;
        log.info("Polling fallback stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return timer != null && !timer.isDisposed();
    }

    private Mono<Void> poll() {
        metrics.incrementPollTick();
        return notificationStore.fetch(hoursWindow, null)
                .map(notifications -> notificationStore.getError() == null)
                .flatMap(fetched -> notificationStore.fetchStats()
                        .map(stats -> fetched && notificationStore.getError() == null))
                .doOnNext(succeeded -> {
                    if (succeeded) {
                        log.debug("Poll tick completed ({} unacknowledged)", notificationStore.getNotifications().size());
                    } else {
                        metrics.incrementPollFailure();
                        log.warn("Poll tick failed, will retry in {}s", interval.toSeconds());
                    }
                })
                .onErrorResume(e -> {
                    metrics.incrementPollFailure();
                    log.warn("Poll tick failed: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
