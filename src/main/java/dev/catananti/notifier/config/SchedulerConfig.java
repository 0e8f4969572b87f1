package dev.catananti.notifier.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Timers used by the delivery session: polling ticks, reconnect backoff and the cable heartbeat watchdog.
 * A single named thread keeps timer callbacks ordered and easy to spot in thread dumps.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SchedulerConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler notifierScheduler() {
        log.info("Configuring notifier timer scheduler");
        return Schedulers.newSingle("notifier-timer", true);
    }

    @Bean
    public Clock notifierClock() {
        return Clock.systemUTC();
    }
}
