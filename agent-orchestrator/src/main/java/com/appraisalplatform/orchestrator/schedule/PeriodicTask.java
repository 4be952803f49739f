package com.appraisalplatform.orchestrator.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Cancellable fixed-rate loop over a reactive pass.
 *
 * <p>A tick arriving while the previous pass is still running is dropped, so passes
 * never overlap. A failing pass is logged and the loop keeps ticking.
 * {@link #stop()} may be called any number of times.
 */
public final class PeriodicTask {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTask.class);

    private final String name;
    private final Disposable subscription;

    private PeriodicTask(String name, Disposable subscription) {
        this.name = name;
        this.subscription = subscription;
    }

    /**
     * Starts the loop; the first pass runs after one {@code period}.
     */
    public static PeriodicTask start(String name, Duration period, Supplier<Mono<Void>> pass) {
        Objects.requireNonNull(pass, "pass");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        Disposable subscription = Flux.interval(period)
            .onBackpressureDrop(tick -> log.warn("Periodic pass skipped, previous still running. task={} tick={}",
                                                 name, tick))
            .concatMap(tick -> Mono.defer(pass)
                .onErrorResume(e -> {
                    log.error("Periodic pass failed. task={} tick={}", name, tick, e);
                    return Mono.empty();
                }), 1)
            .subscribe();
        log.info("Periodic task started. task={} periodMs={}", name, period.toMillis());
        return new PeriodicTask(name, subscription);
    }

    public void stop() {
        if (!subscription.isDisposed()) {
            subscription.dispose();
            log.info("Periodic task stopped. task={}", name);
        }
    }

    public boolean isRunning() {
        return !subscription.isDisposed();
    }

    public String name() {
        return name;
    }
}
