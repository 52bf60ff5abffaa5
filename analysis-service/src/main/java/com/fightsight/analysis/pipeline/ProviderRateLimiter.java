package com.fightsight.analysis.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Process-wide request spacing for one external provider.
 *
 * <p>Every caller reserves the next free slot with a CAS on {@code nextSlotNanos}; the
 * returned {@code Mono} completes when that slot arrives. Reservations never overlap,
 * so across all sessions at most {@code permitsPerSecond} calls start per second.
 * Waiting uses {@link Mono#delay}; no thread is blocked.
 *
 * <p>{@code permitsPerSecond <= 0} disables limiting.
 */
public class ProviderRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private final String provider;
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final AtomicLong nextSlotNanos = new AtomicLong(Long.MIN_VALUE);

    public ProviderRateLimiter(String provider, double permitsPerSecond) {
        this(provider, permitsPerSecond, System::nanoTime);
    }

    ProviderRateLimiter(String provider, double permitsPerSecond, LongSupplier nanoClock) {
        this.provider      = provider;
        this.intervalNanos = permitsPerSecond > 0.0 ? (long) (1_000_000_000L / permitsPerSecond) : 0L;
        this.nanoClock     = nanoClock;
        log.info("[RateLimiter] Configured. provider={} permitsPerSecond={} intervalMs={}",
                 provider, permitsPerSecond, Duration.ofNanos(intervalNanos).toMillis());
    }

    /** Completes once the caller may start its request. */
    public Mono<Void> acquire() {
        if (intervalNanos == 0L) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            long waitNanos = reserve();
            if (waitNanos <= 0L) {
                return Mono.empty();
            }
            log.debug("[RateLimiter] Throttling. provider={} waitMs={}", provider, waitNanos / 1_000_000L);
            return Mono.delay(Duration.ofNanos(waitNanos)).then();
        });
    }

    /** Reserves the next slot and returns how long the caller has to wait for it. */
    long reserve() {
        long now = nanoClock.getAsLong();
        while (true) {
            long slot = nextSlotNanos.get();
            long granted = Math.max(slot, now);
            if (nextSlotNanos.compareAndSet(slot, granted + intervalNanos)) {
                return granted - now;
            }
        }
    }

    public String provider() {
        return provider;
    }
}
