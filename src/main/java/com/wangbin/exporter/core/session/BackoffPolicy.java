package com.wangbin.exporter.core.session;

import com.wangbin.exporter.core.config.ExporterProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避：delay = min(max, initial * multiplier^(attempt-1))，再叠加 ±jitter 的均匀抖动，
 * 抖动后的结果仍不超过上限。多个目标因同一次网络抖动断开时重连时间会被打散。
 */
public class BackoffPolicy {

    private final long initialMillis;
    private final long maxMillis;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration initial, Duration max, double multiplier, double jitter) {
        this(initial, max, multiplier, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration initial, Duration max, double multiplier, double jitter, DoubleSupplier random) {
        this.initialMillis = Math.max(1L, initial.toMillis());
        this.maxMillis = Math.max(this.initialMillis, max.toMillis());
        this.multiplier = Math.max(1.0, multiplier);
        this.jitter = Math.min(1.0, Math.max(0.0, jitter));
        this.random = random;
    }

    public static BackoffPolicy from(ExporterProperties.SessionConfig config) {
        return new BackoffPolicy(config.getInitialBackoff(), config.getMaxBackoff(),
                config.getBackoffMultiplier(), config.getJitter());
    }

    /**
     * 第 attempt 次重试前的等待时间（attempt 从 1 开始）
     */
    public long delayMillis(int attempt) {
        double base = initialMillis * Math.pow(multiplier, Math.max(0, attempt - 1));
        base = Math.min(base, maxMillis);
        double factor = 1.0 - jitter + 2.0 * jitter * random.getAsDouble();
        long delay = Math.round(base * factor);
        return Math.max(1L, Math.min(delay, maxMillis));
    }
}
