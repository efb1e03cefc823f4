package com.wangbin.exporter.core.store.manager;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.Ticker;
import com.wangbin.exporter.core.config.ExporterProperties;
import com.wangbin.exporter.core.store.model.EvictionMode;
import com.wangbin.exporter.core.store.model.MetricEntry;
import com.wangbin.exporter.core.store.model.MetricFamily;
import com.wangbin.exporter.core.store.model.MetricKey;
import com.wangbin.exporter.core.store.model.MetricOwner;
import com.wangbin.exporter.core.store.model.MetricSample;
import com.wangbin.exporter.core.store.model.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Caffeine 的指标缓存。
 * <p>
 * 每个标识对应一个不可变的 {@link MetricEntry}，写入通过 {@code asMap().compute} 原子替换；
 * 过期时间按条目自身的写入时刻计算，超过失效阈值未被重写的条目会被回收。
 */
@Slf4j
@Component
public class CaffeineMetricStore implements MetricStore {

    private final Cache<MetricKey, MetricEntry> cache;
    private final Map<String, MetricFamily> families = new ConcurrentHashMap<>();
    private final Ticker ticker;
    private final long stalenessNanos;

    // 统计计数器
    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong outOfOrder = new AtomicLong(0);
    private final AtomicLong labelConflicts = new AtomicLong(0);
    private final AtomicLong ownerConflicts = new AtomicLong(0);
    private final AtomicLong expired = new AtomicLong(0);
    private final AtomicLong staleMarked = new AtomicLong(0);
    private final AtomicLong removed = new AtomicLong(0);

    private final RemovalListener<MetricKey, MetricEntry> removalListener = (key, value, cause) -> {
        if (cause == RemovalCause.EXPIRED || cause == RemovalCause.SIZE) {
            expired.incrementAndGet();
            log.debug("指标条目被回收: key={}, cause={}", key, cause);
        }
    };

    @Autowired
    public CaffeineMetricStore(ExporterProperties properties) {
        this(properties.getStore().getStalenessThreshold(), properties.getStore().getMaxEntries(), Ticker.systemTicker());
    }

    public CaffeineMetricStore(Duration stalenessThreshold, long maxEntries, Ticker ticker) {
        this.ticker = ticker;
        this.stalenessNanos = stalenessThreshold.toNanos();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new WriteTimeExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener(removalListener)
                .build();
        log.info("指标缓存初始化完成: stalenessThreshold={}, maxEntries={}", stalenessThreshold, maxEntries);
    }

    @Override
    public WriteResult write(MetricSample sample, MetricOwner owner, boolean confirmed) {
        MetricFamily family = families.computeIfAbsent(sample.name(), name -> MetricFamily.of(sample));
        if (!family.isCompatible(sample)) {
            labelConflicts.incrementAndGet();
            log.debug("标签集合冲突，拒绝写入: key={}, expectedLabels={}, type={}, owner={}",
                    sample.key(), family.labelKeys(), family.type(), owner);
            return WriteResult.LABEL_CONFLICT;
        }

        WriteResult[] result = new WriteResult[1];
        long now = ticker.read();
        cache.asMap().compute(sample.key(), (key, current) -> {
            if (current != null && !isExpired(current, now)) {
                if (!current.stale() && !current.owner().equals(owner)) {
                    result[0] = WriteResult.OWNER_CONFLICT;
                    return current;
                }
                if (sample.timestampMillis() < current.timestampMillis()) {
                    result[0] = WriteResult.OUT_OF_ORDER;
                    return current;
                }
            }
            result[0] = WriteResult.ACCEPTED;
            return MetricEntry.of(sample, owner, confirmed, now);
        });

        switch (result[0]) {
            case ACCEPTED -> accepted.incrementAndGet();
            case OUT_OF_ORDER -> {
                outOfOrder.incrementAndGet();
                log.debug("乱序写入被拒绝: key={}, ts={}, owner={}", sample.key(), sample.timestampMillis(), owner);
            }
            case OWNER_CONFLICT -> {
                ownerConflicts.incrementAndGet();
                log.debug("标识已被其他目标占用，拒绝写入: key={}, owner={}", sample.key(), owner);
            }
            default -> {
            }
        }
        return result[0];
    }

    @Override
    public List<MetricEntry> snapshot() {
        List<MetricEntry> entries = new ArrayList<>(cache.asMap().values());
        entries.sort((a, b) -> a.key().compareTo(b.key()));
        return entries;
    }

    @Override
    public int evictTarget(String targetName, EvictionMode mode) {
        AtomicInteger affected = new AtomicInteger();
        for (MetricKey key : new ArrayList<>(cache.asMap().keySet())) {
            cache.asMap().computeIfPresent(key, (k, entry) -> {
                if (!entry.ownedBy(targetName)) {
                    return entry;
                }
                affected.incrementAndGet();
                return mode == EvictionMode.REMOVE ? null : entry.markStale();
            });
        }
        int count = affected.get();
        if (mode == EvictionMode.REMOVE) {
            removed.addAndGet(count);
        } else {
            staleMarked.addAndGet(count);
        }
        log.info("目标指标回收完成: target={}, mode={}, entries={}", targetName, mode, count);
        return count;
    }

    @Override
    public int remove(Collection<MetricKey> keys, MetricOwner owner) {
        AtomicInteger affected = new AtomicInteger();
        for (MetricKey key : keys) {
            cache.asMap().computeIfPresent(key, (k, entry) -> {
                if (!entry.owner().equals(owner)) {
                    return entry;
                }
                affected.incrementAndGet();
                return null;
            });
        }
        removed.addAndGet(affected.get());
        return affected.get();
    }

    @Override
    public MetricFamily family(String name) {
        return families.get(name);
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    /**
     * 定期清理过期条目
     */
    @Scheduled(fixedDelayString = "${exporter.store.eviction-interval-ms:30000}")
    public void runMaintenance() {
        cache.cleanUp();
        log.debug("指标缓存维护完成: size={}", cache.estimatedSize());
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> statistics = new HashMap<>();
        statistics.put("size", cache.estimatedSize());
        statistics.put("families", families.size());
        statistics.put("accepted", accepted.get());
        statistics.put("outOfOrder", outOfOrder.get());
        statistics.put("labelConflicts", labelConflicts.get());
        statistics.put("ownerConflicts", ownerConflicts.get());
        statistics.put("expired", expired.get());
        statistics.put("staleMarked", staleMarked.get());
        statistics.put("removed", removed.get());
        return statistics;
    }

    private boolean isExpired(MetricEntry entry, long now) {
        return now - entry.writtenNanos() >= stalenessNanos;
    }

    private long remaining(MetricEntry entry, long currentTime) {
        return Math.max(0L, stalenessNanos - (currentTime - entry.writtenNanos()));
    }

    /**
     * 过期时间只取决于条目的写入时刻，标记失效不会延长寿命
     */
    private final class WriteTimeExpiry implements Expiry<MetricKey, MetricEntry> {

        @Override
        public long expireAfterCreate(MetricKey key, MetricEntry value, long currentTime) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(MetricKey key, MetricEntry value, long currentTime, long currentDuration) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterRead(MetricKey key, MetricEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
