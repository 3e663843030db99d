package cn.hjw.dev.threatflow.catalog;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 可用任务名缓存
 * <p>
 * 显式创建、显式管理生命周期, 由需要它的组件通过构造参数持有, 不做进程级单例。
 * 加载失败时保留上一次的快照。
 */
@Slf4j
public class TaskCatalog {

    private final Supplier<? extends Collection<String>> loader;
    private final Duration ttl;
    private final Clock clock;

    private Set<String> snapshot = Set.of();
    private Instant loadedAt;

    public TaskCatalog(Supplier<? extends Collection<String>> loader, Duration ttl) {
        this(loader, ttl, Clock.systemUTC());
    }

    public TaskCatalog(Supplier<? extends Collection<String>> loader, Duration ttl, Clock clock) {
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * 固定内容的目录, 永不过期
     */
    public static TaskCatalog of(Collection<String> taskNames) {
        Set<String> fixed = Set.copyOf(taskNames);
        return new TaskCatalog(() -> fixed, Duration.ofDays(36500));
    }

    public synchronized Set<String> knownTasks() {
        if (loadedAt == null || !clock.instant().isBefore(loadedAt.plus(ttl))) {
            refresh();
        }
        return snapshot;
    }

    public boolean isKnown(String taskName) {
        return knownTasks().contains(taskName);
    }

    public synchronized void refresh() {
        try {
            Collection<String> loaded = loader.get();
            snapshot = loaded == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(loaded));
            log.info("Task catalog loaded {} task names", snapshot.size());
        } catch (RuntimeException e) {
            log.warn("Task catalog refresh failed, keeping {} cached names. Cause: {}", snapshot.size(), e.getMessage());
        }
        // 失败后同样等待一个 TTL 再重试
        loadedAt = clock.instant();
    }

    public synchronized void invalidate() {
        loadedAt = null;
    }
}
