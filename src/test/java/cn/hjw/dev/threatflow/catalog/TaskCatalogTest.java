package cn.hjw.dev.threatflow.catalog;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class TaskCatalogTest {

    /**
     * 可手动推进的时钟
     */
    private static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    public void testCachesUntilTtlExpires() {
        AtomicInteger loads = new AtomicInteger();
        MutableClock clock = new MutableClock();
        TaskCatalog catalog = new TaskCatalog(() -> {
            loads.incrementAndGet();
            return List.of("ClamAV", "Yara");
        }, Duration.ofMinutes(5), clock);

        Assertions.assertTrue(catalog.isKnown("ClamAV"));
        Assertions.assertFalse(catalog.isKnown("Unknown"));
        Assertions.assertEquals(1, loads.get());

        clock.advance(Duration.ofMinutes(6));
        catalog.knownTasks();
        Assertions.assertEquals(2, loads.get(), "过期后重新加载");

        catalog.invalidate();
        catalog.knownTasks();
        Assertions.assertEquals(3, loads.get());
    }

    @Test
    public void testKeepsSnapshotWhenLoaderFails() {
        AtomicInteger loads = new AtomicInteger();
        MutableClock clock = new MutableClock();
        TaskCatalog catalog = new TaskCatalog(() -> {
            if (loads.incrementAndGet() > 1) {
                throw new IllegalStateException("analysis backend unavailable");
            }
            return List.of("ClamAV");
        }, Duration.ofMinutes(5), clock);

        Assertions.assertTrue(catalog.isKnown("ClamAV"));
        clock.advance(Duration.ofMinutes(10));
        Assertions.assertTrue(catalog.isKnown("ClamAV"), "加载失败时保留上一次的快照");
        Assertions.assertEquals(2, loads.get());
    }
}
