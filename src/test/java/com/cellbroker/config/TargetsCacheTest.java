package com.cellbroker.config;

import com.cellbroker.model.CellTenant;
import com.cellbroker.model.CellTenantKey;
import com.cellbroker.model.Target;
import com.cellbroker.model.TargetKey;
import com.cellbroker.model.TargetsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.cellbroker.Fixtures.config;
import static com.cellbroker.Fixtures.target;
import static com.cellbroker.Fixtures.tenant;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetsCacheTest {

    private TargetsCache cache;
    private TargetsConfig snapshot;

    @BeforeEach
    void setUp() {
        snapshot = config(
                tenant("shop", "default", "http://ingress/shop/default",
                        target("shop", "default", "auditor", "http://auditor", Map.of("type", "order.placed")),
                        target("shop", "default", "mailer", "http://mailer", Map.of())),
                tenant("billing", "default", "http://ingress/billing/default",
                        target("billing", "default", "ledger", "http://ledger", Map.of())));
        cache = new TargetsCache();
        cache.store(snapshot);
    }

    @Test
    @DisplayName("A new cache holds an empty snapshot, never null")
    void emptyByDefault() {
        TargetsCache fresh = new TargetsCache();
        assertNotNull(fresh.load());
        assertTrue(fresh.load().getCellTenants().isEmpty());
        assertTrue(fresh.getCellTenant(CellTenantKey.broker("shop", "default")).isEmpty());
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("Tenants and targets are found by key")
        void findsByKey() {
            CellTenantKey shop = CellTenantKey.broker("shop", "default");

            assertEquals("http://ingress/shop/default", cache.getCellTenant(shop).orElseThrow().getAddress());
            assertEquals("http://auditor", cache.getTarget(new TargetKey(shop, "auditor")).orElseThrow().getAddress());
        }

        @Test
        @DisplayName("Unknown keys give empty results")
        void unknownKeys() {
            CellTenantKey shop = CellTenantKey.broker("shop", "default");

            assertTrue(cache.getCellTenant(CellTenantKey.broker("nobody", "default")).isEmpty());
            assertTrue(cache.getTarget(new TargetKey(shop, "nobody")).isEmpty());
            assertTrue(cache.getTarget(new TargetKey(CellTenantKey.broker("nobody", "x"), "auditor")).isEmpty());
        }

        @Test
        @DisplayName("forEachTarget visits every target and stops when told to")
        void forEachTarget() {
            List<String> all = new ArrayList<>();
            cache.forEachTarget(t -> all.add(t.getName()));
            assertEquals(List.of("auditor", "mailer", "ledger"), all);

            List<String> firstOnly = new ArrayList<>();
            cache.forEachTarget(t -> {
                firstOnly.add(t.getName());
                return false;
            });
            assertEquals(List.of("auditor"), firstOnly);
        }

        @Test
        @DisplayName("forEachCellTenant visits every tenant")
        void forEachCellTenant() {
            List<String> names = new ArrayList<>();
            cache.forEachCellTenant(t -> names.add(t.getNamespace()));
            assertEquals(List.of("shop", "billing"), names);
        }
    }

    @Nested
    @DisplayName("Serialized comparisons")
    class Comparisons {

        @Test
        @DisplayName("The cache's own bytes and debug string compare equal")
        void equalsOwnForms() {
            assertTrue(cache.equalsBytes(cache.bytes()));
            assertTrue(cache.equalsDebugString(cache.debugString()));
        }

        @Test
        @DisplayName("Encoding is deterministic for equal snapshots")
        void deterministic() throws Exception {
            TargetsCache other = new TargetsCache(TargetsConfigCodec.fromBytes(cache.bytes()));
            assertArrayEquals(cache.bytes(), other.bytes());
        }

        @Test
        @DisplayName("A different snapshot does not compare equal")
        void differentSnapshot() {
            TargetsCache other = new TargetsCache(config(tenant("shop", "default", "http://elsewhere")));
            assertFalse(cache.equalsBytes(other.bytes()));
            assertFalse(cache.equalsDebugString(other.debugString()));
        }

        @Test
        @DisplayName("Malformed input is simply not equal")
        void malformed() {
            assertFalse(cache.equalsBytes("definitely not cbor".getBytes(StandardCharsets.UTF_8)));
            assertFalse(cache.equalsBytes(new byte[]{(byte) 0xff, 0x00, 0x13}));
            assertFalse(cache.equalsBytes(null));
            assertFalse(cache.equalsDebugString("{not json"));
            assertFalse(cache.equalsDebugString(null));
        }
    }

    @Test
    @DisplayName("Readers see whole snapshots while a writer keeps swapping them")
    void snapshotAtomicity() throws Exception {
        TargetsConfig even = versioned("v0");
        TargetsConfig odd = versioned("v1");
        cache.store(even);

        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch readersStarted = new CountDownLatch(4);
        ExecutorService pool = Executors.newFixedThreadPool(5);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 20_000; i++) {
                    cache.store(i % 2 == 0 ? odd : even);
                }
                running.set(false);
            });
            List<Future<Integer>> readers = new ArrayList<>();
            for (int r = 0; r < 4; r++) {
                readers.add(pool.submit(() -> {
                    readersStarted.countDown();
                    int mixed = 0;
                    while (running.get()) {
                        List<String> versions = new ArrayList<>();
                        cache.forEachTarget(t -> versions.add(t.getAddress()));
                        if (versions.stream().distinct().count() != 1) {
                            mixed++;
                        }
                    }
                    return mixed;
                }));
            }
            readersStarted.await(5, TimeUnit.SECONDS);
            writer.get(30, TimeUnit.SECONDS);
            for (Future<Integer> reader : readers) {
                assertEquals(0, reader.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static TargetsConfig versioned(String version) {
        CellTenant a = tenant("a", "default", "http://a",
                target("a", "default", "t1", version, Map.of()),
                target("a", "default", "t2", version, Map.of()));
        CellTenant b = tenant("b", "default", "http://b",
                target("b", "default", "t3", version, Map.of()));
        return config(a, b);
    }

    @Test
    @DisplayName("Targets in a snapshot belong to their tenant")
    void targetsBelongToTenant() {
        cache.forEachCellTenant(tenant -> {
            for (Target t : tenant.getTargets().values()) {
                assertEquals(tenant.key(), t.key().getParentKey());
            }
            return true;
        });
    }
}
