package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationResult;
import com.work.shortkey.core.model.OperationKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AllocationServiceConcurrencyTest {

    @Test
    public void concurrent_allocations_of_same_fingerprint_persist_one_identifier() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 25; round++) {
                InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());
                CountDownLatch start = new CountDownLatch(1);
                Callable<AllocationResult> task = () -> {
                    start.await();
                    return f.allocationService.allocate(InMemoryFixture.request(0xabc));
                };
                Future<AllocationResult> a = pool.submit(task);
                Future<AllocationResult> b = pool.submit(task);
                start.countDown();

                AllocationResult ra = a.get(10, TimeUnit.SECONDS);
                AllocationResult rb = b.get(10, TimeUnit.SECONDS);

                assertEquals(ra.getIdentifier(), rb.getIdentifier());
                assertEquals(ra.getLength(), rb.getLength());
                assertTrue(ra.isDedupHit() ^ rb.isDedupHit());
                assertEquals(1, f.records.snapshot().size());
                assertEquals(1L, f.logs.countByKind(OperationKind.ASSIGN));
                assertEquals(1L, f.logs.countByKind(OperationKind.DEDUP_HIT));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void concurrent_distinct_allocations_in_tiny_keyspace_stay_unique() throws Exception {
        // 3 个字符、最短 3 位：容量很小，迫使大量碰撞与升级
        ShortKeyConfig config = ShortKeyConfig.builder().charset("abc").minLength(3).maxLength(8).build();
        InMemoryFixture f = new InMemoryFixture(config);
        f.seedReserved("abc", "cba");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<AllocationResult>> futures = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                final int n = i;
                futures.add(pool.submit(() -> f.allocationService.allocate(InMemoryFixture.request(n))));
            }
            Set<String> identifiers = new HashSet<>();
            for (Future<AllocationResult> future : futures) {
                AllocationResult r = future.get(30, TimeUnit.SECONDS);
                assertFalse(r.isDedupHit());
                assertTrue(identifiers.add(r.getIdentifier()), "duplicate identifier " + r.getIdentifier());
                assertFalse(f.reservedKeyFilter.isReserved(r.getIdentifier()));
            }
        } finally {
            pool.shutdownNow();
        }

        List<AllocationRecord> all = f.records.snapshot();
        assertEquals(60, all.size());
        for (int len = 3; len < 8; len++) {
            final int l = len;
            f.ledgerRepository.findByLength(len).ifPresent(row ->
                    assertTrue(row.getConsumed() <= row.getCapacity(), "length " + l));
        }
    }
}
