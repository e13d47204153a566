package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.exception.AllocationCancelledException;
import com.work.shortkey.core.exception.KeyspaceExhaustedException;
import com.work.shortkey.core.exception.UniqueConflictException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationResult;
import com.work.shortkey.core.support.metrics.ShortKeyMetrics;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ShortKeyAllocatorTest {

    private static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    private static ScriptedGenerator failingAfter(String... candidates) {
        return new ScriptedGenerator(len -> {
            throw new AssertionError("script exhausted at length " + len);
        }, candidates);
    }

    @Test
    public void reserved_candidate_is_discarded_and_another_committed() {
        ScriptedGenerator generator = failingAfter("admin", "Bx9kQ");
        ShortKeyMetrics metrics = mock(ShortKeyMetrics.class);
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().minLength(5).build(), generator, metrics);
        f.seedReserved("admin");

        AllocationResult result = f.allocationService.allocate(InMemoryFixture.request(1));

        assertEquals("Bx9kQ", result.getIdentifier());
        assertEquals(5, result.getLength());
        // 保留字候选不占用槽位
        assertEquals(1L, f.ledgerRepository.findByLength(5).get().getConsumed());
        assertFalse(f.records.existsByIdentifier("admin"));
        verify(metrics, times(1)).reservedRejected();
    }

    @Test
    public void reserved_check_ignores_candidate_case() {
        ScriptedGenerator generator = failingAfter("AdMin", "zz9kQ");
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().minLength(5).build(), generator);
        f.seedReserved("admin");

        assertEquals("zz9kQ", f.allocationService.allocate(InMemoryFixture.request(1)).getIdentifier());
    }

    @Test
    public void taken_identifier_reserves_new_slot_and_retries_same_length() {
        ScriptedGenerator generator = failingAfter("aaaa", "aaaa", "bbbb");
        ShortKeyMetrics metrics = mock(ShortKeyMetrics.class);
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig(), generator, metrics);

        assertEquals("aaaa", f.allocationService.allocate(InMemoryFixture.request(1)).getIdentifier());
        assertEquals("bbbb", f.allocationService.allocate(InMemoryFixture.request(2)).getIdentifier());

        assertEquals(3L, f.ledgerRepository.findByLength(4).get().getConsumed());
        assertTrue(generator.requestedLengths.stream().allMatch(len -> len == 4));
        verify(metrics, times(1)).collision(eq(4));
    }

    @Test
    public void identifier_conflict_at_commit_is_retried() {
        ScriptedGenerator generator = failingAfter("aaaa", "bbbb");
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig(), generator);
        AtomicInteger calls = new AtomicInteger();

        AllocationRecord out = f.allocator.allocate((identifier, length, salt) -> {
            if (calls.incrementAndGet() == 1) {
                throw new UniqueConflictException(UniqueConflictException.Kind.IDENTIFIER, "race", null);
            }
            AllocationRecord r = new AllocationRecord();
            r.setIdentifier(identifier);
            r.setIdentifierLength(length);
            return r;
        });

        assertEquals("bbbb", out.getIdentifier());
        assertEquals(2, calls.get());
        assertEquals(2L, f.ledgerRepository.findByLength(4).get().getConsumed());
    }

    @Test
    public void fingerprint_conflict_at_commit_is_not_retried() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig(), failingAfter("aaaa"));

        UniqueConflictException ex = assertThrows(UniqueConflictException.class, () ->
                f.allocator.allocate((identifier, length, salt) -> {
                    throw new UniqueConflictException(UniqueConflictException.Kind.FINGERPRINT, "dup", null);
                }));
        assertEquals(UniqueConflictException.Kind.FINGERPRINT, ex.getKind());
    }

    @Test
    public void committer_returning_null_ends_allocation() {
        ScriptedGenerator generator = failingAfter("aaaa");
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig(), generator);

        assertNull(f.allocator.allocate((identifier, length, salt) -> null));
        assertEquals(1, generator.requestedLengths.size());
    }

    @Test
    public void capacity_two_escalates_on_third_allocation() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().capacityOverride(4, 2L).build());

        AllocationResult first = f.allocationService.allocate(InMemoryFixture.request(1));
        AllocationResult second = f.allocationService.allocate(InMemoryFixture.request(2));
        AllocationResult third = f.allocationService.allocate(InMemoryFixture.request(3));

        assertEquals(4, first.getIdentifier().length());
        assertEquals(4, second.getIdentifier().length());
        assertEquals(5, third.getIdentifier().length());
        assertTrue(f.ledger.isExhausted(4));
    }

    @Test
    public void attempt_budget_escalates_and_never_draws_exhausted_length() {
        ScriptedGenerator generator = new ScriptedGenerator(len -> repeat('x', len));
        ShortKeyMetrics metrics = mock(ShortKeyMetrics.class);
        InMemoryFixture f = new InMemoryFixture(
                ShortKeyConfig.builder().maxAttemptsPerLength(3).build(), generator, metrics);
        f.seedReserved("xxxx", "xxxxx");

        AllocationResult result = f.allocationService.allocate(InMemoryFixture.request(1));

        assertEquals("xxxxxx", result.getIdentifier());
        assertTrue(f.ledger.isExhausted(4));
        assertTrue(f.ledger.isExhausted(5));
        int firstFive = generator.requestedLengths.indexOf(5);
        int firstSix = generator.requestedLengths.indexOf(6);
        assertEquals(3, firstFive);
        assertFalse(generator.requestedLengths.subList(firstFive, generator.requestedLengths.size()).contains(4));
        assertFalse(generator.requestedLengths.subList(firstSix, generator.requestedLengths.size()).contains(5));
        verify(metrics).escalation(eq(4));
        verify(metrics).escalation(eq(5));

        // 之后的分配直接从 6 开始
        generator.requestedLengths.clear();
        f.allocationService.allocate(InMemoryFixture.request(2));
        assertEquals(6, (int) generator.requestedLengths.get(0));
    }

    @Test
    public void too_many_escalations_is_fatal() {
        ScriptedGenerator generator = new ScriptedGenerator(len -> repeat('x', len));
        InMemoryFixture f = new InMemoryFixture(
                ShortKeyConfig.builder().maxAttemptsPerLength(2).maxEscalations(1).build(), generator);
        f.seedReserved("xxxx", "xxxxx");

        KeyspaceExhaustedException ex = assertThrows(KeyspaceExhaustedException.class,
                () -> f.allocationService.allocate(InMemoryFixture.request(1)));
        assertEquals(5, ex.getLastLength());
        assertTrue(f.records.snapshot().isEmpty());
    }

    @Test
    public void exceeding_max_length_is_fatal() {
        InMemoryFixture f = new InMemoryFixture(
                ShortKeyConfig.builder().minLength(4).maxLength(4).capacityOverride(4, 1L).build());

        f.allocationService.allocate(InMemoryFixture.request(1));

        assertThrows(KeyspaceExhaustedException.class,
                () -> f.allocationService.allocate(InMemoryFixture.request(2)));
        assertEquals(1, f.records.snapshot().size());
    }

    @Test
    public void interrupted_thread_cancels_without_partial_record() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());
        Thread.currentThread().interrupt();
        try {
            assertThrows(AllocationCancelledException.class,
                    () -> f.allocationService.allocate(InMemoryFixture.request(1)));
        } finally {
            Thread.interrupted();
        }
        assertTrue(f.records.snapshot().isEmpty());
    }
}
