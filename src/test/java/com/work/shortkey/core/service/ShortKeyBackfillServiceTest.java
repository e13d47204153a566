package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.OperationKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ShortKeyBackfillServiceTest {

    @Test
    public void backfill_assigns_missing_identifiers_and_rerun_is_noop() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().assignOnRegister(false).build());
        for (int i = 1; i <= 5; i++) {
            f.allocationService.allocate(InMemoryFixture.request(i));
        }
        assertEquals(5L, f.records.countMissingIdentifier());

        assertEquals(5, f.backfillService.backfill(10));

        Map<String, String> assigned = new HashMap<>();
        for (AllocationRecord r : f.records.snapshot()) {
            assertNotNull(r.getIdentifier());
            assertNotNull(r.getIdentifierAssignedAt());
            assigned.put(r.getFingerprint(), r.getIdentifier());
        }
        assertEquals(5, assigned.values().stream().distinct().count());
        assertEquals(5L, f.logs.countByKind(OperationKind.ASSIGN));

        assertEquals(0, f.backfillService.backfill(10));
        for (AllocationRecord r : f.records.snapshot()) {
            assertEquals(assigned.get(r.getFingerprint()), r.getIdentifier());
        }
        assertEquals(5L, f.logs.countByKind(OperationKind.ASSIGN));
    }

    @Test
    public void backfill_respects_limit() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().assignOnRegister(false).build());
        for (int i = 1; i <= 3; i++) {
            f.allocationService.allocate(InMemoryFixture.request(i));
        }

        assertEquals(2, f.backfillService.backfill(2));
        assertEquals(1L, f.records.countMissingIdentifier());
        assertEquals(1, f.backfillService.backfill(2));
        assertEquals(0L, f.records.countMissingIdentifier());
    }

    @Test
    public void assigning_already_assigned_record_changes_nothing() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());
        String identifier = f.allocationService.allocate(InMemoryFixture.request(1)).getIdentifier();
        long consumedBefore = consumed(f, identifier.length());

        for (int i = 0; i < 3; i++) {
            assertFalse(f.allocationService.assignMissingIdentifier(InMemoryFixture.fp(1)).isPresent());
        }

        List<AllocationRecord> all = f.records.snapshot();
        assertEquals(identifier, all.get(0).getIdentifier());
        assertEquals(1L, f.logs.countByKind(OperationKind.ASSIGN));
        assertEquals(consumedBefore, consumed(f, identifier.length()));
    }

    @Test
    public void assigning_unknown_fingerprint_does_not_touch_ledger() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());

        assertFalse(f.allocationService.assignMissingIdentifier(InMemoryFixture.fp(9)).isPresent());

        assertTrue(f.ledgerRepository.listAll().isEmpty());
    }

    @Test
    public void deleted_or_archived_records_never_receive_identifier() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().assignOnRegister(false).build());
        f.allocationService.allocate(InMemoryFixture.request(2));
        f.allocationService.allocate(InMemoryFixture.request(3));
        f.store.markDeleted(InMemoryFixture.fp(2));
        f.store.markArchived(InMemoryFixture.fp(3));

        assertFalse(f.allocationService.assignMissingIdentifier(InMemoryFixture.fp(2)).isPresent());
        assertFalse(f.allocationService.assignMissingIdentifier(InMemoryFixture.fp(3)).isPresent());

        for (AllocationRecord r : f.records.snapshot()) {
            assertNull(r.getIdentifier());
        }
        assertEquals(0L, f.logs.countByKind(OperationKind.ASSIGN));
        assertTrue(f.ledgerRepository.listAll().isEmpty());
    }

    @Test
    public void repository_assign_skips_inactive_records() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().assignOnRegister(false).build());
        f.allocationService.allocate(InMemoryFixture.request(4));
        f.store.markDeleted(InMemoryFixture.fp(4));

        assertEquals(0, f.records.assignIdentifierIfAbsent(InMemoryFixture.fp(4), "abcd", 4, "00", Instant.now()));
        assertFalse(f.records.existsByIdentifier("abcd"));
    }

    @Test
    public void deleted_records_are_not_backfilled() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().assignOnRegister(false).build());
        f.allocationService.allocate(InMemoryFixture.request(1));
        f.store.markDeleted(InMemoryFixture.fp(1));

        assertEquals(0, f.backfillService.backfill(10));
        assertNull(f.records.snapshot().get(0).getIdentifier());
    }

    private static long consumed(InMemoryFixture f, int length) {
        return f.ledgerRepository.findByLength(length).orElseThrow(AssertionError::new).getConsumed();
    }
}
