package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.AllocationRequest;
import com.work.shortkey.core.model.AllocationResult;
import com.work.shortkey.core.model.OperationKind;
import com.work.shortkey.core.model.RecordStatus;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class AllocationServiceTest {

    @Test
    public void first_allocation_on_fresh_ledger_returns_four_chars() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());

        AllocationResult result = f.allocationService.allocate(InMemoryFixture.request(1));

        assertFalse(result.isDedupHit());
        assertTrue(result.getIdentifier().matches("^[0-9a-zA-Z]{4}$"), result.getIdentifier());
        assertEquals(4, result.getLength());
        assertTrue(result.getSalt().matches("^[0-9a-f]{32}$"));
        assertEquals(1L, f.ledgerRepository.findByLength(4).get().getConsumed());
        assertEquals(1L, f.logs.countByKind(OperationKind.ASSIGN));
        assertEquals(result.getIdentifier() + ".png", result.storageKeyFor(result.getRecord().getFileExtension()));
    }

    @Test
    public void same_fingerprint_twice_is_dedup_hit() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());

        AllocationResult first = f.allocationService.allocate(InMemoryFixture.request(7));
        AllocationResult second = f.allocationService.allocate(InMemoryFixture.request(7));

        assertTrue(second.isDedupHit());
        assertEquals(first.getIdentifier(), second.getIdentifier());
        assertEquals(first.getLength(), second.getLength());
        assertEquals(1, f.records.snapshot().size());
        assertEquals(1L, f.logs.countByKind(OperationKind.ASSIGN));
        assertEquals(1L, f.logs.countByKind(OperationKind.DEDUP_HIT));
        assertEquals(1L, f.ledgerRepository.findByLength(4).get().getConsumed());
    }

    @Test
    public void uppercase_fingerprint_maps_to_same_record() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());
        String fp = InMemoryFixture.fp(0xabc);

        AllocationResult first = f.allocationService.allocate(AllocationRequest.of(fp, "a.txt", 1L, null));
        AllocationResult second = f.allocationService.allocate(
                AllocationRequest.of(fp.toUpperCase(), "b.txt", 1L, null));

        assertTrue(second.isDedupHit());
        assertEquals(first.getIdentifier(), second.getIdentifier());
    }

    @Test
    public void deleted_record_keeps_identifier_and_is_not_resolvable() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());
        AllocationResult first = f.allocationService.allocate(InMemoryFixture.request(3));
        f.store.markDeleted(InMemoryFixture.fp(3));

        AllocationResult again = f.allocationService.allocate(InMemoryFixture.request(3));

        assertTrue(again.isDedupHit());
        assertEquals(first.getIdentifier(), again.getIdentifier());
        assertEquals(RecordStatus.DELETED, again.getRecord().getStatus());
        assertFalse(f.allocationService.resolve(first.getIdentifier()).isPresent());
        // 已删除记录的短键仍然占位
        assertTrue(f.records.existsByIdentifier(first.getIdentifier()));
    }

    @Test
    public void resolve_counts_access() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());
        String identifier = f.allocationService.allocate(InMemoryFixture.request(5)).getIdentifier();

        Optional<AllocationRecord> first = f.allocationService.resolve(identifier);
        Optional<AllocationRecord> second = f.allocationService.resolve(identifier);

        assertTrue(first.isPresent());
        assertEquals(1L, first.get().getAccessCount());
        assertEquals(2L, second.get().getAccessCount());
        assertNotNull(second.get().getLastAccessedAt());
        assertEquals(2L, f.logs.countByKind(OperationKind.ACCESS));
        assertFalse(f.allocationService.resolve("zzzzzzzz").isPresent());
    }

    @Test
    public void deferred_registration_leaves_identifier_empty() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().assignOnRegister(false).build());

        AllocationResult result = f.allocationService.allocate(InMemoryFixture.request(9));
        AllocationResult again = f.allocationService.allocate(InMemoryFixture.request(9));

        assertNull(result.getIdentifier());
        assertTrue(again.isDedupHit());
        assertEquals(1L, f.records.countMissingIdentifier());
        assertTrue(f.ledgerRepository.listAll().isEmpty());
    }
}
