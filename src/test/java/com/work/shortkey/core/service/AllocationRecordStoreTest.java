package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.exception.UniqueConflictException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.OperationKind;
import com.work.shortkey.core.model.OperationLogEntry;
import com.work.shortkey.core.model.RecordStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AllocationRecordStoreTest {

    private final InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.defaultConfig());

    @Test
    public void commit_new_writes_record_and_assign_log() {
        AllocationRecord saved = f.store.commitNew(InMemoryFixture.request(1), "Ab12", 4, "salt");

        assertNotNull(saved.getId());
        assertEquals(".png", saved.getFileExtension());
        assertEquals(RecordStatus.ACTIVE, saved.getStatus());
        List<OperationLogEntry> history = f.store.history(saved.getId());
        assertEquals(1, history.size());
        assertEquals(OperationKind.ASSIGN, history.get(0).getKind());
        assertTrue(history.get(0).getDetails().contains("\"identifier\":\"Ab12\""));
    }

    @Test
    public void duplicate_commits_report_conflict_kind() {
        f.store.commitNew(InMemoryFixture.request(1), "Ab12", 4, "salt");

        UniqueConflictException byFingerprint = assertThrows(UniqueConflictException.class,
                () -> f.store.commitNew(InMemoryFixture.request(1), "Cd34", 4, "salt"));
        UniqueConflictException byIdentifier = assertThrows(UniqueConflictException.class,
                () -> f.store.commitNew(InMemoryFixture.request(2), "Ab12", 4, "salt"));

        assertEquals(UniqueConflictException.Kind.FINGERPRINT, byFingerprint.getKind());
        assertEquals(UniqueConflictException.Kind.IDENTIFIER, byIdentifier.getKind());
        assertEquals(1L, f.logs.countByKind(OperationKind.ASSIGN));
    }

    @Test
    public void upload_metadata_is_recorded_for_active_records_only() {
        AllocationRecord saved = f.store.commitNew(InMemoryFixture.request(1), "Ab12", 4, "salt");

        AllocationRecord updated = f.store.updateUploadMetadata(InMemoryFixture.fp(1), "Ab12.png",
                "https://cdn.example.com/Ab12.png").orElseThrow(AssertionError::new);
        assertEquals("Ab12.png", updated.getStorageKey());
        assertEquals(1L, f.logs.countByKind(OperationKind.UPDATE));

        f.store.markDeleted(InMemoryFixture.fp(1));
        assertThrows(IllegalStateException.class,
                () -> f.store.updateUploadMetadata(InMemoryFixture.fp(1), "x.png", null));
        assertFalse(f.store.updateUploadMetadata(InMemoryFixture.fp(2), "x.png", null).isPresent());
        assertEquals(saved.getId(), updated.getId());
    }

    @Test
    public void status_only_leaves_active_once() {
        f.store.commitNew(InMemoryFixture.request(1), "Ab12", 4, "salt");

        AllocationRecord archived = f.store.markArchived(InMemoryFixture.fp(1)).orElseThrow(AssertionError::new);
        assertEquals(RecordStatus.ARCHIVED, archived.getStatus());

        assertThrows(IllegalStateException.class, () -> f.store.markDeleted(InMemoryFixture.fp(1)));
        assertFalse(f.store.markDeleted(InMemoryFixture.fp(9)).isPresent());
    }

    @Test
    public void history_is_oldest_first() {
        AllocationRecord saved = f.store.commitNew(InMemoryFixture.request(1), "Ab12", 4, "salt");
        f.store.recordDedupHit(saved);
        f.store.markAccessed(InMemoryFixture.fp(1));
        f.store.markDeleted(InMemoryFixture.fp(1));

        List<OperationLogEntry> history = f.store.history(saved.getId());

        assertEquals(4, history.size());
        assertEquals(OperationKind.ASSIGN, history.get(0).getKind());
        assertEquals(OperationKind.DEDUP_HIT, history.get(1).getKind());
        assertEquals(OperationKind.ACCESS, history.get(2).getKind());
        assertEquals(OperationKind.DELETE, history.get(3).getKind());
    }
}
