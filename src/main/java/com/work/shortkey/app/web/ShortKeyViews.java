package com.work.shortkey.app.web;

import com.work.shortkey.app.web.dto.BatchItemView;
import com.work.shortkey.app.web.dto.LengthView;
import com.work.shortkey.app.web.dto.OperationLogView;
import com.work.shortkey.app.web.dto.ShortKeyView;
import com.work.shortkey.app.web.dto.StatisticsView;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.BatchItemOutcome;
import com.work.shortkey.core.model.KeyspaceLedgerEntry;
import com.work.shortkey.core.model.KeyspaceStatistics;
import com.work.shortkey.core.model.OperationLogEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * 领域模型 -> 响应 DTO。
 */
final class ShortKeyViews {

    private ShortKeyViews() {
    }

    static ShortKeyView toView(AllocationRecord r, boolean dedupHit) {
        ShortKeyView v = new ShortKeyView();
        v.setFingerprint(r.getFingerprint());
        v.setIdentifier(r.getIdentifier());
        v.setLength(r.getIdentifierLength());
        v.setDedupHit(dedupHit);
        v.setOriginalFilename(r.getOriginalFilename());
        v.setFileExtension(r.getFileExtension());
        v.setFileSize(r.getFileSize());
        v.setMimeType(r.getMimeType());
        v.setStorageKey(r.getStorageKey());
        v.setUrl(r.getUrl());
        v.setStatus(r.getStatus().name());
        v.setAccessCount(r.getAccessCount());
        v.setLastAccessedAt(r.getLastAccessedAt());
        if (r.getMetadata() != null) {
            v.setAttributes(r.getMetadata().getAttributes());
            v.setTags(r.getMetadata().getTags());
        }
        v.setCreatedAt(r.getCreatedAt());
        v.setIdentifierAssignedAt(r.getIdentifierAssignedAt());
        v.setUpdatedAt(r.getUpdatedAt());
        return v;
    }

    static BatchItemView toView(BatchItemOutcome outcome) {
        BatchItemView v = new BatchItemView();
        v.setFingerprint(outcome.getFingerprint());
        v.setSuccess(outcome.isSuccess());
        if (outcome.isSuccess()) {
            v.setResult(toView(outcome.getResult().getRecord(), outcome.getResult().isDedupHit()));
        } else {
            v.setError(outcome.getError().getMessage());
        }
        return v;
    }

    static OperationLogView toView(OperationLogEntry e) {
        OperationLogView v = new OperationLogView();
        v.setId(e.getId());
        v.setKind(e.getKind().name());
        v.setDetails(e.getDetails());
        v.setTimestamp(e.getTimestamp());
        return v;
    }

    static StatisticsView toView(KeyspaceStatistics s) {
        StatisticsView v = new StatisticsView();
        v.setCharset(s.getCharset());
        v.setCharsetSize(s.getCharsetSize());
        v.setReservedKeyCount(s.getReservedKeyCount());
        v.setAssignedIdentifierCount(s.getAssignedIdentifierCount());
        v.setPendingIdentifierCount(s.getPendingIdentifierCount());
        List<LengthView> lengths = new ArrayList<>(s.getLengths().size());
        for (KeyspaceLedgerEntry e : s.getLengths()) {
            LengthView l = new LengthView();
            l.setLength(e.getLength());
            l.setConsumed(e.getConsumed());
            l.setCapacity(e.getCapacity());
            l.setExhausted(e.isExhausted());
            l.setUsageRatio(e.usageRatio());
            lengths.add(l);
        }
        v.setLengths(lengths);
        return v;
    }
}
