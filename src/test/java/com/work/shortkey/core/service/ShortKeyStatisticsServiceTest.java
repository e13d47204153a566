package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.model.KeyspaceStatistics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ShortKeyStatisticsServiceTest {

    @Test
    public void snapshot_reports_ledger_and_record_counts() {
        InMemoryFixture f = new InMemoryFixture(ShortKeyConfig.builder().capacityOverride(4, 2L).build());
        f.seedReserved("api", "www");
        for (int i = 1; i <= 3; i++) {
            f.allocationService.allocate(InMemoryFixture.request(i));
        }
        ShortKeyStatisticsService service = new ShortKeyStatisticsService(
                f.ledger, f.reservedKeyFilter, f.records, f.config);

        KeyspaceStatistics stats = service.snapshot();

        assertEquals(62, stats.getCharsetSize());
        assertEquals(2, stats.getReservedKeyCount());
        assertEquals(3L, stats.getAssignedIdentifierCount());
        assertEquals(0L, stats.getPendingIdentifierCount());
        assertEquals(2, stats.getLengths().size());
        assertEquals(4, stats.getLengths().get(0).getLength());
        assertEquals(1.0d, stats.getLengths().get(0).usageRatio(), 1e-9);
    }
}
