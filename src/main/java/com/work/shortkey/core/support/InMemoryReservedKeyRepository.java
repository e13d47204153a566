package com.work.shortkey.core.support;

import com.work.shortkey.core.model.ReservedKey;
import com.work.shortkey.core.repository.ReservedKeyRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 纯内存保留短键表。
 */
public class InMemoryReservedKeyRepository implements ReservedKeyRepository {

    private final Map<String, ReservedKey> keys = new LinkedHashMap<>();

    @Override
    public synchronized List<ReservedKey> listAll() {
        return new ArrayList<>(keys.values());
    }

    @Override
    public synchronized boolean insertIfAbsent(String value, String reason) {
        if (keys.containsKey(value)) {
            return false;
        }
        keys.put(value, new ReservedKey(value, reason, Instant.now()));
        return true;
    }
}
