package com.work.shortkey.core.repository.impl;

import com.work.shortkey.core.model.ReservedKey;
import com.work.shortkey.core.repository.ReservedKeyRepository;
import com.work.shortkey.core.repository.entity.ReservedShortKeyEntity;
import com.work.shortkey.core.repository.mapper.ReservedShortKeyMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.work.shortkey.core.support.ValidationUtils.requireNonEmpty;

@Repository
public class PostgresReservedKeyRepository implements ReservedKeyRepository {

    private final ReservedShortKeyMapper reservedMapper;

    public PostgresReservedKeyRepository(ReservedShortKeyMapper reservedMapper) {
        this.reservedMapper = reservedMapper;
    }

    @Override
    public List<ReservedKey> listAll() {
        List<ReservedShortKeyEntity> entities = StorageExceptionTranslator.call("加载保留短键",
                reservedMapper::selectAllOrdered);
        List<ReservedKey> result = new ArrayList<>(entities.size());
        for (ReservedShortKeyEntity e : entities) {
            result.add(new ReservedKey(e.getShortKey(), e.getReason(), e.getCreatedAt()));
        }
        return result;
    }

    @Override
    public boolean insertIfAbsent(String value, String reason) {
        requireNonEmpty(value, "value");
        return StorageExceptionTranslator.call("新增保留短键",
                () -> reservedMapper.insertIfAbsent(value, reason == null ? "" : reason, Instant.now())) > 0;
    }
}
