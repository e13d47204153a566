package com.work.shortkey.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.shortkey.core.repository.entity.KeyspaceLedgerEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * 短键长度账本表 Mapper
 */
public interface KeyspaceLedgerMapper extends BaseMapper<KeyspaceLedgerEntity> {

    @Select("SELECT key_length, consumed, capacity, exhausted, created_at, updated_at " +
            "FROM keyspace_ledger WHERE NOT exhausted AND key_length >= #{minLength} " +
            "ORDER BY key_length ASC LIMIT 1")
    KeyspaceLedgerEntity selectSmallestOpen(@Param("minLength") int minLength);

    @Select("SELECT MAX(key_length) FROM keyspace_ledger")
    Integer selectMaxLength();

    @Select("SELECT key_length, consumed, capacity, exhausted, created_at, updated_at " +
            "FROM keyspace_ledger WHERE key_length = #{length}")
    KeyspaceLedgerEntity selectByLength(@Param("length") int length);

    /**
     * 并发创建同一长度时依赖 ON CONFLICT DO NOTHING：后到者影响 0 行，不报错。
     */
    @Insert("INSERT INTO keyspace_ledger(key_length, consumed, capacity, exhausted, created_at, updated_at) " +
            "VALUES(#{length}, 0, #{capacity}, FALSE, #{now}, #{now}) " +
            "ON CONFLICT(key_length) DO NOTHING")
    int insertIfAbsent(@Param("length") int length, @Param("capacity") long capacity, @Param("now") Instant now);

    /**
     * 单语句完成 “consumed + 1 + 达到容量即耗尽”，返回更新后的整行；已耗尽的行不匹配，返回 null。
     */
    @Select("UPDATE keyspace_ledger " +
            "SET consumed = consumed + 1, exhausted = (consumed + 1 >= capacity), updated_at = #{now} " +
            "WHERE key_length = #{length} AND NOT exhausted " +
            "RETURNING key_length, consumed, capacity, exhausted, created_at, updated_at")
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    KeyspaceLedgerEntity incrementConsumed(@Param("length") int length, @Param("now") Instant now);

    @Update("UPDATE keyspace_ledger " +
            "SET consumed = GREATEST(consumed, capacity), exhausted = TRUE, updated_at = #{now} " +
            "WHERE key_length = #{length} AND NOT exhausted")
    int markExhausted(@Param("length") int length, @Param("now") Instant now);

    @Select("SELECT key_length, consumed, capacity, exhausted, created_at, updated_at " +
            "FROM keyspace_ledger ORDER BY key_length ASC")
    List<KeyspaceLedgerEntity> selectAllOrdered();
}
