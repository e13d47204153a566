package com.work.shortkey.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.shortkey.core.repository.entity.ReservedShortKeyEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * 保留短键表 Mapper
 */
public interface ReservedShortKeyMapper extends BaseMapper<ReservedShortKeyEntity> {

    @Select("SELECT id, short_key, reason, created_at FROM reserved_short_key ORDER BY id ASC")
    List<ReservedShortKeyEntity> selectAllOrdered();

    @Insert("INSERT INTO reserved_short_key(short_key, reason, created_at) " +
            "VALUES(#{shortKey}, #{reason}, #{now}) ON CONFLICT(short_key) DO NOTHING")
    int insertIfAbsent(@Param("shortKey") String shortKey, @Param("reason") String reason, @Param("now") Instant now);
}
