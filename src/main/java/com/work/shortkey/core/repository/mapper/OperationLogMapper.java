package com.work.shortkey.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.shortkey.core.repository.entity.OperationLogEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * 操作日志表 Mapper（只有 INSERT 与 SELECT）
 */
public interface OperationLogMapper extends BaseMapper<OperationLogEntity> {

    @Insert("INSERT INTO operation_log(record_id, operation_kind, details, created_at) " +
            "VALUES(#{recordId}, #{kind}, #{details}, #{createdAt})")
    int append(@Param("recordId") long recordId,
               @Param("kind") String kind,
               @Param("details") String details,
               @Param("createdAt") Instant createdAt);

    @Select("SELECT id, record_id, operation_kind, details, created_at FROM operation_log " +
            "WHERE record_id = #{recordId} ORDER BY id ASC")
    List<OperationLogEntity> selectByRecord(@Param("recordId") long recordId);

    @Select("SELECT COUNT(*) FROM operation_log WHERE operation_kind = #{kind}")
    long countByKind(@Param("kind") String kind);
}
