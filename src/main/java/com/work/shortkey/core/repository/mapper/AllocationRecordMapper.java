package com.work.shortkey.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.shortkey.core.repository.entity.AllocationRecordEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * 分配记录表 Mapper。插入直接使用 BaseMapper#insert（自增主键回填）。
 */
public interface AllocationRecordMapper extends BaseMapper<AllocationRecordEntity> {

    String COLUMNS = "id, fingerprint, identifier, identifier_length, generation_salt, original_filename, " +
            "file_extension, file_size, mime_type, storage_key, url, status, access_count, last_accessed_at, " +
            "metadata, created_at, identifier_assigned_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM allocation_record WHERE fingerprint = #{fingerprint}")
    AllocationRecordEntity selectByFingerprint(@Param("fingerprint") String fingerprint);

    @Select("SELECT " + COLUMNS + " FROM allocation_record WHERE identifier = #{identifier} AND status = 'ACTIVE'")
    AllocationRecordEntity selectActiveByIdentifier(@Param("identifier") String identifier);

    @Select("SELECT EXISTS(SELECT 1 FROM allocation_record WHERE identifier = #{identifier})")
    boolean existsByIdentifier(@Param("identifier") String identifier);

    /**
     * 只在 identifier 仍为空且记录为 ACTIVE 时写入，保证“从无到有仅一次”。
     */
    @Update("UPDATE allocation_record " +
            "SET identifier = #{identifier}, identifier_length = #{length}, generation_salt = #{salt}, " +
            "identifier_assigned_at = #{assignedAt}, updated_at = #{assignedAt} " +
            "WHERE fingerprint = #{fingerprint} AND identifier IS NULL AND status = 'ACTIVE'")
    int assignIdentifierIfAbsent(@Param("fingerprint") String fingerprint,
                                 @Param("identifier") String identifier,
                                 @Param("length") int length,
                                 @Param("salt") String salt,
                                 @Param("assignedAt") Instant assignedAt);

    @Update("UPDATE allocation_record " +
            "SET access_count = access_count + 1, last_accessed_at = #{accessedAt}, updated_at = #{accessedAt} " +
            "WHERE fingerprint = #{fingerprint}")
    int incrementAccess(@Param("fingerprint") String fingerprint, @Param("accessedAt") Instant accessedAt);

    @Update("UPDATE allocation_record " +
            "SET storage_key = #{storageKey}, url = #{url}, updated_at = #{updatedAt} " +
            "WHERE fingerprint = #{fingerprint} AND status = 'ACTIVE'")
    int updateUploadInfo(@Param("fingerprint") String fingerprint,
                         @Param("storageKey") String storageKey,
                         @Param("url") String url,
                         @Param("updatedAt") Instant updatedAt);

    @Update("UPDATE allocation_record SET status = #{target}, updated_at = #{updatedAt} " +
            "WHERE fingerprint = #{fingerprint} AND status = #{expected}")
    int transitionStatus(@Param("fingerprint") String fingerprint,
                         @Param("expected") String expected,
                         @Param("target") String target,
                         @Param("updatedAt") Instant updatedAt);

    @Select("SELECT " + COLUMNS + " FROM allocation_record " +
            "WHERE identifier IS NULL AND status = 'ACTIVE' ORDER BY id ASC LIMIT #{limit}")
    List<AllocationRecordEntity> listMissingIdentifier(@Param("limit") int limit);

    @Select("SELECT COUNT(*) FROM allocation_record WHERE identifier IS NOT NULL")
    long countWithIdentifier();

    @Select("SELECT COUNT(*) FROM allocation_record WHERE identifier IS NULL AND status = 'ACTIVE'")
    long countMissingIdentifier();
}
