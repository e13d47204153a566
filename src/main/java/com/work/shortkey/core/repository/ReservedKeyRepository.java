package com.work.shortkey.core.repository;

import com.work.shortkey.core.model.ReservedKey;

import java.util.List;

/**
 * 保留短键表的数据访问抽象。只在管理操作与缓存加载时访问，不在热路径上。
 */
public interface ReservedKeyRepository {

    List<ReservedKey> listAll();

    /**
     * @return 是否新插入（已存在时返回 false）
     */
    boolean insertIfAbsent(String value, String reason);
}
