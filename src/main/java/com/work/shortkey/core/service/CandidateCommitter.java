package com.work.shortkey.core.service;

import com.work.shortkey.core.model.AllocationRecord;

/**
 * 分配循环的提交步骤：把通过了保留字与存在性检查的候选短键落库。
 * <p>
 * 约定：
 * 1. 短键唯一约束冲突抛 UniqueConflictException(IDENTIFIER)，分配器会换一个候选重试
 * 2. 其它异常（含指纹冲突）原样抛给分配器的调用方
 * 3. 返回 null 表示目标记录已不需要短键（例如已被其他节点回填），分配器直接结束
 */
@FunctionalInterface
public interface CandidateCommitter {

    AllocationRecord commit(String identifier, int length, String salt);
}
