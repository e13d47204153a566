package com.work.shortkey.core.model;

/**
 * 操作日志类型（只追加，不修改、不删除）。
 */
public enum OperationKind {
    /** 新短键写入成功 */
    ASSIGN,
    /** 同一指纹再次请求，返回已有记录 */
    DEDUP_HIT,
    /** 通过短键访问 */
    ACCESS,
    /** 标记删除 */
    DELETE,
    /** 上传信息回填、归档等更新 */
    UPDATE
}
