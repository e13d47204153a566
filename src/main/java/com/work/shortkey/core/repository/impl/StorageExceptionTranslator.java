package com.work.shortkey.core.repository.impl;

import com.work.shortkey.core.exception.IntegrityViolationException;
import com.work.shortkey.core.exception.ShortKeyException;
import com.work.shortkey.core.exception.TransientStorageException;
import com.work.shortkey.core.exception.UniqueConflictException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * 把 Spring 的 DataAccessException 体系翻译为组件自己的异常分类。
 * <p>
 * 约束名见 schema.sql：uk_allocation_record_fingerprint / uk_allocation_record_identifier。
 */
final class StorageExceptionTranslator {

    static final String FINGERPRINT_CONSTRAINT = "uk_allocation_record_fingerprint";
    static final String IDENTIFIER_CONSTRAINT = "uk_allocation_record_identifier";

    private StorageExceptionTranslator() {
        throw new AssertionError("工具类不允许实例化");
    }

    static <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionTimedOutException e) {
            throw translate(operation, e);
        }
    }

    static void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }

    static ShortKeyException translate(String operation, RuntimeException e) {
        if (e instanceof DuplicateKeyException) {
            String detail = mostSpecificMessage(e);
            if (detail.contains(IDENTIFIER_CONSTRAINT)) {
                return new UniqueConflictException(UniqueConflictException.Kind.IDENTIFIER,
                        operation + " 短键唯一约束冲突", e);
            }
            if (detail.contains(FINGERPRINT_CONSTRAINT)) {
                return new UniqueConflictException(UniqueConflictException.Kind.FINGERPRINT,
                        operation + " 指纹唯一约束冲突", e);
            }
            return new IntegrityViolationException(operation + " 未预期的唯一约束冲突: " + detail, e);
        }
        if (e instanceof DataIntegrityViolationException) {
            return new IntegrityViolationException(operation + " 数据完整性错误: " + mostSpecificMessage(e), e);
        }
        if (e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof TransactionTimedOutException) {
            return new TransientStorageException(operation + " 存储暂时不可用: " + e.getMessage(), e);
        }
        return new ShortKeyException(operation + " 存储访问失败: " + e.getMessage(), e);
    }

    private static String mostSpecificMessage(RuntimeException e) {
        Throwable cause = e;
        if (e instanceof DataAccessException) {
            cause = ((DataAccessException) e).getMostSpecificCause();
        }
        String msg = cause.getMessage();
        return msg == null ? "" : msg.toLowerCase(Locale.ROOT);
    }
}
