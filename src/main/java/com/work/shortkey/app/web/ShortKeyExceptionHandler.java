package com.work.shortkey.app.web;

import com.work.shortkey.core.exception.AllocationCancelledException;
import com.work.shortkey.core.exception.IntegrityViolationException;
import com.work.shortkey.core.exception.KeyspaceExhaustedException;
import com.work.shortkey.core.exception.ShortKeyException;
import com.work.shortkey.core.exception.TransientStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 组件异常 -> HTTP 状态码：
 * - 400：参数校验失败
 * - 409：数据完整性错误 / 不允许的状态迁移
 * - 503：存储暂时不可用（调用方可退避重试）
 * - 507：短键空间耗尽
 */
@RestControllerAdvice
public class ShortKeyExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ShortKeyExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("VALIDATION_FAILED", msg));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(err("ILLEGAL_STATE", ex.getMessage()));
    }

    @ExceptionHandler(IntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(IntegrityViolationException ex) {
        log.warn("integrity violation: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(err("INTEGRITY_VIOLATION", ex.getMessage()));
    }

    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<Map<String, Object>> handleTransient(TransientStorageException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(err("STORAGE_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(KeyspaceExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleExhausted(KeyspaceExhaustedException ex) {
        log.error("keyspace exhausted lastLength={}: {}", ex.getLastLength(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INSUFFICIENT_STORAGE).body(err("KEYSPACE_EXHAUSTED", ex.getMessage()));
    }

    @ExceptionHandler(AllocationCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(AllocationCancelledException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(err("CANCELLED", ex.getMessage()));
    }

    @ExceptionHandler(ShortKeyException.class)
    public ResponseEntity<Map<String, Object>> handleOther(ShortKeyException ex) {
        log.error("short key operation failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(err("INTERNAL_ERROR", ex.getMessage()));
    }

    static Map<String, Object> err(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        return body;
    }
}
