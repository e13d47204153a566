package com.work.shortkey.core.service;

import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.exception.AllocationCancelledException;
import com.work.shortkey.core.exception.KeyspaceExhaustedException;
import com.work.shortkey.core.exception.UniqueConflictException;
import com.work.shortkey.core.model.AllocationRecord;
import com.work.shortkey.core.model.SlotReservation;
import com.work.shortkey.core.repository.AllocationRecordRepository;
import com.work.shortkey.core.support.metrics.ShortKeyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import static com.work.shortkey.core.support.ValidationUtils.requireNonNull;

/**
 * 短键分配核心循环：选长度 -> 占槽位 -> 生成候选 -> 过滤 -> 提交，冲突换候选，预算用尽升级长度。
 * <p>
 * 注意：
 * 1. 显式有界循环，单次调用最多尝试 maxAttemptsPerLength * (maxEscalations + 1) 个候选
 * 2. 保留字候选不消耗槽位，但计入本长度的尝试次数
 * 3. 不在进程内缓存任何已分配短键，唯一性只由数据库约束裁决
 */
@Service
public class ShortKeyAllocator {

    private static final Logger log = LoggerFactory.getLogger(ShortKeyAllocator.class);

    private final KeyspaceLedger ledger;
    private final ReservedKeyFilter reservedKeyFilter;
    private final ShortKeyGenerator generator;
    private final AllocationRecordRepository recordRepository;
    private final ShortKeyConfig config;
    private final ShortKeyMetrics metrics;

    public ShortKeyAllocator(KeyspaceLedger ledger,
                             ReservedKeyFilter reservedKeyFilter,
                             ShortKeyGenerator generator,
                             AllocationRecordRepository recordRepository,
                             ShortKeyConfig config,
                             ShortKeyMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.reservedKeyFilter = requireNonNull(reservedKeyFilter, "reservedKeyFilter");
        this.generator = requireNonNull(generator, "generator");
        this.recordRepository = requireNonNull(recordRepository, "recordRepository");
        this.config = requireNonNull(config, "config");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 分配一个全局唯一、非保留的短键，并交给 committer 落库。
     *
     * @return committer 的返回值；committer 返回 null 时这里也返回 null
     * @throws KeyspaceExhaustedException   升级次数超限或长度超过上限
     * @throws AllocationCancelledException 线程在两次尝试之间被中断
     */
    public AllocationRecord allocate(CandidateCommitter committer) {
        requireNonNull(committer, "committer");

        int length = ledger.currentLength();
        int escalations = 0;
        int attempts = 0;
        boolean needSlot = true;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AllocationCancelledException("短键分配被中断, length=" + length);
            }

            boolean escalate = attempts >= config.getMaxAttemptsPerLength();
            if (!escalate && needSlot) {
                SlotReservation slot = ledger.reserveSlot(length);
                if (slot.isGranted()) {
                    needSlot = false;
                } else {
                    escalate = true;
                }
            }
            if (escalate) {
                escalations++;
                if (escalations > config.getMaxEscalations()) {
                    throw new KeyspaceExhaustedException(
                            "短键分配升级次数超限: escalations=" + escalations + ", length=" + length, length);
                }
                ledger.markExhausted(length);
                metrics.escalation(length);
                int next = ledger.currentLength();
                log.info("short key allocation escalated from length={} to length={} after attempts={}",
                        length, next, attempts);
                length = next;
                attempts = 0;
                needSlot = true;
                continue;
            }

            attempts++;
            String candidate = generator.generate(length);
            if (reservedKeyFilter.isReserved(candidate)) {
                log.debug("reserved candidate discarded length={}", length);
                metrics.reservedRejected();
                continue;
            }
            if (recordRepository.existsByIdentifier(candidate)) {
                log.debug("candidate already taken length={} attempt={}", length, attempts);
                metrics.collision(length);
                needSlot = true;
                continue;
            }
            try {
                return committer.commit(candidate, length, generator.newSalt());
            } catch (UniqueConflictException e) {
                if (e.getKind() != UniqueConflictException.Kind.IDENTIFIER) {
                    throw e;
                }
                log.warn("short key collision on commit length={} attempt={}", length, attempts);
                metrics.collision(length);
                needSlot = true;
            }
        }
    }
}
