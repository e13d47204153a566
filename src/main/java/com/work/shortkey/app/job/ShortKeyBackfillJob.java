package com.work.shortkey.app.job;

import com.work.shortkey.app.config.ShortKeyProperties;
import com.work.shortkey.core.ShortKeyComponent;
import com.work.shortkey.core.exception.ShortKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 短键回填任务：
 * - 默认关闭，配合 shortkey.assign-on-register=false 使用
 * - 每轮最多处理 backfill-batch-size 条没有短键的 ACTIVE 记录
 */
@Component
@ConditionalOnProperty(prefix = "shortkey", name = "backfill-enabled", havingValue = "true")
public class ShortKeyBackfillJob {

    private static final Logger log = LoggerFactory.getLogger(ShortKeyBackfillJob.class);

    private final ShortKeyProperties properties;
    private final ShortKeyComponent component;

    public ShortKeyBackfillJob(ShortKeyProperties properties, ShortKeyComponent component) {
        this.properties = properties;
        this.component = component;
    }

    @Scheduled(fixedDelayString = "${shortkey.backfill-interval-ms:60000}")
    public void runOnce() {
        int limit = Math.max(1, properties.getBackfillBatchSize());
        try {
            int assigned = component.backfill(limit);
            if (assigned > 0) {
                log.info("short key backfill assigned {} records", assigned);
            }
        } catch (ShortKeyException e) {
            // 下一轮继续
            log.warn("short key backfill round failed err={}", e.toString());
        }
    }
}
