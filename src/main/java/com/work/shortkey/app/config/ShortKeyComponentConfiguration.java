package com.work.shortkey.app.config;

import com.work.shortkey.core.ShortKeyComponent;
import com.work.shortkey.core.config.ShortKeyConfig;
import com.work.shortkey.core.service.AllocationRecordStore;
import com.work.shortkey.core.service.AllocationService;
import com.work.shortkey.core.service.FingerprintRegister;
import com.work.shortkey.core.service.ReservedKeyFilter;
import com.work.shortkey.core.service.SecureShortKeyGenerator;
import com.work.shortkey.core.service.ShortKeyBackfillService;
import com.work.shortkey.core.service.ShortKeyGenerator;
import com.work.shortkey.core.service.ShortKeyStatisticsService;
import com.work.shortkey.core.support.metrics.NoopShortKeyMetrics;
import com.work.shortkey.core.support.metrics.ShortKeyMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 生产环境使用 PostgreSQL 实现。
 */
@Configuration
@EnableConfigurationProperties(ShortKeyProperties.class)
public class ShortKeyComponentConfiguration {

    // Postgres*Repository 通过 @Repository 自动扫描，各 Service 通过 @Service 自动扫描

    @Bean
    public ShortKeyConfig shortKeyConfig(ShortKeyProperties properties) {
        return ShortKeyConfig.builder()
                .charset(properties.getCharset())
                .minLength(properties.getMinLength())
                .maxLength(properties.getMaxLength())
                .reservedMargin(properties.getReservedMargin())
                .maxUtilization(properties.getMaxUtilization())
                .capacityOverrides(properties.getCapacityOverrides())
                .maxAttemptsPerLength(properties.getMaxAttemptsPerLength())
                .maxEscalations(properties.getMaxEscalations())
                .transactionTimeout(properties.getTransactionTimeout())
                .reservedRefresh(properties.getReservedRefresh())
                .storageRetryAttempts(properties.getStorageRetryAttempts())
                .storageRetryInitialBackoff(properties.getStorageRetryInitialBackoff())
                .storageRetryMaxBackoff(properties.getStorageRetryMaxBackoff())
                .assignOnRegister(properties.isAssignOnRegister())
                .build();
    }

    /**
     * 业务方可提供自己的实现（如接入 Micrometer）
     */
    @Bean
    @ConditionalOnMissingBean(ShortKeyMetrics.class)
    public ShortKeyMetrics shortKeyMetrics() {
        return new NoopShortKeyMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(ShortKeyGenerator.class)
    public ShortKeyGenerator shortKeyGenerator(ShortKeyConfig config) {
        return new SecureShortKeyGenerator(config.getCharset());
    }

    @Bean
    public ShortKeyComponent shortKeyComponent(AllocationService allocationService,
                                               FingerprintRegister register,
                                               AllocationRecordStore store,
                                               ReservedKeyFilter reservedKeyFilter,
                                               ShortKeyBackfillService backfillService,
                                               ShortKeyStatisticsService statisticsService) {
        return new ShortKeyComponent(allocationService, register, store, reservedKeyFilter,
                backfillService, statisticsService);
    }
}
