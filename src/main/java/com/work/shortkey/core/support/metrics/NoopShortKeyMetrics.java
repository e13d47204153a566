package com.work.shortkey.core.support.metrics;

/**
 * 默认 no-op 实现：保证工程在不引入任何 metrics 依赖时仍可运行。
 *
 * 若业务侧提供了自定义 ShortKeyMetrics Bean，可通过 @ConditionalOnMissingBean 覆盖。
 */
public class NoopShortKeyMetrics implements ShortKeyMetrics {
}
