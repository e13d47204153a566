package com.work.shortkey.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 分配主路径只调用接口，不绑定具体 metrics 实现
 * - 业务/平台可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface ShortKeyMetrics {

    default void allocated(int length) {
    }

    default void dedupHit() {
    }

    default void collision(int length) {
    }

    default void reservedRejected() {
    }

    default void escalation(int fromLength) {
    }

    default void transientRetry(String op) {
    }
}
