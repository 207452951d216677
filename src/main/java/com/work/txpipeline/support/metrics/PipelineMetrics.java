package com.work.txpipeline.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台侧可通过自定义 Bean 接入具体实现。
 */
public interface PipelineMetrics {

    default void intentRegistered(String result) {
    }

    default void allocation(String result) {
    }

    default void broadcast(String result) {
    }

    default void replacement(String result) {
    }

    default void receipt(String result) {
    }

    default void terminal(String status) {
    }
}
