package com.fastmqtt.core.retry;

import com.fastmqtt.core.spi.ErrorClassifier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本地重试执行器
 * 用 LocalRetry 的尝试次数/退避 + ErrorClassifier 的重试条件装饰调用
 * 只返回/抛出最后一次的结果
 */
public class LocalRetryRunner {

    private final ErrorClassifier classifier;

    /** LocalRetry 不可变且按值相等, 相同参数只构建一次配置 */
    private final ConcurrentHashMap<LocalRetry, RetryConfig> configCache = new ConcurrentHashMap<>();

    public LocalRetryRunner(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * 执行 call
     * @param name   重试实例名（日志/排查用）
     * @param policy 为空则只执行一次
     */
    public <T> T run(String name, LocalRetry policy, Callable<T> call) throws Exception {
        if (policy == null) {
            return call.call();
        }
        Retry retry = Retry.of(name, configCache.computeIfAbsent(policy, this::buildConfig));
        return retry.executeCallable(call);
    }

    int cachedConfigs() {
        return configCache.size();
    }

    private RetryConfig buildConfig(LocalRetry policy) {
        return RetryConfig.custom()
                .maxAttempts(policy.getAttempts())
                // resilience4j 的次数从 1 开始
                .intervalFunction(n -> policy.delayFor(Math.max(0, n - 1)).toMillis())
                .retryOnException(classifier::shouldRetry)
                .build();
    }
}
