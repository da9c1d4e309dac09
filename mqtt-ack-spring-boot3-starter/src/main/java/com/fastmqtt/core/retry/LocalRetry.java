package com.fastmqtt.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * 本地重试策略（线性递增 + 上限）
 * 第 n 次失败后的等待 = base * (n + 1), 不超过 maxDelay
 * 不可变, 可在发布/订阅间共享同一实例
 */
public final class LocalRetry {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);

    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    private static final int NANOS_PER_MILLI = 1_000_000;

    /** 最大尝试次数（含首次） */
    private final int attempts;

    private final Duration base;

    private final Duration maxDelay;

    private LocalRetry(Duration base, Duration maxDelay, int attempts) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        if (base.isNegative()) {
            throw new IllegalArgumentException("base must be >= 0");
        }
        if (maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be >= 0");
        }
        // 等待按毫秒执行, 不接受更细的精度
        if (base.getNano() % NANOS_PER_MILLI != 0) {
            throw new IllegalArgumentException("base must be whole milliseconds, got " + base);
        }
        if (maxDelay.getNano() % NANOS_PER_MILLI != 0) {
            throw new IllegalArgumentException("maxDelay must be whole milliseconds, got " + maxDelay);
        }
        this.attempts = attempts;
        this.base = base;
        this.maxDelay = maxDelay;
    }

    public static LocalRetry of(Duration base, Duration maxDelay, int attempts) {
        return new LocalRetry(base, maxDelay, attempts);
    }

    /** 1s 起步, 最大 10s */
    public static LocalRetry ofDefault(int attempts) {
        return new LocalRetry(DEFAULT_BASE, DEFAULT_MAX_DELAY, attempts);
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getBase() {
        return base;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * 计算第 attemptIndex 次失败后的等待时间
     * @param attemptIndex 从 0 开始: 首次失败后等待 delayFor(0)
     */
    public Duration delayFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0");
        }
        long baseMs = base.toMillis();
        long maxMs = maxDelay.toMillis();
        // 先判上限, 防止乘法溢出
        if (baseMs > 0 && attemptIndex + 1L > maxMs / baseMs) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMs * (attemptIndex + 1L), maxMs));
    }

    /** 按值相等, 相同参数的策略共享一份重试配置 */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocalRetry other)) {
            return false;
        }
        return attempts == other.attempts && base.equals(other.base) && maxDelay.equals(other.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attempts, base, maxDelay);
    }

    @Override
    public String toString() {
        return "LocalRetry{attempts=" + attempts + ", base=" + base + ", maxDelay=" + maxDelay + "}";
    }
}
