package com.reliablebus.core.notify.ratelimit;

import com.reliablebus.core.spi.notify.NotifierFilter;
import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.Severity;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * 内存窗口限流, 按 事件类型 + 组件 + 级别 计数
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private final LongSupplier clock;

    private volatile long windowStart;

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, System::currentTimeMillis);
    }

    public RateLimitFilter(Duration window, int threshold, LongSupplier clock) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
        this.windowStart = clock.getAsLong();
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = clock.getAsLong();
        // 重置窗口
        if (now - windowStart > windowMs) {
            windowStart = now;
            counter.clear();
        }
        String key = String.format("%s_%s_%s", ctx.getType(), ctx.getComponent(), sev.name());
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= threshold;
    }
}
