package com.reliablebus.core.notify;

import com.reliablebus.core.metric.ReliabilityMetrics;
import com.reliablebus.core.spi.notify.Notifier;
import com.reliablebus.core.spi.notify.NotifierFilter;
import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 限流后在独立线程池中逐个渠道发送, 单渠道失败退避重试
 */
public class AsyncNotifyingService {

    private static final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private static final int MAX_SEND_ATTEMPTS = 3;

    private final ExecutorService exec;

    private final List<Notifier> notifiers;

    private final NotifierFilter filter;

    private final ReliabilityMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, List<Notifier> notifiers,
                                 NotifierFilter filter, ReliabilityMetrics metrics) {
        this.exec = exec;
        this.notifiers = notifiers == null ? List.of() : List.copyOf(notifiers);
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] executor rejected event={}, message={}", ctx.getType(), ctx.getMessageId());
        }
    }

    /**
     * 停止接收新告警, 已入队的继续发送
     */
    public void shutdown() {
        exec.shutdown();
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        for (Notifier n : notifiers) {
            if (!n.supports(ctx)) {
                continue;
            }
            try {
                int attempt = 0;
                long backoff = 200;
                while (true) {
                    try {
                        n.notify(ctx, sev);
                        break;
                    } catch (Exception e) {
                        if (++attempt >= MAX_SEND_ATTEMPTS) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, 4000);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }
}
