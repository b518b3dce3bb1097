package com.reliablebus.core.notify.notifier;

import com.reliablebus.core.spi.notify.Notifier;
import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] component={}, topic={}, message={}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.getComponent(), ctx.getTopic(), ctx.getMessageId(), ctx.getReasonCode(),
                    truncate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] component={}, topic={}, message={}, reason={}, attrs={}",
                    ctx.getType(), ctx.getComponent(), ctx.getTopic(), ctx.getMessageId(), ctx.getReasonCode(),
                    ctx.getAttributes());
            default -> log.info("[Notify-{}] component={}, message={}",
                    ctx.getType(), ctx.getComponent(), ctx.getMessageId());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
