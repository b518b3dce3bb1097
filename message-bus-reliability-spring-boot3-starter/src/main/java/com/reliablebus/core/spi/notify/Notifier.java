package com.reliablebus.core.spi.notify;

import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.Severity;

/**
 * 告警通知器（进入DLQ/熔断打开等）
 */
public interface Notifier {

    /**
     * 渠道名称, 用于日志
     */
    String name();

    /**
     * 粗粒度过滤
     */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 同步派发, 异步由框架层负责
     */
    void notify(NotifyContext ctx, Severity severity);
}
