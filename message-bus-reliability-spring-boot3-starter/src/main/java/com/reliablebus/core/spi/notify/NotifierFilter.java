package com.reliablebus.core.spi.notify;

import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.Severity;

/**
 * 过滤器：限流、去抖等
 */
public interface NotifierFilter {

    /**
     * true 放行, false 抑制
     */
    boolean allow(NotifyContext ctx, Severity severity);
}
