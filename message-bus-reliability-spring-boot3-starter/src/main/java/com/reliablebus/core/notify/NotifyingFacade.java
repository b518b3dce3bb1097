package com.reliablebus.core.notify;

import com.reliablebus.model.ctx.NotifyContext;
import com.reliablebus.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

/**
 * 告警入口, 未启用 notify 时静默丢弃
 */
public class NotifyingFacade {

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        this.delegate = p::getIfAvailable;
    }

    public NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    public static NotifyingFacade noop() {
        return new NotifyingFacade((Supplier<AsyncNotifyingService>) () -> null);
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) {
            s.fire(ctx, sev);
        }
    }
}
