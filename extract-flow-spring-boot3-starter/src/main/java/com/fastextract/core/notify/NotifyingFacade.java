package com.fastextract.core.notify;

import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

/**
 * 通知入口; 未启用通知时为空操作
 */
public class NotifyingFacade {

    private static final NotifyingFacade NO_OP = of(null);

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        // 未启用 notify 则为 null
        this.delegate = p::getIfAvailable;
    }

    private NotifyingFacade(AsyncNotifyingService fixed) {
        this.delegate = () -> fixed;
    }

    /**
     * 绑定固定实例, 手工装配时使用; null 等同 noop()
     */
    public static NotifyingFacade of(AsyncNotifyingService service) {
        return new NotifyingFacade(service);
    }

    public static NotifyingFacade noop() {
        return NO_OP;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) s.fire(ctx, sev);
    }
}
