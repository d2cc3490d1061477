package com.fastextract.core.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 取消控制器, 持有者调用 cancel(), 其余方只拿到 signal()
 * 注册与取消在同一把锁下完成, 每个回调至多执行一次
 */
public class CancellationController {

    private static final Logger log = LoggerFactory.getLogger(CancellationController.class);

    private final Object lock = new Object();

    /** 取消后置为 null */
    private Set<Listener> listeners = new LinkedHashSet<>();

    private volatile boolean cancelled;

    private final CancellationSignal signal = new Signal();

    public CancellationSignal signal() {
        return signal;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** 当前挂载的回调数 */
    public int listenerCount() {
        synchronized (lock) {
            return listeners == null ? 0 : listeners.size();
        }
    }

    /**
     * 幂等, 只有第一次调用会触发回调
     */
    public void cancel() {
        List<Listener> drained;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            drained = new ArrayList<>(listeners);
            listeners = null;
        }
        // 锁外执行, 回调可以再次注册或取消别的控制器
        for (Listener l : drained) {
            fire(l.action);
        }
    }

    private static void fire(Runnable l) {
        try {
            l.run();
        } catch (RuntimeException e) {
            log.warn("[Cancel] listener threw, ignored: {}", e.toString());
        }
    }

    private final class Listener implements CancellationSignal.Registration {

        private final Runnable action;

        private Listener(Runnable action) {
            this.action = action;
        }

        @Override
        public boolean unregister() {
            synchronized (lock) {
                return listeners != null && listeners.remove(this);
            }
        }
    }

    private final class Signal implements CancellationSignal {

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public Registration onCancel(Runnable listener) {
            synchronized (lock) {
                if (!cancelled) {
                    Listener l = new Listener(listener);
                    listeners.add(l);
                    return l;
                }
            }
            fire(listener);
            return Registration.NOOP;
        }
    }
}
